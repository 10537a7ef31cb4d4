package com.migrationpilot.orchestrator.worker;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void cancel_runsEachListenerOnce() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThat(calls).hasValue(1);
    }

    @Test
    void closedRegistration_isNotNotified() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();

        try (CancellationToken.Registration ignored = token.onCancel(calls::incrementAndGet)) {
            assertThat(token.listenerCount()).isEqualTo(1);
        }
        token.cancel();

        assertThat(calls).hasValue(0);
        assertThat(token.listenerCount()).isZero();
    }

    @Test
    void onCancel_afterCancellation_runsImmediately() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet).close();

        assertThat(calls).hasValue(1);
        assertThat(token.listenerCount()).isZero();
    }

    @Test
    void shutdownHookBridge_releasesHookOnClose() {
        ShutdownHookSignalBridge bridge = new ShutdownHookSignalBridge();

        try (CancellationToken.Registration ignored = bridge.bind(CancellationToken.create())) {
            assertThat(bridge.activeBindings()).isEqualTo(1);
        }

        assertThat(bridge.activeBindings()).isZero();
    }
}
