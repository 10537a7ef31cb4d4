package com.migrationpilot.orchestrator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Binds SIGINT/SIGTERM to a token through a JVM shutdown hook.
 *
 * The JVM turns both signals into an orderly shutdown and runs its hooks;
 * the hook cancels the token, and the token's listeners terminate the child
 * before the hook returns. The hook is removed again as soon as the bound
 * scope closes.
 */
@Component
public class ShutdownHookSignalBridge implements SignalBridge {

    private static final Logger log = LoggerFactory.getLogger(ShutdownHookSignalBridge.class);

    private final AtomicInteger active = new AtomicInteger();

    @Override
    public CancellationToken.Registration bind(CancellationToken token) {
        Thread hook = new Thread(() -> {
            log.warn("Termination requested, stopping the active worker");
            token.cancel();
        }, "worker-signal-forwarder");

        Runtime.getRuntime().addShutdownHook(hook);
        active.incrementAndGet();

        return () -> {
            active.decrementAndGet();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // The JVM is already shutting down and the hook is running; nothing to undo.
                log.debug("Shutdown in progress, forwarder hook stays registered: {}", e.getMessage());
            }
        };
    }

    /** Number of hooks currently registered by this bridge. */
    public int activeBindings() {
        return active.get();
    }
}
