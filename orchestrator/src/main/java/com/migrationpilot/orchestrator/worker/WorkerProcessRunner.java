package com.migrationpilot.orchestrator.worker;

import com.migrationpilot.orchestrator.config.MigrationPilotProperties;
import com.migrationpilot.orchestrator.model.WorkerInvocation;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Spawns one worker process and blocks until it exits.
 *
 * The child inherits stdin/stdout/stderr, so interactive workers talk to the
 * operator's terminal directly. There is no timeout: some workers wait on a
 * human. The only way to stop a child early is the {@link CancellationToken},
 * which triggers a polite termination followed, after the grace period, by a
 * forced kill.
 *
 * Every run is recorded as:
 * <pre>
 *   migrationpilot.worker.duration{stage, outcome="success|failure|cancelled"}
 * </pre>
 */
@Component
public class WorkerProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcessRunner.class);

    private final SignalBridge  signalBridge;
    private final MeterRegistry meterRegistry;
    private final Duration      terminationGrace;

    @Autowired
    public WorkerProcessRunner(SignalBridge signalBridge,
                               MeterRegistry meterRegistry,
                               MigrationPilotProperties properties) {
        this(signalBridge, meterRegistry, properties.worker().terminationGrace());
    }

    public WorkerProcessRunner(SignalBridge signalBridge, MeterRegistry meterRegistry, Duration terminationGrace) {
        this.signalBridge     = signalBridge;
        this.meterRegistry    = meterRegistry;
        this.terminationGrace = terminationGrace;
    }

    /**
     * Run the worker to completion.
     *
     * @return the child's exit code, unchanged; nonzero is not an error here,
     *         the caller decides what it means
     * @throws WorkerExecutionException if the process cannot be started, or the
     *         waiting thread is interrupted (the child is terminated first)
     */
    public int run(WorkerInvocation invocation, CancellationToken token) {
        ProcessBuilder builder = new ProcessBuilder(invocation.argv())
                .directory(invocation.workingDirectory().toFile())
                .inheritIO();
        // The builder holds a private copy of our environment; overrides stay with this child.
        builder.environment().putAll(invocation.environment());

        log.info("Starting {} worker: {}", invocation.stage(), invocation.commandLine());

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failure";

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            sample.stop(timer(invocation, outcome));
            throw new WorkerExecutionException(invocation, "could not be started: " + e.getMessage(), e);
        }

        try (CancellationToken.Registration signals  = signalBridge.bind(token);
             CancellationToken.Registration onCancel = token.onCancel(() -> terminate(process, invocation))) {

            int exitCode = process.waitFor();
            if (token.isCancelled()) {
                outcome = "cancelled";
            } else if (exitCode == 0) {
                outcome = "success";
            }
            log.info("{} worker exited with code {} (pid {})", invocation.stage(), exitCode, process.pid());
            return exitCode;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate(process, invocation);
            outcome = "cancelled";
            throw new WorkerExecutionException(invocation, "was abandoned because the orchestrator was interrupted", e);
        } finally {
            sample.stop(timer(invocation, outcome));
        }
    }

    /** Polite termination first, forced kill once the grace period has passed. */
    private void terminate(Process process, WorkerInvocation invocation) {
        if (!process.isAlive()) {
            return;
        }
        log.warn("Terminating {} worker (pid {})", invocation.stage(), process.pid());
        process.destroy();
        try {
            if (!process.waitFor(terminationGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} worker ignored termination for {}, killing it", invocation.stage(), terminationGrace);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private Timer timer(WorkerInvocation invocation, String outcome) {
        return meterRegistry.timer("migrationpilot.worker.duration",
                "stage", invocation.stage(), "outcome", outcome);
    }
}
