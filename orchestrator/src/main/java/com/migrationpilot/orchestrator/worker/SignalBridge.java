package com.migrationpilot.orchestrator.worker;

/**
 * Maps process-level termination requests onto a {@link CancellationToken}.
 *
 * Implementations must undo their hookup when the registration is closed.
 */
public interface SignalBridge {

    CancellationToken.Registration bind(CancellationToken token);
}
