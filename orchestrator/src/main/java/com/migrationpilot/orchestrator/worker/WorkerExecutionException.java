package com.migrationpilot.orchestrator.worker;

import com.migrationpilot.orchestrator.model.WorkerInvocation;
import com.migrationpilot.orchestrator.pipeline.PipelineException;

/**
 * A worker process exited nonzero, could not be started, or was abandoned
 * because the waiting thread was interrupted.
 *
 * The exit code is the worker's own, so the orchestrator can hand it back
 * to its caller unchanged.
 */
public class WorkerExecutionException extends PipelineException {

    private final String stage;

    public WorkerExecutionException(WorkerInvocation invocation, int exitCode) {
        super("The " + invocation.stage() + " worker failed (exit " + exitCode + ")",
                exitCode,
                "Re-run the worker manually:\n  " + invocation.rerunCommandLine());
        this.stage = invocation.stage();
    }

    public WorkerExecutionException(WorkerInvocation invocation, String message, Throwable cause) {
        super("The " + invocation.stage() + " worker " + message,
                1,
                "Check the command and re-run it manually:\n  " + invocation.rerunCommandLine(),
                cause);
        this.stage = invocation.stage();
    }

    public String stage() { return stage; }
}
