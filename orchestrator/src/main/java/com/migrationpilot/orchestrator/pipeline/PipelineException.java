package com.migrationpilot.orchestrator.pipeline;

/**
 * Base type for every fatal pipeline failure.
 *
 * Unchecked, like the rest of the orchestrator's failures: callers only catch
 * it at the command boundary, where {@link #exitCode()} becomes the process
 * exit status and {@link #remediation()} is printed for the operator.
 */
public class PipelineException extends RuntimeException {

    private final int    exitCode;
    private final String remediation;

    public PipelineException(String message, int exitCode, String remediation) {
        super(message);
        this.exitCode    = exitCode;
        this.remediation = remediation;
    }

    public PipelineException(String message, int exitCode, String remediation, Throwable cause) {
        super(message, cause);
        this.exitCode    = exitCode;
        this.remediation = remediation;
    }

    public int    exitCode()    { return exitCode; }

    /** Concrete next action for the operator; may be null. */
    public String remediation() { return remediation; }
}
