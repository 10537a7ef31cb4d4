package com.migrationpilot.orchestrator.cli;

/** Process exit statuses not taken from a worker. */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    public static final int FAILURE = 1;

    private ExitCodes() {}
}
