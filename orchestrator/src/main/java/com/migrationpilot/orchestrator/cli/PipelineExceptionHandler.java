package com.migrationpilot.orchestrator.cli;

import com.migrationpilot.orchestrator.config.ConfigurationException;
import com.migrationpilot.orchestrator.pipeline.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Turns failures escaping a command into an exit status.
 *
 * A {@link PipelineException} is logged with its remediation and exits with
 * its own code, so a failing worker's status reaches the shell unchanged.
 * Anything else is logged with its stack trace and exits 1.
 */
public class PipelineExceptionHandler
        implements CommandLine.IExecutionExceptionHandler, CommandLine.IParameterExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        if (ex instanceof PipelineException pe) {
            log.error(pe.getMessage());
            if (pe.remediation() != null) {
                log.error("Next step: {}", pe.remediation());
            }
            if (pe instanceof ConfigurationException) {
                commandLine.usage(commandLine.getErr());
            }
            return pe.exitCode();
        }
        log.error("Unexpected failure", ex);
        return ExitCodes.FAILURE;
    }

    @Override
    public int handleParseException(CommandLine.ParameterException ex, String[] args) {
        CommandLine cmd = ex.getCommandLine();
        log.error(ex.getMessage());
        cmd.usage(cmd.getErr());
        return ExitCodes.FAILURE;
    }
}
