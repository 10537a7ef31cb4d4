package com.migrationpilot.orchestrator.deploy;

import java.util.List;

/**
 * @param filesCopied files copied, or that would be copied on a dry run
 */
public record DeploymentResult(int filesCopied, List<CopyFailure> errors, boolean dryRun) {

    public DeploymentResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() { return !errors.isEmpty(); }
}
