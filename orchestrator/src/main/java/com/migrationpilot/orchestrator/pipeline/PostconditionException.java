package com.migrationpilot.orchestrator.pipeline;

import java.util.List;

/**
 * The analysis worker exited 0 but required artifacts are still absent.
 */
public class PostconditionException extends PipelineException {

    private final List<String> missingArtifacts;

    public PostconditionException(String subject, List<String> missingArtifacts, String rerunCommand) {
        super("Analysis outputs for '" + subject + "' are still missing after the worker run: "
                        + String.join(", ", missingArtifacts),
                1,
                "Try running a full analysis:\n  " + rerunCommand);
        this.missingArtifacts = List.copyOf(missingArtifacts);
    }

    public List<String> missingArtifacts() { return missingArtifacts; }
}
