package com.migrationpilot.orchestrator.artifact;

import com.migrationpilot.orchestrator.pipeline.PipelineException;

import java.nio.file.Path;

/**
 * An artifact exists but its content does not match its descriptor.
 */
public class ArtifactSchemaException extends PipelineException {

    private final Path artifact;

    public ArtifactSchemaException(Path artifact, String problem) {
        this(artifact, problem, null);
    }

    public ArtifactSchemaException(Path artifact, String problem, Throwable cause) {
        super("Artifact " + artifact + " is invalid: " + problem,
                1,
                "Delete " + artifact.getFileName() + " and re-run so the analysis step regenerates it",
                cause);
        this.artifact = artifact;
    }

    public Path artifact() { return artifact; }
}
