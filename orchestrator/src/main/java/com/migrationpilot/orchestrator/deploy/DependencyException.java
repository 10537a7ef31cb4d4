package com.migrationpilot.orchestrator.deploy;

import com.migrationpilot.orchestrator.pipeline.PipelineException;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A directory the deployment depends on does not exist.
 *
 * Raised before any file is copied.
 */
public class DependencyException extends PipelineException {

    private final List<Path> missingPaths;

    public DependencyException(String message, List<Path> missingPaths, String remediation) {
        super(message + ": " + missingPaths.stream().map(Path::toString).collect(Collectors.joining(", ")),
                1, remediation);
        this.missingPaths = List.copyOf(missingPaths);
    }

    public List<Path> missingPaths() { return missingPaths; }
}
