package com.migrationpilot.orchestrator.artifact;

import java.util.List;

/**
 * Typed contract for one named artifact.
 *
 * @param name           file name inside the subject directory
 * @param schemaVersion  highest {@code schemaVersion} value this build understands;
 *                       documents that omit the field are treated as version 1
 * @param requiredFields top-level fields that must be present
 */
public record ArtifactDescriptor(String name, int schemaVersion, List<String> requiredFields) {

    public ArtifactDescriptor {
        requiredFields = List.copyOf(requiredFields);
    }

    public static ArtifactDescriptor of(String name, String... requiredFields) {
        return new ArtifactDescriptor(name, 1, List.of(requiredFields));
    }
}
