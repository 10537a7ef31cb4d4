package com.migrationpilot.orchestrator.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The unit of work a run operates on (e.g. the "Facility" entity) and the
 * directory that holds its artifacts.
 */
public record Subject(String name, Path directory) {

    public Subject {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(directory, "directory");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Subject name must not be blank");
        }
        directory = directory.toAbsolutePath().normalize();
    }

    /**
     * Resolve a subject under the output root unless an explicit directory
     * override is given.
     */
    public static Subject of(String name, Path outputRoot, Path directoryOverride) {
        Path dir = directoryOverride != null ? directoryOverride : outputRoot.resolve(name);
        return new Subject(name, dir);
    }

    /** The layered output (shared/api/ui) written by the generation stage. */
    public Path templatesDirectory() {
        return directory.resolve("templates");
    }
}
