package com.migrationpilot.orchestrator.deploy;

import java.nio.file.Path;

/** A single file that could not be copied. Collected, never thrown. */
public record CopyFailure(Path source, String message) {}
