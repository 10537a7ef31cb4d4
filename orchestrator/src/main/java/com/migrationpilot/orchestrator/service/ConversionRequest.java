package com.migrationpilot.orchestrator.service;

import java.nio.file.Path;

/**
 * What the operator asked for on the command line.
 *
 * @param outputDirectory overrides {@code <outputRoot>/<entity>}; may be null
 * @param formName        optional legacy form name; forces SINGLE mode unless it
 *                        follows the Search/Detail naming
 */
public record ConversionRequest(
        String  entity,
        Path    outputDirectory,
        String  formName,
        boolean skipGeneration,
        boolean deploy,
        boolean dryRun) {}
