package com.migrationpilot.orchestrator.deploy;

import java.nio.file.Path;

/**
 * One template sub-folder and where it lands in a target project.
 *
 * @param source          folder relative to the templates directory
 * @param destination     absolute destination folder
 * @param destinationRoot root of the target project; must exist before copying
 * @param targetName      "shared", "api" or "ui"
 */
public record DeploymentMapping(String source, Path destination, Path destinationRoot, String targetName) {}
