package com.migrationpilot.orchestrator.config;

import com.migrationpilot.orchestrator.pipeline.PipelineException;

/**
 * Required input is absent or unusable. Reported before any work starts.
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message, String usage) {
        super(message, 1, usage);
    }
}
