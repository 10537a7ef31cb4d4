package com.migrationpilot.orchestrator.service;

import com.migrationpilot.orchestrator.deploy.DeploymentResult;
import com.migrationpilot.orchestrator.generation.AssetClassification;
import com.migrationpilot.orchestrator.model.PipelineRun;

import java.util.Optional;

/**
 * @param run        artifact state found before reconciliation
 * @param deployment present only when deployment was requested
 */
public record ConversionOutcome(
        PipelineRun                run,
        AssetClassification        images,
        boolean                    generated,
        Optional<DeploymentResult> deployment) {

    public boolean hasErrors() {
        return deployment.map(DeploymentResult::hasErrors).orElse(false);
    }
}
