package com.migrationpilot.orchestrator.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Progress file the analysis worker keeps in each subject directory.
 * Only read by the output audit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversionStatus(
        String           entity,
        String           formName,
        String           overallStatus,
        List<StepStatus> steps) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StepStatus(int stepNumber, String name, String status, String outputFile) {

        public boolean isProblem() {
            return "failed".equals(status) || "pending".equals(status);
        }

        public boolean isSkipped() {
            return "skipped".equals(status);
        }
    }

    public List<StepStatus> stepsOrEmpty() {
        return steps == null ? List.of() : steps;
    }
}
