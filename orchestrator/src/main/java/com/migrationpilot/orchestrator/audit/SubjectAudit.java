package com.migrationpilot.orchestrator.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.migrationpilot.orchestrator.artifact.ConversionStatus;
import com.migrationpilot.orchestrator.model.AnalysisMode;

import java.util.List;

/**
 * Audit result for one subject directory.
 *
 * @param entity                entity name from conversion-status.json, else the folder name
 * @param problemSteps          steps reported failed or pending
 * @param missingStepOutputs    non-skipped step outputs named in the status file but absent on disk
 * @param missingForTemplateGen required artifacts of the inferred mode that are absent
 */
public record SubjectAudit(
        String                           folder,
        String                           entity,
        String                           formName,
        String                           overallStatus,
        AnalysisMode                     mode,
        boolean                          hasTemplatesFolder,
        List<ConversionStatus.StepStatus> problemSteps,
        List<MissingStepOutput>          missingStepOutputs,
        List<String>                     missingForTemplateGen) {

    public SubjectAudit {
        problemSteps          = List.copyOf(problemSteps);
        missingStepOutputs    = List.copyOf(missingStepOutputs);
        missingForTemplateGen = List.copyOf(missingForTemplateGen);
    }

    @JsonIgnore
    public boolean needsAttention() {
        return !problemSteps.isEmpty() || !missingStepOutputs.isEmpty() || !missingForTemplateGen.isEmpty();
    }

    public record MissingStepOutput(int stepNumber, String stepName, String status, String outputFile) {}
}
