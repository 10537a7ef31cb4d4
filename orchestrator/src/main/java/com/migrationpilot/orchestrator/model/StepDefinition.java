package com.migrationpilot.orchestrator.model;

import java.util.List;

/**
 * One numbered step of the analysis pipeline.
 *
 * @param index 1-based step number, as understood by the worker's --skip-steps flag
 * @param steps the analysis outputs this step produces; the step is only
 *              skippable when every one of their artifacts exists
 */
public record StepDefinition(int index, List<AnalysisStep> steps) {

    public StepDefinition {
        if (index < 1) {
            throw new IllegalArgumentException("Step index is 1-based, got " + index);
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Step " + index + " must produce at least one artifact");
        }
        steps = List.copyOf(steps);
    }

    public static StepDefinition of(int index, AnalysisStep... steps) {
        return new StepDefinition(index, List.of(steps));
    }

    public List<String> artifacts() {
        return steps.stream().map(AnalysisStep::artifact).toList();
    }
}
