package com.migrationpilot.orchestrator.model;

import java.util.List;

/**
 * Snapshot of what one reconciliation call found on disk.
 *
 * Recomputed from the filesystem on every call and never persisted, so a run
 * can always be repeated safely.
 *
 * @param required  every artifact the mode needs, in step order
 * @param missing   the subset of {@code required} not present
 * @param skipSteps ascending 1-based indices of steps whose artifacts all exist
 */
public record PipelineRun(
        Subject       subject,
        AnalysisMode  mode,
        List<String>  required,
        List<String>  missing,
        List<Integer> skipSteps) {

    public PipelineRun {
        required  = List.copyOf(required);
        missing   = List.copyOf(missing);
        skipSteps = List.copyOf(skipSteps);
    }

    public boolean isComplete() { return missing.isEmpty(); }
}
