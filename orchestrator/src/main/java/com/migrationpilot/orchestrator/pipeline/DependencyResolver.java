package com.migrationpilot.orchestrator.pipeline;

import com.migrationpilot.orchestrator.artifact.ArtifactStore;
import com.migrationpilot.orchestrator.model.AnalysisMode;
import com.migrationpilot.orchestrator.model.PipelineRun;
import com.migrationpilot.orchestrator.model.StepDefinition;
import com.migrationpilot.orchestrator.model.Subject;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

import static com.migrationpilot.orchestrator.model.AnalysisStep.*;

/**
 * Works out which artifacts a mode needs, which are missing, and which
 * worker steps can be skipped because their output already exists.
 *
 * Everything is derived from the current directory contents on each call.
 * There is no "last run" state, so reconciliation can be repeated freely.
 */
@Component
public class DependencyResolver {

    // Step numbering matches the analysis worker's own numbering per mode.
    private static final List<StepDefinition> PAIRED_STEPS = List.of(
            StepDefinition.of(1,  FORM_STRUCTURE_SEARCH),
            StepDefinition.of(2,  FORM_STRUCTURE_DETAIL),
            StepDefinition.of(3,  BUSINESS_LOGIC),
            StepDefinition.of(4,  DATA_ACCESS),
            StepDefinition.of(5,  SECURITY),
            StepDefinition.of(6,  UI_MAPPING),
            StepDefinition.of(7,  WORKFLOW),
            StepDefinition.of(8,  TABS),
            StepDefinition.of(9,  VALIDATION),
            StepDefinition.of(10, RELATED_ENTITIES)
    );

    private static final List<StepDefinition> SINGLE_STEPS = List.of(
            StepDefinition.of(1, FORM_STRUCTURE),
            StepDefinition.of(2, BUSINESS_LOGIC),
            StepDefinition.of(3, DATA_ACCESS),
            StepDefinition.of(4, SECURITY),
            StepDefinition.of(5, UI_MAPPING),
            StepDefinition.of(6, WORKFLOW),
            StepDefinition.of(7, TABS),
            StepDefinition.of(8, VALIDATION),
            StepDefinition.of(9, RELATED_ENTITIES)
    );

    private final ArtifactStore store;

    public DependencyResolver(ArtifactStore store) {
        this.store = store;
    }

    public List<StepDefinition> steps(AnalysisMode mode) {
        return switch (mode) {
            case PAIRED -> PAIRED_STEPS;
            case SINGLE -> SINGLE_STEPS;
        };
    }

    /** Every artifact the mode needs, in step order. Fixed per mode. */
    public List<String> requiredArtifacts(AnalysisMode mode) {
        return steps(mode).stream()
                .flatMap(step -> step.artifacts().stream())
                .toList();
    }

    /** Subset of {@code required} with no file on disk, in {@code required} order. */
    public List<String> missing(Path subjectDir, List<String> required) {
        return required.stream()
                .filter(name -> !store.exists(subjectDir, name))
                .toList();
    }

    /** Ascending 1-based indices of steps whose whole artifact set is present. */
    public List<Integer> skipStepsFor(Path subjectDir, AnalysisMode mode) {
        return skipSteps(subjectDir, steps(mode));
    }

    List<Integer> skipSteps(Path subjectDir, List<StepDefinition> steps) {
        return steps.stream()
                .filter(step -> step.artifacts().stream().allMatch(name -> store.exists(subjectDir, name)))
                .map(StepDefinition::index)
                .sorted()
                .toList();
    }

    public PipelineRun plan(Subject subject, AnalysisMode mode) {
        List<String> required = requiredArtifacts(mode);
        return new PipelineRun(
                subject,
                mode,
                required,
                missing(subject.directory(), required),
                skipStepsFor(subject.directory(), mode));
    }
}
