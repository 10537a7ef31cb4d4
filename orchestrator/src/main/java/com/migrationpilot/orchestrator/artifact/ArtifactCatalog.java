package com.migrationpilot.orchestrator.artifact;

import com.migrationpilot.orchestrator.model.AnalysisStep;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Descriptors for every artifact the orchestrator reads.
 *
 * Analysis outputs without a listed field only have to be JSON objects.
 */
public final class ArtifactCatalog {

    public static final ArtifactDescriptor TABS =
            ArtifactDescriptor.of(AnalysisStep.TABS.artifact(), "tabs");

    public static final ArtifactDescriptor CONVERSION_STATUS =
            ArtifactDescriptor.of("conversion-status.json", "entity");

    private static final Map<String, ArtifactDescriptor> BY_NAME = Arrays.stream(AnalysisStep.values())
            .map(step -> step == AnalysisStep.TABS ? TABS : ArtifactDescriptor.of(step.artifact()))
            .collect(Collectors.toMap(ArtifactDescriptor::name, Function.identity()));

    private ArtifactCatalog() {}

    public static ArtifactDescriptor forName(String name) {
        if (CONVERSION_STATUS.name().equals(name)) {
            return CONVERSION_STATUS;
        }
        ArtifactDescriptor descriptor = BY_NAME.get(name);
        if (descriptor == null) {
            throw new IllegalArgumentException("No descriptor registered for artifact '" + name + "'");
        }
        return descriptor;
    }
}
