package com.migrationpilot.orchestrator.deploy;

import com.migrationpilot.orchestrator.config.MigrationPilotProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Turns the configured deploy targets into concrete copy mappings. */
@Component
public class DeploymentPlanFactory {

    private final MigrationPilotProperties properties;

    public DeploymentPlanFactory(MigrationPilotProperties properties) {
        this.properties = properties;
    }

    public List<DeploymentMapping> mappings() {
        List<DeploymentMapping> mappings = new ArrayList<>();
        for (MigrationPilotProperties.Target target : properties.deploy().targets()) {
            Path root = Path.of(target.root()).toAbsolutePath().normalize();
            for (MigrationPilotProperties.Mapping m : target.mappings()) {
                Path destination = m.destination() == null || m.destination().isBlank()
                        ? root
                        : root.resolve(m.destination()).normalize();
                mappings.add(new DeploymentMapping(m.source(), destination, root, target.name()));
            }
        }
        return mappings;
    }
}
