package com.migrationpilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Everything configurable about a run, bound from the {@code migrationpilot.*}
 * keys in application.yml (environment variables override through Spring's
 * relaxed binding, e.g. MIGRATIONPILOT_OUTPUT_ROOT).
 *
 * @param outputRoot  parent of all subject directories
 * @param projectDir  handed to workers as CLAUDE_PROJECT_DIR
 */
@ConfigurationProperties(prefix = "migrationpilot")
public record MigrationPilotProperties(
        String     outputRoot,
        String     projectDir,
        Worker     worker,
        Analysis   analysis,
        Generation generation,
        Deploy     deploy) {

    public MigrationPilotProperties {
        if (outputRoot == null || outputRoot.isBlank()) outputRoot = "output";
        if (projectDir == null || projectDir.isBlank()) projectDir = ".";
        if (worker == null)     worker     = new Worker(null);
        if (analysis == null)   analysis   = new Analysis(null);
        if (generation == null) generation = new Generation(null, null, null);
        if (deploy == null)     deploy     = new Deploy(null);
    }

    public Path outputRootPath() { return Path.of(outputRoot).toAbsolutePath().normalize(); }
    public Path projectDirPath() { return Path.of(projectDir).toAbsolutePath().normalize(); }

    /**
     * @param terminationGrace how long a cancelled worker gets between the
     *                         polite termination request and the forced kill
     */
    public record Worker(Duration terminationGrace) {
        public Worker {
            if (terminationGrace == null) terminationGrace = Duration.ofSeconds(10);
        }
    }

    /** @param command executable plus leading arguments of the analysis worker */
    public record Analysis(List<String> command) {
        public Analysis {
            command = command == null || command.isEmpty()
                    ? List.of("bun", "run", "agents/orchestrator.ts")
                    : List.copyOf(command);
        }
    }

    /**
     * @param command    executable of the interactive generation worker
     * @param arguments  fixed flags placed before the per-run ones
     * @param entityFlag pass {@code --entity <subject>} on the command line; off for
     *                   the bare claude CLI, which rejects unknown options and reads
     *                   ENTITY_NAME instead
     */
    public record Generation(List<String> command, List<String> arguments, Boolean entityFlag) {
        public Generation {
            command    = command == null || command.isEmpty() ? List.of("claude") : List.copyOf(command);
            arguments  = arguments == null ? List.of() : List.copyOf(arguments);
            entityFlag = entityFlag != null && entityFlag;
        }
    }

    public record Deploy(List<Target> targets) {
        public Deploy {
            targets = targets == null ? List.of() : List.copyOf(targets);
        }
    }

    /**
     * One target project. Its root must already exist before anything is copied.
     *
     * @param name     label used in logs ("shared", "api", "ui")
     * @param root     the target project's root directory
     * @param mappings template sub-folders copied into it
     */
    public record Target(String name, String root, List<Mapping> mappings) {
        public Target {
            mappings = mappings == null ? List.of() : List.copyOf(mappings);
        }
    }

    /**
     * @param source      folder relative to the subject's templates/ directory
     * @param destination folder relative to the target root; blank means the root itself
     */
    public record Mapping(String source, String destination) {}
}
