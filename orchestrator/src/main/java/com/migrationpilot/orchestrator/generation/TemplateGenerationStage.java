package com.migrationpilot.orchestrator.generation;

import com.migrationpilot.orchestrator.config.MigrationPilotProperties;
import com.migrationpilot.orchestrator.model.Subject;
import com.migrationpilot.orchestrator.model.WorkerInvocation;
import com.migrationpilot.orchestrator.worker.CancellationToken;
import com.migrationpilot.orchestrator.worker.WorkerExecutionException;
import com.migrationpilot.orchestrator.worker.WorkerProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Launches the interactive template generator for a subject whose analysis
 * artifacts are complete. The worker shares the terminal with the operator.
 */
@Component
public class TemplateGenerationStage {

    private static final Logger log = LoggerFactory.getLogger(TemplateGenerationStage.class);

    static final String STAGE = "generation";

    private final WorkerProcessRunner      runner;
    private final MigrationPilotProperties properties;

    public TemplateGenerationStage(WorkerProcessRunner runner, MigrationPilotProperties properties) {
        this.runner     = runner;
        this.properties = properties;
    }

    /**
     * @throws WorkerExecutionException if the generator exits nonzero
     */
    public void generate(Subject subject,
                         List<String> analysisFiles,
                         AssetClassification images,
                         CancellationToken token) {
        WorkerInvocation invocation = invocation(subject, analysisFiles, images);

        log.info("Starting template generation for '{}' ({} reference images)", subject.name(), images.size());
        int exitCode = runner.run(invocation, token);
        if (exitCode != 0) {
            log.error("Template generation failed for '{}' (exit {})", subject.name(), exitCode);
            throw new WorkerExecutionException(invocation, exitCode);
        }
        log.info("Template generation for '{}' finished", subject.name());
    }

    WorkerInvocation invocation(Subject subject, List<String> analysisFiles, AssetClassification images) {
        MigrationPilotProperties.Generation cfg = properties.generation();

        List<String> args = new ArrayList<>(cfg.arguments());
        if (cfg.entityFlag()) {
            args.add("--entity");
            args.add(subject.name());
        }
        args.add("--append-system-prompt");
        args.add(GenerationContextBuilder.build(subject, analysisFiles, images));
        args.add(GenerationContextBuilder.initialPrompt(subject));

        return new WorkerInvocation(
                STAGE,
                cfg.command(),
                args,
                subject.directory(),
                Map.of(
                        "ENTITY_NAME",        subject.name(),
                        "OUTPUT_PATH",        subject.directory().toString(),
                        "CLAUDE_PROJECT_DIR", properties.projectDirPath().toString()));
    }
}
