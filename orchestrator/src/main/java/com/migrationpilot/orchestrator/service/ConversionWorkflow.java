package com.migrationpilot.orchestrator.service;

import com.migrationpilot.orchestrator.artifact.ArtifactStore;
import com.migrationpilot.orchestrator.config.ConfigurationException;
import com.migrationpilot.orchestrator.config.MigrationPilotProperties;
import com.migrationpilot.orchestrator.deploy.DependencyException;
import com.migrationpilot.orchestrator.deploy.DeploymentCopier;
import com.migrationpilot.orchestrator.deploy.DeploymentPlanFactory;
import com.migrationpilot.orchestrator.deploy.DeploymentResult;
import com.migrationpilot.orchestrator.generation.AssetClassification;
import com.migrationpilot.orchestrator.generation.AssetMatcher;
import com.migrationpilot.orchestrator.generation.TemplateGenerationStage;
import com.migrationpilot.orchestrator.model.AnalysisMode;
import com.migrationpilot.orchestrator.model.PipelineRun;
import com.migrationpilot.orchestrator.model.Subject;
import com.migrationpilot.orchestrator.pipeline.ModeDetector;
import com.migrationpilot.orchestrator.pipeline.PipelineOrchestrator;
import com.migrationpilot.orchestrator.worker.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * End-to-end run for one subject.
 *
 * Steps:
 *  1. detect the mode from the form-name hint and the files on disk
 *  2. reconcile the analysis artifacts (runs the analysis worker if needed)
 *  3. classify reference images against the subject's tabs
 *  4. launch the interactive template generator
 *  5. optionally mirror the templates into the target projects
 *
 * Strictly sequential; any stage failure ends the run with its exception.
 */
@Service
public class ConversionWorkflow {

    private static final Logger log = LoggerFactory.getLogger(ConversionWorkflow.class);

    static final String MDC_SUBJECT = "subject";

    private final PipelineOrchestrator     orchestrator;
    private final ArtifactStore            store;
    private final TemplateGenerationStage  generation;
    private final DeploymentCopier         copier;
    private final DeploymentPlanFactory    plans;
    private final MigrationPilotProperties properties;

    public ConversionWorkflow(PipelineOrchestrator orchestrator,
                              ArtifactStore store,
                              TemplateGenerationStage generation,
                              DeploymentCopier copier,
                              DeploymentPlanFactory plans,
                              MigrationPilotProperties properties) {
        this.orchestrator = orchestrator;
        this.store        = store;
        this.generation   = generation;
        this.copier       = copier;
        this.plans        = plans;
        this.properties   = properties;
    }

    // ------------------------------------------------------------------
    // Full run
    // ------------------------------------------------------------------

    public ConversionOutcome run(ConversionRequest request, CancellationToken token) {
        Subject subject = subject(request.entity(), request.outputDirectory());
        MDC.put(MDC_SUBJECT, subject.name());
        try {
            AnalysisMode mode = ModeDetector.detect(request.formName(), store.presentNames(subject.directory()));
            log.info("Converting '{}' in {} mode (output {})", subject.name(), mode, subject.directory());

            PipelineRun run = orchestrator.ensureArtifacts(subject, mode, request.formName(), token);

            if (request.skipGeneration()) {
                log.info("Skipping template generation as requested");
                return new ConversionOutcome(run, AssetClassification.empty(), false, Optional.empty());
            }

            List<Path> imageFiles = AssetMatcher.findReferenceImages(subject.directory());
            AssetClassification images = AssetMatcher.classify(imageFiles, store.readTabLabels(subject.directory()));
            log.info("Classified {} reference image(s) into {}", images.size(), images.categories());

            generation.generate(subject, run.required(), images, token);

            Optional<DeploymentResult> deployment = request.deploy()
                    ? Optional.of(deployTemplates(subject, request.dryRun()))
                    : Optional.empty();
            return new ConversionOutcome(run, images, true, deployment);
        } finally {
            MDC.remove(MDC_SUBJECT);
        }
    }

    // ------------------------------------------------------------------
    // Deployment only
    // ------------------------------------------------------------------

    public DeploymentResult deploy(String entity, Path outputDirectory, boolean dryRun) {
        Subject subject = subject(entity, outputDirectory);
        MDC.put(MDC_SUBJECT, subject.name());
        try {
            return deployTemplates(subject, dryRun);
        } finally {
            MDC.remove(MDC_SUBJECT);
        }
    }

    private DeploymentResult deployTemplates(Subject subject, boolean dryRun) {
        Path templates = subject.templatesDirectory();
        if (!Files.isDirectory(templates)) {
            throw new DependencyException(
                    "No generated templates for '" + subject.name() + "'",
                    List.of(templates),
                    "Run template generation first: migration-pilot --entity " + subject.name());
        }
        return copier.copy(templates, plans.mappings(), dryRun);
    }

    private Subject subject(String entity, Path outputDirectory) {
        if (entity == null || entity.isBlank()) {
            throw new ConfigurationException("Missing required option --entity",
                    "migration-pilot --entity <name> [--output <dir>] [--form-name <name>]");
        }
        return Subject.of(entity, properties.outputRootPath(), outputDirectory);
    }
}
