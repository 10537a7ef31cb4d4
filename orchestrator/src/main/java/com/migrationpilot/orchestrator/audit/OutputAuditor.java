package com.migrationpilot.orchestrator.audit;

import com.migrationpilot.orchestrator.artifact.ArtifactCatalog;
import com.migrationpilot.orchestrator.artifact.ArtifactStore;
import com.migrationpilot.orchestrator.artifact.ConversionStatus;
import com.migrationpilot.orchestrator.model.AnalysisMode;
import com.migrationpilot.orchestrator.pipeline.DependencyResolver;
import com.migrationpilot.orchestrator.pipeline.ModeDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Scans every subject directory under the output root and reports what is
 * still missing before template generation can run.
 *
 * Folders starting with "_" or "." are not subjects and are ignored.
 */
@Component
public class OutputAuditor {

    private static final Logger log = LoggerFactory.getLogger(OutputAuditor.class);

    public static final String REPORT_FILE = "_audit-output.json";

    private final ArtifactStore      store;
    private final DependencyResolver resolver;
    private final Clock              clock;

    public OutputAuditor(ArtifactStore store, DependencyResolver resolver) {
        this(store, resolver, Clock.systemUTC());
    }

    OutputAuditor(ArtifactStore store, DependencyResolver resolver, Clock clock) {
        this.store    = store;
        this.resolver = resolver;
        this.clock    = clock;
    }

    /** Audit all subjects and write {@value #REPORT_FILE} into the output root. */
    public AuditReport audit(Path outputRoot) {
        List<SubjectAudit> audits = new ArrayList<>();
        for (Path dir : subjectDirectories(outputRoot)) {
            audits.add(auditSubject(dir));
        }

        AuditReport report = new AuditReport(Instant.now(clock).toString(), audits);
        Path reportFile = outputRoot.resolve(REPORT_FILE);
        store.writeJson(reportFile, report);

        log.info("Audited {} subject(s), {} need attention; report written to {}",
                audits.size(), report.needingAttention().size(), reportFile);
        return report;
    }

    SubjectAudit auditSubject(Path dir) {
        String folder = dir.getFileName().toString();
        Optional<ConversionStatus> status = store.read(dir, ArtifactCatalog.CONVERSION_STATUS, ConversionStatus.class);

        List<ConversionStatus.StepStatus> steps = status.map(ConversionStatus::stepsOrEmpty).orElse(List.of());
        List<ConversionStatus.StepStatus> problems = steps.stream()
                .filter(ConversionStatus.StepStatus::isProblem)
                .toList();

        List<SubjectAudit.MissingStepOutput> missingOutputs = new ArrayList<>();
        for (ConversionStatus.StepStatus step : steps) {
            if (step.outputFile() == null || step.isSkipped()) {
                continue;
            }
            if (!Files.exists(dir.resolve(step.outputFile()))) {
                missingOutputs.add(new SubjectAudit.MissingStepOutput(
                        step.stepNumber(), step.name(), step.status(), step.outputFile()));
            }
        }

        AnalysisMode mode = ModeDetector.detect(null, store.presentNames(dir));
        List<String> missingForGeneration = resolver.missing(dir, resolver.requiredArtifacts(mode));

        return new SubjectAudit(
                folder,
                status.map(ConversionStatus::entity).orElse(folder),
                status.map(ConversionStatus::formName).orElse(null),
                status.map(ConversionStatus::overallStatus).orElse(null),
                mode,
                Files.isDirectory(dir.resolve("templates")),
                problems,
                missingOutputs,
                missingForGeneration);
    }

    private static List<Path> subjectDirectories(Path outputRoot) {
        if (!Files.isDirectory(outputRoot)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(outputRoot)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return !name.startsWith("_") && !name.startsWith(".");
                    })
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + outputRoot, e);
        }
    }
}
