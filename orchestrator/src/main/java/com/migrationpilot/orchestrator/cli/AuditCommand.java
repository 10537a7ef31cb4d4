package com.migrationpilot.orchestrator.cli;

import com.migrationpilot.orchestrator.audit.AuditReport;
import com.migrationpilot.orchestrator.audit.OutputAuditor;
import com.migrationpilot.orchestrator.audit.SubjectAudit;
import com.migrationpilot.orchestrator.config.MigrationPilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Summarises which subjects under the output root still need work.
 * Always exits 0; the report itself is the result.
 */
@Component
@Command(
    name = "audit",
    description = "Audit analysis outputs and write _audit-output.json",
    mixinStandardHelpOptions = true
)
public class AuditCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AuditCommand.class);

    @Option(names = "--output-root", description = "Directory holding one folder per entity (default: configured output root)")
    Path outputRoot;

    private final OutputAuditor            auditor;
    private final MigrationPilotProperties properties;

    public AuditCommand(OutputAuditor auditor, MigrationPilotProperties properties) {
        this.auditor    = auditor;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        Path root = outputRoot != null ? outputRoot.toAbsolutePath().normalize() : properties.outputRootPath();
        AuditReport report = auditor.audit(root);

        if (report.needingAttention().isEmpty()) {
            log.info("All subjects have complete analysis outputs for their inferred mode");
            return ExitCodes.SUCCESS;
        }
        for (SubjectAudit audit : report.needingAttention()) {
            log.info("- {} (entity: {}{})", audit.folder(), audit.entity(),
                    audit.formName() != null ? ", form: " + audit.formName() : "");
            audit.problemSteps().forEach(s ->
                    log.info("    step {}: {} ({})", s.stepNumber(), s.status(), s.name()));
            audit.missingStepOutputs().forEach(m ->
                    log.info("    step {}: {} ({}) missing {}", m.stepNumber(), m.stepName(), m.status(), m.outputFile()));
            audit.missingForTemplateGen().forEach(f ->
                    log.info("    missing for template generation: {}", f));
        }
        return ExitCodes.SUCCESS;
    }
}
