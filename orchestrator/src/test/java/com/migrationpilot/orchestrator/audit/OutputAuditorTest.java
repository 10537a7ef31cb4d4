package com.migrationpilot.orchestrator.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.migrationpilot.orchestrator.artifact.ArtifactStore;
import com.migrationpilot.orchestrator.artifact.ConversionStatus;
import com.migrationpilot.orchestrator.model.AnalysisMode;
import com.migrationpilot.orchestrator.pipeline.DependencyResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class OutputAuditorTest {

    @TempDir Path root;

    ObjectMapper       json;
    DependencyResolver resolver;
    OutputAuditor      auditor;

    @BeforeEach
    void setUp() {
        json     = new ObjectMapper();
        ArtifactStore store = new ArtifactStore(json);
        resolver = new DependencyResolver(store);
        auditor  = new OutputAuditor(store, resolver,
                Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void audit_flagsSubjectsWithGapsAndWritesReport() throws IOException {
        // Complete single-form subject with templates
        Path vendor = Files.createDirectories(root.resolve("Vendor"));
        for (String name : resolver.requiredArtifacts(AnalysisMode.SINGLE)) {
            Files.writeString(vendor.resolve(name), "{}");
        }
        Files.createDirectories(vendor.resolve("templates"));

        // Paired subject with a failed step and a missing output
        Path acme = Files.createDirectories(root.resolve("Acme"));
        Files.writeString(acme.resolve("form-structure-search.json"), "{}");
        Files.writeString(acme.resolve("conversion-status.json"), """
                { "entity": "Acme", "formName": "frmAcmeSearch", "overallStatus": "failed",
                  "steps": [
                    { "stepNumber": 1, "name": "Search form", "status": "completed", "outputFile": "form-structure-search.json" },
                    { "stepNumber": 3, "name": "Business logic", "status": "failed", "outputFile": "business-logic.json" },
                    { "stepNumber": 4, "name": "Data access", "status": "skipped", "outputFile": "data-access.json" }
                  ] }
                """);

        // Not subjects
        Files.createDirectories(root.resolve("_archive"));
        Files.createDirectories(root.resolve(".cache"));

        AuditReport report = auditor.audit(root);

        assertThat(report.audits()).extracting(SubjectAudit::folder).containsExactly("Acme", "Vendor");
        assertThat(report.needingAttention()).extracting(SubjectAudit::folder).containsExactly("Acme");

        SubjectAudit audit = report.audits().get(0);
        assertThat(audit.mode()).isEqualTo(AnalysisMode.PAIRED);
        assertThat(audit.formName()).isEqualTo("frmAcmeSearch");
        assertThat(audit.hasTemplatesFolder()).isFalse();
        assertThat(audit.problemSteps()).extracting(ConversionStatus.StepStatus::stepNumber).containsExactly(3);
        assertThat(audit.missingStepOutputs()).extracting(SubjectAudit.MissingStepOutput::outputFile)
                .containsExactly("business-logic.json");
        assertThat(audit.missingForTemplateGen()).hasSize(9).doesNotContain("form-structure-search.json");

        SubjectAudit vendorAudit = report.audits().get(1);
        assertThat(vendorAudit.mode()).isEqualTo(AnalysisMode.SINGLE);
        assertThat(vendorAudit.entity()).isEqualTo("Vendor");
        assertThat(vendorAudit.hasTemplatesFolder()).isTrue();

        JsonNode written = json.readTree(root.resolve(OutputAuditor.REPORT_FILE).toFile());
        assertThat(written.get("generatedAt").asText()).isEqualTo("2026-01-05T10:00:00Z");
        assertThat(written.get("audits")).hasSize(2);
        assertThat(written.get("audits").get(0).has("needsAttention")).isFalse();
    }

    @Test
    void audit_emptyRoot_writesEmptyReport() {
        AuditReport report = auditor.audit(root);

        assertThat(report.audits()).isEmpty();
        assertThat(root.resolve(OutputAuditor.REPORT_FILE)).exists();
    }
}
