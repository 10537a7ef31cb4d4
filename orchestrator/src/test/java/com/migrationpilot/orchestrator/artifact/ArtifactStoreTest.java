package com.migrationpilot.orchestrator.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactStoreTest {

    @TempDir Path dir;

    ArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(new ObjectMapper());
    }

    // ------------------------------------------------------------------
    // Presence
    // ------------------------------------------------------------------

    @Test
    void presentNames_listsFilesOnlySorted() throws IOException {
        Files.writeString(dir.resolve("tabs.json"), "{}");
        Files.writeString(dir.resolve("business-logic.json"), "{}");
        Files.createDirectory(dir.resolve("templates"));

        assertThat(store.presentNames(dir)).containsExactly("business-logic.json", "tabs.json");
    }

    @Test
    void presentNames_missingDirectory_isEmpty() {
        assertThat(store.presentNames(dir.resolve("nope"))).isEmpty();
    }

    // ------------------------------------------------------------------
    // read() / readTabLabels()
    // ------------------------------------------------------------------

    @Test
    void readTabLabels_absentFile_isEmpty() {
        assertThat(store.readTabLabels(dir)).isEmpty();
    }

    @Test
    void readTabLabels_mixedEntries_prefersTabNameAndStripsMarker() throws IOException {
        Files.writeString(dir.resolve("tabs.json"), """
                {
                  "tabs": [
                    "Billing",
                    { "tabName": "tabAudit", "tabText": "Audit Trail" },
                    { "tabText": "NotesTab" },
                    { "tabName": "" },
                    "Tab"
                  ]
                }
                """);

        List<String> labels = store.readTabLabels(dir);

        assertThat(labels).containsExactly("Billing", "Audit", "Notes", "Tab");
    }

    @Test
    void read_invalidJson_raisesSchemaError() throws IOException {
        Files.writeString(dir.resolve("tabs.json"), "{ not json");

        assertThatThrownBy(() -> store.readTabLabels(dir))
                .isInstanceOf(ArtifactSchemaException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void read_topLevelArray_raisesSchemaError() throws IOException {
        Files.writeString(dir.resolve("tabs.json"), "[\"Billing\"]");

        assertThatThrownBy(() -> store.readTabLabels(dir))
                .isInstanceOf(ArtifactSchemaException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    void read_missingRequiredField_raisesSchemaError() throws IOException {
        Files.writeString(dir.resolve("tabs.json"), "{\"formName\": \"frmAcme\"}");

        assertThatThrownBy(() -> store.readTabLabels(dir))
                .isInstanceOf(ArtifactSchemaException.class)
                .hasMessageContaining("'tabs'")
                .satisfies(e -> assertThat(((ArtifactSchemaException) e).exitCode()).isEqualTo(1));
    }

    @Test
    void read_newerSchemaVersion_raisesSchemaError() throws IOException {
        Files.writeString(dir.resolve("tabs.json"), "{\"schemaVersion\": 99, \"tabs\": []}");

        assertThatThrownBy(() -> store.readTabLabels(dir))
                .isInstanceOf(ArtifactSchemaException.class)
                .hasMessageContaining("schemaVersion 99");
    }

    @Test
    void read_conversionStatus_ignoresUnknownFields() throws IOException {
        Files.writeString(dir.resolve("conversion-status.json"), """
                { "entity": "Acme", "totalSteps": 10,
                  "steps": [ { "stepNumber": 3, "name": "Business logic", "status": "failed" } ] }
                """);

        ConversionStatus status = store.read(dir, ArtifactCatalog.CONVERSION_STATUS, ConversionStatus.class)
                .orElseThrow();

        assertThat(status.entity()).isEqualTo("Acme");
        assertThat(status.stepsOrEmpty()).singleElement()
                .satisfies(s -> assertThat(s.isProblem()).isTrue());
    }

    @Test
    void writeJson_createsParentsAndWritesPrettyJson() throws IOException {
        Path file = dir.resolve("out/report.json");

        store.writeJson(file, Map.of("entity", "Acme"));

        assertThat(Files.readString(file)).contains("\"entity\" : \"Acme\"");
    }

    // ------------------------------------------------------------------
    // ArtifactCatalog
    // ------------------------------------------------------------------

    @Test
    void catalog_knowsEveryAnalysisArtifact() {
        assertThat(ArtifactCatalog.forName("tabs.json")).isSameAs(ArtifactCatalog.TABS);
        assertThat(ArtifactCatalog.forName("security.json").requiredFields()).isEmpty();
        assertThatThrownBy(() -> ArtifactCatalog.forName("unknown.json"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
