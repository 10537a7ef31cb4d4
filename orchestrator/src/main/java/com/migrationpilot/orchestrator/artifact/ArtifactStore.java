package com.migrationpilot.orchestrator.artifact;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Filesystem view of a subject's artifact directory.
 *
 * Presence is always read from disk; nothing is cached between calls, so a
 * worker that writes files in the meantime is seen on the next check.
 */
@Component
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final ObjectMapper json;

    public ArtifactStore(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Presence
    // ------------------------------------------------------------------

    public boolean exists(Path subjectDir, String artifactName) {
        return Files.isRegularFile(subjectDir.resolve(artifactName));
    }

    /** Names of all regular files directly under the directory (sorted). */
    public Set<String> presentNames(Path subjectDir) {
        if (!Files.isDirectory(subjectDir)) {
            return Collections.emptySet();
        }
        try (Stream<Path> entries = Files.list(subjectDir)) {
            Set<String> names = new TreeSet<>();
            entries.filter(Files::isRegularFile)
                   .forEach(p -> names.add(p.getFileName().toString()));
            return names;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + subjectDir, e);
        }
    }

    // ------------------------------------------------------------------
    // Typed reads
    // ------------------------------------------------------------------

    /**
     * Read and validate an artifact against its descriptor.
     *
     * @return empty when the file does not exist
     * @throws ArtifactSchemaException when the file exists but does not match
     */
    public <T> Optional<T> read(Path subjectDir, ArtifactDescriptor descriptor, Class<T> type) {
        Path file = subjectDir.resolve(descriptor.name());
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = json.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new ArtifactSchemaException(file, "not valid JSON (" + e.getOriginalMessage() + ")", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }

        validate(file, root, descriptor);

        try {
            return Optional.of(json.treeToValue(root, type));
        } catch (JsonProcessingException e) {
            throw new ArtifactSchemaException(file, "unexpected shape (" + e.getOriginalMessage() + ")", e);
        }
    }

    /** Tab labels from tabs.json, in file order; empty when the artifact is absent. */
    public List<String> readTabLabels(Path subjectDir) {
        List<String> labels = read(subjectDir, ArtifactCatalog.TABS, TabsArtifact.class)
                .map(TabsArtifact::labels)
                .orElse(List.of());
        log.debug("Read {} tab label(s) from {}", labels.size(), subjectDir);
        return labels;
    }

    /** Pretty-printed JSON write, used for reports the orchestrator produces itself. */
    public void writeJson(Path file, Object value) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            json.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + file, e);
        }
    }

    private static void validate(Path file, JsonNode root, ArtifactDescriptor descriptor) {
        if (root == null || !root.isObject()) {
            throw new ArtifactSchemaException(file, "expected a JSON object at the top level");
        }
        for (String field : descriptor.requiredFields()) {
            if (!root.has(field) || root.get(field).isNull()) {
                throw new ArtifactSchemaException(file, "required field '" + field + "' is missing");
            }
        }
        JsonNode version = root.get("schemaVersion");
        if (version != null && version.canConvertToInt() && version.asInt() > descriptor.schemaVersion()) {
            throw new ArtifactSchemaException(file, "schemaVersion " + version.asInt()
                    + " is newer than the supported version " + descriptor.schemaVersion());
        }
    }
}
