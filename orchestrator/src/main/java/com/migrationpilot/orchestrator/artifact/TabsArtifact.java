package com.migrationpilot.orchestrator.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Shape of tabs.json as far as the orchestrator cares: the ordered list of
 * tabs on the detail form. Entries are either plain strings or objects
 * carrying {@code tabName} and/or {@code tabText}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TabsArtifact(List<JsonNode> tabs) {

    /**
     * Display labels in tabs.json order, with the "tab" control-name marker
     * removed ("tabBilling" and "BillingTab" both become "Billing").
     */
    public List<String> labels() {
        List<String> labels = new ArrayList<>();
        if (tabs == null) {
            return labels;
        }
        for (JsonNode tab : tabs) {
            String raw = rawName(tab);
            if (raw == null || raw.isBlank()) {
                continue;
            }
            labels.add(stripMarker(raw.strip()));
        }
        return labels;
    }

    private static String rawName(JsonNode tab) {
        if (tab == null || tab.isNull()) {
            return null;
        }
        if (tab.isTextual()) {
            return tab.asText();
        }
        String name = tab.path("tabName").asText("");
        return name.isBlank() ? tab.path("tabText").asText("") : name;
    }

    static String stripMarker(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        String stripped = name;
        if (lower.startsWith("tab") && name.length() > 3) {
            stripped = name.substring(3);
        } else if (lower.endsWith("tab") && name.length() > 3) {
            stripped = name.substring(0, name.length() - 3);
        }
        return stripped;
    }
}
