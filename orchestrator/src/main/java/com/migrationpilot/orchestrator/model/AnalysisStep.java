package com.migrationpilot.orchestrator.model;

/**
 * The analysis steps run by the upstream worker, one artifact each.
 *
 * The order here is not the step order; {@code DependencyResolver} owns the
 * per-mode step tables. Each constant only knows which file it produces.
 */
public enum AnalysisStep {
    FORM_STRUCTURE        ("form-structure.json",        "Extract single-form UI components"),
    FORM_STRUCTURE_SEARCH ("form-structure-search.json", "Extract search form UI components"),
    FORM_STRUCTURE_DETAIL ("form-structure-detail.json", "Extract detail form UI components"),
    BUSINESS_LOGIC        ("business-logic.json",        "Extract business rules"),
    DATA_ACCESS           ("data-access.json",           "Extract stored procedures and queries"),
    SECURITY              ("security.json",              "Extract permissions and authorization"),
    UI_MAPPING            ("ui-mapping.json",            "Map legacy controls to modern equivalents"),
    WORKFLOW              ("workflow.json",              "Extract user flows and state management"),
    TABS                  ("tabs.json",                  "Extract tab structure"),
    VALIDATION            ("validation.json",            "Extract validation rules"),
    RELATED_ENTITIES      ("related-entities.json",      "Extract entity relationships");

    private final String artifact;
    private final String description;

    AnalysisStep(String artifact, String description) {
        this.artifact    = artifact;
        this.description = description;
    }

    /** File name of the artifact this step writes into the subject directory. */
    public String artifact()    { return artifact; }
    public String description() { return description; }
}
