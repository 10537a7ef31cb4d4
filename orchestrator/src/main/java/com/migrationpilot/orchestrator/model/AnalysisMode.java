package com.migrationpilot.orchestrator.model;

/**
 * Which required-artifact set applies to a subject.
 *
 *   PAIRED: the legacy screen is a search form plus a detail form, analysed
 *            separately (form-structure-search.json + form-structure-detail.json)
 *   SINGLE: one standalone form (form-structure.json)
 *
 * Decided once per run and never changed afterwards.
 */
public enum AnalysisMode {
    PAIRED,
    SINGLE
}
