package com.migrationpilot.orchestrator.pipeline;

import com.migrationpilot.orchestrator.model.AnalysisMode;
import com.migrationpilot.orchestrator.model.AnalysisStep;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which artifact set applies to a subject.
 *
 * Pure function of its inputs: the caller lists the artifact names already on
 * disk, so this class never touches the filesystem itself.
 *
 * Precedence (first match wins):
 *   1. a form-name hint that is not "[frm]Xxx(Search|Detail)" forces SINGLE
 *   2. form-structure.json present                          → SINGLE
 *   3. form-structure-search.json or -detail.json present   → PAIRED
 *   4. otherwise                                            → PAIRED
 */
public final class ModeDetector {

    // Same convention the legacy forms use: frmFacilitySearch, frmFacilityDetail.
    private static final Pattern SEARCH_OR_DETAIL_FORM = Pattern.compile(
            "^(frm)?\\w+(Search|Detail)$",
            Pattern.CASE_INSENSITIVE
    );

    private ModeDetector() {}

    public static AnalysisMode detect(String formNameHint, Set<String> existingArtifactNames) {
        if (formNameHint != null && !formNameHint.isBlank()
                && !SEARCH_OR_DETAIL_FORM.matcher(formNameHint).matches()) {
            return AnalysisMode.SINGLE;
        }

        Set<String> existing = existingArtifactNames == null ? Set.of() : existingArtifactNames;
        if (existing.contains(AnalysisStep.FORM_STRUCTURE.artifact())) {
            return AnalysisMode.SINGLE;
        }
        if (existing.contains(AnalysisStep.FORM_STRUCTURE_SEARCH.artifact())
                || existing.contains(AnalysisStep.FORM_STRUCTURE_DETAIL.artifact())) {
            return AnalysisMode.PAIRED;
        }
        return AnalysisMode.PAIRED;
    }

    /**
     * Form name passed to the worker in SINGLE mode: the caller's hint, or
     * {@code frm<Subject>} when none was given.
     */
    public static String singleFormName(String subjectName, String formNameHint) {
        return formNameHint != null && !formNameHint.isBlank() ? formNameHint : "frm" + subjectName;
    }
}
