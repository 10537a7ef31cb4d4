package com.migrationpilot.orchestrator.audit;

import java.util.List;

/** Shape of _audit-output.json. */
public record AuditReport(String generatedAt, List<SubjectAudit> audits) {

    public AuditReport {
        audits = List.copyOf(audits);
    }

    public List<SubjectAudit> needingAttention() {
        return audits.stream().filter(SubjectAudit::needsAttention).toList();
    }
}
