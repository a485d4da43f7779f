package com.siteaudit.scan.model;

import java.util.List;

public record FailedEvidence(String message) implements PillarEvidence {

    @Override
    public List<AuditFinding> findings() {
        return List.of();
    }
}
