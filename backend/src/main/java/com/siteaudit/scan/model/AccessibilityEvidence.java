package com.siteaudit.scan.model;

import java.util.List;

public record AccessibilityEvidence(
    List<AccessibilityViolation> violations,
    int passes,
    int criticalViolations
) implements PillarEvidence {

    public AccessibilityEvidence {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    @Override
    public List<AuditFinding> findings() {
        return violations.stream()
            .map(violation -> new AuditFinding(
                violation.id(),
                violation.description(),
                "Fix " + violation.nodes() + " instance(s) of " + violation.id(),
                violation.impact().toImpact(),
                violation.nodes()
            ))
            .toList();
    }

    public record AccessibilityViolation(
        String id,
        Severity impact,
        String description,
        int nodes
    ) {
    }

    public enum Severity {
        CRITICAL,
        SERIOUS,
        MODERATE,
        MINOR;

        Impact toImpact() {
            return switch (this) {
                case CRITICAL, SERIOUS -> Impact.HIGH;
                case MODERATE -> Impact.MEDIUM;
                case MINOR -> Impact.LOW;
            };
        }
    }
}
