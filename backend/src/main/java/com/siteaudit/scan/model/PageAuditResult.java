package com.siteaudit.scan.model;

import java.util.Map;

public record PageAuditResult(
    String url,
    PageType pageType,
    PillarResult accessibility,
    PillarResult performance,
    PillarResult security,
    PillarResult agentReadiness,
    String screenshotRef,
    EcommerceAnalysis ecommerceAnalysis,
    int overallScore
) {
    public PageAuditResult {
        overallScore = PillarResult.clamp(overallScore);
    }

    /**
     * Result recorded when the whole audit set for a page blew up.
     */
    public static PageAuditResult failed(DiscoveredPage page, String message) {
        return new PageAuditResult(
            page.url(),
            page.pageType(),
            PillarResult.failed(message),
            PillarResult.failed(message),
            PillarResult.failed(message),
            PillarResult.failed(message),
            null,
            null,
            0
        );
    }

    public PillarResult pillar(Pillar pillar) {
        return switch (pillar) {
            case ACCESSIBILITY -> accessibility;
            case PERFORMANCE -> performance;
            case SECURITY -> security;
            case AGENT_READINESS -> agentReadiness;
        };
    }

    public Map<Pillar, PillarResult> pillars() {
        return Map.of(
            Pillar.ACCESSIBILITY, accessibility,
            Pillar.PERFORMANCE, performance,
            Pillar.SECURITY, security,
            Pillar.AGENT_READINESS, agentReadiness
        );
    }

    /**
     * True when at least one pillar produced a non-zero score without error.
     */
    public boolean hasUsableScore() {
        return pillars().values().stream().anyMatch(result -> result.isUsable() && result.score() > 0);
    }
}
