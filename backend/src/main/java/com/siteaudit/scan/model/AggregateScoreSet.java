package com.siteaudit.scan.model;

public record AggregateScoreSet(
    int accessibility,
    int performance,
    int security,
    int agentReadiness,
    int overall
) {
    public AggregateScoreSet {
        accessibility = PillarResult.clamp(accessibility);
        performance = PillarResult.clamp(performance);
        security = PillarResult.clamp(security);
        agentReadiness = PillarResult.clamp(agentReadiness);
        overall = PillarResult.clamp(overall);
    }

    public int score(Pillar pillar) {
        return switch (pillar) {
            case ACCESSIBILITY -> accessibility;
            case PERFORMANCE -> performance;
            case SECURITY -> security;
            case AGENT_READINESS -> agentReadiness;
        };
    }
}
