package com.siteaudit.scan.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Pillar {
    ACCESSIBILITY("accessibility", "Accessibility"),
    PERFORMANCE("performance", "Performance"),
    SECURITY("security", "Trust & Security"),
    AGENT_READINESS("agentReadiness", "Agent Readiness");

    private final String key;
    private final String displayName;

    Pillar(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }
}
