package com.siteaudit.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record PillarResult(
    int score,
    PillarEvidence evidence,
    boolean error
) {
    public PillarResult {
        score = clamp(score);
        if (evidence == null) {
            evidence = new FailedEvidence("no evidence reported");
        }
    }

    public static PillarResult of(int score, PillarEvidence evidence) {
        return new PillarResult(score, evidence, false);
    }

    public static PillarResult failed(String message) {
        return new PillarResult(0, new FailedEvidence(message), true);
    }

    @JsonIgnore
    public boolean isUsable() {
        return !error;
    }

    public static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
