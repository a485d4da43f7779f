package com.siteaudit.scan.model;

import java.util.List;

public record EcommerceSummary(
    boolean hasEcommerce,
    boolean hasBooking,
    int functionalityScore,
    int securityScore,
    List<String> criticalIssues,
    List<String> recommendations
) {
    public EcommerceSummary {
        functionalityScore = PillarResult.clamp(functionalityScore);
        securityScore = PillarResult.clamp(securityScore);
        criticalIssues = criticalIssues == null ? List.of() : List.copyOf(criticalIssues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
