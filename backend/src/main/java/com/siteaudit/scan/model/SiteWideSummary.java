package com.siteaudit.scan.model;

import java.util.List;

public record SiteWideSummary(
    int totalIssues,
    int criticalIssues,
    List<String> commonProblems,
    List<String> strengths
) {
    public SiteWideSummary {
        commonProblems = commonProblems == null ? List.of() : List.copyOf(commonProblems);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
    }
}
