package com.siteaudit.scan.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of a completed scan, handed to the result sink.
 */
public record ScanReport(
    String scanId,
    String primaryUrl,
    int pagesAnalyzed,
    List<PageAuditResult> pageResults,
    AggregateScoreSet aggregateScores,
    String grade,
    String gradeExplanation,
    SiteWideSummary siteWideSummary,
    EcommerceSummary ecommerceSummary,
    EnrichedSummary enrichment,
    Instant completedAt
) {
    public ScanReport {
        pageResults = pageResults == null ? List.of() : List.copyOf(pageResults);
    }
}
