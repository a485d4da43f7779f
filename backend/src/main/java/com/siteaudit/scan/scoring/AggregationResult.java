package com.siteaudit.scan.scoring;

import com.siteaudit.scan.model.AggregateScoreSet;
import com.siteaudit.scan.model.EcommerceSummary;
import com.siteaudit.scan.model.SiteWideSummary;

/**
 * {@code ecommerceSummary} is null when the crawl found no commerce or booking pages.
 */
public record AggregationResult(
    AggregateScoreSet scores,
    Grade grade,
    SiteWideSummary siteWideSummary,
    EcommerceSummary ecommerceSummary
) {
}
