package com.siteaudit.scan.enrichment;

import com.siteaudit.scan.model.EnrichedSummary;

/**
 * External summarizer for a finished scan. Implementations signal every failure, including
 * quota, timeout and malformed responses, with {@link EnrichmentException}.
 */
public interface EnrichmentClient {
    EnrichedSummary summarize(EvidenceSummary evidence);
}
