package com.siteaudit.scan.enrichment;

import com.siteaudit.scan.model.EnrichedSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class EnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final EnrichmentClient client;
    private final DeterministicSummaryGenerator fallbackGenerator;

    public EnrichmentService(EnrichmentClient client, DeterministicSummaryGenerator fallbackGenerator) {
        this.client = client;
        this.fallbackGenerator = fallbackGenerator;
    }

    /**
     * Never fails: an enrichment error is replaced by the deterministic summary of the same shape.
     */
    public EnrichedSummary enrich(EvidenceSummary evidence) {
        return EnrichmentAttempt.of(() -> client.summarize(evidence))
            .orElseGet(failure -> {
                log.warn("enrichment unavailable, using fallback summary url={} reason={}",
                    evidence.primaryUrl(), failure.getMessage());
                return fallbackGenerator.generate(evidence);
            });
    }
}
