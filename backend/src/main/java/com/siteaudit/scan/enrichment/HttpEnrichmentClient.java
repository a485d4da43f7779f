package com.siteaudit.scan.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.http.PoliteHttpClient;
import com.siteaudit.scan.model.EnrichedSummary;
import com.siteaudit.scan.model.HttpFetchResult;
import com.siteaudit.scan.model.TopFix;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Posts the evidence summary as JSON to the configured summarizer endpoint.
 */
@Component
public class HttpEnrichmentClient implements EnrichmentClient {
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AuditProperties.Enrichment settings;

    public HttpEnrichmentClient(PoliteHttpClient httpClient, ObjectMapper objectMapper, AuditProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getEnrichment();
    }

    @Override
    public EnrichedSummary summarize(EvidenceSummary evidence) {
        if (!settings.isConfigured()) {
            throw new EnrichmentException("enrichment endpoint not configured");
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            throw new EnrichmentException("could not serialize evidence summary", e);
        }

        Map<String, String> headers = settings.getApiKey() == null || settings.getApiKey().isBlank()
            ? Map.of()
            : Map.of("Authorization", "Bearer " + settings.getApiKey());
        HttpFetchResult response = httpClient.postJson(settings.getEndpoint(), payload, "application/json", headers);
        if (!response.isSuccessful() || response.body() == null) {
            throw new EnrichmentException("enrichment call failed: " + response.failureReason());
        }

        SummarizerResponse parsed;
        try {
            parsed = objectMapper.readValue(response.body(), SummarizerResponse.class);
        } catch (JsonProcessingException e) {
            throw new EnrichmentException("malformed enrichment response", e);
        }
        if (parsed.summary() == null || parsed.summary().isBlank()) {
            throw new EnrichmentException("enrichment response had no summary");
        }
        return new EnrichedSummary(
            parsed.summary(),
            parsed.topFixes(),
            parsed.recommendations(),
            parsed.gradeExplanation() == null ? evidence.gradeExplanation() : parsed.gradeExplanation(),
            EnrichedSummary.Source.AI
        );
    }

    record SummarizerResponse(
        String summary,
        List<TopFix> topFixes,
        List<String> recommendations,
        String gradeExplanation
    ) {
    }
}
