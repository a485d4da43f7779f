package com.siteaudit.scan.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteaudit.config.AuditConfig;
import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.http.PoliteHttpClient;
import com.siteaudit.scan.model.EnrichedSummary;
import com.siteaudit.scan.model.Impact;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpEnrichmentClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private AuditProperties properties;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new AuditProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.getEnrichment().setEndpoint(server.url("/v1/summarize").toString());
        objectMapper = new AuditConfig().objectMapper();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void postsEvidenceAndParsesSummary() throws Exception {
        properties.getEnrichment().setApiKey("secret-key");
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "summary": "Solid accessibility, slow pages.",
                  "topFixes": [
                    {"title": "Add CSP", "description": "Send a policy", "impact": "medium", "effort": "low",
                     "pillar": "Trust & Security", "priority": 60.0}
                  ],
                  "recommendations": ["Compress hero images"],
                  "model": "ignored-field"
                }
                """));

        EnrichedSummary summary = client().summarize(EnrichmentFixtures.typicalEvidence());

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret-key");
        assertThat(request.getBody().readUtf8())
            .contains("\"primaryUrl\":\"https://example.com/\"")
            .contains("\"grade\":\"C+\"");
        assertThat(summary.source()).isEqualTo(EnrichedSummary.Source.AI);
        assertThat(summary.summary()).isEqualTo("Solid accessibility, slow pages.");
        assertThat(summary.topFixes()).singleElement().satisfies(fix -> {
            assertThat(fix.impact()).isEqualTo(Impact.MEDIUM);
            assertThat(fix.effort()).isEqualTo(Impact.LOW);
        });
        assertThat(summary.gradeExplanation()).startsWith("Fair.");
    }

    @Test
    void serverErrorBecomesEnrichmentException() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"quota\"}"));

        assertThatThrownBy(() -> client().summarize(EnrichmentFixtures.typicalEvidence()))
            .isInstanceOf(EnrichmentException.class)
            .hasMessageContaining("http_429");
    }

    @Test
    void malformedOrEmptyResponsesAreRejected() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("not json"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"summary\":\"  \"}"));
        HttpEnrichmentClient client = client();

        assertThatThrownBy(() -> client.summarize(EnrichmentFixtures.typicalEvidence()))
            .isInstanceOf(EnrichmentException.class)
            .hasMessage("malformed enrichment response");
        assertThatThrownBy(() -> client.summarize(EnrichmentFixtures.typicalEvidence()))
            .isInstanceOf(EnrichmentException.class)
            .hasMessage("enrichment response had no summary");
    }

    @Test
    void unconfiguredEndpointFailsWithoutCalling() {
        properties.getEnrichment().setEndpoint("  ");

        assertThatThrownBy(() -> client().summarize(EnrichmentFixtures.typicalEvidence()))
            .isInstanceOf(EnrichmentException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    private HttpEnrichmentClient client() {
        return new HttpEnrichmentClient(new PoliteHttpClient(properties, executor), objectMapper, properties);
    }
}
