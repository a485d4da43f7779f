package com.siteaudit.scan.audit;

import com.siteaudit.scan.http.PoliteHttpClient;
import com.siteaudit.scan.model.AuditFinding;
import com.siteaudit.scan.model.HttpFetchResult;
import com.siteaudit.scan.model.Impact;
import com.siteaudit.scan.model.PillarResult;
import com.siteaudit.scan.model.SecurityEvidence;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SecurityHeadersAuditorTest {

    @Test
    void hardenedHttpsPageIsCappedAtHundred() {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String header : SecurityHeadersAuditor.SECURITY_HEADERS) {
            headers.put(header, "set");
        }
        HttpFetchResult fetch = fetch("https://example.com/", 200, headers, """
            <a href="/privacy">Privacy</a><a href="/terms">Terms</a><a href="/contact">Contact us</a>
            """);

        PillarResult result = SecurityHeadersAuditor.evaluate(fetch);

        SecurityEvidence evidence = (SecurityEvidence) result.evidence();
        assertThat(result.score()).isEqualTo(100);
        assertThat(evidence.https()).isTrue();
        assertThat(evidence.missingHeaders()).isEmpty();
        assertThat(evidence.findings()).isEmpty();
    }

    @Test
    void scoresHeadersHttpsAndPolicyLinks() {
        HttpFetchResult fetch = fetch("https://example.com/", 200, Map.of(
            "strict-transport-security", "max-age=63072000",
            "x-content-type-options", "nosniff"
        ), "<footer><a href=\"/legal/privacy-notice\">Privacy</a></footer>");

        PillarResult result = SecurityHeadersAuditor.evaluate(fetch);

        // two headers, https, privacy link, legal path counts as terms
        assertThat(result.score()).isEqualTo(55);
        SecurityEvidence evidence = (SecurityEvidence) result.evidence();
        assertThat(evidence.privacyPolicy()).isTrue();
        assertThat(evidence.termsOfService()).isTrue();
        assertThat(evidence.hasHeader("strict-transport-security")).isTrue();
        assertThat(evidence.findings()).extracting(AuditFinding::id)
            .containsExactly("missing-csp", "missing-x-frame-options");
    }

    @Test
    void plainHttpIsAHighImpactFinding() {
        PillarResult result = SecurityHeadersAuditor.evaluate(fetch("http://example.com/", 200, Map.of(), "<p>hi</p>"));

        assertThat(result.score()).isZero();
        assertThat(((SecurityEvidence) result.evidence()).https()).isFalse();
        assertThat(result.evidence().findings()).first()
            .extracting(AuditFinding::id, AuditFinding::impact)
            .containsExactly("no-https", Impact.HIGH);
    }

    @Test
    void errorStatusIsStillAuditedButTransportFailureIsNot() {
        PoliteHttpClient client = mock(PoliteHttpClient.class);
        when(client.get("https://example.com/gone", PoliteHttpClient.HTML_ACCEPT))
            .thenReturn(fetch("https://example.com/gone", 404, Map.of("x-frame-options", "DENY"), ""));
        when(client.get("https://down.example.com/", PoliteHttpClient.HTML_ACCEPT))
            .thenReturn(new HttpFetchResult("https://down.example.com/", null, 0, null, null, null, null,
                Map.of(), Instant.now(), Duration.ZERO, "timeout", "timed out"));
        SecurityHeadersAuditor auditor = new SecurityHeadersAuditor(client);

        PillarResult gone = auditor.audit("https://example.com/gone");
        PillarResult down = auditor.audit("https://down.example.com/");

        assertThat(gone.error()).isFalse();
        assertThat(gone.score()).isEqualTo(30);
        assertThat(down.error()).isTrue();
        assertThat(down.score()).isZero();
    }

    private static HttpFetchResult fetch(String url, int status, Map<String, String> headers, String body) {
        return new HttpFetchResult(url, URI.create(url), status, body, body.getBytes(), "text/html", null,
            headers, Instant.now(), Duration.ZERO, null, null);
    }
}
