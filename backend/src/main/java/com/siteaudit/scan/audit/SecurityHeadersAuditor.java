package com.siteaudit.scan.audit;

import com.siteaudit.scan.http.PoliteHttpClient;
import com.siteaudit.scan.model.AuditFinding;
import com.siteaudit.scan.model.HttpFetchResult;
import com.siteaudit.scan.model.Impact;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.PillarResult;
import com.siteaudit.scan.model.SecurityEvidence;
import com.siteaudit.scan.util.UrlSupport;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class SecurityHeadersAuditor implements PageAuditor {
    private static final Logger log = LoggerFactory.getLogger(SecurityHeadersAuditor.class);

    static final List<String> SECURITY_HEADERS = List.of(
        "content-security-policy",
        "strict-transport-security",
        "x-content-type-options",
        "x-frame-options",
        "x-xss-protection",
        "referrer-policy",
        "permissions-policy",
        "expect-ct"
    );
    private static final List<String> PRIVACY_HINTS = List.of("privacy", "datenschutz", "gdpr", "cookie-policy");
    private static final List<String> TERMS_HINTS = List.of("terms", "conditions", "tos", "legal");
    private static final List<String> CONTACT_HINTS = List.of("contact", "support", "help");

    private final PoliteHttpClient httpClient;

    public SecurityHeadersAuditor(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Pillar pillar() {
        return Pillar.SECURITY;
    }

    @Override
    public PillarResult audit(String url) {
        HttpFetchResult fetch = httpClient.get(url, PoliteHttpClient.HTML_ACCEPT);
        if (fetch.statusCode() == 0) {
            log.debug("security fetch failed url={} errorCode={}", url, fetch.errorCode());
            return PillarResult.failed("page fetch failed: " + fetch.failureReason());
        }
        return evaluate(fetch);
    }

    static PillarResult evaluate(HttpFetchResult fetch) {
        boolean https = UrlSupport.isHttps(fetch.finalUrlOrRequested());
        Map<String, String> present = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String header : SECURITY_HEADERS) {
            String value = fetch.header(header);
            if (value != null && !value.isBlank()) {
                present.put(header, value);
            } else {
                missing.add(header);
            }
        }

        List<String> hrefs = new ArrayList<>();
        if (fetch.body() != null) {
            Document doc = Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested());
            for (Element anchor : doc.select("a[href]")) {
                hrefs.add(anchor.attr("href").toLowerCase(Locale.ROOT) + " " + anchor.text().toLowerCase(Locale.ROOT));
            }
        }
        boolean privacy = linksMention(hrefs, PRIVACY_HINTS);
        boolean terms = linksMention(hrefs, TERMS_HINTS);
        boolean contact = linksMention(hrefs, CONTACT_HINTS);

        int score = present.size() * 10
            + (https ? 20 : 0)
            + (privacy ? 10 : 0)
            + (terms ? 5 : 0)
            + (contact ? 5 : 0);

        List<AuditFinding> findings = new ArrayList<>();
        if (!https) {
            findings.add(new AuditFinding("no-https", "No HTTPS encryption",
                "Serve every page over HTTPS and redirect plain HTTP requests.", Impact.HIGH, 1));
        }
        if (!present.containsKey("content-security-policy")) {
            findings.add(new AuditFinding("missing-csp", "Missing Content Security Policy",
                "Add a Content-Security-Policy header to restrict script and frame sources.", Impact.MEDIUM, 1));
        }
        if (!present.containsKey("strict-transport-security")) {
            findings.add(new AuditFinding("missing-hsts", "Missing HTTP Strict Transport Security",
                "Send Strict-Transport-Security so browsers refuse downgraded connections.", Impact.MEDIUM, 1));
        }
        if (!present.containsKey("x-frame-options")) {
            findings.add(new AuditFinding("missing-x-frame-options", "Missing clickjacking protection",
                "Send X-Frame-Options or a frame-ancestors CSP directive.", Impact.MEDIUM, 1));
        }
        if (!present.containsKey("x-content-type-options")) {
            findings.add(new AuditFinding("missing-x-content-type-options", "Missing X-Content-Type-Options header",
                "Send X-Content-Type-Options: nosniff.", Impact.LOW, 1));
        }
        if (!privacy) {
            findings.add(new AuditFinding("missing-privacy-policy", "No privacy policy link",
                "Link a privacy policy from every page.", Impact.LOW, 1));
        }

        SecurityEvidence evidence = new SecurityEvidence(https, present, missing, privacy, terms, contact, findings);
        return PillarResult.of(Math.min(100, score), evidence);
    }

    private static boolean linksMention(List<String> hrefs, List<String> hints) {
        return hrefs.stream().anyMatch(href -> hints.stream().anyMatch(href::contains));
    }
}
