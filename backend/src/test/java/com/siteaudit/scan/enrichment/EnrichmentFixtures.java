package com.siteaudit.scan.enrichment;

import com.siteaudit.scan.model.AggregateScoreSet;
import com.siteaudit.scan.model.AuditFinding;
import com.siteaudit.scan.model.EcommerceSummary;
import com.siteaudit.scan.model.Impact;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.SiteWideSummary;

import java.util.List;

final class EnrichmentFixtures {

    private EnrichmentFixtures() {
    }

    static EvidenceSummary evidence(AggregateScoreSet scores, List<PillarFinding> findings, EcommerceSummary ecommerce) {
        return new EvidenceSummary(
            "https://example.com/",
            4,
            scores,
            "C+",
            "Fair. Your website meets basic requirements but needs significant improvements.",
            new SiteWideSummary(3, 1, List.of("Multiple pages not using HTTPS"), List.of()),
            ecommerce,
            findings
        );
    }

    static EvidenceSummary typicalEvidence() {
        return evidence(
            new AggregateScoreSet(82, 55, 64, 71, 69),
            List.of(
                finding(Pillar.SECURITY, "missing-csp", "Missing Content Security Policy", Impact.MEDIUM, 4, 4),
                finding(Pillar.ACCESSIBILITY, "image-alt", "Images must have alternate text", Impact.HIGH, 2, 14),
                finding(Pillar.PERFORMANCE, "slow-load", "Slow full page load", Impact.HIGH, 1, 1)
            ),
            null
        );
    }

    static PillarFinding finding(Pillar pillar, String id, String title, Impact impact, int pages, int occurrences) {
        return new PillarFinding(pillar, new AuditFinding(id, title, title + " description", impact, occurrences), pages, occurrences);
    }
}
