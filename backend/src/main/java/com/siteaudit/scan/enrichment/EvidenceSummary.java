package com.siteaudit.scan.enrichment;

import com.siteaudit.scan.model.AggregateScoreSet;
import com.siteaudit.scan.model.AuditFinding;
import com.siteaudit.scan.model.EcommerceSummary;
import com.siteaudit.scan.model.PageAuditResult;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.PillarResult;
import com.siteaudit.scan.model.SiteWideSummary;
import com.siteaudit.scan.scoring.AggregationResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compact, serializable view of a finished scan that is sent for enrichment.
 */
public record EvidenceSummary(
    String primaryUrl,
    int pagesAnalyzed,
    AggregateScoreSet scores,
    String grade,
    String gradeExplanation,
    SiteWideSummary siteWideSummary,
    EcommerceSummary ecommerceSummary,
    List<PillarFinding> findings
) {
    public EvidenceSummary {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static EvidenceSummary from(String primaryUrl, List<PageAuditResult> results, AggregationResult aggregation) {
        return new EvidenceSummary(
            primaryUrl,
            results.size(),
            aggregation.scores(),
            aggregation.grade().label(),
            aggregation.grade().explanation(),
            aggregation.siteWideSummary(),
            aggregation.ecommerceSummary(),
            mergeFindings(results)
        );
    }

    static List<PillarFinding> mergeFindings(List<PageAuditResult> results) {
        Map<String, PillarFinding> merged = new LinkedHashMap<>();
        for (Pillar pillar : Pillar.values()) {
            for (PageAuditResult result : results) {
                PillarResult pillarResult = result.pillar(pillar);
                if (pillarResult == null || !pillarResult.isUsable()) {
                    continue;
                }
                Set<String> seenOnPage = new HashSet<>();
                for (AuditFinding finding : pillarResult.evidence().findings()) {
                    String key = pillar.key() + ":" + finding.id();
                    boolean firstOnPage = seenOnPage.add(key);
                    merged.merge(
                        key,
                        new PillarFinding(pillar, finding, 1, Math.max(1, finding.occurrences())),
                        (existing, next) -> new PillarFinding(
                            pillar,
                            existing.finding(),
                            existing.pages() + (firstOnPage ? 1 : 0),
                            existing.occurrences() + next.occurrences()
                        )
                    );
                }
            }
        }
        return new ArrayList<>(merged.values());
    }
}
