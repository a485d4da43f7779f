package com.siteaudit.scan.enrichment;

import com.siteaudit.scan.model.AggregateScoreSet;
import com.siteaudit.scan.model.EnrichedSummary;
import com.siteaudit.scan.model.Impact;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.TopFix;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary derived only from scores and merged findings, used when enrichment is unavailable.
 * Identical evidence always yields an identical summary.
 */
@Component
public class DeterministicSummaryGenerator {
    static final String UNAVAILABLE_NOTE = "AI recommendations temporarily unavailable - scan data collected successfully.";
    static final int MAX_FIXES = 5;
    private static final Map<Pillar, String> REMEDIATION = new EnumMap<>(Map.of(
        Pillar.ACCESSIBILITY, "Add text alternatives, form labels and a document language so assistive technology can use every page",
        Pillar.PERFORMANCE, "Reduce server response time and render-blocking resources, and compress large images",
        Pillar.SECURITY, "Serve every page over HTTPS and add Content-Security-Policy, HSTS and X-Frame-Options headers",
        Pillar.AGENT_READINESS, "Publish robots.txt and an XML sitemap, and add structured data and descriptive metadata"
    ));

    public EnrichedSummary generate(EvidenceSummary evidence) {
        AggregateScoreSet scores = evidence.scores();
        Pillar strongest = Pillar.ACCESSIBILITY;
        Pillar weakest = Pillar.ACCESSIBILITY;
        for (Pillar pillar : Pillar.values()) {
            if (scores.score(pillar) > scores.score(strongest)) {
                strongest = pillar;
            }
            if (scores.score(pillar) < scores.score(weakest)) {
                weakest = pillar;
            }
        }

        String summary = String.format(
            "%s scored %d/100 (grade %s) across %d analyzed pages. Strongest area: %s (%d). Weakest area: %s (%d). %s",
            evidence.primaryUrl(),
            scores.overall(),
            evidence.grade(),
            evidence.pagesAnalyzed(),
            strongest.displayName(),
            scores.score(strongest),
            weakest.displayName(),
            scores.score(weakest),
            UNAVAILABLE_NOTE
        );

        return new EnrichedSummary(
            summary,
            topFixes(evidence),
            recommendations(evidence),
            evidence.gradeExplanation(),
            EnrichedSummary.Source.FALLBACK
        );
    }

    List<TopFix> topFixes(EvidenceSummary evidence) {
        int pageCount = Math.max(1, evidence.pagesAnalyzed());
        List<TopFix> fixes = new ArrayList<>();
        for (PillarFinding merged : evidence.findings()) {
            Impact effort = effort(merged);
            int reach = (int) Math.round(merged.pages() * 100.0 / pageCount);
            fixes.add(new TopFix(
                merged.finding().title(),
                merged.finding().description(),
                merged.finding().impact(),
                effort,
                merged.pillar().displayName(),
                priority(merged.finding().impact(), effort, reach)
            ));
        }
        fixes.sort(Comparator.comparingDouble(TopFix::priority).reversed()
            .thenComparing(TopFix::pillar)
            .thenComparing(TopFix::title));
        return fixes.size() > MAX_FIXES ? List.copyOf(fixes.subList(0, MAX_FIXES)) : fixes;
    }

    List<String> recommendations(EvidenceSummary evidence) {
        List<String> recommendations = new ArrayList<>();
        for (Pillar pillar : Pillar.values()) {
            if (evidence.scores().score(pillar) < 70) {
                recommendations.add(REMEDIATION.get(pillar));
            }
        }
        if (evidence.ecommerceSummary() != null) {
            recommendations.addAll(evidence.ecommerceSummary().recommendations());
        }
        for (String problem : evidence.siteWideSummary().commonProblems()) {
            recommendations.add("Resolve site-wide problem: " + problem);
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Keep monitoring: re-run the audit after each release to catch regressions early");
        }
        return recommendations;
    }

    /**
     * Impact x inverse effort x reach, with reach given as the percentage of pages affected.
     */
    static double priority(Impact impact, Impact effort, int reachPercent) {
        int effortScore = switch (effort) {
            case LOW -> 3;
            case MEDIUM -> 2;
            case HIGH -> 1;
        };
        double reachScore = Math.min(reachPercent / 10.0, 10.0);
        return impact.weight() * effortScore * reachScore;
    }

    private static Impact effort(PillarFinding merged) {
        return switch (merged.pillar()) {
            case ACCESSIBILITY -> merged.occurrences() > 10 ? Impact.HIGH : merged.occurrences() > 3 ? Impact.MEDIUM : Impact.LOW;
            case SECURITY -> Impact.LOW;
            case PERFORMANCE, AGENT_READINESS -> Impact.MEDIUM;
        };
    }
}
