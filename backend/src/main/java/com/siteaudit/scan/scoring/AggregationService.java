package com.siteaudit.scan.scoring;

import com.siteaudit.scan.model.AccessibilityEvidence;
import com.siteaudit.scan.model.AggregateScoreSet;
import com.siteaudit.scan.model.CommerceInventory;
import com.siteaudit.scan.model.EcommerceAnalysis;
import com.siteaudit.scan.model.EcommerceSummary;
import com.siteaudit.scan.model.PageAuditResult;
import com.siteaudit.scan.model.PageType;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.PillarResult;
import com.siteaudit.scan.model.SecurityEvidence;
import com.siteaudit.scan.model.SiteWideSummary;
import com.siteaudit.scan.util.UrlSupport;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds per-page results into site-level scores, a grade and the site-wide and commerce summaries.
 */
@Service
public class AggregationService {
    static final String NO_HTTPS = "no-https";

    public AggregationResult aggregate(List<PageAuditResult> results, CommerceInventory commerce) {
        List<PageAuditResult> pages = results == null ? List.of() : results;
        AggregateScoreSet scores = aggregateScores(pages);
        return new AggregationResult(
            scores,
            Grade.forScore(scores.overall()),
            siteWideSummary(pages, scores),
            ecommerceSummary(pages, commerce == null ? CommerceInventory.none() : commerce)
        );
    }

    public AggregateScoreSet aggregateScores(List<PageAuditResult> results) {
        return PillarWeights.withOverall(
            weightedPillar(results, Pillar.ACCESSIBILITY),
            weightedPillar(results, Pillar.PERFORMANCE),
            weightedPillar(results, Pillar.SECURITY),
            weightedPillar(results, Pillar.AGENT_READINESS)
        );
    }

    static int weightedPillar(List<PageAuditResult> results, Pillar pillar) {
        double weightedSum = 0;
        double totalWeight = 0;
        for (PageAuditResult result : results) {
            PillarResult pillarResult = result.pillar(pillar);
            if (pillarResult == null || !pillarResult.isUsable()) {
                continue;
            }
            double weight = PageWeights.weight(result.pageType());
            weightedSum += pillarResult.score() * weight;
            totalWeight += weight;
        }
        if (totalWeight == 0) {
            return 0;
        }
        return PillarResult.clamp((int) Math.round(weightedSum / totalWeight));
    }

    SiteWideSummary siteWideSummary(List<PageAuditResult> results, AggregateScoreSet scores) {
        int totalIssues = 0;
        int criticalIssues = 0;
        Map<String, Integer> problemCounts = new LinkedHashMap<>();

        for (PageAuditResult result : results) {
            if (result.accessibility().evidence() instanceof AccessibilityEvidence accessibility) {
                totalIssues += accessibility.violations().size();
                criticalIssues += accessibility.criticalViolations();
                for (AccessibilityEvidence.AccessibilityViolation violation : accessibility.violations()) {
                    problemCounts.merge(violation.id(), 1, Integer::sum);
                }
            }
            if (result.security().evidence() instanceof SecurityEvidence security && !security.https()) {
                problemCounts.merge(NO_HTTPS, 1, Integer::sum);
            }
        }

        double halfPages = results.size() / 2.0;
        List<String> commonProblems = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : problemCounts.entrySet()) {
            if (entry.getValue() < halfPages) {
                continue;
            }
            if (NO_HTTPS.equals(entry.getKey())) {
                commonProblems.add("Multiple pages not using HTTPS");
            } else {
                commonProblems.add("Accessibility issue \"" + entry.getKey() + "\" found on " + entry.getValue() + " pages");
            }
        }

        List<String> strengths = new ArrayList<>();
        if (scores.accessibility() >= 90) {
            strengths.add("Excellent accessibility across the site");
        }
        if (scores.performance() >= 90) {
            strengths.add("Outstanding performance on all tested pages");
        }
        if (scores.security() >= 90) {
            strengths.add("Strong security implementation");
        }
        if (scores.agentReadiness() >= 85) {
            strengths.add("Well-optimized for search engines and AI agents");
        }
        return new SiteWideSummary(totalIssues, criticalIssues, commonProblems, strengths);
    }

    EcommerceSummary ecommerceSummary(List<PageAuditResult> results, CommerceInventory commerce) {
        boolean hasEcommerce = commerce.hasEcommerce();
        boolean hasBooking = commerce.hasBooking();
        if (!hasEcommerce && !hasBooking) {
            return null;
        }

        List<PageAuditResult> commercePages = results.stream()
            .filter(result -> result.ecommerceAnalysis() != null && result.pageType() != null && result.pageType().isCommerce())
            .toList();
        if (commercePages.isEmpty()) {
            return new EcommerceSummary(hasEcommerce, hasBooking, 0, 0, List.of(), List.of());
        }

        int functionality = 0;
        if (commercePages.stream().anyMatch(result -> result.ecommerceAnalysis().hasShoppingCart())) {
            functionality += 25;
        }
        if (commercePages.stream().anyMatch(result -> result.ecommerceAnalysis().hasCheckoutFlow())) {
            functionality += 25;
        }
        if (commercePages.stream().anyMatch(result -> result.ecommerceAnalysis().hasProductCatalog())) {
            functionality += 25;
        }
        if (commercePages.stream().anyMatch(result -> result.ecommerceAnalysis().hasBookingSystem())) {
            functionality += 25;
        }

        int securityScore = (int) Math.round(commercePages.stream()
            .map(PageAuditResult::security)
            .filter(PillarResult::isUsable)
            .mapToInt(PillarResult::score)
            .average()
            .orElse(0));

        Set<String> criticalIssues = new LinkedHashSet<>();
        for (PageAuditResult result : commercePages) {
            criticalIssues.addAll(result.ecommerceAnalysis().issues());
            if (result.pageType().isPaymentStep()) {
                if (!usesHttps(result)) {
                    criticalIssues.add("CRITICAL: " + label(result.pageType()) + " page not using HTTPS!");
                }
                if (result.accessibility().score() < 70) {
                    criticalIssues.add(label(result.pageType())
                        + " page has accessibility issues that may prevent users from completing purchases");
                }
            }
        }

        List<String> recommendations = new ArrayList<>();
        if (hasEcommerce && !commerce.hasCart()) {
            recommendations.add("Add a dedicated shopping cart page for better user experience");
        }
        if (securityScore < 80) {
            recommendations.add("Improve security on ecommerce pages - implement HTTPS, CSP, and other security headers");
        }
        boolean richTrust = commercePages.stream()
            .map(PageAuditResult::ecommerceAnalysis)
            .map(EcommerceAnalysis::trustSignals)
            .anyMatch(signals -> signals.size() > 2);
        if (!richTrust) {
            recommendations.add("Add more trust signals (security badges, SSL certificates, customer reviews)");
        }

        return new EcommerceSummary(hasEcommerce, hasBooking, functionality, securityScore,
            List.copyOf(criticalIssues), recommendations);
    }

    private static boolean usesHttps(PageAuditResult result) {
        if (result.security().evidence() instanceof SecurityEvidence security) {
            return security.https();
        }
        return UrlSupport.isHttps(result.url());
    }

    private static String label(PageType type) {
        return type == PageType.CART ? "Cart" : "Checkout";
    }
}
