package com.siteaudit.scan.scoring;

import com.siteaudit.scan.model.AggregateScoreSet;
import com.siteaudit.scan.model.PageAuditResult;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.PillarResult;

import java.util.EnumMap;
import java.util.Map;

/**
 * Pillar weights in whole percent so the site-level weights sum to exactly 100.
 * The per-page blend deliberately uses a different split than the site-level one.
 */
public final class PillarWeights {
    private static final Map<Pillar, Integer> SITE_PERCENT = new EnumMap<>(Map.of(
        Pillar.ACCESSIBILITY, 40,
        Pillar.SECURITY, 20,
        Pillar.PERFORMANCE, 25,
        Pillar.AGENT_READINESS, 15
    ));
    private static final Map<Pillar, Integer> PAGE_PERCENT = new EnumMap<>(Map.of(
        Pillar.ACCESSIBILITY, 30,
        Pillar.PERFORMANCE, 25,
        Pillar.SECURITY, 25,
        Pillar.AGENT_READINESS, 20
    ));

    private PillarWeights() {
    }

    public static int sitePercent(Pillar pillar) {
        return SITE_PERCENT.get(pillar);
    }

    public static int pagePercent(Pillar pillar) {
        return PAGE_PERCENT.get(pillar);
    }

    public static double siteWeight(Pillar pillar) {
        return sitePercent(pillar) / 100.0;
    }

    public static int siteOverall(int accessibility, int performance, int security, int agentReadiness) {
        return blend(SITE_PERCENT, accessibility, performance, security, agentReadiness);
    }

    public static int pageOverall(PillarResult accessibility, PillarResult performance, PillarResult security, PillarResult agentReadiness) {
        return blend(PAGE_PERCENT, accessibility.score(), performance.score(), security.score(), agentReadiness.score());
    }

    public static int pageOverall(PageAuditResult result) {
        return pageOverall(result.accessibility(), result.performance(), result.security(), result.agentReadiness());
    }

    public static AggregateScoreSet withOverall(int accessibility, int performance, int security, int agentReadiness) {
        return new AggregateScoreSet(accessibility, performance, security, agentReadiness,
            siteOverall(accessibility, performance, security, agentReadiness));
    }

    private static int blend(Map<Pillar, Integer> percents, int accessibility, int performance, int security, int agentReadiness) {
        long weighted = (long) PillarResult.clamp(accessibility) * percents.get(Pillar.ACCESSIBILITY)
            + (long) PillarResult.clamp(performance) * percents.get(Pillar.PERFORMANCE)
            + (long) PillarResult.clamp(security) * percents.get(Pillar.SECURITY)
            + (long) PillarResult.clamp(agentReadiness) * percents.get(Pillar.AGENT_READINESS);
        return PillarResult.clamp((int) Math.round(weighted / 100.0));
    }
}
