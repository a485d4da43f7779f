package com.siteaudit.scan.audit;

import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.browser.BrowserPool;
import com.siteaudit.scan.browser.PageLease;
import com.siteaudit.scan.model.AuditFinding;
import com.siteaudit.scan.model.Impact;
import com.siteaudit.scan.model.PerformanceEvidence;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.PillarResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the page in a pooled browser and scores the navigation timing entries it reports.
 */
@Component
public class PerformanceAuditor implements PageAuditor {
    private static final Logger log = LoggerFactory.getLogger(PerformanceAuditor.class);

    static final String TIMING_SCRIPT = """
        () => {
          const nav = performance.getEntriesByType('navigation')[0];
          const fcp = performance.getEntriesByName('first-contentful-paint')[0];
          if (!nav) {
            return { ttfb: -1, fcp: fcp ? fcp.startTime : -1, dcl: -1, load: -1 };
          }
          return {
            ttfb: nav.responseStart - nav.requestStart,
            fcp: fcp ? fcp.startTime : -1,
            dcl: nav.domContentLoadedEventEnd,
            load: nav.loadEventEnd
          };
        }
        """;

    private final BrowserPool browserPool;
    private final int navigationTimeoutMs;

    public PerformanceAuditor(BrowserPool browserPool, AuditProperties properties) {
        this.browserPool = browserPool;
        this.navigationTimeoutMs = properties.getPageNavigationTimeoutMs();
    }

    @Override
    public Pillar pillar() {
        return Pillar.PERFORMANCE;
    }

    @Override
    public PillarResult audit(String url) {
        try (PageLease lease = browserPool.acquire()) {
            int status = lease.page().navigate(url, navigationTimeoutMs);
            if (status >= 400) {
                return PillarResult.failed("navigation returned status " + status);
            }
            Object raw = lease.page().evaluate(TIMING_SCRIPT);
            if (!(raw instanceof Map<?, ?> timings)) {
                return PillarResult.failed("browser reported no navigation timings");
            }
            return evaluate(
                millis(timings.get("ttfb")),
                millis(timings.get("fcp")),
                millis(timings.get("dcl")),
                millis(timings.get("load"))
            );
        } catch (RuntimeException e) {
            log.warn("performance audit failed url={} error={}", url, e.getMessage());
            return PillarResult.failed("browser measurement failed: " + e.getMessage());
        }
    }

    static PillarResult evaluate(long ttfb, long fcp, long dcl, long load) {
        List<Integer> metricScores = new ArrayList<>();
        List<AuditFinding> findings = new ArrayList<>();

        addMetric(metricScores, findings, ttfb, 800, 1800, "slow-ttfb", "Slow server response",
            "Time to first byte was " + ttfb + " ms. Cache responses or move closer to visitors.");
        addMetric(metricScores, findings, fcp, 1800, 3000, "slow-fcp", "Slow first contentful paint",
            "First content appeared after " + fcp + " ms. Reduce render-blocking scripts and styles.");
        addMetric(metricScores, findings, dcl, 2000, 4000, "slow-dom-ready", "Slow DOM readiness",
            "DOMContentLoaded fired after " + dcl + " ms. Defer non-critical JavaScript.");
        addMetric(metricScores, findings, load, 3000, 6000, "slow-load", "Slow full page load",
            "The load event fired after " + load + " ms. Compress images and trim third-party tags.");

        if (metricScores.isEmpty()) {
            return PillarResult.failed("browser reported no usable timings");
        }
        int score = (int) Math.round(metricScores.stream().mapToInt(Integer::intValue).average().orElse(0));
        return PillarResult.of(score, new PerformanceEvidence(ttfb, fcp, dcl, load, findings));
    }

    /**
     * 100 up to {@code good}, 50 at {@code poor}, falling linearly to 0 at twice {@code poor}.
     */
    static int metricScore(long value, long good, long poor) {
        if (value <= good) {
            return 100;
        }
        if (value <= poor) {
            return (int) Math.round(100 - 50.0 * (value - good) / (poor - good));
        }
        if (value >= poor * 2) {
            return 0;
        }
        return (int) Math.round(50 - 50.0 * (value - poor) / poor);
    }

    private static void addMetric(
        List<Integer> scores,
        List<AuditFinding> findings,
        long value,
        long good,
        long poor,
        String id,
        String title,
        String description
    ) {
        if (value < 0) {
            return;
        }
        scores.add(metricScore(value, good, poor));
        if (value > poor) {
            findings.add(new AuditFinding(id, title, description, Impact.HIGH, 1));
        } else if (value > good) {
            findings.add(new AuditFinding(id, title, description, Impact.MEDIUM, 1));
        }
    }

    private static long millis(Object value) {
        if (value instanceof Number number) {
            return Math.round(number.doubleValue());
        }
        return -1;
    }
}
