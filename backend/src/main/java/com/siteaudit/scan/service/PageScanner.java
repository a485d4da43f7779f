package com.siteaudit.scan.service;

import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.audit.PageAuditor;
import com.siteaudit.scan.audit.ScreenshotService;
import com.siteaudit.scan.booking.BookingSystemDetector;
import com.siteaudit.scan.booking.EcommerceAnalyzer;
import com.siteaudit.scan.model.BookingSystemDetails;
import com.siteaudit.scan.model.DiscoveredPage;
import com.siteaudit.scan.model.EcommerceAnalysis;
import com.siteaudit.scan.model.PageAuditResult;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.PillarResult;
import com.siteaudit.scan.scoring.PillarWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Audits one page: the four pillars and a screenshot run concurrently and settle independently,
 * then commerce pages get the booking detector and a commerce analysis.
 */
@Service
public class PageScanner {
    private static final Logger log = LoggerFactory.getLogger(PageScanner.class);

    private final Map<Pillar, PageAuditor> auditors = new EnumMap<>(Pillar.class);
    private final ScreenshotService screenshotService;
    private final BookingSystemDetector bookingSystemDetector;
    private final EcommerceAnalyzer ecommerceAnalyzer;
    private final ExecutorService auditExecutor;
    private final long pillarTimeoutSeconds;

    public PageScanner(
        List<PageAuditor> pageAuditors,
        ScreenshotService screenshotService,
        BookingSystemDetector bookingSystemDetector,
        EcommerceAnalyzer ecommerceAnalyzer,
        @Qualifier("auditExecutor") ExecutorService auditExecutor,
        AuditProperties properties
    ) {
        for (PageAuditor auditor : pageAuditors) {
            auditors.put(auditor.pillar(), auditor);
        }
        this.screenshotService = screenshotService;
        this.bookingSystemDetector = bookingSystemDetector;
        this.ecommerceAnalyzer = ecommerceAnalyzer;
        this.auditExecutor = auditExecutor;
        this.pillarTimeoutSeconds = properties.getScan().getPillarTimeoutSeconds();
    }

    public PageAuditResult scan(String scanId, int pageIndex, DiscoveredPage page, String homepageUrl) {
        Map<Pillar, CompletableFuture<PillarResult>> pillarFutures = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            pillarFutures.put(pillar, auditAsync(pillar, page.url()));
        }
        CompletableFuture<String> screenshot = CompletableFuture
            .supplyAsync(() -> screenshotService.capture(scanId, pageIndex, page.url()), auditExecutor)
            .orTimeout(pillarTimeoutSeconds, TimeUnit.SECONDS)
            .exceptionally(e -> {
                log.warn("screenshot task failed scanId={} url={} error={}", scanId, page.url(), describe(e));
                return null;
            });

        CompletableFuture.allOf(
            pillarFutures.get(Pillar.ACCESSIBILITY),
            pillarFutures.get(Pillar.PERFORMANCE),
            pillarFutures.get(Pillar.SECURITY),
            pillarFutures.get(Pillar.AGENT_READINESS),
            screenshot
        ).join();

        PillarResult accessibility = pillarFutures.get(Pillar.ACCESSIBILITY).join();
        PillarResult performance = pillarFutures.get(Pillar.PERFORMANCE).join();
        PillarResult security = pillarFutures.get(Pillar.SECURITY).join();
        PillarResult agentReadiness = pillarFutures.get(Pillar.AGENT_READINESS).join();

        EcommerceAnalysis ecommerce = null;
        if (page.pageType().isCommerce()) {
            BookingSystemDetails details = bookingSystemDetector.detect(page.url(), homepageUrl);
            ecommerce = ecommerceAnalyzer.analyze(page, security, details);
        }

        return new PageAuditResult(
            page.url(),
            page.pageType(),
            accessibility,
            performance,
            security,
            agentReadiness,
            screenshot.join(),
            ecommerce,
            PillarWeights.pageOverall(accessibility, performance, security, agentReadiness)
        );
    }

    private CompletableFuture<PillarResult> auditAsync(Pillar pillar, String url) {
        PageAuditor auditor = auditors.get(pillar);
        if (auditor == null) {
            return CompletableFuture.completedFuture(PillarResult.failed("no auditor registered for " + pillar.key()));
        }
        return CompletableFuture
            .supplyAsync(() -> auditor.audit(url), auditExecutor)
            .orTimeout(pillarTimeoutSeconds, TimeUnit.SECONDS)
            .thenApply(result -> result == null ? PillarResult.failed("auditor returned no result") : result)
            .exceptionally(e -> {
                String reason = describe(e);
                log.warn("pillar audit failed pillar={} url={} error={}", pillar.key(), url, reason);
                return PillarResult.failed(pillar.displayName() + " audit failed: " + reason);
            });
    }

    static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
