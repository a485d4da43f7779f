package com.siteaudit.scan.service;

import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.crawl.CrawlResult;
import com.siteaudit.scan.crawl.SiteCrawlerService;
import com.siteaudit.scan.enrichment.EnrichmentService;
import com.siteaudit.scan.enrichment.EvidenceSummary;
import com.siteaudit.scan.model.DiscoveredPage;
import com.siteaudit.scan.model.EnrichedSummary;
import com.siteaudit.scan.model.PageAuditResult;
import com.siteaudit.scan.model.PageType;
import com.siteaudit.scan.model.ScanReport;
import com.siteaudit.scan.progress.ScanProgressTracker;
import com.siteaudit.scan.scoring.AggregationResult;
import com.siteaudit.scan.scoring.AggregationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs one scan through crawling, per-page scanning and finalizing. Page failures are isolated;
 * the scan only fails when no page produced a usable score. The first page (or first batch) is
 * always scanned; the optional deadline only cuts the pages after it.
 */
@Service
public class ScanPipelineService {
    private static final Logger log = LoggerFactory.getLogger(ScanPipelineService.class);

    private final SiteCrawlerService crawler;
    private final PageScanner pageScanner;
    private final AggregationService aggregationService;
    private final EnrichmentService enrichmentService;
    private final ScanProgressTracker progressTracker;
    private final ExecutorService pageExecutor;
    private final AuditProperties.Scan settings;
    private final Clock clock;

    @Autowired
    public ScanPipelineService(
        SiteCrawlerService crawler,
        PageScanner pageScanner,
        AggregationService aggregationService,
        EnrichmentService enrichmentService,
        ScanProgressTracker progressTracker,
        @Qualifier("pageExecutor") ExecutorService pageExecutor,
        AuditProperties properties
    ) {
        this(crawler, pageScanner, aggregationService, enrichmentService, progressTracker, pageExecutor,
            properties, Clock.systemUTC());
    }

    ScanPipelineService(
        SiteCrawlerService crawler,
        PageScanner pageScanner,
        AggregationService aggregationService,
        EnrichmentService enrichmentService,
        ScanProgressTracker progressTracker,
        ExecutorService pageExecutor,
        AuditProperties properties,
        Clock clock
    ) {
        this.crawler = crawler;
        this.pageScanner = pageScanner;
        this.aggregationService = aggregationService;
        this.enrichmentService = enrichmentService;
        this.progressTracker = progressTracker;
        this.pageExecutor = pageExecutor;
        this.settings = properties.getScan();
        this.clock = clock;
    }

    public ScanReport run(String scanId, String targetUrl) {
        Instant deadline = settings.getMaxDurationSeconds() > 0
            ? clock.instant().plusSeconds(settings.getMaxDurationSeconds())
            : null;

        progressTracker.start(scanId);
        CrawlResult crawl = crawler.discover(targetUrl);
        List<DiscoveredPage> pages = crawl.pages();
        progressTracker.crawled(scanId, pages.stream().map(DiscoveredPage::url).toList());
        log.info("scan crawl finished scanId={} pages={} source={}", scanId, pages.size(), crawl.source());

        String homepageUrl = pages.stream()
            .filter(page -> page.pageType() == PageType.HOMEPAGE)
            .map(DiscoveredPage::url)
            .findFirst()
            .orElse(targetUrl);

        List<PageAuditResult> results = settings.getPageParallelism() > 1
            ? scanInBatches(scanId, pages, homepageUrl, deadline)
            : scanSequentially(scanId, pages, homepageUrl, deadline);

        if (results.stream().noneMatch(PageAuditResult::hasUsableScore)) {
            throw new ScanFatalException("No page produced a usable score; target unreachable: " + targetUrl);
        }

        progressTracker.finalizing(scanId);
        AggregationResult aggregation = aggregationService.aggregate(results, crawl.commerce());
        EnrichedSummary enrichment = enrichmentService.enrich(EvidenceSummary.from(targetUrl, results, aggregation));
        log.info("scan finalized scanId={} pages={} overall={} grade={}",
            scanId, results.size(), aggregation.scores().overall(), aggregation.grade().label());

        return new ScanReport(
            scanId,
            targetUrl,
            results.size(),
            results,
            aggregation.scores(),
            aggregation.grade().label(),
            aggregation.grade().explanation(),
            aggregation.siteWideSummary(),
            aggregation.ecommerceSummary(),
            enrichment,
            clock.instant()
        );
    }

    private List<PageAuditResult> scanSequentially(String scanId, List<DiscoveredPage> pages, String homepageUrl, Instant deadline) {
        List<PageAuditResult> results = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            if (i > 0 && pastDeadline(scanId, deadline, pages.size() - i)) {
                break;
            }
            DiscoveredPage page = pages.get(i);
            progressTracker.pageStarted(scanId, i + 1, page.url());
            results.add(scanIsolated(scanId, i, page, homepageUrl));
            progressTracker.pageScanned(scanId, i + 1, page.url());
        }
        return results;
    }

    private List<PageAuditResult> scanInBatches(String scanId, List<DiscoveredPage> pages, String homepageUrl, Instant deadline) {
        int batchSize = settings.getPageParallelism();
        List<PageAuditResult> results = new ArrayList<>();
        for (int start = 0; start < pages.size(); start += batchSize) {
            if (start > 0 && pastDeadline(scanId, deadline, pages.size() - start)) {
                break;
            }
            int end = Math.min(start + batchSize, pages.size());
            List<CompletableFuture<PageAuditResult>> batch = new ArrayList<>();
            for (int i = start; i < end; i++) {
                int index = i;
                DiscoveredPage page = pages.get(i);
                progressTracker.pageStarted(scanId, i + 1, page.url());
                batch.add(CompletableFuture.supplyAsync(() -> scanIsolated(scanId, index, page, homepageUrl), pageExecutor));
            }
            for (int i = start; i < end; i++) {
                DiscoveredPage page = pages.get(i);
                PageAuditResult result;
                try {
                    result = batch.get(i - start).join();
                } catch (CompletionException e) {
                    log.warn("page scan task failed scanId={} url={}", scanId, page.url(), e);
                    result = PageAuditResult.failed(page, "page scan failed: " + PageScanner.describe(e));
                }
                results.add(result);
                progressTracker.pageScanned(scanId, i + 1, page.url());
            }
        }
        return results;
    }

    private PageAuditResult scanIsolated(String scanId, int index, DiscoveredPage page, String homepageUrl) {
        try {
            return pageScanner.scan(scanId, index + 1, page, homepageUrl);
        } catch (RuntimeException e) {
            log.warn("page scan failed scanId={} url={}", scanId, page.url(), e);
            return PageAuditResult.failed(page, "page scan failed: " + PageScanner.describe(e));
        }
    }

    private boolean pastDeadline(String scanId, Instant deadline, int remaining) {
        if (deadline == null || !clock.instant().isAfter(deadline)) {
            return false;
        }
        log.warn("scan deadline reached scanId={} skippedPages={}", scanId, remaining);
        return true;
    }
}
