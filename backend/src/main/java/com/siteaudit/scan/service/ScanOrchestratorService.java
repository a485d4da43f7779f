package com.siteaudit.scan.service;

import com.siteaudit.scan.model.ScanJob;
import com.siteaudit.scan.model.ScanReport;
import com.siteaudit.scan.progress.ScanProgressTracker;
import com.siteaudit.scan.util.UrlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Accepts scan submissions, runs them in the background and records each job's lifecycle.
 */
@Service
public class ScanOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScanOrchestratorService.class);

    private final ScanPipelineService pipeline;
    private final ScanJobRegistry jobRegistry;
    private final ScanResultSink resultSink;
    private final ScanProgressTracker progressTracker;
    private final ExecutorService scanRunExecutor;

    public ScanOrchestratorService(
        ScanPipelineService pipeline,
        ScanJobRegistry jobRegistry,
        ScanResultSink resultSink,
        ScanProgressTracker progressTracker,
        @Qualifier("scanRunExecutor") ExecutorService scanRunExecutor
    ) {
        this.pipeline = pipeline;
        this.jobRegistry = jobRegistry;
        this.resultSink = resultSink;
        this.progressTracker = progressTracker;
        this.scanRunExecutor = scanRunExecutor;
    }

    public ScanJob submit(String rawUrl) {
        String targetUrl = validate(rawUrl);
        ScanJob job = ScanJob.pending(UUID.randomUUID().toString(), targetUrl, Instant.now());
        jobRegistry.register(job);
        scanRunExecutor.submit(() -> runJob(job.id(), targetUrl));
        log.info("scan submitted scanId={} url={}", job.id(), targetUrl);
        return job;
    }

    void runJob(String scanId, String targetUrl) {
        jobRegistry.update(scanId, ScanJob::scanning);
        try {
            ScanReport report = pipeline.run(scanId, targetUrl);
            resultSink.accept(report);
            jobRegistry.update(scanId, job -> job.completed(report.completedAt()));
            log.info("scan completed scanId={} overall={} grade={}", scanId, report.aggregateScores().overall(), report.grade());
        } catch (ScanFatalException e) {
            log.warn("scan failed scanId={} reason={}", scanId, e.getMessage());
            jobRegistry.update(scanId, job -> job.failed(Instant.now(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("scan crashed scanId={}", scanId, e);
            jobRegistry.update(scanId, job -> job.failed(Instant.now(), "scan_error: " + e.getClass().getSimpleName()));
        } finally {
            progressTracker.remove(scanId);
        }
    }

    /**
     * Normalizes a user-supplied URL to an absolute http(s) URL or rejects it.
     */
    static String validate(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new ScanValidationException("url is required");
        }
        String candidate = rawUrl.trim();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        URI uri = UrlSupport.httpUri(candidate);
        String host = uri == null ? null : uri.getHost();
        if (host == null || (!host.contains(".") && !host.equalsIgnoreCase("localhost"))) {
            throw new ScanValidationException("invalid url: " + rawUrl);
        }
        return uri.toString();
    }
}
