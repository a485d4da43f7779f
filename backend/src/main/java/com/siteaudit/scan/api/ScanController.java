package com.siteaudit.scan.api;

import com.siteaudit.scan.browser.BrowserPool;
import com.siteaudit.scan.model.ScanJob;
import com.siteaudit.scan.progress.ScanProgressTracker;
import com.siteaudit.scan.service.ScanJobRegistry;
import com.siteaudit.scan.service.ScanOrchestratorService;
import com.siteaudit.scan.service.ScanResultSink;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class ScanController {
    private final ScanOrchestratorService orchestratorService;
    private final ScanJobRegistry jobRegistry;
    private final ScanProgressTracker progressTracker;
    private final ScanResultSink resultSink;
    private final BrowserPool browserPool;

    public ScanController(
        ScanOrchestratorService orchestratorService,
        ScanJobRegistry jobRegistry,
        ScanProgressTracker progressTracker,
        ScanResultSink resultSink,
        BrowserPool browserPool
    ) {
        this.orchestratorService = orchestratorService;
        this.jobRegistry = jobRegistry;
        this.progressTracker = progressTracker;
        this.resultSink = resultSink;
        this.browserPool = browserPool;
    }

    @PostMapping("/scans")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ScanSubmittedResponse submitScan(@RequestBody(required = false) ScanApiRequest request) {
        ScanJob job = orchestratorService.submit(request == null ? null : request.url());
        return new ScanSubmittedResponse(job.id(), job.status());
    }

    @GetMapping("/scans/{scanId}")
    public ScanStatusResponse getScan(@PathVariable("scanId") String scanId) {
        ScanJob job = jobRegistry.get(scanId).orElseThrow(() -> new ScanNotFoundException(scanId));
        return new ScanStatusResponse(
            job,
            progressTracker.get(scanId).orElse(null),
            resultSink.find(scanId).orElse(null)
        );
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/browser/health")
    public BrowserHealthResponse browserHealth() {
        return new BrowserHealthResponse(browserPool.healthCheck(), browserPool.stats());
    }
}
