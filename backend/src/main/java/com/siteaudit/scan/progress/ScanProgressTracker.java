package com.siteaudit.scan.progress;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory progress per running scan. Entries exist from crawl start until the scan reaches a
 * terminal state; the percentage never moves backwards.
 */
@Component
public class ScanProgressTracker {
    private final Map<String, ScanProgress> progressByScan = new ConcurrentHashMap<>();

    public void start(String scanId) {
        progressByScan.put(scanId, new ScanProgress(ScanStage.CRAWLING, 0, 0, "Discovering pages", 0, null, List.of()));
    }

    public void crawled(String scanId, List<String> discoveredPages) {
        int total = discoveredPages == null ? 0 : discoveredPages.size();
        progressByScan.computeIfPresent(scanId, (id, current) -> new ScanProgress(
            ScanStage.SCANNING,
            0,
            total,
            "Found " + total + " pages to analyze",
            current.percentage(),
            null,
            discoveredPages
        ));
    }

    public void pageStarted(String scanId, int pageNumber, String pageUrl) {
        progressByScan.computeIfPresent(scanId, (id, current) -> new ScanProgress(
            ScanStage.SCANNING,
            current.currentPage(),
            current.totalPages(),
            "Analyzing page " + pageNumber + " of " + current.totalPages(),
            current.percentage(),
            pageUrl,
            current.discoveredPages()
        ));
    }

    public void pageScanned(String scanId, int pageNumber, String pageUrl) {
        progressByScan.computeIfPresent(scanId, (id, current) -> new ScanProgress(
            ScanStage.SCANNING,
            Math.max(current.currentPage(), pageNumber),
            current.totalPages(),
            "Analyzed page " + pageNumber + " of " + current.totalPages(),
            Math.max(current.percentage(), percentage(pageNumber, current.totalPages())),
            pageUrl,
            current.discoveredPages()
        ));
    }

    public void finalizing(String scanId) {
        progressByScan.computeIfPresent(scanId, (id, current) -> new ScanProgress(
            ScanStage.FINALIZING,
            current.totalPages(),
            current.totalPages(),
            "Aggregating results",
            Math.max(current.percentage(), percentage(current.totalPages() + 1, current.totalPages())),
            null,
            current.discoveredPages()
        ));
    }

    public Optional<ScanProgress> get(String scanId) {
        return Optional.ofNullable(progressByScan.get(scanId));
    }

    public void remove(String scanId) {
        progressByScan.remove(scanId);
    }

    /**
     * Two extra steps account for crawling and finalizing.
     */
    static int percentage(int step, int totalPages) {
        return (int) Math.round(step * 100.0 / (totalPages + 2));
    }
}
