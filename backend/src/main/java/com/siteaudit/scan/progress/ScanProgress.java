package com.siteaudit.scan.progress;

import java.util.List;

public record ScanProgress(
    ScanStage stage,
    int currentPage,
    int totalPages,
    String message,
    int percentage,
    String pageUrl,
    List<String> discoveredPages
) {
    public ScanProgress {
        discoveredPages = discoveredPages == null ? List.of() : List.copyOf(discoveredPages);
        percentage = Math.max(0, Math.min(100, percentage));
    }
}
