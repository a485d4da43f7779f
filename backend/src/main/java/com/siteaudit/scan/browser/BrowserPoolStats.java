package com.siteaudit.scan.browser;

public record BrowserPoolStats(
    int processes,
    int launchedProcesses,
    int connectedProcesses,
    int maxPages,
    int pagesInUse
) {
}
