package com.siteaudit.scan.api;

import com.siteaudit.scan.browser.BrowserPoolStats;

public record BrowserHealthResponse(boolean healthy, BrowserPoolStats pool) {
}
