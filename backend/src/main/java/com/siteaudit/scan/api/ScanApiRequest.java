package com.siteaudit.scan.api;

public record ScanApiRequest(String url) {
}
