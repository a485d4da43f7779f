package com.siteaudit.scan.sitemap;

import java.util.List;
import java.util.Map;

public record SitemapDiscoveryResult(
    List<String> fetchedSitemaps,
    List<String> discoveredUrls,
    Map<String, Integer> errors
) {
    public boolean isEmpty() {
        return discoveredUrls.isEmpty();
    }
}
