package com.siteaudit.scan.model;

public record DiscoveredPage(
    String url,
    PageType pageType,
    int priority
) {
    public static DiscoveredPage homepage(String url) {
        return new DiscoveredPage(url, PageType.HOMEPAGE, 10);
    }
}
