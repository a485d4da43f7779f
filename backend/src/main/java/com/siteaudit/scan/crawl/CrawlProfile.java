package com.siteaudit.scan.crawl;

/**
 * Page budget per scan. The mixed-commerce profile leaves room for both a shop and a booking flow.
 */
public enum CrawlProfile {
    DEFAULT(4),
    MIXED_COMMERCE(6);

    private final int pageCap;

    CrawlProfile(int pageCap) {
        this.pageCap = pageCap;
    }

    public int pageCap() {
        return pageCap;
    }
}
