package com.siteaudit.scan.crawl;

import com.siteaudit.scan.model.CommerceInventory;
import com.siteaudit.scan.model.DiscoveredPage;

import java.util.List;

public record CrawlResult(
    List<DiscoveredPage> pages,
    CommerceInventory commerce,
    Source source
) {
    public CrawlResult {
        pages = List.copyOf(pages);
    }

    public static CrawlResult homepageOnly(String startUrl) {
        return new CrawlResult(List.of(DiscoveredPage.homepage(startUrl)), CommerceInventory.none(), Source.FALLBACK);
    }

    public enum Source {
        SITEMAP,
        LINKS,
        FALLBACK
    }
}
