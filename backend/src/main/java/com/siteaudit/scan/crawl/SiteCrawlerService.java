package com.siteaudit.scan.crawl;

import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.http.PoliteHttpClient;
import com.siteaudit.scan.model.CommerceInventory;
import com.siteaudit.scan.model.DiscoveredPage;
import com.siteaudit.scan.model.HttpFetchResult;
import com.siteaudit.scan.robots.RobotsReport;
import com.siteaudit.scan.robots.RobotsTxtService;
import com.siteaudit.scan.sitemap.SitemapDiscoveryResult;
import com.siteaudit.scan.sitemap.SitemapService;
import com.siteaudit.scan.util.UrlSupport;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Discovers a handful of critical pages for one site. Robots rules are reported, never enforced,
 * since the scanner only audits sites on behalf of their owners.
 */
@Service
public class SiteCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(SiteCrawlerService.class);

    private final AuditProperties properties;
    private final RobotsTxtService robotsTxtService;
    private final SitemapService sitemapService;
    private final PoliteHttpClient httpClient;

    public SiteCrawlerService(
        AuditProperties properties,
        RobotsTxtService robotsTxtService,
        SitemapService sitemapService,
        PoliteHttpClient httpClient
    ) {
        this.properties = properties;
        this.robotsTxtService = robotsTxtService;
        this.sitemapService = sitemapService;
        this.httpClient = httpClient;
    }

    public CrawlResult discover(String startUrl) {
        return discover(startUrl, properties.getCrawl().effectivePageCap());
    }

    public CrawlResult discover(String startUrl, int cap) {
        try {
            return crawl(startUrl, cap);
        } catch (RuntimeException e) {
            log.warn("crawl degraded to homepage only url={} error={}", startUrl, e.getMessage(), e);
            return CrawlResult.homepageOnly(startUrl);
        }
    }

    private CrawlResult crawl(String startUrl, int cap) {
        String origin = UrlSupport.origin(startUrl);
        String siteHost = UrlSupport.host(startUrl);
        if (origin == null || siteHost == null) {
            throw new IllegalArgumentException("Not an absolute http(s) URL: " + startUrl);
        }

        RobotsReport robots = robotsTxtService.fetch(startUrl);
        if (robots.found() && robots.rules().disallowsRoot()) {
            log.info("robots.txt disallows / for url={}; continuing because this is a self-audit", startUrl);
        }

        AuditProperties.Crawl crawl = properties.getCrawl();
        SitemapDiscoveryResult sitemap = sitemapService.discover(
            origin,
            robots.rules().getSitemapUrls(),
            crawl.getMaxChildSitemaps(),
            crawl.getMaxSitemapUrls()
        );

        CrawlResult.Source source;
        List<String> rawCandidates;
        if (!sitemap.isEmpty()) {
            source = CrawlResult.Source.SITEMAP;
            rawCandidates = sitemap.discoveredUrls();
        } else {
            source = CrawlResult.Source.LINKS;
            rawCandidates = discoverLinks(startUrl);
        }

        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(UrlSupport.canonicalize(startUrl));
        for (String raw : rawCandidates) {
            if (candidates.size() >= crawl.getMaxLinks()) {
                break;
            }
            String canonical = UrlSupport.canonicalize(raw);
            if (canonical != null && LinkScopeFilter.inScope(canonical, siteHost)) {
                candidates.add(canonical);
            }
        }

        List<DiscoveredPage> classified = new ArrayList<>();
        for (String candidate : candidates) {
            classified.add(PageClassifier.classify(candidate, siteHost));
        }
        CommerceInventory inventory = CommerceInventory.fromPageTypes(
            classified.stream().map(DiscoveredPage::pageType).toList()
        );
        List<DiscoveredPage> selected = PageSelector.select(classified, cap);
        log.info(
            "crawl finished url={} source={} candidates={} selected={} sitemapErrors={}",
            startUrl,
            source,
            classified.size(),
            selected.size(),
            sitemap.errors()
        );
        return new CrawlResult(selected, inventory, source);
    }

    private List<String> discoverLinks(String startUrl) {
        HttpFetchResult fetch = httpClient.get(startUrl, PoliteHttpClient.HTML_ACCEPT);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.info("start page not fetchable url={} status={} errorCode={}", startUrl, fetch.statusCode(), fetch.errorCode());
            return List.of();
        }
        Document doc = Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested());
        List<String> links = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.attr("abs:href");
            if (!href.isBlank()) {
                links.add(href);
            }
        }
        return links;
    }
}
