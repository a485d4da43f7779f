package com.siteaudit.scan.audit;

import com.siteaudit.scan.http.PoliteHttpClient;
import com.siteaudit.scan.model.AuditFinding;
import com.siteaudit.scan.model.HttpFetchResult;
import com.siteaudit.scan.model.Impact;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.PillarResult;
import com.siteaudit.scan.model.SeoEvidence;
import com.siteaudit.scan.robots.RobotsReport;
import com.siteaudit.scan.robots.RobotsTxtService;
import com.siteaudit.scan.sitemap.SitemapDiscoveryResult;
import com.siteaudit.scan.sitemap.SitemapService;
import com.siteaudit.scan.util.UrlSupport;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * How well crawlers and AI agents can read the site: robots, sitemap, structured data and head metadata.
 */
@Component
public class AgentReadinessAuditor implements PageAuditor {
    private static final Logger log = LoggerFactory.getLogger(AgentReadinessAuditor.class);

    private final PoliteHttpClient httpClient;
    private final RobotsTxtService robotsTxtService;
    private final SitemapService sitemapService;

    public AgentReadinessAuditor(
        PoliteHttpClient httpClient,
        RobotsTxtService robotsTxtService,
        SitemapService sitemapService
    ) {
        this.httpClient = httpClient;
        this.robotsTxtService = robotsTxtService;
        this.sitemapService = sitemapService;
    }

    @Override
    public Pillar pillar() {
        return Pillar.AGENT_READINESS;
    }

    @Override
    public PillarResult audit(String url) {
        HttpFetchResult fetch = httpClient.get(url, PoliteHttpClient.HTML_ACCEPT);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.debug("agent readiness fetch failed url={} status={} errorCode={}", url, fetch.statusCode(), fetch.errorCode());
            return PillarResult.failed("page fetch failed: " + fetch.failureReason());
        }
        String origin = UrlSupport.origin(fetch.finalUrlOrRequested());
        RobotsReport robots = robotsTxtService.fetch(origin);
        SitemapDiscoveryResult sitemaps = sitemapService.discover(origin, robots.rules().getSitemapUrls(), 0, 1);
        Document doc = Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested());
        return evaluate(robots.found(), robots.found() && robots.rules().isWellFormed(),
            !sitemaps.fetchedSitemaps().isEmpty(), doc);
    }

    static PillarResult evaluate(boolean robotsFound, boolean robotsValid, boolean sitemapFound, Document doc) {
        int structuredData = doc.select("script[type=application/ld+json]").size() + doc.select("[itemscope]").size();
        boolean canonical = !doc.select("link[rel=canonical][href]").isEmpty();
        boolean hreflang = !doc.select("link[rel=alternate][hreflang]").isEmpty();
        boolean title = !doc.title().isBlank();
        boolean description = !doc.select("meta[name=description]").attr("content").isBlank();
        int openGraph = doc.select("meta[property^=og:]").size();

        int score = (robotsFound ? 15 : 0)
            + (robotsValid ? 10 : 0)
            + (sitemapFound ? 15 : 0)
            + Math.min(structuredData * 5, 20)
            + (canonical ? 10 : 0)
            + (hreflang ? 5 : 0)
            + (title ? 10 : 0)
            + (description ? 10 : 0)
            + Math.min(openGraph * 2, 10);

        List<AuditFinding> findings = new ArrayList<>();
        if (!robotsFound) {
            findings.add(new AuditFinding("missing-robots", "No robots.txt",
                "Publish a robots.txt that points crawlers at your sitemap.", Impact.MEDIUM, 1));
        }
        if (!sitemapFound) {
            findings.add(new AuditFinding("missing-sitemap", "No XML sitemap",
                "Publish /sitemap.xml or declare one in robots.txt.", Impact.MEDIUM, 1));
        }
        if (structuredData == 0) {
            findings.add(new AuditFinding("missing-structured-data", "No structured data",
                "Add schema.org JSON-LD describing the business, products or offers.", Impact.HIGH, 1));
        }
        if (!description) {
            findings.add(new AuditFinding("missing-meta-description", "Missing meta description",
                "Add a concise meta description for search and agent previews.", Impact.LOW, 1));
        }
        if (!canonical) {
            findings.add(new AuditFinding("missing-canonical", "Missing canonical link",
                "Declare a canonical URL to avoid duplicate content.", Impact.LOW, 1));
        }
        if (openGraph == 0) {
            findings.add(new AuditFinding("missing-open-graph", "No Open Graph tags",
                "Add og:title, og:description and og:image for link previews.", Impact.LOW, 1));
        }

        SeoEvidence evidence = new SeoEvidence(robotsFound, robotsValid, sitemapFound, structuredData,
            canonical, hreflang, title, description, openGraph, findings);
        return PillarResult.of(score, evidence);
    }
}
