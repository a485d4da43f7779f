package com.siteaudit.scan.robots;

import com.siteaudit.scan.http.PoliteHttpClient;
import com.siteaudit.scan.model.HttpFetchResult;
import com.siteaudit.scan.util.UrlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final String ROBOTS_ACCEPT = "text/plain,text/*;q=0.9,*/*;q=0.1";
    private static final int MAX_ROBOTS_BYTES = 512_000;

    private final PoliteHttpClient httpClient;

    public RobotsTxtService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Best-effort fetch of {@code /robots.txt} for the origin of {@code siteUrl}.
     */
    public RobotsReport fetch(String siteUrl) {
        String origin = UrlSupport.origin(siteUrl);
        if (origin == null) {
            return RobotsReport.missing(null, 0, "invalid_url");
        }
        String robotsUrl = origin + "/robots.txt";
        HttpFetchResult fetch = httpClient.get(robotsUrl, ROBOTS_ACCEPT, MAX_ROBOTS_BYTES);
        if (!fetch.isSuccessful()) {
            log.debug("robots unavailable url={} status={} errorCode={}", robotsUrl, fetch.statusCode(), fetch.errorCode());
            return RobotsReport.missing(robotsUrl, fetch.statusCode(), fetch.errorCode());
        }
        RobotsRules rules = RobotsRules.parse(fetch.body());
        log.debug("loaded robots url={} rules={} sitemapHints={}", robotsUrl, rules.getRules().size(), rules.getSitemapUrls().size());
        return new RobotsReport(robotsUrl, true, fetch.statusCode(), null, rules);
    }
}
