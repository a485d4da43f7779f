package com.siteaudit.config;

import com.siteaudit.scan.crawl.CrawlProfile;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "audit")
public class AuditProperties {
    private static final String DEFAULT_USER_AGENT = "site-auditor/0.1 (+self-audit)";

    private String userAgent;
    private int perHostDelayMs = 100;
    private int globalConcurrency = 8;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 0;
    private int requestRetryBaseDelayMs = 250;
    private int requestRetryMaxDelayMs = 2000;
    private int maxBodyBytes = 5_000_000;
    private Crawl crawl = new Crawl();
    private Browser browser = new Browser();
    private Scan scan = new Scan();
    private Detector detector = new Detector();
    private Screenshots screenshots = new Screenshots();
    private Enrichment enrichment = new Enrichment();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public int getMaxBodyBytes() {
        return Math.max(1024, maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }

    public Crawl getCrawl() {
        return crawl;
    }

    public void setCrawl(Crawl crawl) {
        this.crawl = crawl;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Scan getScan() {
        return scan;
    }

    public void setScan(Scan scan) {
        this.scan = scan;
    }

    /**
     * Navigation timeout for pooled pages, capped at the pillar timeout.
     */
    public int getPageNavigationTimeoutMs() {
        long pillarMs = scan.getPillarTimeoutSeconds() * 1000L;
        return (int) Math.min(browser.getNavigationTimeoutMs(), pillarMs);
    }

    public Detector getDetector() {
        return detector;
    }

    public void setDetector(Detector detector) {
        this.detector = detector;
    }

    public Screenshots getScreenshots() {
        return screenshots;
    }

    public void setScreenshots(Screenshots screenshots) {
        this.screenshots = screenshots;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Crawl {
        private CrawlProfile profile = CrawlProfile.DEFAULT;
        private int maxPages = 0;
        private int maxChildSitemaps = 5;
        private int maxSitemapUrls = 200;
        private int maxLinks = 300;

        public CrawlProfile getProfile() {
            return profile == null ? CrawlProfile.DEFAULT : profile;
        }

        public void setProfile(CrawlProfile profile) {
            this.profile = profile;
        }

        public int getMaxPages() {
            return Math.max(0, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        /**
         * Number of pages selected per scan. An explicit {@code max-pages} wins over the profile default.
         */
        public int effectivePageCap() {
            int override = getMaxPages();
            return override > 0 ? override : getProfile().pageCap();
        }

        public int getMaxChildSitemaps() {
            return Math.max(0, maxChildSitemaps);
        }

        public void setMaxChildSitemaps(int maxChildSitemaps) {
            this.maxChildSitemaps = maxChildSitemaps;
        }

        public int getMaxSitemapUrls() {
            return Math.max(1, maxSitemapUrls);
        }

        public void setMaxSitemapUrls(int maxSitemapUrls) {
            this.maxSitemapUrls = maxSitemapUrls;
        }

        public int getMaxLinks() {
            return Math.max(1, maxLinks);
        }

        public void setMaxLinks(int maxLinks) {
            this.maxLinks = maxLinks;
        }
    }

    public static class Browser {
        private int processes = 2;
        private int maxPages = 10;
        private int navigationTimeoutMs = 30_000;
        private int launchTimeoutMs = 30_000;
        private boolean headless = true;
        private int viewportWidth = 1920;
        private int viewportHeight = 1080;

        public int getProcesses() {
            return Math.max(1, processes);
        }

        public void setProcesses(int processes) {
            this.processes = processes;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public int getNavigationTimeoutMs() {
            return Math.max(1000, navigationTimeoutMs);
        }

        public void setNavigationTimeoutMs(int navigationTimeoutMs) {
            this.navigationTimeoutMs = navigationTimeoutMs;
        }

        public int getLaunchTimeoutMs() {
            return Math.max(1000, launchTimeoutMs);
        }

        public void setLaunchTimeoutMs(int launchTimeoutMs) {
            this.launchTimeoutMs = launchTimeoutMs;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getViewportWidth() {
            return Math.max(320, viewportWidth);
        }

        public void setViewportWidth(int viewportWidth) {
            this.viewportWidth = viewportWidth;
        }

        public int getViewportHeight() {
            return Math.max(240, viewportHeight);
        }

        public void setViewportHeight(int viewportHeight) {
            this.viewportHeight = viewportHeight;
        }
    }

    public static class Scan {
        private int pageParallelism = 1;
        private int concurrentScans = 2;
        private int auditConcurrency = 8;
        private int pillarTimeoutSeconds = 90;
        private int maxDurationSeconds = 0;

        public int getPageParallelism() {
            return Math.max(1, pageParallelism);
        }

        public void setPageParallelism(int pageParallelism) {
            this.pageParallelism = pageParallelism;
        }

        public int getConcurrentScans() {
            return Math.max(1, concurrentScans);
        }

        public void setConcurrentScans(int concurrentScans) {
            this.concurrentScans = concurrentScans;
        }

        public int getAuditConcurrency() {
            return Math.max(5, auditConcurrency);
        }

        public void setAuditConcurrency(int auditConcurrency) {
            this.auditConcurrency = auditConcurrency;
        }

        public int getPillarTimeoutSeconds() {
            return Math.max(1, pillarTimeoutSeconds);
        }

        public void setPillarTimeoutSeconds(int pillarTimeoutSeconds) {
            this.pillarTimeoutSeconds = pillarTimeoutSeconds;
        }

        /**
         * Job-level deadline in seconds, {@code 0} disables it.
         */
        public int getMaxDurationSeconds() {
            return Math.max(0, maxDurationSeconds);
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = maxDurationSeconds;
        }
    }

    public static class Detector {
        private boolean networkStageEnabled = true;
        private int networkWindowMs = 3000;

        public boolean isNetworkStageEnabled() {
            return networkStageEnabled;
        }

        public void setNetworkStageEnabled(boolean networkStageEnabled) {
            this.networkStageEnabled = networkStageEnabled;
        }

        public int getNetworkWindowMs() {
            return Math.max(100, networkWindowMs);
        }

        public void setNetworkWindowMs(int networkWindowMs) {
            this.networkWindowMs = networkWindowMs;
        }
    }

    public static class Screenshots {
        private boolean enabled = true;
        private String directory = "screenshots";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectory() {
            return directory == null || directory.isBlank() ? "screenshots" : directory.trim();
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Enrichment {
        private String endpoint;
        private String apiKey;

        public String getEndpoint() {
            return endpoint == null ? null : endpoint.trim();
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isConfigured() {
            String value = getEndpoint();
            return value != null && !value.isBlank();
        }
    }
}
