package com.siteaudit.scan.booking;

import com.siteaudit.scan.browser.BrowserPage;
import com.siteaudit.scan.browser.PageLease;
import com.siteaudit.scan.util.UrlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-detection state shared by the stages. The browser page is leased and loaded only when a
 * stage first asks for content, and released when the context closes.
 */
public final class DetectionContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DetectionContext.class);

    private final String pageUrl;
    private final String pageHost;
    private final String siteHost;
    private final Supplier<PageLease> leaseSupplier;
    private final int navigationTimeoutMs;
    private PageLease lease;
    private String content;
    private boolean loadAttempted;

    DetectionContext(
        String pageUrl,
        String homepageUrl,
        Supplier<PageLease> leaseSupplier,
        int navigationTimeoutMs
    ) {
        this.pageUrl = pageUrl;
        this.pageHost = UrlSupport.host(pageUrl);
        String homeHost = homepageUrl == null ? null : UrlSupport.host(homepageUrl);
        this.siteHost = homeHost == null ? pageHost : homeHost;
        this.leaseSupplier = leaseSupplier;
        this.navigationTimeoutMs = navigationTimeoutMs;
    }

    /**
     * Context over already-fetched markup with no live browser page.
     */
    static DetectionContext ofContent(String pageUrl, String homepageUrl, String html) {
        DetectionContext context = new DetectionContext(pageUrl, homepageUrl, null, 0);
        context.content = html == null ? "" : html;
        context.loadAttempted = true;
        return context;
    }

    public String pageUrl() {
        return pageUrl;
    }

    public String pageHost() {
        return pageHost;
    }

    public String siteHost() {
        return siteHost;
    }

    public String content() {
        load();
        return content == null ? "" : content;
    }

    public Optional<BrowserPage> page() {
        load();
        return lease == null ? Optional.empty() : Optional.of(lease.page());
    }

    private void load() {
        if (loadAttempted) {
            return;
        }
        loadAttempted = true;
        if (leaseSupplier == null) {
            return;
        }
        try {
            lease = leaseSupplier.get();
            lease.page().navigate(pageUrl, navigationTimeoutMs);
            content = lease.page().content();
        } catch (RuntimeException e) {
            log.warn("booking detection page load failed url={} error={}", pageUrl, e.getMessage());
            releaseLease();
        }
    }

    private void releaseLease() {
        if (lease != null) {
            lease.close();
            lease = null;
        }
    }

    @Override
    public void close() {
        releaseLease();
    }
}
