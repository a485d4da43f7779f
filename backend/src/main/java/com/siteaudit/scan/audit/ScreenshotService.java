package com.siteaudit.scan.audit;

import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.browser.BrowserPool;
import com.siteaudit.scan.browser.PageLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Service
public class ScreenshotService {
    private static final Logger log = LoggerFactory.getLogger(ScreenshotService.class);

    private final BrowserPool browserPool;
    private final AuditProperties properties;

    public ScreenshotService(BrowserPool browserPool, AuditProperties properties) {
        this.browserPool = browserPool;
        this.properties = properties;
    }

    /**
     * Captures a full-page PNG and returns its path, or {@code null} when disabled or the capture failed.
     */
    public String capture(String scanId, int pageIndex, String url) {
        if (!properties.getScreenshots().isEnabled()) {
            return null;
        }
        Path target = Paths.get(properties.getScreenshots().getDirectory(), scanId + "_page" + pageIndex + ".png");
        try (PageLease lease = browserPool.acquire()) {
            lease.page().navigate(url, properties.getPageNavigationTimeoutMs());
            byte[] png = lease.page().screenshot(true);
            Files.createDirectories(target.getParent());
            Files.write(target, png);
            return target.toString();
        } catch (IOException | RuntimeException e) {
            log.warn("screenshot failed scanId={} url={} error={}", scanId, url, e.getMessage());
            return null;
        }
    }
}
