package com.siteaudit.scan.booking;

import com.siteaudit.scan.browser.BrowserPage;
import com.siteaudit.scan.model.Confidence;
import com.siteaudit.scan.model.DetectionMethod;
import com.siteaudit.scan.util.UrlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens a date picker and watches which hosts the page talks to for a short window.
 */
class NetworkStage implements BookingDetectionStage {
    private static final Logger log = LoggerFactory.getLogger(NetworkStage.class);
    static final List<String> DATE_PICKER_SELECTORS = List.of(
        "input[type=date]",
        "input[name*=checkin i]",
        "input[name*=arrival i]",
        "[class*=datepicker]",
        "[class*=date-picker]",
        "[data-testid*=date]",
        "button:has-text(\"Check availability\")",
        "a:has-text(\"Book now\")"
    );

    private final long windowMs;

    NetworkStage(long windowMs) {
        this.windowMs = windowMs;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.NETWORK;
    }

    @Override
    public Optional<StageMatch> detect(DetectionContext context) {
        Optional<BrowserPage> maybePage = context.page();
        if (maybePage.isEmpty()) {
            return Optional.empty();
        }
        BrowserPage page = maybePage.get();
        Set<String> hosts = ConcurrentHashMap.newKeySet();
        page.onRequest(url -> {
            String host = UrlSupport.host(url);
            if (host != null) {
                hosts.add(host);
            }
        });

        boolean opened = false;
        for (String selector : DATE_PICKER_SELECTORS) {
            if (page.click(selector)) {
                opened = true;
                break;
            }
        }
        if (!opened) {
            log.debug("no date picker found url={}", context.pageUrl());
            return Optional.empty();
        }
        page.waitFor(windowMs);

        for (String host : hosts) {
            Optional<BookingPlatformCatalog.Vendor> vendor = BookingPlatformCatalog.vendorForHost(host);
            if (vendor.isPresent()) {
                return Optional.of(StageMatch.provider(vendor.get().name(), Confidence.HIGH));
            }
        }
        return Optional.empty();
    }
}
