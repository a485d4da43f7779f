package com.siteaudit.scan.booking;

import com.siteaudit.scan.model.Confidence;
import com.siteaudit.scan.model.DetectionMethod;

import java.util.List;
import java.util.Optional;

/**
 * Hostname lookup against known platform domains and hosted booking/shop subdomain conventions.
 */
class DomainStage implements BookingDetectionStage {
    @Override
    public DetectionMethod method() {
        return DetectionMethod.DOMAIN;
    }

    @Override
    public Optional<StageMatch> detect(DetectionContext context) {
        String host = context.pageHost();
        if (host == null) {
            return Optional.empty();
        }
        Optional<BookingPlatformCatalog.Vendor> vendor = BookingPlatformCatalog.vendorForHost(host);
        if (vendor.isPresent()) {
            return Optional.of(StageMatch.provider(vendor.get().name(), Confidence.HIGH));
        }
        if (host.equals(context.siteHost())) {
            return Optional.empty();
        }
        if (startsWithAny(host, BookingPlatformCatalog.BOOKING_SUBDOMAIN_PREFIXES)) {
            return Optional.of(StageMatch.platform("Hosted booking subdomain", Confidence.HIGH));
        }
        if (startsWithAny(host, BookingPlatformCatalog.SHOP_SUBDOMAIN_PREFIXES)) {
            return Optional.of(StageMatch.platform("Hosted shop subdomain", Confidence.HIGH));
        }
        return Optional.empty();
    }

    private static boolean startsWithAny(String host, List<String> prefixes) {
        return prefixes.stream().anyMatch(host::startsWith);
    }
}
