package com.siteaudit.scan.booking;

import com.siteaudit.scan.model.Confidence;
import com.siteaudit.scan.model.DetectionMethod;

import java.util.Optional;

/**
 * Vendor script and markup signatures in the page source, then generic framework markers.
 */
class FingerprintStage implements BookingDetectionStage {
    @Override
    public DetectionMethod method() {
        return DetectionMethod.FINGERPRINT;
    }

    @Override
    public Optional<StageMatch> detect(DetectionContext context) {
        String source = context.content();
        if (source.isEmpty()) {
            return Optional.empty();
        }
        Optional<BookingPlatformCatalog.Vendor> vendor = BookingPlatformCatalog.vendorInSource(source);
        if (vendor.isPresent()) {
            return Optional.of(StageMatch.provider(vendor.get().name(), Confidence.HIGH));
        }
        return BookingPlatformCatalog.framework(source)
            .map(framework -> StageMatch.platform(framework, Confidence.MEDIUM));
    }
}
