package com.siteaudit.scan.booking;

import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.browser.BrowserPool;
import com.siteaudit.scan.model.BookingSystemDetails;
import com.siteaudit.scan.model.Confidence;
import com.siteaudit.scan.model.DetectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Identifies the booking engine or commerce platform behind a page by escalating through
 * progressively more expensive stages. Never throws; the worst outcome is a low-confidence fallback.
 */
@Service
public class BookingSystemDetector {
    private static final Logger log = LoggerFactory.getLogger(BookingSystemDetector.class);
    static final String CUSTOM_BUILT = "Custom Built";

    private final BrowserPool browserPool;
    private final int navigationTimeoutMs;
    private final List<BookingDetectionStage> stages;

    @Autowired
    public BookingSystemDetector(BrowserPool browserPool, AuditProperties properties) {
        this(browserPool, properties, defaultStages(properties.getDetector()));
    }

    BookingSystemDetector(BrowserPool browserPool, AuditProperties properties, List<BookingDetectionStage> stages) {
        this.browserPool = browserPool;
        this.navigationTimeoutMs = properties.getPageNavigationTimeoutMs();
        this.stages = List.copyOf(stages);
    }

    static List<BookingDetectionStage> defaultStages(AuditProperties.Detector settings) {
        List<BookingDetectionStage> ordered = new ArrayList<>();
        ordered.add(new DomainStage());
        ordered.add(new FooterStage());
        ordered.add(new FingerprintStage());
        if (settings.isNetworkStageEnabled()) {
            ordered.add(new NetworkStage(settings.getNetworkWindowMs()));
        }
        return ordered;
    }

    public BookingSystemDetails detect(String pageUrl, String homepageUrl) {
        try (DetectionContext context = new DetectionContext(pageUrl, homepageUrl, browserPool::acquire, navigationTimeoutMs)) {
            return detect(context);
        } catch (RuntimeException e) {
            log.warn("booking detection failed url={} error={}", pageUrl, e.getMessage());
            return new BookingSystemDetails(null, null, List.of(), List.of(), DetectionMethod.FALLBACK, Confidence.LOW);
        }
    }

    BookingSystemDetails detect(DetectionContext context) {
        for (BookingDetectionStage stage : stages) {
            Optional<StageMatch> match = stage.detect(context);
            if (match.isPresent()) {
                log.debug("booking platform detected url={} method={} provider={} platform={}",
                    context.pageUrl(), stage.method(), match.get().provider(), match.get().platform());
                return details(context, match.get(), stage.method());
            }
        }
        return fallback(context);
    }

    private BookingSystemDetails details(DetectionContext context, StageMatch match, DetectionMethod method) {
        String source = context.content();
        return new BookingSystemDetails(
            match.provider(),
            match.platform(),
            BookingPlatformCatalog.thirdParties(source),
            BookingPlatformCatalog.features(source),
            method,
            match.confidence()
        );
    }

    private BookingSystemDetails fallback(DetectionContext context) {
        String source = context.content();
        List<String> features = BookingPlatformCatalog.features(source);
        boolean customBuilt = features.size() > 3;
        return new BookingSystemDetails(
            null,
            customBuilt ? CUSTOM_BUILT : null,
            BookingPlatformCatalog.thirdParties(source),
            features,
            DetectionMethod.FALLBACK,
            customBuilt ? Confidence.MEDIUM : Confidence.LOW
        );
    }
}
