package com.siteaudit.scan.booking;

import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.browser.BrowserPool;
import com.siteaudit.scan.browser.FakeBrowserEngine;
import com.siteaudit.scan.browser.FakeBrowserEngine.FakePage;
import com.siteaudit.scan.model.BookingSystemDetails;
import com.siteaudit.scan.model.Confidence;
import com.siteaudit.scan.model.DetectionMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BookingSystemDetectorTest {
    private static final String HOME = "https://example.com/";

    private AuditProperties properties;
    private BookingSystemDetector detector;

    @BeforeEach
    void setUp() {
        properties = new AuditProperties();
        properties.getDetector().setNetworkStageEnabled(false);
        detector = new BookingSystemDetector(
            new BrowserPool(properties, new FakeBrowserEngine()),
            properties,
            BookingSystemDetector.defaultStages(properties.getDetector())
        );
    }

    @Test
    void vendorDomainWinsOverFooterBranding() {
        BookingSystemDetails details = detect("https://hotel.cloudbeds.com/reservation/abc", """
            <html><body><footer>Powered by SiteMinder</footer></body></html>
            """);

        assertThat(details.provider()).isEqualTo("Cloudbeds");
        assertThat(details.detectionMethod()).isEqualTo(DetectionMethod.DOMAIN);
        assertThat(details.confidence()).isEqualTo(Confidence.HIGH);
    }

    @Test
    void hostedBookingSubdomainIsReportedAsPlatform() {
        BookingSystemDetails details = detect("https://book.example.com/", "<html></html>");

        assertThat(details.provider()).isNull();
        assertThat(details.platform()).isEqualTo("Hosted booking subdomain");
        assertThat(details.detectionMethod()).isEqualTo(DetectionMethod.DOMAIN);
    }

    @Test
    void footerBrandingIdentifiesVendor() {
        BookingSystemDetails details = detect("https://example.com/book", """
            <html><body>
              <main>Plan your stay</main>
              <div class="site-footer">Booking engine by SiteMinder | All rights reserved</div>
            </body></html>
            """);

        assertThat(details.provider()).isEqualTo("SiteMinder");
        assertThat(details.detectionMethod()).isEqualTo(DetectionMethod.FOOTER);
    }

    @Test
    void footerLinkToVendorHostIdentifiesVendor() {
        BookingSystemDetails details = detect("https://example.com/tours", """
            <html><body>
              <footer><a href="https://example.fareharbor.com/items/42">Reserve a tour</a></footer>
            </body></html>
            """);

        assertThat(details.provider()).isEqualTo("FareHarbor");
        assertThat(details.detectionMethod()).isEqualTo(DetectionMethod.FOOTER);
    }

    @Test
    void vendorScriptIsAFingerprint() {
        BookingSystemDetails details = detect("https://example.com/activities", """
            <html><head><script src="https://widgets.rezdy.com/plugins/rezdy-modal.js"></script></head>
            <body><p>Tours</p></body></html>
            """);

        assertThat(details.provider()).isEqualTo("Rezdy");
        assertThat(details.detectionMethod()).isEqualTo(DetectionMethod.FINGERPRINT);
        assertThat(details.confidence()).isEqualTo(Confidence.HIGH);
    }

    @Test
    void frameworkMarkerIsMediumConfidencePlatform() {
        BookingSystemDetails details = detect("https://example.com/shop", """
            <html><body><div id="__next"></div>
            <script id="__NEXT_DATA__" type="application/json">{}</script></body></html>
            """);

        assertThat(details.provider()).isNull();
        assertThat(details.platform()).isEqualTo("Next.js");
        assertThat(details.confidence()).isEqualTo(Confidence.MEDIUM);
    }

    @Test
    void manyBookingFeaturesWithoutVendorIsCustomBuilt() {
        BookingSystemDetails details = detect("https://example.com/book", """
            <html><body>
              <div class="calendar">Select dates</div>
              <p>Check availability for your stay</p>
              <label>Guest count</label>
              <p>Best price guaranteed</p>
              <button>Continue to payment</button>
              <script src="https://js.stripe.com/v3/"></script>
            </body></html>
            """);

        assertThat(details.platform()).isEqualTo(BookingSystemDetector.CUSTOM_BUILT);
        assertThat(details.detectionMethod()).isEqualTo(DetectionMethod.FALLBACK);
        assertThat(details.confidence()).isEqualTo(Confidence.MEDIUM);
        assertThat(details.features()).hasSizeGreaterThan(3);
        assertThat(details.thirdParties()).contains("Stripe Payments");
    }

    @Test
    void nothingRecognisableIsLowConfidence() {
        BookingSystemDetails details = detect("https://example.com/book", "<html><body><p>Call us</p></body></html>");

        assertThat(details.identified()).isFalse();
        assertThat(details.detectionMethod()).isEqualTo(DetectionMethod.FALLBACK);
        assertThat(details.confidence()).isEqualTo(Confidence.LOW);
    }

    @Test
    void networkStageCatchesVendorRequestsAfterOpeningDatePicker() {
        properties.getDetector().setNetworkStageEnabled(true);
        properties.getDetector().setNetworkWindowMs(100);
        FakeBrowserEngine engine = new FakeBrowserEngine()
            .pages(() -> new FakePage().requestsOnClick("https://api.mews.com/distributor/availability"));
        BrowserPool pool = new BrowserPool(properties, engine);
        BookingSystemDetector live = new BookingSystemDetector(pool, properties);

        BookingSystemDetails details = live.detect("https://example.com/book", HOME);

        assertThat(details.provider()).isEqualTo("Mews");
        assertThat(details.detectionMethod()).isEqualTo(DetectionMethod.NETWORK);
        assertThat(pool.stats().pagesInUse()).isZero();
    }

    @Test
    void browserOutageDegradesToFallback() {
        FakeBrowserEngine engine = new FakeBrowserEngine().failLaunch(true);
        BookingSystemDetector live = new BookingSystemDetector(new BrowserPool(properties, engine), properties);

        BookingSystemDetails details = live.detect("https://example.com/book", HOME);

        assertThat(details.detectionMethod()).isEqualTo(DetectionMethod.FALLBACK);
        assertThat(details.confidence()).isEqualTo(Confidence.LOW);
        assertThat(details.features()).isEmpty();
    }

    private BookingSystemDetails detect(String pageUrl, String html) {
        try (DetectionContext context = DetectionContext.ofContent(pageUrl, HOME, html)) {
            return detector.detect(context);
        }
    }
}
