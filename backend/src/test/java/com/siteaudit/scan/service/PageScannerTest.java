package com.siteaudit.scan.service;

import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.audit.PageAuditor;
import com.siteaudit.scan.audit.ScreenshotService;
import com.siteaudit.scan.booking.BookingSystemDetector;
import com.siteaudit.scan.booking.EcommerceAnalyzer;
import com.siteaudit.scan.model.BookingSystemDetails;
import com.siteaudit.scan.model.Confidence;
import com.siteaudit.scan.model.DetectionMethod;
import com.siteaudit.scan.model.DiscoveredPage;
import com.siteaudit.scan.model.PageAuditResult;
import com.siteaudit.scan.model.PageType;
import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.PillarResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageScannerTest {
    private static final String HOME = "https://example.com/";

    @Mock
    private ScreenshotService screenshotService;

    @Mock
    private BookingSystemDetector bookingSystemDetector;

    private ExecutorService executor;
    private AuditProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        properties = new AuditProperties();
        properties.getScan().setPillarTimeoutSeconds(1);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void blendsAllPillarsIntoPageScore() {
        when(screenshotService.capture("scan-1", 1, HOME)).thenReturn("screenshots/scan-1_page1.png");
        PageScanner scanner = scanner(
            auditor(Pillar.ACCESSIBILITY, url -> PillarResult.of(100, null)),
            auditor(Pillar.PERFORMANCE, url -> PillarResult.of(80, null)),
            auditor(Pillar.SECURITY, url -> PillarResult.of(60, null)),
            auditor(Pillar.AGENT_READINESS, url -> PillarResult.of(40, null))
        );

        PageAuditResult result = scanner.scan("scan-1", 1, DiscoveredPage.homepage(HOME), HOME);

        // 100*30 + 80*25 + 60*25 + 40*20
        assertThat(result.overallScore()).isEqualTo(73);
        assertThat(result.screenshotRef()).isEqualTo("screenshots/scan-1_page1.png");
        assertThat(result.ecommerceAnalysis()).isNull();
        verify(bookingSystemDetector, never()).detect(anyString(), anyString());
    }

    @Test
    void failingOrSlowPillarDoesNotSinkTheOthers() {
        PageScanner scanner = scanner(
            auditor(Pillar.ACCESSIBILITY, url -> {
                throw new IllegalStateException("parser exploded");
            }),
            auditor(Pillar.PERFORMANCE, url -> {
                sleep(3000);
                return PillarResult.of(90, null);
            }),
            auditor(Pillar.SECURITY, url -> null),
            auditor(Pillar.AGENT_READINESS, url -> PillarResult.of(70, null))
        );

        PageAuditResult result = scanner.scan("scan-1", 1, DiscoveredPage.homepage(HOME), HOME);

        assertThat(result.accessibility().error()).isTrue();
        assertThat(result.performance().error()).isTrue();
        assertThat(result.performance().evidence().toString()).contains("timed out");
        assertThat(result.security().error()).isTrue();
        assertThat(result.agentReadiness().score()).isEqualTo(70);
        assertThat(result.hasUsableScore()).isTrue();
    }

    @Test
    void missingAuditorIsRecordedAsFailedPillar() {
        PageScanner scanner = scanner(auditor(Pillar.SECURITY, url -> PillarResult.of(50, null)));

        PageAuditResult result = scanner.scan("scan-1", 1, DiscoveredPage.homepage(HOME), HOME);

        assertThat(result.accessibility().error()).isTrue();
        assertThat(result.security().score()).isEqualTo(50);
    }

    @Test
    void commercePagesGetBookingDetectionAndAnalysis() {
        DiscoveredPage booking = new DiscoveredPage("https://example.com/book", PageType.BOOKING, 9);
        BookingSystemDetails details = new BookingSystemDetails("Cloudbeds", null, List.of(), List.of(),
            DetectionMethod.DOMAIN, Confidence.HIGH);
        when(bookingSystemDetector.detect("https://example.com/book", HOME)).thenReturn(details);
        PageScanner scanner = scanner(
            auditor(Pillar.ACCESSIBILITY, url -> PillarResult.of(90, null)),
            auditor(Pillar.PERFORMANCE, url -> PillarResult.of(90, null)),
            auditor(Pillar.SECURITY, url -> PillarResult.of(90, null)),
            auditor(Pillar.AGENT_READINESS, url -> PillarResult.of(90, null))
        );

        PageAuditResult result = scanner.scan("scan-1", 2, booking, HOME);

        assertThat(result.ecommerceAnalysis()).isNotNull();
        assertThat(result.ecommerceAnalysis().hasBookingSystem()).isTrue();
        assertThat(result.ecommerceAnalysis().bookingSystemDetails().provider()).isEqualTo("Cloudbeds");
    }

    @Test
    void describeUnwrapsCompletionAndTimeout() {
        assertThat(PageScanner.describe(new CompletionException(new TimeoutException()))).isEqualTo("timed out");
        assertThat(PageScanner.describe(new CompletionException(new IllegalStateException("boom")))).isEqualTo("boom");
        assertThat(PageScanner.describe(new NullPointerException())).isEqualTo("NullPointerException");
    }

    private PageScanner scanner(PageAuditor... auditors) {
        return new PageScanner(List.of(auditors), screenshotService, bookingSystemDetector,
            new EcommerceAnalyzer(), executor, properties);
    }

    private static PageAuditor auditor(Pillar pillar, Function<String, PillarResult> behaviour) {
        return new PageAuditor() {
            @Override
            public Pillar pillar() {
                return pillar;
            }

            @Override
            public PillarResult audit(String url) {
                return behaviour.apply(url);
            }
        };
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
