package com.siteaudit.scan.booking;

import com.siteaudit.scan.model.BookingSystemDetails;
import com.siteaudit.scan.model.DiscoveredPage;
import com.siteaudit.scan.model.EcommerceAnalysis;
import com.siteaudit.scan.model.PageType;
import com.siteaudit.scan.model.PillarResult;
import com.siteaudit.scan.model.SecurityEvidence;
import com.siteaudit.scan.util.UrlSupport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-page commerce flags, trust signals and payment-page issues for commerce-typed pages.
 */
@Component
public class EcommerceAnalyzer {
    public EcommerceAnalysis analyze(DiscoveredPage page, PillarResult security, BookingSystemDetails details) {
        PageType type = page.pageType();
        SecurityEvidence evidence = security != null && security.evidence() instanceof SecurityEvidence sec ? sec : null;
        boolean https = evidence != null ? evidence.https() : UrlSupport.isHttps(page.url());

        List<String> trustSignals = new ArrayList<>();
        if (https) {
            trustSignals.add("HTTPS enabled");
        }
        if (evidence != null && evidence.hasHeader("strict-transport-security")) {
            trustSignals.add("HSTS enabled");
        }
        if (evidence != null && evidence.hasHeader("content-security-policy")) {
            trustSignals.add("CSP configured");
        }

        List<String> issues = new ArrayList<>();
        boolean securePayment = false;
        if (type == PageType.CHECKOUT) {
            securePayment = https;
            if (!https) {
                issues.add("Checkout page is not using HTTPS - critical security issue!");
            }
        }
        if (type.isPaymentStep()) {
            if (!https) {
                issues.add("Payment/checkout pages must use HTTPS");
            }
            if (evidence == null || !evidence.hasHeader("x-frame-options")) {
                issues.add("Missing clickjacking protection on payment page");
            }
        }

        boolean paymentOptions = details != null
            && details.thirdParties().stream().anyMatch(BookingPlatformCatalog::isPaymentProcessor);

        return new EcommerceAnalysis(
            type == PageType.CART,
            type == PageType.CHECKOUT,
            paymentOptions,
            type == PageType.PRODUCT,
            type == PageType.BOOKING,
            securePayment,
            details,
            trustSignals,
            issues
        );
    }
}
