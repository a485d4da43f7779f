package com.siteaudit.scan.booking;

import com.siteaudit.scan.model.Confidence;
import com.siteaudit.scan.model.DetectionMethod;
import com.siteaudit.scan.util.UrlSupport;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "Powered by" style branding and outbound vendor links in the page footer.
 */
class FooterStage implements BookingDetectionStage {
    private static final String FOOTER_SELECTOR = "footer, [role=contentinfo], [id*=footer], [class*=footer]";
    private static final Pattern BRANDING = Pattern.compile(
        "(?:powered by|booking engine by|booking system by|reservations by|online booking by)\\s+([\\p{L}0-9][\\p{L}0-9.&' -]{1,40})",
        Pattern.CASE_INSENSITIVE
    );

    @Override
    public DetectionMethod method() {
        return DetectionMethod.FOOTER;
    }

    @Override
    public Optional<StageMatch> detect(DetectionContext context) {
        String html = context.content();
        if (html.isEmpty()) {
            return Optional.empty();
        }
        Document doc = Jsoup.parse(html, context.pageUrl());
        Elements footers = doc.select(FOOTER_SELECTOR);
        if (footers.isEmpty()) {
            return Optional.empty();
        }

        Matcher matcher = BRANDING.matcher(footers.text());
        while (matcher.find()) {
            Optional<BookingPlatformCatalog.Vendor> vendor = BookingPlatformCatalog.vendorByName(matcher.group(1));
            if (vendor.isPresent()) {
                return Optional.of(StageMatch.provider(vendor.get().name(), Confidence.HIGH));
            }
        }

        for (Element link : footers.select("a[href]")) {
            String host = UrlSupport.host(link.attr("abs:href"));
            Optional<BookingPlatformCatalog.Vendor> vendor = BookingPlatformCatalog.vendorForHost(host);
            if (vendor.isPresent()) {
                return Optional.of(StageMatch.provider(vendor.get().name(), Confidence.HIGH));
            }
        }
        return Optional.empty();
    }
}
