package com.siteaudit.scan.booking;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Known booking engines, commerce platforms, third-party services and booking feature keywords.
 */
public final class BookingPlatformCatalog {
    static final List<Vendor> VENDORS = List.of(
        vendor("BookAssist", "bookassist", "bookassist.com", "bookassist.org"),
        vendor("Booking.com", "booking\\.com", "booking.com"),
        vendor("Expedia", "expedia", "expedia.com"),
        vendor("Cloudbeds", "cloudbeds", "cloudbeds.com"),
        vendor("Opera PMS", "\\bopera\\s*(pms|cloud)\\b", "opera-hotel.com"),
        vendor("Amadeus", "amadeus", "amadeus-hospitality.com"),
        vendor("Sabre", "\\bsabre\\b|synxis", "synxis.com", "sabre.com"),
        vendor("Hotelogix", "hotelogix", "hotelogix.com"),
        vendor("Little Hotelier", "littlehotelier", "littlehotelier.com"),
        vendor("Rezdy", "rezdy", "rezdy.com"),
        vendor("Checkfront", "checkfront", "checkfront.com"),
        vendor("FareHarbor", "fareharbor", "fareharbor.com"),
        vendor("OpenTable", "opentable", "opentable.com"),
        vendor("Resy", "\\bresy\\b", "resy.com"),
        vendor("Yelp Reservations", "yelp.*reservations", "yelpreservations.com"),
        vendor("Rezgo", "rezgo", "rezgo.com"),
        vendor("TrekkSoft", "trekksoft", "trekksoft.com"),
        vendor("Guestline", "guestline", "guestline.net"),
        vendor("SiteMinder", "siteminder|thebookingbutton", "siteminder.com", "thebookingbutton.com"),
        vendor("Mews", "\\bmews\\b", "mews.com", "mews.li"),
        vendor("Shopify", "cdn\\.shopify\\.com|shopify\\.theme", "myshopify.com", "shopify.com"),
        vendor("WooCommerce", "woocommerce"),
        vendor("BigCommerce", "bigcommerce", "mybigcommerce.com", "bigcommerce.com"),
        vendor("Generic Booking Engine", "bookingengine")
    );

    static final List<Marker> FRAMEWORKS = List.of(
        new Marker("ASP.NET WebForms", Pattern.compile("__VIEWSTATE|__EVENTVALIDATION")),
        new Marker("Next.js", Pattern.compile("__NEXT_DATA__|/_next/static/")),
        new Marker("Nuxt", Pattern.compile("__NUXT__|/_nuxt/")),
        new Marker("Angular", Pattern.compile("\\bng-version=")),
        new Marker("React", Pattern.compile("data-reactroot|data-reactid")),
        new Marker("Magento", Pattern.compile("Magento_|mage/cookies", Pattern.CASE_INSENSITIVE)),
        new Marker("WordPress", Pattern.compile("/wp-content/|/wp-includes/"))
    );

    static final List<Marker> THIRD_PARTIES = List.of(
        marker("Google Analytics", "google.*analytics|googletagmanager\\.com/gtag"),
        marker("Google Tag Manager", "google.*tag.*manager|googletagmanager\\.com/gtm"),
        marker("Facebook Pixel", "facebook.*pixel|connect\\.facebook\\.net"),
        marker("Stripe Payments", "stripe"),
        marker("PayPal", "paypal"),
        marker("Square Payments", "squareup|square.*payments"),
        marker("Adyen", "adyen"),
        marker("Braintree", "braintree"),
        marker("Mailchimp", "mailchimp"),
        marker("HubSpot", "hubspot"),
        marker("TripAdvisor", "tripadvisor"),
        marker("Trustpilot", "trustpilot"),
        marker("Hotjar", "hotjar"),
        marker("Intercom", "intercom"),
        marker("Zendesk", "zendesk"),
        marker("Calendly", "calendly"),
        marker("Twilio", "twilio")
    );

    static final List<String> PAYMENT_PROCESSORS = List.of(
        "Stripe Payments", "PayPal", "Square Payments", "Adyen", "Braintree"
    );

    static final List<Marker> FEATURES = List.of(
        marker("Date Selection", "calendar|date.*picker"),
        marker("Real-time Availability", "availability|available"),
        marker("Guest Management", "guest.*count|occupancy"),
        marker("Room Selection", "room.*type|accommodation"),
        marker("Dynamic Pricing", "price|\\brates?\\b|cost"),
        marker("Online Payment", "payment|checkout"),
        marker("Booking Confirmation", "confirmation|booking.*reference"),
        marker("Cancellation Policy", "cancel|modification"),
        marker("Special Requests", "special.*request|preferences"),
        marker("Loyalty Program", "loyalty|rewards")
    );

    static final List<String> BOOKING_SUBDOMAIN_PREFIXES = List.of("book.", "booking.", "reservations.", "reserve.");
    static final List<String> SHOP_SUBDOMAIN_PREFIXES = List.of("shop.", "store.");

    private BookingPlatformCatalog() {
    }

    public static Optional<Vendor> vendorForHost(String host) {
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        for (Vendor vendor : VENDORS) {
            for (String domain : vendor.domains()) {
                if (normalized.equals(domain) || normalized.endsWith("." + domain)) {
                    return Optional.of(vendor);
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<Vendor> vendorInSource(String source) {
        if (source == null || source.isEmpty()) {
            return Optional.empty();
        }
        for (Vendor vendor : VENDORS) {
            if (vendor.sourcePattern().matcher(source).find()) {
                return Optional.of(vendor);
            }
        }
        return Optional.empty();
    }

    public static Optional<Vendor> vendorByName(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Vendor vendor : VENDORS) {
            if (lower.contains(vendor.name().toLowerCase(Locale.ROOT))) {
                return Optional.of(vendor);
            }
        }
        return vendorInSource(text);
    }

    public static Optional<String> framework(String source) {
        if (source == null || source.isEmpty()) {
            return Optional.empty();
        }
        for (Marker marker : FRAMEWORKS) {
            if (marker.pattern().matcher(source).find()) {
                return Optional.of(marker.name());
            }
        }
        return Optional.empty();
    }

    public static List<String> thirdParties(String source) {
        return matching(THIRD_PARTIES, source);
    }

    public static List<String> features(String source) {
        return matching(FEATURES, source);
    }

    public static boolean isPaymentProcessor(String thirdParty) {
        return PAYMENT_PROCESSORS.contains(thirdParty);
    }

    private static List<String> matching(List<Marker> markers, String source) {
        List<String> names = new ArrayList<>();
        if (source == null || source.isEmpty()) {
            return names;
        }
        for (Marker marker : markers) {
            if (marker.pattern().matcher(source).find()) {
                names.add(marker.name());
            }
        }
        return names;
    }

    private static Vendor vendor(String name, String sourceRegex, String... domains) {
        return new Vendor(name, Pattern.compile(sourceRegex, Pattern.CASE_INSENSITIVE), List.of(domains));
    }

    private static Marker marker(String name, String regex) {
        return new Marker(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public record Vendor(String name, Pattern sourcePattern, List<String> domains) {
    }

    record Marker(String name, Pattern pattern) {
    }
}
