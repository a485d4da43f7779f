package com.siteaudit.scan.crawl;

import java.util.List;
import java.util.regex.Pattern;

final class PageKeywords {
    static final List<String> BOOKING = List.of(
        "book", "booking", "reservation", "reserve", "reservations", "appointment",
        "schedule", "ticket", "register", "enroll", "availability"
    );
    static final List<String> BOOKING_HOSTS = List.of(
        "book", "reservation", "reserve", "ticket", "appointment", "schedule"
    );
    static final List<String> CHECKOUT = List.of("checkout", "payment", "pay");
    static final List<String> CHECKOUT_HOSTS = List.of("checkout", "payment", "secure");
    static final List<String> CART = List.of("cart", "basket", "bag");
    static final List<String> COMMERCE_HOSTS = List.of("shop", "store", "cart", "checkout", "buy", "order", "secure", "payment");
    static final List<String> OFFERINGS = List.of(
        "shop", "store", "buy", "product", "catalog", "catalogue", "collection", "merchandise", "gift", "retail",
        "service", "offering", "package", "menu", "treatment", "class", "classes", "program", "course", "plan",
        "category", "categories", "room", "suite", "accommodation", "tour", "experience", "activity", "activities",
        "event", "venue", "facility", "facilities"
    );
    static final List<String> DETAIL_EXCLUSIONS = List.of("category", "categories", "search", "tag", "page");
    static final List<String> CONTACT = List.of("contact", "support", "location", "directions", "getting-here", "parking");
    static final List<String> ABOUT = List.of("about", "our-story", "team", "faq", "policy", "policies");
    static final List<String> SOCIAL_HOSTS = List.of(
        "facebook.com", "twitter.com", "x.com", "instagram.com", "youtube.com", "linkedin.com", "tiktok.com", "pinterest.com"
    );

    static final Pattern HYPHENATED_SLUG = Pattern.compile("[a-z0-9]+-[a-z0-9]+-[a-z0-9]+");
    static final Pattern NUMERIC_ID = Pattern.compile("\\d{2,}");

    private PageKeywords() {
    }
}
