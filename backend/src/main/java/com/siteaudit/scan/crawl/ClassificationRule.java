package com.siteaudit.scan.crawl;

import com.siteaudit.scan.model.PageType;

import java.util.function.Predicate;

/**
 * Ordered URL rules; {@link PageClassifier} applies them top-down and the first match wins.
 */
public enum ClassificationRule {
    HOMEPAGE(PageType.HOMEPAGE, 10, facts -> !facts.external() && facts.depth() == 0 && !facts.hasQuery()),
    BOOKING(PageType.BOOKING, 9, facts -> facts.hasSegment(PageKeywords.BOOKING)
        || (facts.external() && facts.hostContains(PageKeywords.BOOKING_HOSTS))),
    CHECKOUT(PageType.CHECKOUT, 8, facts -> facts.hasSegment(PageKeywords.CHECKOUT)
        || (facts.external() && facts.hostContains(PageKeywords.CHECKOUT_HOSTS))),
    CART(PageType.CART, 8, facts -> facts.hasSegment(PageKeywords.CART)),
    OFFERINGS(PageType.PRODUCT, 7, ClassificationRule::isListingPage),
    DETAIL(PageType.PRODUCT, 5, ClassificationRule::isDetailPage),
    CONTACT(PageType.CONTACT, 3, facts -> facts.hasSegment(PageKeywords.CONTACT)),
    ABOUT(PageType.ABOUT, 2, facts -> facts.hasSegment(PageKeywords.ABOUT)),
    OTHER(PageType.OTHER, 1, facts -> true);

    private final PageType pageType;
    private final int priority;
    private final Predicate<UrlFacts> matcher;

    ClassificationRule(PageType pageType, int priority, Predicate<UrlFacts> matcher) {
        this.pageType = pageType;
        this.priority = priority;
        this.matcher = matcher;
    }

    public PageType pageType() {
        return pageType;
    }

    public int priority() {
        return priority;
    }

    boolean matches(UrlFacts facts) {
        return matcher.test(facts);
    }

    // A catalog keyword in last position is a listing; anything below it is a detail page.
    private static boolean isListingPage(UrlFacts facts) {
        if (facts.external() && facts.hostContains(PageKeywords.COMMERCE_HOSTS) && facts.depth() <= 1) {
            return true;
        }
        return !facts.segments().isEmpty()
            && UrlFacts.matchesKeyword(facts.lastSegment(), PageKeywords.OFFERINGS);
    }

    private static boolean isDetailPage(UrlFacts facts) {
        if (facts.segments().isEmpty()) {
            return false;
        }
        for (int i = 0; i < facts.segments().size() - 1; i++) {
            if (UrlFacts.matchesKeyword(facts.segments().get(i), PageKeywords.OFFERINGS)
                && !PageKeywords.DETAIL_EXCLUSIONS.contains(facts.segments().get(i))) {
                return true;
            }
        }
        if (facts.hasSegment(PageKeywords.DETAIL_EXCLUSIONS)) {
            return false;
        }
        if (facts.depth() >= 3) {
            return true;
        }
        String last = facts.lastSegment();
        if (UrlFacts.matchesKeyword(last, PageKeywords.CONTACT) || UrlFacts.matchesKeyword(last, PageKeywords.ABOUT)) {
            return false;
        }
        return PageKeywords.HYPHENATED_SLUG.matcher(last).matches()
            || PageKeywords.NUMERIC_ID.matcher(last).matches();
    }
}
