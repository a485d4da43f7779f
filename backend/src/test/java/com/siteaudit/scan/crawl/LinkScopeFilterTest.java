package com.siteaudit.scan.crawl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinkScopeFilterTest {

    @Test
    void keepsTheSiteHostWithOrWithoutWww() {
        assertTrue(LinkScopeFilter.inScope("https://example.com/rooms", "www.example.com"));
        assertTrue(LinkScopeFilter.inScope("http://www.example.com/about", "example.com"));
    }

    @Test
    void subdomainsNeedACommerceOrBookingHost() {
        assertTrue(LinkScopeFilter.inScope("https://shop.example.com/", "example.com"));
        assertTrue(LinkScopeFilter.inScope("https://book.example.com/rooms", "example.com"));
        assertFalse(LinkScopeFilter.inScope("https://blog.example.com/post", "example.com"));
    }

    @Test
    void keepsExternalBookingAndShopFronts() {
        assertTrue(LinkScopeFilter.inScope("https://reservations.hotelhub.net/h/42", "example.com"));
        assertTrue(LinkScopeFilter.inScope("https://example-store.myshopify.com/", "example.com"));
    }

    @Test
    void dropsSocialStaticAndUnrelatedLinks() {
        assertFalse(LinkScopeFilter.inScope("https://www.facebook.com/example", "example.com"));
        assertFalse(LinkScopeFilter.inScope("https://example.com/menu.pdf", "example.com"));
        assertFalse(LinkScopeFilter.inScope("https://news.othersite.org/article", "example.com"));
        assertFalse(LinkScopeFilter.inScope("mailto:info@example.com", "example.com"));
    }
}
