package com.siteaudit.scan.crawl;

import com.siteaudit.scan.model.DiscoveredPage;
import com.siteaudit.scan.model.PageType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageSelectorTest {

    @Test
    void homepageComesFirstThenBookingAndCheckout() {
        List<DiscoveredPage> candidates = classify(
            "https://example.com/blog",
            "https://example.com/checkout",
            "https://example.com/book",
            "https://example.com/"
        );

        List<DiscoveredPage> selected = PageSelector.select(candidates, 3);

        assertThat(selected).extracting(DiscoveredPage::pageType)
            .containsExactly(PageType.HOMEPAGE, PageType.BOOKING, PageType.CHECKOUT);
    }

    @Test
    void cartStandsInWhenThereIsNoCheckout() {
        List<DiscoveredPage> candidates = classify(
            "https://example.com/",
            "https://example.com/about",
            "https://example.com/cart"
        );

        List<DiscoveredPage> selected = PageSelector.select(candidates, 2);

        assertThat(selected).extracting(DiscoveredPage::url)
            .containsExactly("https://example.com/", "https://example.com/cart");
    }

    @Test
    void listingAndOneDetailPrecedeRemainingPriorities() {
        List<DiscoveredPage> candidates = classify(
            "https://example.com/",
            "https://example.com/contact",
            "https://example.com/rooms/garden-view-suite",
            "https://example.com/rooms",
            "https://example.com/rooms/ocean-view-suite"
        );

        List<DiscoveredPage> selected = PageSelector.select(candidates, 4);

        assertThat(selected).extracting(DiscoveredPage::url).containsExactly(
            "https://example.com/",
            "https://example.com/rooms",
            "https://example.com/rooms/garden-view-suite",
            "https://example.com/rooms/ocean-view-suite"
        );
    }

    @Test
    void neverExceedsCapAndDropsDuplicates() {
        List<DiscoveredPage> candidates = classify(
            "https://example.com/",
            "https://example.com/",
            "https://example.com/book",
            "https://example.com/book",
            "https://example.com/contact",
            "https://example.com/about",
            "https://example.com/blog"
        );

        List<DiscoveredPage> selected = PageSelector.select(candidates, 4);

        assertThat(selected).hasSize(4);
        assertThat(selected).extracting(DiscoveredPage::url).doesNotHaveDuplicates();
    }

    @Test
    void wwwAndSchemeVariantsAreOnePage() {
        List<DiscoveredPage> candidates = classify(
            "https://example.com/",
            "https://www.example.com/",
            "http://example.com/",
            "https://example.com/book",
            "http://www.example.com/book/",
            "https://example.com/contact"
        );

        List<DiscoveredPage> selected = PageSelector.select(candidates, 4);

        assertThat(selected).extracting(DiscoveredPage::url).containsExactly(
            "https://example.com/",
            "https://example.com/book",
            "https://example.com/contact"
        );
    }

    @Test
    void keepsOneHomepageEvenWhenRootsDiffer() {
        List<DiscoveredPage> candidates = classify(
            "https://example.com/",
            "https://example.com:8443/",
            "https://example.com/about"
        );

        List<DiscoveredPage> selected = PageSelector.select(candidates, 4);

        assertThat(selected).extracting(DiscoveredPage::pageType)
            .containsExactly(PageType.HOMEPAGE, PageType.ABOUT);
    }

    @Test
    void emptyInputOrZeroCapSelectsNothing() {
        assertThat(PageSelector.select(List.of(), 4)).isEmpty();
        assertThat(PageSelector.select(classify("https://example.com/"), 0)).isEmpty();
    }

    private static List<DiscoveredPage> classify(String... urls) {
        return Arrays.stream(urls)
            .map(url -> PageClassifier.classify(url, "example.com"))
            .toList();
    }
}
