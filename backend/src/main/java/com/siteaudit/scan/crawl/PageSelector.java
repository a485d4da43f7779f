package com.siteaudit.scan.crawl;

import com.siteaudit.scan.model.DiscoveredPage;
import com.siteaudit.scan.model.PageType;
import com.siteaudit.scan.util.UrlSupport;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Picks the critical subset of classified pages: homepage, booking, checkout, offerings,
 * one detail page, then the highest remaining priorities. Pages are identified by
 * {@link UrlSupport#pageKey(String)} and at most one homepage is kept.
 */
public final class PageSelector {
    private static final Comparator<DiscoveredPage> BY_PRIORITY =
        Comparator.comparingInt(DiscoveredPage::priority).reversed();

    private PageSelector() {
    }

    public static List<DiscoveredPage> select(List<DiscoveredPage> candidates, int cap) {
        if (cap <= 0 || candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<DiscoveredPage> unique = dedupe(candidates);
        List<DiscoveredPage> selected = new ArrayList<>();
        Set<String> taken = new LinkedHashSet<>();

        pickFirst(unique, page -> page.pageType() == PageType.HOMEPAGE, selected, taken, cap);
        pickBest(unique, page -> page.pageType() == PageType.BOOKING, selected, taken, cap);
        if (!pickBest(unique, page -> page.pageType() == PageType.CHECKOUT, selected, taken, cap)) {
            pickBest(unique, page -> page.pageType() == PageType.CART, selected, taken, cap);
        }
        pickBest(unique, page -> isRule(page, ClassificationRule.OFFERINGS), selected, taken, cap);
        pickBest(unique, page -> isRule(page, ClassificationRule.DETAIL), selected, taken, cap);

        boolean haveHomepage = selected.stream().anyMatch(page -> page.pageType() == PageType.HOMEPAGE);
        unique.stream()
            .filter(page -> !taken.contains(key(page)))
            .filter(page -> !haveHomepage || page.pageType() != PageType.HOMEPAGE)
            .sorted(BY_PRIORITY)
            .forEach(page -> add(page, selected, taken, cap));
        return List.copyOf(selected);
    }

    private static String key(DiscoveredPage page) {
        return UrlSupport.pageKey(page.url());
    }

    private static boolean isRule(DiscoveredPage page, ClassificationRule rule) {
        return page.pageType() == rule.pageType() && page.priority() == rule.priority();
    }

    private static void pickFirst(
        List<DiscoveredPage> pages,
        Predicate<DiscoveredPage> filter,
        List<DiscoveredPage> selected,
        Set<String> taken,
        int cap
    ) {
        pages.stream()
            .filter(page -> !taken.contains(key(page)))
            .filter(filter)
            .findFirst()
            .ifPresent(page -> add(page, selected, taken, cap));
    }

    private static boolean pickBest(
        List<DiscoveredPage> pages,
        Predicate<DiscoveredPage> filter,
        List<DiscoveredPage> selected,
        Set<String> taken,
        int cap
    ) {
        Optional<DiscoveredPage> best = pages.stream()
            .filter(page -> !taken.contains(key(page)))
            .filter(filter)
            .sorted(BY_PRIORITY)
            .findFirst();
        best.ifPresent(page -> add(page, selected, taken, cap));
        return best.isPresent();
    }

    private static void add(DiscoveredPage page, List<DiscoveredPage> selected, Set<String> taken, int cap) {
        if (selected.size() < cap && taken.add(key(page))) {
            selected.add(page);
        }
    }

    private static List<DiscoveredPage> dedupe(List<DiscoveredPage> candidates) {
        Set<String> seen = new LinkedHashSet<>();
        List<DiscoveredPage> unique = new ArrayList<>();
        for (DiscoveredPage page : candidates) {
            if (page != null && page.url() != null && seen.add(key(page))) {
                unique.add(page);
            }
        }
        return unique;
    }
}
