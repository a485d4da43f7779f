package com.siteaudit.scan.crawl;

import com.siteaudit.scan.model.DiscoveredPage;

public final class PageClassifier {

    private PageClassifier() {
    }

    public static DiscoveredPage classify(String url, String siteHost) {
        ClassificationRule rule = matchingRule(url, siteHost);
        return new DiscoveredPage(url, rule.pageType(), rule.priority());
    }

    public static ClassificationRule matchingRule(String url, String siteHost) {
        UrlFacts facts = UrlFacts.of(url, siteHost);
        for (ClassificationRule rule : ClassificationRule.values()) {
            if (rule.matches(facts)) {
                return rule;
            }
        }
        return ClassificationRule.OTHER;
    }
}
