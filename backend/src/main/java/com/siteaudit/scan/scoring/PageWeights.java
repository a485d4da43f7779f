package com.siteaudit.scan.scoring;

import com.siteaudit.scan.model.PageType;

/**
 * Site-level importance of each page type when averaging pillar scores.
 */
public final class PageWeights {
    private PageWeights() {
    }

    public static double weight(PageType pageType) {
        if (pageType == null) {
            return 1.0;
        }
        return switch (pageType) {
            case HOMEPAGE -> 2.0;
            case CHECKOUT, CART -> 1.8;
            case BOOKING -> 1.7;
            case PRODUCT -> 1.5;
            case CONTACT -> 1.3;
            case ABOUT, OTHER -> 1.0;
        };
    }
}
