package com.siteaudit.scan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

public enum PageType {
    HOMEPAGE,
    PRODUCT,
    BOOKING,
    CHECKOUT,
    CART,
    CONTACT,
    ABOUT,
    OTHER;

    private static final Set<PageType> COMMERCE = Set.of(CART, CHECKOUT, BOOKING, PRODUCT);

    /**
     * Page types that get the booking/e-commerce detector and a commerce analysis.
     */
    public boolean isCommerce() {
        return COMMERCE.contains(this);
    }

    public boolean isPaymentStep() {
        return this == CHECKOUT || this == CART;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
