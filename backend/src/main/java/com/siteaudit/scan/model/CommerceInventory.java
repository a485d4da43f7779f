package com.siteaudit.scan.model;

import java.util.Collection;

/**
 * Commerce page types seen anywhere during discovery, not only among the selected pages.
 */
public record CommerceInventory(
    boolean hasCart,
    boolean hasCheckout,
    int productPages,
    boolean hasBooking
) {
    public static CommerceInventory none() {
        return new CommerceInventory(false, false, 0, false);
    }

    public static CommerceInventory fromPageTypes(Collection<PageType> pageTypes) {
        boolean cart = false;
        boolean checkout = false;
        boolean booking = false;
        int products = 0;
        for (PageType type : pageTypes) {
            switch (type) {
                case CART -> cart = true;
                case CHECKOUT -> checkout = true;
                case BOOKING -> booking = true;
                case PRODUCT -> products++;
                default -> {
                }
            }
        }
        return new CommerceInventory(cart, checkout, products, booking);
    }

    public boolean hasEcommerce() {
        return hasCart || hasCheckout || productPages > 0;
    }
}
