package com.siteaudit.scan.model;

import java.util.List;

public record EcommerceAnalysis(
    boolean hasShoppingCart,
    boolean hasCheckoutFlow,
    boolean hasPaymentOptions,
    boolean hasProductCatalog,
    boolean hasBookingSystem,
    boolean securePayment,
    BookingSystemDetails bookingSystemDetails,
    List<String> trustSignals,
    List<String> issues
) {
    public EcommerceAnalysis {
        trustSignals = trustSignals == null ? List.of() : List.copyOf(trustSignals);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
