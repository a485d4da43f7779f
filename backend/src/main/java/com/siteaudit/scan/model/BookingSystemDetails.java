package com.siteaudit.scan.model;

import java.util.List;

public record BookingSystemDetails(
    String provider,
    String platform,
    List<String> thirdParties,
    List<String> features,
    DetectionMethod detectionMethod,
    Confidence confidence
) {
    public BookingSystemDetails {
        thirdParties = thirdParties == null ? List.of() : List.copyOf(thirdParties);
        features = features == null ? List.of() : List.copyOf(features);
    }

    public boolean identified() {
        return provider != null || platform != null;
    }
}
