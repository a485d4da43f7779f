package com.siteaudit.scan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DetectionMethod {
    DOMAIN,
    FOOTER,
    FINGERPRINT,
    NETWORK,
    FALLBACK;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
