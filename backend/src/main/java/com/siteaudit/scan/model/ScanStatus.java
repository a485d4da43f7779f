package com.siteaudit.scan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScanStatus {
    PENDING,
    SCANNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
