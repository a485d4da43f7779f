package com.siteaudit.scan.progress;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScanStage {
    CRAWLING,
    SCANNING,
    FINALIZING;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
