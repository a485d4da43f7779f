package com.siteaudit.scan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Impact {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    Impact(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
