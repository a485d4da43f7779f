package com.siteaudit.scan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public record EnrichedSummary(
    String summary,
    List<TopFix> topFixes,
    List<String> recommendations,
    String gradeExplanation,
    Source source
) {
    public EnrichedSummary {
        topFixes = topFixes == null ? List.of() : List.copyOf(topFixes);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public enum Source {
        AI,
        FALLBACK;

        @JsonValue
        public String jsonValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
