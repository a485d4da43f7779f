package com.siteaudit.scan.booking;

import com.siteaudit.scan.model.Confidence;

/**
 * Positive identification from one detection stage.
 */
public record StageMatch(
    String provider,
    String platform,
    Confidence confidence
) {
    public static StageMatch provider(String provider, Confidence confidence) {
        return new StageMatch(provider, null, confidence);
    }

    public static StageMatch platform(String platform, Confidence confidence) {
        return new StageMatch(null, platform, confidence);
    }
}
