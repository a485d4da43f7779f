package com.siteaudit.scan.enrichment;

import com.siteaudit.scan.model.EnrichedSummary;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of one enrichment call: either a summary or the failure that prevented it.
 */
public final class EnrichmentAttempt {
    private final EnrichedSummary value;
    private final EnrichmentException failure;

    private EnrichmentAttempt(EnrichedSummary value, EnrichmentException failure) {
        this.value = value;
        this.failure = failure;
    }

    public static EnrichmentAttempt success(EnrichedSummary value) {
        if (value == null) {
            return failure(new EnrichmentException("enrichment returned no summary"));
        }
        return new EnrichmentAttempt(value, null);
    }

    public static EnrichmentAttempt failure(EnrichmentException failure) {
        return new EnrichmentAttempt(null, failure);
    }

    /**
     * Runs the call and captures enrichment failures instead of throwing them.
     */
    public static EnrichmentAttempt of(Supplier<EnrichedSummary> call) {
        try {
            return success(call.get());
        } catch (EnrichmentException e) {
            return failure(e);
        } catch (RuntimeException e) {
            return failure(new EnrichmentException("enrichment call failed unexpectedly: " + e.getMessage(), e));
        }
    }

    public boolean isSuccess() {
        return value != null;
    }

    public Optional<EnrichmentException> failure() {
        return Optional.ofNullable(failure);
    }

    public EnrichedSummary orElseGet(Function<EnrichmentException, EnrichedSummary> fallback) {
        return value != null ? value : fallback.apply(failure);
    }
}
