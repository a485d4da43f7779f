package com.siteaudit.scan.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Pillar-specific raw evidence. Each pillar reports its own record type so downstream code
 * can match on the concrete evidence instead of inspecting an untyped payload.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AccessibilityEvidence.class, name = "accessibility"),
    @JsonSubTypes.Type(value = PerformanceEvidence.class, name = "performance"),
    @JsonSubTypes.Type(value = SecurityEvidence.class, name = "security"),
    @JsonSubTypes.Type(value = SeoEvidence.class, name = "seo"),
    @JsonSubTypes.Type(value = FailedEvidence.class, name = "failed")
})
public interface PillarEvidence {

    List<AuditFinding> findings();
}
