package com.siteaudit.scan.model;

import java.util.List;

/**
 * Navigation timings in milliseconds; {@code -1} when the browser did not report a value.
 */
public record PerformanceEvidence(
    long timeToFirstByteMs,
    long firstContentfulPaintMs,
    long domContentLoadedMs,
    long loadMs,
    List<AuditFinding> findings
) implements PillarEvidence {

    public PerformanceEvidence {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
