package com.siteaudit.scan.model;

/**
 * A single remediable problem reported by an auditor.
 */
public record AuditFinding(
    String id,
    String title,
    String description,
    Impact impact,
    int occurrences
) {
}
