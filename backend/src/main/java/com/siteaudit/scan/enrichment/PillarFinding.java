package com.siteaudit.scan.enrichment;

import com.siteaudit.scan.model.AuditFinding;
import com.siteaudit.scan.model.Pillar;

/**
 * A finding merged across pages: {@code pages} is how many scanned pages reported it.
 */
public record PillarFinding(
    Pillar pillar,
    AuditFinding finding,
    int pages,
    int occurrences
) {
}
