package com.siteaudit.scan.model;

import java.util.List;

public record SeoEvidence(
    boolean robotsFound,
    boolean robotsValid,
    boolean sitemapFound,
    int structuredDataBlocks,
    boolean canonical,
    boolean hreflang,
    boolean title,
    boolean metaDescription,
    int openGraphTags,
    List<AuditFinding> findings
) implements PillarEvidence {

    public SeoEvidence {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
