package com.siteaudit.scan.model;

import java.util.List;
import java.util.Map;

public record SecurityEvidence(
    boolean https,
    Map<String, String> presentHeaders,
    List<String> missingHeaders,
    boolean privacyPolicy,
    boolean termsOfService,
    boolean contactPage,
    List<AuditFinding> findings
) implements PillarEvidence {

    public SecurityEvidence {
        presentHeaders = presentHeaders == null ? Map.of() : Map.copyOf(presentHeaders);
        missingHeaders = missingHeaders == null ? List.of() : List.copyOf(missingHeaders);
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public boolean hasHeader(String name) {
        return presentHeaders.containsKey(name);
    }
}
