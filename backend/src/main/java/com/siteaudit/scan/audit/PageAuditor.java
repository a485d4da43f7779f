package com.siteaudit.scan.audit;

import com.siteaudit.scan.model.Pillar;
import com.siteaudit.scan.model.PillarResult;

/**
 * One audit pillar. Implementations report failures through {@link PillarResult#failed(String)}
 * instead of throwing for ordinary page content.
 */
public interface PageAuditor {

    Pillar pillar();

    PillarResult audit(String url);
}
