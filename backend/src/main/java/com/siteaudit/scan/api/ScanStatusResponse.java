package com.siteaudit.scan.api;

import com.siteaudit.scan.model.ScanJob;
import com.siteaudit.scan.model.ScanReport;
import com.siteaudit.scan.progress.ScanProgress;

/**
 * Poll view of a scan: {@code progress} is present while it runs, {@code report} once it completed.
 */
public record ScanStatusResponse(
    ScanJob job,
    ScanProgress progress,
    ScanReport report
) {
}
