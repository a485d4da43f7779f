package com.siteaudit.scan.service;

import com.siteaudit.scan.model.ScanReport;

import java.util.Optional;

public interface ScanResultSink {
    void accept(ScanReport report);

    Optional<ScanReport> find(String scanId);
}
