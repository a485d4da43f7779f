package com.siteaudit.scan.service;

import com.siteaudit.scan.model.ScanReport;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryScanResultSink implements ScanResultSink {
    private final Map<String, ScanReport> reports = new ConcurrentHashMap<>();

    @Override
    public void accept(ScanReport report) {
        reports.put(report.scanId(), report);
    }

    @Override
    public Optional<ScanReport> find(String scanId) {
        return Optional.ofNullable(reports.get(scanId));
    }
}
