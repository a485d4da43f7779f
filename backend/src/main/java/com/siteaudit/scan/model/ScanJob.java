package com.siteaudit.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

public record ScanJob(
    String id,
    String targetUrl,
    ScanStatus status,
    Instant createdAt,
    Instant completedAt,
    String errorMessage
) {
    public static ScanJob pending(String id, String targetUrl, Instant createdAt) {
        return new ScanJob(id, targetUrl, ScanStatus.PENDING, createdAt, null, null);
    }

    public ScanJob scanning() {
        return new ScanJob(id, targetUrl, ScanStatus.SCANNING, createdAt, null, null);
    }

    public ScanJob completed(Instant at) {
        return new ScanJob(id, targetUrl, ScanStatus.COMPLETED, createdAt, at, null);
    }

    public ScanJob failed(Instant at, String message) {
        return new ScanJob(id, targetUrl, ScanStatus.FAILED, createdAt, at, message);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status == ScanStatus.COMPLETED || status == ScanStatus.FAILED;
    }
}
