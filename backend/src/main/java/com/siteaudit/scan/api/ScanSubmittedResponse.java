package com.siteaudit.scan.api;

import com.siteaudit.scan.model.ScanStatus;

public record ScanSubmittedResponse(String scanId, ScanStatus status) {
}
