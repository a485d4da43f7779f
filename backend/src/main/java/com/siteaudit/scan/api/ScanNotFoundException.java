package com.siteaudit.scan.api;

public class ScanNotFoundException extends RuntimeException {
    public ScanNotFoundException(String scanId) {
        super("No scan with id " + scanId);
    }
}
