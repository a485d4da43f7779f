package com.siteaudit.scan.service;

/**
 * Target URL rejected before any work started.
 */
public class ScanValidationException extends RuntimeException {
    public ScanValidationException(String message) {
        super(message);
    }
}
