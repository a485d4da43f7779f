package com.siteaudit.scan.service;

/**
 * No page produced a usable score; the target is treated as unreachable.
 */
public class ScanFatalException extends RuntimeException {
    public ScanFatalException(String message) {
        super(message);
    }
}
