package com.siteaudit.scan.browser;

/**
 * A long-lived browser process.
 */
public interface BrowserSession extends AutoCloseable {

    BrowserPage newPage();

    boolean isConnected();

    @Override
    void close();
}
