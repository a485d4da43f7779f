package com.siteaudit.scan.browser;

import java.util.function.Consumer;

/**
 * One browser tab. Implementations are used by a single caller at a time.
 */
public interface BrowserPage extends AutoCloseable {

    /**
     * Navigates and returns the main-document HTTP status, or {@code 0} when the browser reported none.
     */
    int navigate(String url, int timeoutMs);

    String content();

    Object evaluate(String script);

    byte[] screenshot(boolean fullPage);

    /**
     * Clicks the first visible element matching {@code selector}; false when nothing matched.
     */
    boolean click(String selector);

    void onRequest(Consumer<String> requestUrlListener);

    void waitFor(long millis);

    @Override
    void close();
}
