package com.siteaudit.scan.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitUntilState;
import com.siteaudit.config.AuditProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Chromium via Playwright. Playwright objects are not thread-safe, so every call against a process
 * and its pages is serialized on that process's monitor.
 */
@Component
public class PlaywrightBrowserEngine implements BrowserEngine {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserEngine.class);

    private final AuditProperties.Browser settings;
    private final String userAgent;

    public PlaywrightBrowserEngine(AuditProperties properties) {
        this.settings = properties.getBrowser();
        this.userAgent = properties.getUserAgent();
    }

    @Override
    public BrowserSession launch() {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(settings.isHeadless())
                .setTimeout(settings.getLaunchTimeoutMs()));
            return new PlaywrightSession(playwright, browser);
        } catch (PlaywrightException e) {
            if (playwright != null) {
                closePlaywright(playwright);
            }
            throw new BrowserUnavailableException("Chromium launch failed: " + e.getMessage(), e);
        }
    }

    private static void closePlaywright(Playwright playwright) {
        try {
            playwright.close();
        } catch (PlaywrightException e) {
            log.warn("closing playwright driver failed error={}", e.getMessage());
        }
    }

    private final class PlaywrightSession implements BrowserSession {
        private final Playwright playwright;
        private final Browser browser;

        private PlaywrightSession(Playwright playwright, Browser browser) {
            this.playwright = playwright;
            this.browser = browser;
        }

        @Override
        public synchronized BrowserPage newPage() {
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setViewportSize(settings.getViewportWidth(), settings.getViewportHeight())
                .setUserAgent(userAgent));
            context.setDefaultNavigationTimeout(settings.getNavigationTimeoutMs());
            return new PlaywrightPage(this, context, context.newPage());
        }

        @Override
        public synchronized boolean isConnected() {
            try {
                return browser.isConnected();
            } catch (PlaywrightException e) {
                log.debug("chromium connectivity probe failed error={}", e.getMessage());
                return false;
            }
        }

        @Override
        public synchronized void close() {
            try {
                browser.close();
            } catch (PlaywrightException e) {
                log.warn("closing chromium failed error={}", e.getMessage());
            } finally {
                closePlaywright(playwright);
            }
        }
    }

    private static final class PlaywrightPage implements BrowserPage {
        private final Object lock;
        private final BrowserContext context;
        private final Page page;

        private PlaywrightPage(Object lock, BrowserContext context, Page page) {
            this.lock = lock;
            this.context = context;
            this.page = page;
        }

        @Override
        public int navigate(String url, int timeoutMs) {
            synchronized (lock) {
                Response response = page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(timeoutMs)
                    .setWaitUntil(WaitUntilState.LOAD));
                return response == null ? 0 : response.status();
            }
        }

        @Override
        public String content() {
            synchronized (lock) {
                return page.content();
            }
        }

        @Override
        public Object evaluate(String script) {
            synchronized (lock) {
                return page.evaluate(script);
            }
        }

        @Override
        public byte[] screenshot(boolean fullPage) {
            synchronized (lock) {
                return page.screenshot(new Page.ScreenshotOptions().setFullPage(fullPage));
            }
        }

        @Override
        public boolean click(String selector) {
            synchronized (lock) {
                Locator target = page.locator(selector).first();
                if (target.count() == 0 || !target.isVisible()) {
                    return false;
                }
                try {
                    target.click(new Locator.ClickOptions().setTimeout(2000));
                    return true;
                } catch (PlaywrightException e) {
                    log.debug("click failed selector={} error={}", selector, e.getMessage());
                    return false;
                }
            }
        }

        @Override
        public void onRequest(Consumer<String> requestUrlListener) {
            synchronized (lock) {
                page.onRequest(request -> requestUrlListener.accept(request.url()));
            }
        }

        @Override
        public void waitFor(long millis) {
            synchronized (lock) {
                page.waitForTimeout(millis);
            }
        }

        @Override
        public void close() {
            synchronized (lock) {
                try {
                    page.close();
                } finally {
                    context.close();
                }
            }
        }
    }
}
