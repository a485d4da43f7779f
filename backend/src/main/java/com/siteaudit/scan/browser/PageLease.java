package com.siteaudit.scan.browser;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A page checked out of the {@link BrowserPool}. Closing the lease returns its slot.
 */
public final class PageLease implements AutoCloseable {
    private final BrowserPage page;
    private final BrowserPool pool;
    private final AtomicBoolean released = new AtomicBoolean(false);

    PageLease(BrowserPage page, BrowserPool pool) {
        this.page = page;
        this.pool = pool;
    }

    public BrowserPage page() {
        return page;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        pool.release(this);
    }
}
