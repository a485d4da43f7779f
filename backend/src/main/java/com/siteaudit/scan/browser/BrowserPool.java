package com.siteaudit.scan.browser;

import com.siteaudit.config.AuditProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small set of long-lived browser processes shared by every scan. A fair semaphore caps the number
 * of open pages across all processes; callers block until a slot frees. Processes are launched on
 * first use and relaunched when found disconnected.
 */
@Component
public class BrowserPool {
    private static final Logger log = LoggerFactory.getLogger(BrowserPool.class);

    private final BrowserEngine engine;
    private final int maxPages;
    private final Semaphore pageSlots;
    private final BrowserSession[] sessions;
    private final Object[] sessionLocks;
    private final AtomicInteger nextSession = new AtomicInteger();
    private final AtomicInteger pagesInUse = new AtomicInteger();
    private volatile boolean closed;

    public BrowserPool(AuditProperties properties, BrowserEngine engine) {
        this.engine = engine;
        this.maxPages = properties.getBrowser().getMaxPages();
        this.pageSlots = new Semaphore(maxPages, true);
        int processes = properties.getBrowser().getProcesses();
        this.sessions = new BrowserSession[processes];
        this.sessionLocks = new Object[processes];
        for (int i = 0; i < processes; i++) {
            sessionLocks[i] = new Object();
        }
    }

    public PageLease acquire() {
        if (closed) {
            throw new BrowserUnavailableException("Browser pool is shut down");
        }
        try {
            pageSlots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserUnavailableException("Interrupted while waiting for a browser page", e);
        }
        try {
            int index = Math.floorMod(nextSession.getAndIncrement(), sessions.length);
            BrowserPage page = openPage(index);
            pagesInUse.incrementAndGet();
            return new PageLease(page, this);
        } catch (RuntimeException e) {
            pageSlots.release();
            if (e instanceof BrowserUnavailableException unavailable) {
                throw unavailable;
            }
            throw new BrowserUnavailableException("Could not open a browser page: " + e.getMessage(), e);
        }
    }

    public void release(PageLease lease) {
        if (lease == null || !lease.markReleased()) {
            return;
        }
        try {
            lease.page().close();
        } catch (RuntimeException e) {
            log.debug("closing browser page failed error={}", e.getMessage());
        } finally {
            pagesInUse.decrementAndGet();
            pageSlots.release();
        }
    }

    /**
     * Launches the first process if needed and reports whether it is connected.
     */
    public boolean healthCheck() {
        if (closed) {
            return false;
        }
        try {
            return sessionFor(0, false).isConnected();
        } catch (RuntimeException e) {
            log.warn("browser health check failed error={}", e.getMessage());
            return false;
        }
    }

    public BrowserPoolStats stats() {
        int launched = 0;
        int connected = 0;
        for (int i = 0; i < sessions.length; i++) {
            synchronized (sessionLocks[i]) {
                if (sessions[i] != null) {
                    launched++;
                    if (sessions[i].isConnected()) {
                        connected++;
                    }
                }
            }
        }
        return new BrowserPoolStats(sessions.length, launched, connected, maxPages, pagesInUse.get());
    }

    @PreDestroy
    public void closeAll() {
        closed = true;
        for (int i = 0; i < sessions.length; i++) {
            synchronized (sessionLocks[i]) {
                closeSession(sessions[i]);
                sessions[i] = null;
            }
        }
        log.info("browser pool closed processes={}", sessions.length);
    }

    private BrowserPage openPage(int index) {
        BrowserSession session = sessionFor(index, false);
        try {
            return session.newPage();
        } catch (RuntimeException e) {
            if (session.isConnected()) {
                throw e;
            }
            log.warn("browser process {} dropped while opening a page, relaunching", index);
            return sessionFor(index, true).newPage();
        }
    }

    private BrowserSession sessionFor(int index, boolean forceRelaunch) {
        synchronized (sessionLocks[index]) {
            BrowserSession current = sessions[index];
            if (current != null && !forceRelaunch && current.isConnected()) {
                return current;
            }
            if (current != null) {
                log.warn("relaunching disconnected browser process index={}", index);
                closeSession(current);
            }
            BrowserSession launched = engine.launch();
            sessions[index] = launched;
            log.info("launched browser process index={}", index);
            return launched;
        }
    }

    private void closeSession(BrowserSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("closing browser process failed error={}", e.getMessage());
        }
    }
}
