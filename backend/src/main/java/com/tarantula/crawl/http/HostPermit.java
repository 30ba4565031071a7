package com.tarantula.crawl.http;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One granted request slot for a host. Closing releases the slot; repeated closes are no-ops.
 */
public final class HostPermit implements AutoCloseable {
    private final String host;
    private final HostRateLimiter limiter;
    private final AtomicBoolean released = new AtomicBoolean(false);

    HostPermit(String host, HostRateLimiter limiter) {
        this.host = host;
        this.limiter = limiter;
    }

    public String host() {
        return host;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            limiter.release(host);
        }
    }
}
