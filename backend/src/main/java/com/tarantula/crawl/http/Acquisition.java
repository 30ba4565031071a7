package com.tarantula.crawl.http;

import java.time.Duration;

/**
 * Outcome of {@link HostRateLimiter#tryAcquire}: either a permit or the time to wait before asking again.
 */
public record Acquisition(HostPermit permit, Duration retryAfter) {

    static Acquisition granted(HostPermit permit) {
        return new Acquisition(permit, Duration.ZERO);
    }

    static Acquisition retryAfter(Duration wait) {
        return new Acquisition(null, wait);
    }

    public boolean isGranted() {
        return permit != null;
    }
}
