package com.tarantula.crawl.http;

import com.tarantula.config.CrawlerProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-host politeness shared by every run in the process. Limits in-flight requests per host and
 * spaces successive grants by the largest of the configured per-host delay, the caller's minimum
 * gap and the host's robots crawl-delay. Never blocks.
 */
@Service
public class HostRateLimiter {
    private final CrawlerProperties properties;
    private final Clock clock;
    private final Map<String, HostState> hosts = new ConcurrentHashMap<>();

    public HostRateLimiter(CrawlerProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public Acquisition tryAcquire(String host, Duration minimumGap) {
        HostState state = stateFor(host);
        synchronized (state) {
            Duration wait = waitTime(state, minimumGap);
            if (!wait.isZero()) {
                return Acquisition.retryAfter(wait);
            }
            state.inFlight++;
            state.lastGrant = clock.instant();
            return Acquisition.granted(new HostPermit(host, this));
        }
    }

    /**
     * Time until {@link #tryAcquire} would succeed for the host, without taking anything.
     */
    public Duration readyIn(String host, Duration minimumGap) {
        HostState state = stateFor(host);
        synchronized (state) {
            return waitTime(state, minimumGap);
        }
    }

    public void updateCrawlDelay(String host, Duration crawlDelay) {
        if (crawlDelay == null || crawlDelay.isNegative()) {
            return;
        }
        HostState state = stateFor(host);
        synchronized (state) {
            state.crawlDelay = crawlDelay;
        }
    }

    public int inFlight(String host) {
        HostState state = hosts.get(host);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.inFlight;
        }
    }

    void release(String host) {
        HostState state = hosts.get(host);
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.inFlight = Math.max(0, state.inFlight - 1);
        }
    }

    private Duration waitTime(HostState state, Duration minimumGap) {
        if (state.inFlight >= properties.getPerHostConcurrency()) {
            // no way to know when a slot frees up; completions re-signal dispatch
            return Duration.ofMillis(properties.getIdlePollMs());
        }
        if (state.lastGrant == null) {
            return Duration.ZERO;
        }
        Duration gap = effectiveGap(state, minimumGap);
        Instant nextAllowed = state.lastGrant.plus(gap);
        Instant now = clock.instant();
        return nextAllowed.isAfter(now) ? Duration.between(now, nextAllowed) : Duration.ZERO;
    }

    private Duration effectiveGap(HostState state, Duration minimumGap) {
        Duration gap = Duration.ofMillis(properties.getPerHostDelayMs());
        if (minimumGap != null && minimumGap.compareTo(gap) > 0) {
            gap = minimumGap;
        }
        if (state.crawlDelay != null && state.crawlDelay.compareTo(gap) > 0) {
            gap = state.crawlDelay;
        }
        return gap;
    }

    private HostState stateFor(String host) {
        return hosts.computeIfAbsent(host, ignored -> new HostState());
    }

    private static final class HostState {
        private Instant lastGrant;
        private Duration crawlDelay;
        private int inFlight;
    }
}
