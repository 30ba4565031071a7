package com.tarantula.crawl.model;

import java.time.Duration;

/**
 * Parameters of a single crawl run. Immutable for the lifetime of the run.
 *
 * @param url               seed URL, crawled at depth 0
 * @param ignoreRedirects   treat any redirect as a fetch failure
 * @param maximumRedirects  redirects followed per fetch before giving up
 * @param maximumDepth      deepest link hop that is still fetched
 * @param ignoreRobotsTxt   skip robots.txt checks entirely
 * @param keepHtmlInMemory  include page content in emitted results
 * @param userAgent         User-Agent sent on every request of the run
 * @param callbackUrl       destination for results, may be null
 * @param crawlDelay        per-run minimum gap between requests to a host, may be null
 */
public record RunConfig(
    String url,
    boolean ignoreRedirects,
    int maximumRedirects,
    int maximumDepth,
    boolean ignoreRobotsTxt,
    boolean keepHtmlInMemory,
    String userAgent,
    String callbackUrl,
    Duration crawlDelay
) {
    public int effectiveMaximumRedirects() {
        return ignoreRedirects ? 0 : maximumRedirects;
    }

    public boolean hasCallback() {
        return callbackUrl != null && !callbackUrl.isBlank();
    }

    public Duration crawlDelayOrZero() {
        return crawlDelay == null || crawlDelay.isNegative() ? Duration.ZERO : crawlDelay;
    }
}
