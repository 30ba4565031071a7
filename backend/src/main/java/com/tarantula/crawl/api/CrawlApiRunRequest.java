package com.tarantula.crawl.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run submission body. Every field but {@code url} may be left out and falls back to the
 * configured defaults.
 */
public record CrawlApiRunRequest(
    String url,
    @JsonProperty("ignore_redirects") Boolean ignoreRedirects,
    @JsonProperty("maximum_redirects") Integer maximumRedirects,
    @JsonProperty("maximum_depth") Integer maximumDepth,
    @JsonProperty("ignore_robots_txt") Boolean ignoreRobotsTxt,
    @JsonProperty("keep_html_in_memory") Boolean keepHtmlInMemory,
    @JsonProperty("user_agent") String userAgent,
    @JsonProperty("callback_url") String callbackUrl,
    @JsonProperty("crawl_delay_ms") Long crawlDelayMs
) {
}
