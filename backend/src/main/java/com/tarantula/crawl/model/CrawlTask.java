package com.tarantula.crawl.model;

/**
 * A URL accepted into a run's frontier, waiting for or undergoing a fetch.
 */
public record CrawlTask(
    String runId,
    String url,
    String host,
    int depth,
    String via
) {
}
