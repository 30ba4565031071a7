package com.tarantula.crawl.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * The outcome of one fetch, emitted to the result sink exactly once.
 */
public record PageResult(
    @JsonProperty("run_id") String runId,
    String url,
    @JsonProperty("final_url") String finalUrl,
    FetchStatus status,
    @JsonProperty("http_status") Integer httpStatus,
    int depth,
    String via,
    List<Redirect> redirects,
    @JsonProperty("discovered_links") List<Link> discoveredLinks,
    String content,
    @JsonProperty("content_type") String contentType,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("fetch_duration_ms") long fetchDurationMs,
    Instant timestamp
) {
    public static PageResult from(CrawlTask task, PageFetchResult fetch, List<Link> links, boolean keepContent) {
        return new PageResult(
            task.runId(),
            task.url(),
            fetch.finalUrlOrRequested(),
            fetch.status(),
            fetch.httpStatus(),
            task.depth(),
            task.via(),
            fetch.redirects() == null ? List.of() : List.copyOf(fetch.redirects()),
            links == null ? List.of() : List.copyOf(links),
            keepContent ? fetch.body() : null,
            fetch.contentType(),
            fetch.errorMessage(),
            fetch.duration() == null ? 0L : fetch.duration().toMillis(),
            fetch.fetchedAt()
        );
    }
}
