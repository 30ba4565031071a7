package com.tarantula.crawl.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CrawlRunStatusResponse(
    @JsonProperty("run_id") String runId,
    String url,
    RunState state,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    int pending,
    @JsonProperty("in_flight") int inFlight,
    int visited,
    @JsonProperty("pages_emitted") long pagesEmitted,
    long failures,
    @JsonProperty("robots_excluded") long robotsExcluded,
    @JsonProperty("links_discovered") long linksDiscovered,
    @JsonProperty("results_dropped") long resultsDropped
) {
}
