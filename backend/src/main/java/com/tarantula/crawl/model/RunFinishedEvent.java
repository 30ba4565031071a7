package com.tarantula.crawl.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Final notification posted to a run's callback once it reaches a terminal state.
 */
public record RunFinishedEvent(
    String event,
    @JsonProperty("run_id") String runId,
    RunState state,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    int visited,
    @JsonProperty("pages_emitted") long pagesEmitted,
    long failures,
    @JsonProperty("robots_excluded") long robotsExcluded,
    @JsonProperty("links_discovered") long linksDiscovered,
    @JsonProperty("results_dropped") long resultsDropped
) {
    public static final String RUN_FINISHED = "run_finished";

    public static RunFinishedEvent of(CrawlRunStatusResponse status) {
        return new RunFinishedEvent(
            RUN_FINISHED,
            status.runId(),
            status.state(),
            status.startedAt(),
            status.finishedAt(),
            status.visited(),
            status.pagesEmitted(),
            status.failures(),
            status.robotsExcluded(),
            status.linksDiscovered(),
            status.resultsDropped()
        );
    }
}
