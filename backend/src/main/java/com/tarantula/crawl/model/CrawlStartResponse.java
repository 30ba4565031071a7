package com.tarantula.crawl.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CrawlStartResponse(@JsonProperty("run_id") String runId) {
}
