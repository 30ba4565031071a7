package com.tarantula.crawl.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Redirect(
    String source,
    String destination,
    @JsonProperty("status_code") int statusCode
) {
}
