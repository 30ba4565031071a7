package com.tarantula.crawl.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record PageFetchResult(
    String requestedUrl,
    String finalUrl,
    FetchStatus status,
    Integer httpStatus,
    String body,
    String contentType,
    Map<String, List<String>> headers,
    List<Redirect> redirects,
    Instant fetchedAt,
    Duration duration,
    String errorMessage
) {
    public boolean isSuccessful() {
        return status == FetchStatus.OK;
    }

    public String finalUrlOrRequested() {
        return finalUrl != null ? finalUrl : requestedUrl;
    }

    public boolean isHtml() {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("text/html") || lower.contains("application/xhtml");
    }
}
