package com.tarantula.crawl.http;

import com.tarantula.crawl.model.PageFetchResult;

/**
 * Fetches one URL, following at most {@code maxRedirects} redirects. Failures are reported in the
 * returned result, never thrown.
 */
@FunctionalInterface
public interface PageFetcher {
    PageFetchResult fetch(String url, String userAgent, int maxRedirects, int maxBodyBytes);
}
