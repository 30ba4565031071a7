package com.tarantula.crawl.robots;

import com.tarantula.config.CrawlerProperties;
import com.tarantula.crawl.http.PageFetcher;
import com.tarantula.crawl.model.PageFetchResult;
import com.tarantula.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide robots.txt cache keyed by origin. The first caller for an origin fetches; concurrent
 * callers wait on the same future, so each origin is fetched once.
 */
@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);

    private final CrawlerProperties properties;
    private final PageFetcher fetcher;
    private final Map<String, CompletableFuture<RobotsRules>> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(CrawlerProperties properties, PageFetcher fetcher) {
        this.properties = properties;
        this.fetcher = fetcher;
    }

    public boolean isAllowed(String url, String userAgent) {
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return true;
        }
        RobotsRules rules = rulesFor(url, userAgent);
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return rules.isAllowed(path, userAgent);
    }

    public Optional<Duration> crawlDelay(String url, String userAgent) {
        return rulesFor(url, userAgent).crawlDelay(userAgent);
    }

    public RobotsRules rulesFor(String url, String userAgent) {
        String origin = UrlNormalizer.origin(url);
        if (origin == null) {
            return RobotsRules.allowAll();
        }
        CompletableFuture<RobotsRules> entry = cache.get(origin);
        if (entry == null) {
            CompletableFuture<RobotsRules> created = new CompletableFuture<>();
            entry = cache.putIfAbsent(origin, created);
            if (entry == null) {
                entry = created;
                created.complete(loadRules(origin, userAgent));
            }
        }
        return entry.join();
    }

    private RobotsRules loadRules(String origin, String userAgent) {
        String robotsUrl = origin + "/robots.txt";
        PageFetchResult fetch;
        try {
            fetch = fetcher.fetch(
                robotsUrl,
                userAgent,
                properties.getRobots().getMaxRedirects(),
                properties.getRobots().getMaxBodyBytes()
            );
        } catch (RuntimeException e) {
            log.warn("robots fetch failed origin={} error={} decision=allow_all", origin, e.toString());
            return RobotsRules.allowAll();
        }
        if (!fetch.isSuccessful() || fetch.httpStatus() == null || fetch.httpStatus() != 200) {
            log.warn(
                "robots unavailable origin={} status={} httpStatus={} errorMessage={} decision=allow_all",
                origin,
                fetch.status(),
                fetch.httpStatus(),
                fetch.errorMessage()
            );
            return RobotsRules.allowAll();
        }
        if (fetch.body() == null || fetch.body().isBlank()) {
            log.debug("robots empty origin={} decision=allow_all", origin);
            return RobotsRules.allowAll();
        }
        RobotsRules rules = RobotsRules.parse(fetch.body());
        log.debug("Loaded robots for origin {} with {} sitemap hints", origin, rules.getSitemapUrls().size());
        return rules;
    }
}
