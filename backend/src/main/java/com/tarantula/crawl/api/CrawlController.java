package com.tarantula.crawl.api;

import com.tarantula.config.CrawlerProperties;
import com.tarantula.crawl.model.CrawlRunStatusResponse;
import com.tarantula.crawl.model.CrawlStartResponse;
import com.tarantula.crawl.model.RunConfig;
import com.tarantula.crawl.service.CrawlCoordinator;
import com.tarantula.crawl.service.InvalidRunConfigException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final CrawlCoordinator crawlCoordinator;
    private final CrawlerProperties crawlerProperties;

    public CrawlController(CrawlCoordinator crawlCoordinator, CrawlerProperties crawlerProperties) {
        this.crawlCoordinator = crawlCoordinator;
        this.crawlerProperties = crawlerProperties;
    }

    @PutMapping("/crawl")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public CrawlStartResponse startCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        return new CrawlStartResponse(crawlCoordinator.startRun(toRunConfig(request)));
    }

    @PostMapping("/crawl")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public CrawlStartResponse startCrawlPost(@RequestBody(required = false) CrawlApiRunRequest request) {
        return startCrawl(request);
    }

    @GetMapping("/runs")
    public List<CrawlRunStatusResponse> runs() {
        return crawlCoordinator.runs();
    }

    @GetMapping("/runs/{runId}")
    public CrawlRunStatusResponse run(@PathVariable("runId") String runId) {
        return crawlCoordinator.status(runId);
    }

    @DeleteMapping("/runs/{runId}")
    public CrawlRunStatusResponse cancel(@PathVariable("runId") String runId) {
        return crawlCoordinator.cancelRun(runId);
    }

    RunConfig toRunConfig(CrawlApiRunRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new InvalidRunConfigException("url is required");
        }
        CrawlerProperties.Defaults defaults = crawlerProperties.getDefaults();
        String userAgent = request.userAgent() == null || request.userAgent().isBlank()
            ? crawlerProperties.getUserAgent()
            : request.userAgent().trim();
        return new RunConfig(
            request.url().trim(),
            request.ignoreRedirects() == null ? defaults.isIgnoreRedirects() : request.ignoreRedirects(),
            request.maximumRedirects() == null ? defaults.getMaximumRedirects() : request.maximumRedirects(),
            request.maximumDepth() == null ? defaults.getMaximumDepth() : request.maximumDepth(),
            request.ignoreRobotsTxt() == null ? defaults.isIgnoreRobotsTxt() : request.ignoreRobotsTxt(),
            request.keepHtmlInMemory() == null ? defaults.isKeepHtmlInMemory() : request.keepHtmlInMemory(),
            userAgent,
            request.callbackUrl() == null || request.callbackUrl().isBlank() ? null : request.callbackUrl().trim(),
            request.crawlDelayMs() == null ? null : Duration.ofMillis(request.crawlDelayMs())
        );
    }
}
