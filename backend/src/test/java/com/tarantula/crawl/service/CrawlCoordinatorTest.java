package com.tarantula.crawl.service;

import com.tarantula.config.CrawlerProperties;
import com.tarantula.crawl.http.HostRateLimiter;
import com.tarantula.crawl.http.PageFetcher;
import com.tarantula.crawl.links.LinkExtractor;
import com.tarantula.crawl.model.CrawlRunStatusResponse;
import com.tarantula.crawl.model.DeliveryStatus;
import com.tarantula.crawl.model.FetchStatus;
import com.tarantula.crawl.model.PageFetchResult;
import com.tarantula.crawl.model.PageResult;
import com.tarantula.crawl.model.Redirect;
import com.tarantula.crawl.model.RunConfig;
import com.tarantula.crawl.model.RunFinishedEvent;
import com.tarantula.crawl.model.RunState;
import com.tarantula.crawl.robots.RobotsTxtService;
import com.tarantula.crawl.sink.ResultSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class CrawlCoordinatorTest {
    private static final String AGENT = "tarantula-test/1.0";
    private static final Duration WAIT = Duration.ofSeconds(10);

    private FakeWeb web;
    private CapturingSink sink;
    private ExecutorService executor;
    private CrawlCoordinator coordinator;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setPerHostDelayMs(0);
        properties.setWorkerCount(4);
        properties.setIdlePollMs(10);
        web = new FakeWeb();
        sink = new CapturingSink();
        executor = Executors.newFixedThreadPool(properties.getWorkerCount());
        coordinator = new CrawlCoordinator(
            properties,
            new RobotsTxtService(properties, web),
            new HostRateLimiter(properties, Clock.systemUTC()),
            web,
            new LinkExtractor(),
            sink,
            new CrawlRunRegistry(properties),
            executor,
            Clock.systemUTC()
        );
        coordinator.start();
    }

    @AfterEach
    void tearDown() {
        coordinator.stop();
        executor.shutdownNow();
    }

    @Test
    void depthZeroFetchesOnlyTheSeed() throws Exception {
        web.html("https://example.com/", "<a href=\"/a\">a</a><a href=\"/b\">b</a>");

        CrawlRunStatusResponse status = runToEnd(config("https://example.com", 0));

        assertThat(status.state()).isEqualTo(RunState.COMPLETED);
        assertThat(sink.results).extracting(PageResult::url).containsExactly("https://example.com/");
        assertThat(web.pagesFetched()).containsExactly("https://example.com/");
        assertThat(status.linksDiscovered()).isZero();
    }

    @Test
    void selfLinkIsDuplicateAndRunCompletes() throws Exception {
        web.html("https://example.com/", "<a href=\"/\">home</a><a href=\"https://example.com/#top\">top</a>");

        CrawlRunStatusResponse status = runToEnd(config("https://example.com/", 3));

        assertThat(status.state()).isEqualTo(RunState.COMPLETED);
        assertThat(sink.results).hasSize(1);
        assertThat(status.linksDiscovered()).isZero();
        assertThat(sink.results.get(0).discoveredLinks()).hasSize(1);
    }

    @Test
    void robotsDisallowedLinkIsNeverFetched() throws Exception {
        web.text("https://example.com/robots.txt", "User-agent: *\nDisallow: /private\n");
        web.html("https://example.com/", "<a href=\"/private\">secret</a>");
        web.html("https://example.com/private", "<p>secret</p>");

        CrawlRunStatusResponse status = runToEnd(config("https://example.com/", 3));

        assertThat(status.state()).isEqualTo(RunState.COMPLETED);
        assertThat(sink.results).extracting(PageResult::url).containsExactly("https://example.com/");
        assertThat(web.pagesFetched()).doesNotContain("https://example.com/private");
        assertThat(status.robotsExcluded()).isEqualTo(1L);
    }

    @Test
    void ignoringRobotsFetchesDisallowedPages() throws Exception {
        web.text("https://example.com/robots.txt", "User-agent: *\nDisallow: /private\n");
        web.html("https://example.com/", "<a href=\"/private\">secret</a>");
        web.html("https://example.com/private", "<p>secret</p>");
        RunConfig config = new RunConfig("https://example.com/", false, 10, 3, true, false, AGENT, null, null);

        CrawlRunStatusResponse status = runToEnd(config);

        assertThat(sink.results).extracting(PageResult::url)
            .containsExactlyInAnyOrder("https://example.com/", "https://example.com/private");
        assertThat(web.fetched).doesNotContain("https://example.com/robots.txt");
        assertThat(status.robotsExcluded()).isZero();
    }

    @Test
    void timedOutSeedIsOneFailedResult() throws Exception {
        web.page("https://example.com/", failure("https://example.com/", FetchStatus.TIMEOUT));

        CrawlRunStatusResponse status = runToEnd(config("https://example.com/", 3));

        assertThat(status.state()).isEqualTo(RunState.COMPLETED);
        assertThat(sink.results).hasSize(1);
        assertThat(sink.results.get(0).status()).isEqualTo(FetchStatus.TIMEOUT);
        assertThat(status.failures()).isEqualTo(1L);
    }

    @Test
    void redirectLimitComesFromRunConfig() throws Exception {
        web.page("https://example.com/", failure("https://example.com/", FetchStatus.REDIRECT_LIMIT));

        runToEnd(new RunConfig("https://example.com/", false, 2, 3, false, false, AGENT, null, null));
        runToEnd(new RunConfig("https://example.com/", true, 2, 3, false, false, AGENT, null, null));

        assertThat(web.redirectLimits.get("https://example.com/")).containsExactly(2, 0);
        assertThat(sink.results).extracting(PageResult::status)
            .containsOnly(FetchStatus.REDIRECT_LIMIT);
    }

    @Test
    void followsLinksUpToMaximumDepth() throws Exception {
        web.html("https://example.com/", "<a href=\"/1\">1</a>");
        web.html("https://example.com/1", "<a href=\"/2\">2</a>");
        web.html("https://example.com/2", "<a href=\"/3\">3</a>");
        web.html("https://example.com/3", "<p>too deep</p>");

        CrawlRunStatusResponse status = runToEnd(config("https://example.com/", 2));

        assertThat(sink.results).extracting(PageResult::url, PageResult::depth)
            .containsExactlyInAnyOrder(
                tuple("https://example.com/", 0),
                tuple("https://example.com/1", 1),
                tuple("https://example.com/2", 2)
            );
        PageResult first = sink.results.stream().filter(r -> r.depth() == 1).findFirst().orElseThrow();
        assertThat(first.via()).isEqualTo("https://example.com/");
        assertThat(status.visited()).isEqualTo(3);
    }

    @Test
    void redirectTargetCountsAsVisited() throws Exception {
        web.page("https://example.com/", new PageFetchResult(
            "https://example.com/",
            "https://example.com/landing",
            FetchStatus.OK,
            200,
            "<a href=\"/landing\">self</a><a href=\"other\">other</a>",
            "text/html",
            Map.of(),
            List.of(new Redirect("https://example.com/", "https://example.com/landing", 301)),
            Instant.now(),
            Duration.ofMillis(3),
            null
        ));
        web.html("https://example.com/other", "<p>other</p>");

        runToEnd(config("https://example.com/", 3));

        assertThat(web.pagesFetched())
            .containsExactlyInAnyOrder("https://example.com/", "https://example.com/other");
        assertThat(sink.results.stream().filter(r -> r.url().equals("https://example.com/")).findFirst().orElseThrow()
            .finalUrl()).isEqualTo("https://example.com/landing");
    }

    @Test
    void redirectedPageLinkingToItsOwnTargetIsFetchedOnce() throws Exception {
        web.page("https://example.com/", new PageFetchResult(
            "https://example.com/",
            "https://example.com/landing",
            FetchStatus.OK,
            200,
            "<a href=\"/landing\">landing</a>",
            "text/html",
            Map.of(),
            List.of(new Redirect("https://example.com/", "https://example.com/landing", 301)),
            Instant.now(),
            Duration.ofMillis(3),
            null
        ));
        web.html("https://example.com/landing", "<p>landing</p>");

        CrawlRunStatusResponse status = runToEnd(config("https://example.com/", 2));

        assertThat(status.state()).isEqualTo(RunState.COMPLETED);
        assertThat(web.pagesFetched()).containsExactly("https://example.com/");
        assertThat(status.linksDiscovered()).isZero();
        assertThat(status.visited()).isEqualTo(2);
    }

    @Test
    void lastTaskInFlightWithNothingPendingIsDraining() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch releaseFetch = new CountDownLatch(1);
        web.html("https://example.com/", "<p>only page</p>");
        web.blockOn("https://example.com/", fetchStarted, releaseFetch);

        String runId = coordinator.startRun(config("https://example.com/", 0));
        assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
        CrawlRunStatusResponse draining = coordinator.status(runId);
        releaseFetch.countDown();
        CrawlRunStatusResponse status = coordinator.awaitCompletion(runId, WAIT);

        assertThat(draining.state()).isEqualTo(RunState.DRAINING);
        assertThat(draining.pending()).isZero();
        assertThat(draining.inFlight()).isEqualTo(1);
        assertThat(status.state()).isEqualTo(RunState.COMPLETED);
    }

    @Test
    void keepsContentOnlyWhenAsked() throws Exception {
        web.html("https://example.com/", "<p>hello</p>");

        runToEnd(config("https://example.com/", 0));
        runToEnd(new RunConfig("https://example.com/", false, 10, 0, false, true, AGENT, null, null));

        assertThat(sink.results.get(0).content()).isNull();
        assertThat(sink.results.get(1).content()).contains("hello");
    }

    @Test
    void cancellationSuppressesInFlightResultsAndLinks() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch releaseFetch = new CountDownLatch(1);
        web.html("https://example.com/", "<a href=\"/next\">next</a>");
        web.html("https://example.com/next", "<p>next</p>");
        web.blockOn("https://example.com/", fetchStarted, releaseFetch);

        String runId = coordinator.startRun(config("https://example.com/", 3));
        assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
        CrawlRunStatusResponse cancelling = coordinator.cancelRun(runId);
        releaseFetch.countDown();
        CrawlRunStatusResponse status = coordinator.awaitCompletion(runId, WAIT);

        assertThat(cancelling.state()).isNotEqualTo(RunState.COMPLETED);
        assertThat(status.state()).isEqualTo(RunState.CANCELLED);
        assertThat(sink.results).isEmpty();
        assertThat(web.pagesFetched()).containsExactly("https://example.com/");
        assertThat(sink.events).extracting(RunFinishedEvent::state).containsExactly(RunState.CANCELLED);
    }

    @Test
    void finishedRunsStayQueryableAndNotifyTheSink() throws Exception {
        web.html("https://example.com/", "<p>done</p>");

        CrawlRunStatusResponse status = runToEnd(config("https://example.com/", 1));

        assertThat(coordinator.status(status.runId()).state()).isEqualTo(RunState.COMPLETED);
        assertThat(coordinator.runs()).extracting(CrawlRunStatusResponse::runId).contains(status.runId());
        assertThat(coordinator.cancelRun(status.runId()).state()).isEqualTo(RunState.COMPLETED);
        assertThat(sink.events).hasSize(1);
        assertThat(sink.events.get(0).event()).isEqualTo("run_finished");
        assertThat(sink.events.get(0).pagesEmitted()).isEqualTo(1L);
    }

    @Test
    void rejectsInvalidConfigBeforeCreatingAnyState() {
        assertThatThrownBy(() -> coordinator.startRun(config("ftp://example.com/", 1)))
            .isInstanceOf(InvalidRunConfigException.class);
        assertThatThrownBy(() -> coordinator.startRun(config("https://example.com/", -1)))
            .isInstanceOf(InvalidRunConfigException.class);
        assertThatThrownBy(() -> coordinator.startRun(
            new RunConfig("https://example.com/", false, 10, 1, false, false, AGENT, "not-a-callback", null)))
            .isInstanceOf(InvalidRunConfigException.class);
        assertThat(coordinator.runs()).isEmpty();
        assertThat(web.fetched).isEmpty();
    }

    @Test
    void unknownRunIsNotFound() {
        assertThatThrownBy(() -> coordinator.status("missing")).isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> coordinator.cancelRun("missing")).isInstanceOf(RunNotFoundException.class);
    }

    private CrawlRunStatusResponse runToEnd(RunConfig config) throws InterruptedException {
        String runId = coordinator.startRun(config);
        CrawlRunStatusResponse status = coordinator.awaitCompletion(runId, WAIT);
        assertThat(status.state().isTerminal()).as("run %s finished", runId).isTrue();
        return status;
    }

    private static RunConfig config(String url, int maximumDepth) {
        return new RunConfig(url, false, 10, maximumDepth, false, false, AGENT, null, null);
    }

    private static PageFetchResult failure(String url, FetchStatus status) {
        return new PageFetchResult(url, url, status, null, null, null, Map.of(), List.of(),
            Instant.now(), Duration.ofMillis(1), status.name().toLowerCase());
    }

    static final class FakeWeb implements PageFetcher {
        final Map<String, PageFetchResult> pages = new ConcurrentHashMap<>();
        final List<String> fetched = new CopyOnWriteArrayList<>();
        final Map<String, List<Integer>> redirectLimits = new ConcurrentHashMap<>();
        private final Map<String, CountDownLatch[]> blocking = new ConcurrentHashMap<>();

        void html(String url, String body) {
            pages.put(url, ok(url, body, "text/html; charset=utf-8"));
        }

        void text(String url, String body) {
            pages.put(url, ok(url, body, "text/plain"));
        }

        void page(String url, PageFetchResult result) {
            pages.put(url, result);
        }

        void blockOn(String url, CountDownLatch started, CountDownLatch release) {
            blocking.put(url, new CountDownLatch[] {started, release});
        }

        List<String> pagesFetched() {
            return fetched.stream().filter(url -> !url.endsWith("/robots.txt")).toList();
        }

        @Override
        public PageFetchResult fetch(String url, String userAgent, int maxRedirects, int maxBodyBytes) {
            fetched.add(url);
            redirectLimits.computeIfAbsent(url, ignored -> new CopyOnWriteArrayList<>()).add(maxRedirects);
            CountDownLatch[] latches = blocking.get(url);
            if (latches != null) {
                latches[0].countDown();
                try {
                    latches[1].await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            PageFetchResult page = pages.get(url);
            if (page != null) {
                return page;
            }
            return new PageFetchResult(url, url, FetchStatus.HTTP_ERROR, 404, "", "text/plain", Map.of(),
                List.of(), Instant.now(), Duration.ofMillis(1), "HTTP 404");
        }

        private static PageFetchResult ok(String url, String body, String contentType) {
            return new PageFetchResult(url, url, FetchStatus.OK, 200, body, contentType, Map.of(), List.of(),
                Instant.now(), Duration.ofMillis(2), null);
        }
    }

    static final class CapturingSink implements ResultSink {
        final List<PageResult> results = new CopyOnWriteArrayList<>();
        final List<RunFinishedEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public DeliveryStatus deliver(RunConfig config, PageResult result) {
            results.add(result);
            return DeliveryStatus.SKIPPED;
        }

        @Override
        public DeliveryStatus runFinished(RunConfig config, RunFinishedEvent event) {
            events.add(event);
            return DeliveryStatus.SKIPPED;
        }
    }
}
