package com.tarantula.crawl.service;

import com.tarantula.config.CrawlerProperties;
import com.tarantula.crawl.frontier.UrlFrontier;
import com.tarantula.crawl.http.Acquisition;
import com.tarantula.crawl.http.HostPermit;
import com.tarantula.crawl.http.HostRateLimiter;
import com.tarantula.crawl.http.PageFetcher;
import com.tarantula.crawl.links.LinkExtractor;
import com.tarantula.crawl.model.CrawlRunStatusResponse;
import com.tarantula.crawl.model.CrawlTask;
import com.tarantula.crawl.model.DeliveryStatus;
import com.tarantula.crawl.model.FrontierCounts;
import com.tarantula.crawl.model.Link;
import com.tarantula.crawl.model.OfferResult;
import com.tarantula.crawl.model.PageFetchResult;
import com.tarantula.crawl.model.PageResult;
import com.tarantula.crawl.model.Redirect;
import com.tarantula.crawl.model.RunConfig;
import com.tarantula.crawl.model.RunFinishedEvent;
import com.tarantula.crawl.model.RunState;
import com.tarantula.crawl.robots.RobotsTxtService;
import com.tarantula.crawl.sink.ResultSink;
import com.tarantula.crawl.util.UrlNormalizer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every active run and the shared worker pool that drains their frontiers.
 *
 * <p>Workers pick runs round-robin, draw a host-ready task, check robots, take a host permit,
 * fetch, offer discovered links and emit the result. A worker with nothing ready waits on the
 * dispatch condition for the shortest host wait hint. A run completes once its frontier reports
 * no pending and no in-flight task in the same snapshot.
 */
@Service
public class CrawlCoordinator {
    private static final Logger log = LoggerFactory.getLogger(CrawlCoordinator.class);

    private final CrawlerProperties properties;
    private final RobotsTxtService robotsTxtService;
    private final HostRateLimiter rateLimiter;
    private final PageFetcher pageFetcher;
    private final LinkExtractor linkExtractor;
    private final ResultSink resultSink;
    private final CrawlRunRegistry registry;
    private final ExecutorService crawlExecutor;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger runCursor = new AtomicInteger();
    private final Object lifecycleLock = new Object();
    private final ReentrantLock dispatchLock = new ReentrantLock();
    private final Condition workAvailable = dispatchLock.newCondition();
    private long workGeneration;

    public CrawlCoordinator(
        CrawlerProperties properties,
        RobotsTxtService robotsTxtService,
        HostRateLimiter rateLimiter,
        PageFetcher pageFetcher,
        LinkExtractor linkExtractor,
        ResultSink resultSink,
        CrawlRunRegistry registry,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.robotsTxtService = robotsTxtService;
        this.rateLimiter = rateLimiter;
        this.pageFetcher = pageFetcher;
        this.linkExtractor = linkExtractor;
        this.resultSink = resultSink;
        this.registry = registry;
        this.crawlExecutor = crawlExecutor;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            running.set(true);
            int workerCount = properties.getWorkerCount();
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                crawlExecutor.submit(() -> workerLoop(workerIndex));
            }
            log.info("Crawl coordinator started with {} workers", workerCount);
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.getAndSet(false)) {
                return;
            }
            signalWork();
        }
    }

    public String startRun(RunConfig config) {
        validate(config);
        String runId = UUID.randomUUID().toString();
        CrawlRun run = new CrawlRun(runId, config, new UrlFrontier(runId, config.maximumDepth()), clock.instant());
        OfferResult seeded = run.frontier().offer(config.url(), 0, null);
        if (!seeded.isAccepted()) {
            throw new InvalidRunConfigException("seed url rejected: " + seeded);
        }
        run.transition(RunState.STARTING, RunState.RUNNING);
        registry.register(run);
        log.info(
            "Crawl run {} started url={} maximumDepth={} maximumRedirects={} ignoreRobotsTxt={} callback={}",
            runId,
            config.url(),
            config.maximumDepth(),
            config.effectiveMaximumRedirects(),
            config.ignoreRobotsTxt(),
            config.hasCallback()
        );
        signalWork();
        return runId;
    }

    public CrawlRunStatusResponse cancelRun(String runId) {
        Optional<CrawlRun> active = registry.active(runId);
        if (active.isEmpty()) {
            return status(runId);
        }
        CrawlRun run = active.get();
        if (run.requestCancel()) {
            run.frontier().close();
            log.info("Crawl run {} cancel requested inFlight={}", runId, run.frontier().counts().inFlight());
        }
        updateRunState(run);
        return registry.find(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public CrawlRunStatusResponse status(String runId) {
        return registry.find(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public List<CrawlRunStatusResponse> runs() {
        return registry.all();
    }

    /**
     * Blocks until the run reaches a terminal state or the timeout passes, then returns its status.
     */
    public CrawlRunStatusResponse awaitCompletion(String runId, Duration timeout) throws InterruptedException {
        Optional<CrawlRun> active = registry.active(runId);
        if (active.isPresent()) {
            active.get().awaitFinished(timeout);
        }
        return status(runId);
    }

    void validate(RunConfig config) {
        if (config == null) {
            throw new InvalidRunConfigException("run config is required");
        }
        if (UrlNormalizer.normalize(config.url()) == null) {
            throw new InvalidRunConfigException("url must be an absolute http or https URL: " + config.url());
        }
        if (config.maximumDepth() < 0) {
            throw new InvalidRunConfigException("maximum_depth must not be negative");
        }
        if (config.maximumRedirects() < 0) {
            throw new InvalidRunConfigException("maximum_redirects must not be negative");
        }
        if (config.crawlDelay() != null && config.crawlDelay().isNegative()) {
            throw new InvalidRunConfigException("crawl_delay_ms must not be negative");
        }
        if (config.hasCallback()) {
            URI callback = UrlNormalizer.safeUri(config.callbackUrl());
            if (callback == null || callback.getHost() == null || !UrlNormalizer.isHttpScheme(callback)) {
                throw new InvalidRunConfigException("callback_url must be an http or https URL: " + config.callbackUrl());
            }
        }
    }

    private void workerLoop(int workerIndex) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            long generation = currentGeneration();
            try {
                Duration wait = dispatchOnce();
                if (wait != null) {
                    awaitWork(generation, wait);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Crawl worker {} dispatch failed", workerIndex, e);
            }
        }
    }

    /**
     * Processes at most one task. Returns null when a task was processed, otherwise how long to wait.
     */
    Duration dispatchOnce() {
        Duration idle = Duration.ofMillis(properties.getIdlePollMs());
        List<CrawlRun> runs = registry.activeRuns();
        if (runs.isEmpty()) {
            return idle;
        }
        Duration shortest = idle;
        int start = Math.floorMod(runCursor.getAndIncrement(), runs.size());
        for (int i = 0; i < runs.size(); i++) {
            CrawlRun run = runs.get((start + i) % runs.size());
            if (!run.isAccepting()) {
                continue;
            }
            Duration runGap = run.config().crawlDelayOrZero();
            UrlFrontier.Take take = run.frontier().take(host -> rateLimiter.readyIn(host, runGap));
            if (take.hasTask()) {
                updateRunState(run);
                processSafely(run, take.task());
                return null;
            }
            if (take.retryAfter() != null && take.retryAfter().compareTo(shortest) < 0) {
                shortest = take.retryAfter();
            }
        }
        return shortest;
    }

    private void processSafely(CrawlRun run, CrawlTask task) {
        try {
            process(run, task);
        } catch (RuntimeException e) {
            log.error("Crawl run {} task failed url={}", run.runId(), task.url(), e);
        }
    }

    void process(CrawlRun run, CrawlTask task) {
        boolean requeued = false;
        try {
            if (!run.isAccepting()) {
                return;
            }
            RunConfig config = run.config();
            if (!config.ignoreRobotsTxt()) {
                if (!robotsTxtService.isAllowed(task.url(), config.userAgent())) {
                    run.robotsExcluded.incrementAndGet();
                    log.debug("robots excluded runId={} url={}", run.runId(), task.url());
                    return;
                }
                robotsTxtService.crawlDelay(task.url(), config.userAgent())
                    .ifPresent(delay -> rateLimiter.updateCrawlDelay(task.host(), delay));
            }

            Acquisition acquisition = rateLimiter.tryAcquire(task.host(), config.crawlDelayOrZero());
            if (!acquisition.isGranted()) {
                run.frontier().requeue(task);
                requeued = true;
                return;
            }
            try (HostPermit ignored = acquisition.permit()) {
                fetchAndEmit(run, task);
            }
        } finally {
            if (!requeued) {
                FrontierCounts counts = run.frontier().markDone(task);
                log.trace("task done runId={} url={} pending={} inFlight={}",
                    run.runId(), task.url(), counts.pending(), counts.inFlight());
            }
            updateRunState(run);
            signalWork();
        }
    }

    private void fetchAndEmit(CrawlRun run, CrawlTask task) {
        RunConfig config = run.config();
        PageFetchResult fetch = pageFetcher.fetch(
            task.url(),
            config.userAgent(),
            config.effectiveMaximumRedirects(),
            properties.getMaxBodyBytes()
        );

        for (Redirect redirect : fetch.redirects()) {
            run.frontier().markVisited(redirect.destination());
        }

        List<Link> links = List.of();
        if (fetch.isSuccessful() && fetch.isHtml() && !run.isCancelRequested()) {
            links = linkExtractor.extract(fetch.finalUrlOrRequested(), fetch.body());
            for (Link link : links) {
                if (run.frontier().offer(link.url(), task.depth() + 1, task.url()).isAccepted()) {
                    run.linksDiscovered.incrementAndGet();
                }
            }
        }
        if (run.isCancelRequested()) {
            return;
        }
        PageResult result = PageResult.from(task, fetch, links, config.keepHtmlInMemory());
        run.pagesEmitted.incrementAndGet();
        if (fetch.status().isFailure()) {
            run.failures.incrementAndGet();
            log.debug("fetch failed runId={} url={} status={} httpStatus={} error={}",
                run.runId(), task.url(), fetch.status(), fetch.httpStatus(), fetch.errorMessage());
        }
        if (resultSink.deliver(config, result) == DeliveryStatus.DROPPED) {
            run.resultsDropped.incrementAndGet();
        }
    }

    /**
     * Moves the run along RUNNING, DRAINING and its terminal state from one frontier snapshot.
     * Decisions for a run are serialized, so the last call after the last frontier change wins.
     */
    void updateRunState(CrawlRun run) {
        boolean finished = false;
        synchronized (run.stateLock()) {
            if (run.state().isTerminal()) {
                return;
            }
            FrontierCounts counts = run.frontier().counts();
            if (run.isCancelRequested()) {
                finished = counts.inFlight() == 0 && run.finish(RunState.CANCELLED, clock.instant());
            } else if (counts.pending() == 0) {
                run.transition(RunState.RUNNING, RunState.DRAINING);
                finished = counts.isDrained() && run.finish(RunState.COMPLETED, clock.instant());
            } else {
                run.transition(RunState.DRAINING, RunState.RUNNING);
            }
        }
        if (finished) {
            finalizeRun(run);
        }
    }

    private void finalizeRun(CrawlRun run) {
        run.frontier().close();
        CrawlRunStatusResponse status = run.toStatus();
        registry.finish(run, status);
        log.info(
            "Crawl run {} finished state={} visited={} pages={} failures={} robotsExcluded={} linksDiscovered={} dropped={}",
            run.runId(),
            status.state(),
            status.visited(),
            status.pagesEmitted(),
            status.failures(),
            status.robotsExcluded(),
            status.linksDiscovered(),
            status.resultsDropped()
        );
        DeliveryStatus delivery = resultSink.runFinished(run.config(), RunFinishedEvent.of(status));
        if (delivery == DeliveryStatus.DROPPED) {
            log.warn("run_finished event dropped runId={}", run.runId());
        }
        run.markFinished();
    }

    private long currentGeneration() {
        dispatchLock.lock();
        try {
            return workGeneration;
        } finally {
            dispatchLock.unlock();
        }
    }

    private void awaitWork(long seenGeneration, Duration wait) throws InterruptedException {
        long waitMs = Math.max(1L, Math.min(wait.toMillis(), properties.getIdlePollMs()));
        dispatchLock.lock();
        try {
            if (workGeneration == seenGeneration && running.get()) {
                workAvailable.await(waitMs, TimeUnit.MILLISECONDS);
            }
        } finally {
            dispatchLock.unlock();
        }
    }

    private void signalWork() {
        dispatchLock.lock();
        try {
            workGeneration++;
            workAvailable.signalAll();
        } finally {
            dispatchLock.unlock();
        }
    }
}
