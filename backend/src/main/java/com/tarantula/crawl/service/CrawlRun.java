package com.tarantula.crawl.service;

import com.tarantula.crawl.frontier.UrlFrontier;
import com.tarantula.crawl.model.CrawlRunStatusResponse;
import com.tarantula.crawl.model.FrontierCounts;
import com.tarantula.crawl.model.RunConfig;
import com.tarantula.crawl.model.RunState;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Context of one active run: its configuration, frontier, state and counters.
 */
public class CrawlRun {
    private final String runId;
    private final RunConfig config;
    private final UrlFrontier frontier;
    private final Instant startedAt;
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.STARTING);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Object stateLock = new Object();
    private volatile Instant finishedAt;

    final AtomicLong pagesEmitted = new AtomicLong();
    final AtomicLong failures = new AtomicLong();
    final AtomicLong robotsExcluded = new AtomicLong();
    final AtomicLong linksDiscovered = new AtomicLong();
    final AtomicLong resultsDropped = new AtomicLong();

    public CrawlRun(String runId, RunConfig config, UrlFrontier frontier, Instant startedAt) {
        this.runId = runId;
        this.config = config;
        this.frontier = frontier;
        this.startedAt = startedAt;
    }

    public String runId() {
        return runId;
    }

    public RunConfig config() {
        return config;
    }

    public UrlFrontier frontier() {
        return frontier;
    }

    public RunState state() {
        return state.get();
    }

    /**
     * Whether workers may still draw and process tasks of this run.
     */
    public boolean isAccepting() {
        return !cancelRequested.get() && !state.get().isTerminal();
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    boolean requestCancel() {
        return !state.get().isTerminal() && cancelRequested.compareAndSet(false, true);
    }

    Object stateLock() {
        return stateLock;
    }

    boolean transition(RunState from, RunState to) {
        return state.compareAndSet(from, to);
    }

    /**
     * Moves to a terminal state once; later calls return false.
     */
    boolean finish(RunState terminal, Instant at) {
        while (true) {
            RunState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, terminal)) {
                finishedAt = at;
                return true;
            }
        }
    }

    void markFinished() {
        finished.countDown();
    }

    boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public CrawlRunStatusResponse toStatus() {
        FrontierCounts counts = frontier.counts();
        return new CrawlRunStatusResponse(
            runId,
            config.url(),
            state.get(),
            startedAt,
            finishedAt,
            counts.pending(),
            counts.inFlight(),
            counts.visited(),
            pagesEmitted.get(),
            failures.get(),
            robotsExcluded.get(),
            linksDiscovered.get(),
            resultsDropped.get()
        );
    }
}
