package com.tarantula.crawl.frontier;

import com.tarantula.crawl.model.CrawlTask;
import com.tarantula.crawl.model.FrontierCounts;
import com.tarantula.crawl.model.OfferResult;
import com.tarantula.crawl.util.UrlNormalizer;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pending, in-flight and visited URLs of one run. Pending tasks are queued per host and handed out
 * round-robin across hosts, skipping hosts the gate reports as not ready. Every operation holds one
 * lock, so a URL is never both pending and in flight and never accepted twice.
 */
public class UrlFrontier {

    /**
     * Non-consuming readiness check for a host; zero means a fetch could start now.
     */
    @FunctionalInterface
    public interface HostGate {
        Duration readyIn(String host);
    }

    /**
     * A drawn task, or the shortest wait among hosts with pending work when none is ready.
     * Both fields are null when nothing is pending.
     */
    public record Take(CrawlTask task, Duration retryAfter) {
        static final Take EMPTY = new Take(null, null);

        public boolean hasTask() {
            return task != null;
        }
    }

    private final String runId;
    private final int maximumDepth;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> seen = new HashSet<>();
    private final Set<String> visited = new HashSet<>();
    private final Set<String> inFlight = new HashSet<>();
    private final Map<String, Deque<CrawlTask>> pendingByHost = new HashMap<>();
    private final Deque<String> hostOrder = new ArrayDeque<>();
    private int pending;
    private boolean closed;

    public UrlFrontier(String runId, int maximumDepth) {
        this.runId = runId;
        this.maximumDepth = maximumDepth;
    }

    public OfferResult offer(String url, int depth, String via) {
        lock.lock();
        try {
            if (closed) {
                return OfferResult.CLOSED;
            }
            URI uri = UrlNormalizer.safeUri(url);
            if (uri == null || !uri.isAbsolute()) {
                return OfferResult.MALFORMED;
            }
            if (!UrlNormalizer.isHttpScheme(uri)) {
                return OfferResult.SCHEME_UNSUPPORTED;
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                return OfferResult.MALFORMED;
            }
            String normalized = UrlNormalizer.normalize(uri);
            if (normalized == null) {
                return OfferResult.MALFORMED;
            }
            if (depth > maximumDepth) {
                return OfferResult.DEPTH_EXCEEDED;
            }
            if (!seen.add(normalized)) {
                return OfferResult.DUPLICATE;
            }
            String host = UrlNormalizer.hostKey(normalized);
            enqueue(new CrawlTask(runId, normalized, host, depth, via), false);
            return OfferResult.ACCEPTED;
        } finally {
            lock.unlock();
        }
    }

    public Take take(HostGate gate) {
        lock.lock();
        try {
            if (closed || pending == 0) {
                return Take.EMPTY;
            }
            Duration shortestWait = null;
            int hosts = hostOrder.size();
            for (int i = 0; i < hosts; i++) {
                String host = hostOrder.pollFirst();
                Deque<CrawlTask> queue = pendingByHost.get(host);
                if (queue == null || queue.isEmpty()) {
                    pendingByHost.remove(host);
                    continue;
                }
                Duration wait = gate.readyIn(host);
                if (wait == null || wait.isZero() || wait.isNegative()) {
                    CrawlTask task = queue.pollFirst();
                    pending--;
                    inFlight.add(task.url());
                    if (queue.isEmpty()) {
                        pendingByHost.remove(host);
                    } else {
                        hostOrder.addLast(host);
                    }
                    return new Take(task, null);
                }
                hostOrder.addLast(host);
                if (shortestWait == null || wait.compareTo(shortestWait) < 0) {
                    shortestWait = wait;
                }
            }
            return new Take(null, shortestWait);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a drawn task to the head of its host queue without consuming it.
     */
    public void requeue(CrawlTask task) {
        lock.lock();
        try {
            inFlight.remove(task.url());
            if (!closed) {
                enqueue(task, true);
            }
        } finally {
            lock.unlock();
        }
    }

    public FrontierCounts markDone(CrawlTask task) {
        lock.lock();
        try {
            inFlight.remove(task.url());
            visited.add(task.url());
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a URL reached through a redirect so later links to it count as duplicates. A pending
     * task for the same URL is dropped; one already in flight is left alone.
     */
    public void markVisited(String url) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null) {
            return;
        }
        lock.lock();
        try {
            seen.add(normalized);
            visited.add(normalized);
            Deque<CrawlTask> queue = pendingByHost.get(UrlNormalizer.hostKey(normalized));
            if (queue != null && queue.removeIf(task -> task.url().equals(normalized))) {
                pending--;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops all pending tasks and rejects further offers. In-flight tasks still finish normally.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            pendingByHost.clear();
            hostOrder.clear();
            pending = 0;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public FrontierCounts counts() {
        lock.lock();
        try {
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    private void enqueue(CrawlTask task, boolean atHead) {
        Deque<CrawlTask> queue = pendingByHost.get(task.host());
        if (queue == null) {
            queue = new ArrayDeque<>();
            pendingByHost.put(task.host(), queue);
            hostOrder.addLast(task.host());
        }
        if (atHead) {
            queue.addFirst(task);
        } else {
            queue.addLast(task);
        }
        pending++;
    }

    private FrontierCounts snapshot() {
        return new FrontierCounts(pending, inFlight.size(), visited.size());
    }
}
