package com.tarantula.crawl.service;

import com.tarantula.config.CrawlerProperties;
import com.tarantula.crawl.model.CrawlRunStatusResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Active runs plus a bounded history of final status snapshots for runs that have finished.
 */
@Component
public class CrawlRunRegistry {
    private final List<CrawlRun> active = new CopyOnWriteArrayList<>();
    private final Map<String, CrawlRunStatusResponse> history;

    public CrawlRunRegistry(CrawlerProperties properties) {
        int historySize = properties.getRuns().getHistorySize();
        this.history = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CrawlRunStatusResponse> eldest) {
                return size() > historySize;
            }
        };
    }

    public void register(CrawlRun run) {
        active.add(run);
    }

    public List<CrawlRun> activeRuns() {
        return List.copyOf(active);
    }

    public Optional<CrawlRun> active(String runId) {
        return active.stream().filter(run -> run.runId().equals(runId)).findFirst();
    }

    public void finish(CrawlRun run, CrawlRunStatusResponse finalStatus) {
        synchronized (history) {
            history.put(run.runId(), finalStatus);
        }
        active.remove(run);
    }

    public Optional<CrawlRunStatusResponse> find(String runId) {
        Optional<CrawlRun> running = active(runId);
        if (running.isPresent()) {
            return Optional.of(running.get().toStatus());
        }
        synchronized (history) {
            return Optional.ofNullable(history.get(runId));
        }
    }

    public List<CrawlRunStatusResponse> all() {
        Map<String, CrawlRunStatusResponse> byId = new LinkedHashMap<>();
        active.forEach(run -> byId.put(run.runId(), run.toStatus()));
        synchronized (history) {
            // a finishing run can briefly sit in both; the final snapshot wins
            byId.putAll(history);
        }
        List<CrawlRunStatusResponse> statuses = new ArrayList<>(byId.values());
        statuses.sort(Comparator.comparing(CrawlRunStatusResponse::startedAt).reversed());
        return statuses;
    }
}
