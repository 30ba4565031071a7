package com.tarantula.crawl.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tarantula.config.CrawlerProperties;
import com.tarantula.crawl.model.DeliveryStatus;
import com.tarantula.crawl.model.PageResult;
import com.tarantula.crawl.model.RunConfig;
import com.tarantula.crawl.model.RunFinishedEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Posts results as JSON to each run's callback URL. Events wait in a bounded queue drained by the
 * callback executor; a full queue drops the event instead of blocking the crawl worker.
 */
@Service
public class CallbackResultSink implements ResultSink {
    private static final Logger log = LoggerFactory.getLogger(CallbackResultSink.class);

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService callbackExecutor;
    private final HttpClient client;
    private final BlockingQueue<Delivery> queue;
    private volatile boolean running;

    public CallbackResultSink(
        CrawlerProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("callbackExecutor") ExecutorService callbackExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.callbackExecutor = callbackExecutor;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
        this.queue = new ArrayBlockingQueue<>(properties.getCallback().getQueueCapacity());
    }

    @PostConstruct
    public void start() {
        running = true;
        for (int i = 0; i < properties.getCallback().getDeliveryThreads(); i++) {
            callbackExecutor.submit(this::deliveryLoop);
        }
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (!queue.isEmpty()) {
            log.info("Callback sink stopping with {} undelivered events", queue.size());
        }
    }

    @Override
    public DeliveryStatus deliver(RunConfig config, PageResult result) {
        return enqueue(config, result, "page " + result.url());
    }

    @Override
    public DeliveryStatus runFinished(RunConfig config, RunFinishedEvent event) {
        return enqueue(config, event, "run_finished " + event.runId());
    }

    int queuedEvents() {
        return queue.size();
    }

    private DeliveryStatus enqueue(RunConfig config, Object payload, String description) {
        if (!config.hasCallback()) {
            log.debug("No callback configured, result logged only: {}", description);
            return DeliveryStatus.SKIPPED;
        }
        Delivery delivery = new Delivery(
            config.callbackUrl(),
            CrawlerProperties.normalizeUserAgent(config.userAgent()),
            payload,
            description
        );
        if (!queue.offer(delivery)) {
            log.warn("callback queue full callbackUrl={} capacity={} dropped={}",
                config.callbackUrl(), properties.getCallback().getQueueCapacity(), description);
            return DeliveryStatus.DROPPED;
        }
        return DeliveryStatus.QUEUED;
    }

    private void deliveryLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            Delivery delivery;
            try {
                delivery = queue.poll(properties.getIdlePollMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (delivery == null) {
                continue;
            }
            try {
                send(delivery);
            } catch (RuntimeException e) {
                log.error("Callback delivery failed unexpectedly for {}", delivery.description(), e);
            }
        }
    }

    boolean send(Delivery delivery) {
        String json;
        try {
            json = objectMapper.writeValueAsString(delivery.payload());
        } catch (JsonProcessingException e) {
            log.error("Could not serialize callback payload for {}", delivery.description(), e);
            return false;
        }
        int maxAttempts = properties.getCallback().getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int status = post(delivery, json);
            if (status >= 200 && status < 300) {
                return true;
            }
            if (!shouldRetry(status) || attempt >= maxAttempts) {
                log.warn("callback delivery failed callbackUrl={} status={} attempts={} event={}",
                    delivery.callbackUrl(), status, attempt, delivery.description());
                return false;
            }
            if (!sleepBackoff(attempt)) {
                return false;
            }
        }
        return false;
    }

    // -1 for transport errors
    private int post(Delivery delivery, String json) {
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(delivery.callbackUrl()))
                .timeout(Duration.ofSeconds(properties.getCallback().getRequestTimeoutSeconds()))
                .header("User-Agent", delivery.userAgent())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
            return client.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
        } catch (IOException e) {
            log.debug("callback post error callbackUrl={} error={}", delivery.callbackUrl(), e.toString());
            return -1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        } catch (IllegalArgumentException e) {
            log.warn("callback url rejected callbackUrl={} error={}", delivery.callbackUrl(), e.getMessage());
            return 0;
        }
    }

    private static boolean shouldRetry(int status) {
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        return status == -1 || status == 408 || status == 429 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getCallback().getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getCallback().getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep(delay / 2 + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    record Delivery(String callbackUrl, String userAgent, Object payload, String description) {
    }
}
