package com.tarantula.crawl.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tarantula.config.CrawlerProperties;
import com.tarantula.crawl.model.CrawlRunStatusResponse;
import com.tarantula.crawl.model.DeliveryStatus;
import com.tarantula.crawl.model.FetchStatus;
import com.tarantula.crawl.model.Link;
import com.tarantula.crawl.model.PageResult;
import com.tarantula.crawl.model.Redirect;
import com.tarantula.crawl.model.RunConfig;
import com.tarantula.crawl.model.RunFinishedEvent;
import com.tarantula.crawl.model.RunState;
import com.tarantula.crawl.model.UriScope;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CallbackResultSinkTest {
    private static final String AGENT = "tarantula-test/1.0";

    private MockWebServer server;
    private ExecutorService executor;
    private CallbackResultSink sink;
    private CrawlerProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new CrawlerProperties();
        properties.setIdlePollMs(20);
        properties.getCallback().setDeliveryThreads(1);
        properties.getCallback().setMaxAttempts(3);
        properties.getCallback().setRetryBaseDelayMs(1);
        properties.getCallback().setRetryMaxDelayMs(5);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (sink != null) {
            sink.stop();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void postsSnakeCaseJsonWithRunUserAgent() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        sink = startedSink();

        DeliveryStatus status = sink.deliver(config(server.url("/hook").toString()), pageResult());

        assertThat(status).isEqualTo(DeliveryStatus.QUEUED);
        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("User-Agent")).isEqualTo(AGENT);
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("run_id").asText()).isEqualTo("run-1");
        assertThat(body.get("final_url").asText()).isEqualTo("https://example.com/landing");
        assertThat(body.get("status").asText()).isEqualTo("OK");
        assertThat(body.get("http_status").asInt()).isEqualTo(200);
        assertThat(body.get("fetch_duration_ms").asLong()).isEqualTo(42L);
        assertThat(body.get("redirects").get(0).get("status_code").asInt()).isEqualTo(301);
        assertThat(body.get("discovered_links").get(0).get("source_tag").asText()).isEqualTo("a");
        assertThat(body.get("timestamp").asText()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    void retriesServerErrors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200));
        sink = startedSink();

        sink.deliver(config(server.url("/hook").toString()), pageResult());

        assertThat(server.takeRequest(5, TimeUnit.SECONDS)).isNotNull();
        assertThat(server.takeRequest(5, TimeUnit.SECONDS)).isNotNull();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void doesNotRetryClientErrors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(400));
        server.enqueue(new MockResponse().setResponseCode(200));
        sink = startedSink();

        sink.deliver(config(server.url("/hook").toString()), pageResult());

        assertThat(server.takeRequest(5, TimeUnit.SECONDS)).isNotNull();
        assertThat(server.takeRequest(300, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void skipsRunsWithoutCallback() {
        sink = startedSink();

        assertThat(sink.deliver(config(null), pageResult())).isEqualTo(DeliveryStatus.SKIPPED);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void dropsWhenQueueIsFull() {
        properties.getCallback().setQueueCapacity(1);
        sink = new CallbackResultSink(properties, objectMapper, executor);
        RunConfig config = config(server.url("/hook").toString());

        assertThat(sink.deliver(config, pageResult())).isEqualTo(DeliveryStatus.QUEUED);
        assertThat(sink.deliver(config, pageResult())).isEqualTo(DeliveryStatus.DROPPED);
        assertThat(sink.queuedEvents()).isEqualTo(1);
    }

    @Test
    void postsRunFinishedEvent() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        sink = startedSink();
        CrawlRunStatusResponse status = new CrawlRunStatusResponse(
            "run-1", "https://example.com/", RunState.COMPLETED,
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:01:00Z"),
            0, 0, 3, 3, 1, 0, 2, 0
        );

        sink.runFinished(config(server.url("/hook").toString()), RunFinishedEvent.of(status));

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("event").asText()).isEqualTo("run_finished");
        assertThat(body.get("state").asText()).isEqualTo("COMPLETED");
        assertThat(body.get("pages_emitted").asLong()).isEqualTo(3L);
    }

    private CallbackResultSink startedSink() {
        CallbackResultSink started = new CallbackResultSink(properties, objectMapper, executor);
        started.start();
        return started;
    }

    private static RunConfig config(String callbackUrl) {
        return new RunConfig("https://example.com/", false, 10, 2, false, false, AGENT, callbackUrl, null);
    }

    private static PageResult pageResult() {
        return new PageResult(
            "run-1",
            "https://example.com/",
            "https://example.com/landing",
            FetchStatus.OK,
            200,
            0,
            null,
            List.of(new Redirect("https://example.com/", "https://example.com/landing", 301)),
            List.of(new Link("https://example.com/next", UriScope.SAME_DOMAIN, null, "a")),
            null,
            "text/html",
            null,
            42L,
            Instant.parse("2024-01-01T00:00:00Z")
        );
    }
}
