package com.tarantula.crawl.http;

import com.tarantula.config.CrawlerProperties;
import com.tarantula.crawl.model.FetchStatus;
import com.tarantula.crawl.model.PageFetchResult;
import com.tarantula.crawl.model.Redirect;
import com.tarantula.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class HttpPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final Set<Integer> REDIRECT_CODES = Set.of(301, 302, 303, 307, 308);
    private static final String ACCEPT = "text/html,application/xhtml+xml,text/plain;q=0.9,*/*;q=0.5";

    private final CrawlerProperties properties;
    private final HttpClient client;

    public HttpPageFetcher(CrawlerProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public PageFetchResult fetch(String url, String userAgent, int maxRedirects, int maxBodyBytes) {
        Instant startedAt = Instant.now();
        Instant deadline = startedAt.plusSeconds(properties.getRequestTimeoutSeconds());
        List<Redirect> redirects = new ArrayList<>();
        String current = url;
        String safeUserAgent = CrawlerProperties.normalizeUserAgent(userAgent);
        try {
            while (true) {
                URI uri = UrlNormalizer.safeUri(current);
                if (uri == null || uri.getHost() == null || !UrlNormalizer.isHttpScheme(uri)) {
                    return errorResult(url, current, FetchStatus.CONNECTION, null, redirects, startedAt,
                        "URL missing host or malformed");
                }
                Duration remaining = Duration.between(Instant.now(), deadline);
                if (remaining.isZero() || remaining.isNegative()) {
                    return errorResult(url, current, FetchStatus.TIMEOUT, null, redirects, startedAt,
                        "request timed out");
                }
                HttpRequest request = HttpRequest.newBuilder(uri)
                    .timeout(remaining)
                    .header("User-Agent", safeUserAgent)
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();
                HttpResponse<byte[]> response = exchange(request, maxBodyBytes, deadline);
                int code = response.statusCode();
                Optional<String> location = response.headers().firstValue("Location");

                if (isRedirect(code, location)) {
                    String target = UrlNormalizer.resolve(current, location.get());
                    if (target == null) {
                        return errorResult(url, current, FetchStatus.HTTP_ERROR, code, redirects, startedAt,
                            "unusable redirect location " + location.get());
                    }
                    if (redirects.size() >= maxRedirects) {
                        log.debug("redirect limit reached url={} hops={} next={}", url, redirects.size(), target);
                        return errorResult(url, current, FetchStatus.REDIRECT_LIMIT, code, redirects, startedAt,
                            "redirect limit " + maxRedirects + " exceeded");
                    }
                    redirects.add(new Redirect(current, target, code));
                    current = target;
                    continue;
                }

                byte[] bytes = response.body();
                if (bytes == null) {
                    return errorResult(url, current, FetchStatus.BODY_TOO_LARGE, code, redirects, startedAt,
                        "body larger than " + maxBodyBytes + " bytes");
                }
                String contentType = response.headers().firstValue("Content-Type").orElse(null);
                String body = new String(bytes, charsetOf(contentType));
                boolean success = code >= 200 && code < 300;
                return new PageFetchResult(
                    url,
                    current,
                    success ? FetchStatus.OK : FetchStatus.HTTP_ERROR,
                    code,
                    body,
                    contentType,
                    Map.copyOf(response.headers().map()),
                    List.copyOf(redirects),
                    Instant.now(),
                    Duration.between(startedAt, Instant.now()),
                    success ? null : "HTTP " + code
                );
            }
        } catch (HttpTimeoutException | TimeoutException e) {
            return errorResult(url, current, FetchStatus.TIMEOUT, null, redirects, startedAt,
                e.getMessage() == null ? "request timed out" : e.getMessage());
        } catch (IOException e) {
            return errorResult(url, current, FetchStatus.CONNECTION, null, redirects, startedAt, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, current, FetchStatus.CONNECTION, null, redirects, startedAt, "interrupted");
        } catch (IllegalArgumentException e) {
            return errorResult(url, current, FetchStatus.CONNECTION, null, redirects, startedAt, e.getMessage());
        }
    }

    /**
     * Sends one request and reads its body, all within the fetch deadline. A slow body is cut off the
     * same way as slow headers. The body is null when it exceeds maxBodyBytes.
     */
    private HttpResponse<byte[]> exchange(HttpRequest request, int maxBodyBytes, Instant deadline)
        throws IOException, InterruptedException, TimeoutException {
        HttpResponse.BodyHandler<byte[]> handler = info -> {
            if (isRedirect(info.statusCode(), info.headers().firstValue("Location"))) {
                return HttpResponse.BodySubscribers.replacing(new byte[0]);
            }
            long declaredLength = info.headers().firstValueAsLong("Content-Length").orElse(-1L);
            return new BoundedBodySubscriber(maxBodyBytes, declaredLength);
        };
        CompletableFuture<HttpResponse<byte[]>> pending = client.sendAsync(request, handler);
        long remainingMs = Math.max(1L, Duration.between(Instant.now(), deadline).toMillis());
        try {
            return pending.get(remainingMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new TimeoutException("request timed out after " + properties.getRequestTimeoutSeconds() + "s");
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof IllegalArgumentException iae) {
                throw iae;
            }
            throw new IOException(cause == null ? "request failed" : cause.getMessage(), cause);
        }
    }

    private static boolean isRedirect(int code, Optional<String> location) {
        return REDIRECT_CODES.contains(code) && location.isPresent();
    }

    /**
     * Collects the body into memory and cancels the stream once it passes maxBytes, completing with null.
     */
    static final class BoundedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {
        private final int maxBytes;
        private final long declaredLength;
        private final CompletableFuture<byte[]> result = new CompletableFuture<>();
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private Flow.Subscription subscription;
        private long total;

        BoundedBodySubscriber(int maxBytes, long declaredLength) {
            this.maxBytes = maxBytes;
            this.declaredLength = declaredLength;
        }

        @Override
        public CompletionStage<byte[]> getBody() {
            return result;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            if (declaredLength > maxBytes) {
                subscription.cancel();
                result.complete(null);
                return;
            }
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> buffers) {
            if (result.isDone()) {
                return;
            }
            for (ByteBuffer buffer : buffers) {
                total += buffer.remaining();
                if (total > maxBytes) {
                    subscription.cancel();
                    result.complete(null);
                    return;
                }
                byte[] chunk = new byte[buffer.remaining()];
                buffer.get(chunk);
                out.write(chunk, 0, chunk.length);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            result.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            result.complete(out.toByteArray());
        }
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static PageFetchResult errorResult(
        String requestedUrl,
        String finalUrl,
        FetchStatus status,
        Integer httpStatus,
        List<Redirect> redirects,
        Instant startedAt,
        String message
    ) {
        return new PageFetchResult(
            requestedUrl,
            finalUrl,
            status,
            httpStatus,
            null,
            null,
            Map.of(),
            List.copyOf(redirects),
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            message
        );
    }
}
