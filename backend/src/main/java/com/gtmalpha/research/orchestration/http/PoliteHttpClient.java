package com.gtmalpha.research.orchestration.http;

import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

@Service
public class PoliteHttpClient {
    private static final Duration RATE_LIMIT_BACKOFF = Duration.ofSeconds(30);

    private final ResearchProperties.Http properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpClient(ResearchProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties.getHttp();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(Math.max(1, this.properties.getGlobalConcurrency()));
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return send(url, "GET", acceptHeader, null, Map.of());
    }

    public HttpFetchResult postJson(String url, String jsonBody, Map<String, String> extraHeaders) {
        return send(url, "POST", "application/json", jsonBody == null ? "" : jsonBody, extraHeaders);
    }

    private HttpFetchResult send(String url, String method, String acceptHeader, String body, Map<String, String> extraHeaders) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            enforcePerHostDelay(host);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", ResearchProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8");
            if (extraHeaders != null) {
                extraHeaders.forEach((name, value) -> {
                    if (name != null && value != null && !value.isBlank()) {
                        builder.header(name, value);
                    }
                });
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() == 429) {
                extendBackoff(host, RATE_LIMIT_BACKOFF);
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                flattenHeaders(response.headers().map()),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(Math.max(0, properties.getPerHostDelayMs())));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private Map<String, String> flattenHeaders(Map<String, List<String>> raw) {
        Map<String, String> out = new LinkedHashMap<>();
        raw.forEach((name, values) -> {
            if (name != null && values != null && !values.isEmpty()) {
                out.put(name, values.get(0));
            }
        });
        return out;
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Map.of(),
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
