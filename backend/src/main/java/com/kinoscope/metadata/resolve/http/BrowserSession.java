package com.kinoscope.metadata.resolve.http;

import com.kinoscope.metadata.config.ResolverProperties;
import com.kinoscope.metadata.resolve.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HTTP session that presents itself as a desktop browser: rotating user agents, browser header set,
 * a cookie jar kept for the lifetime of the session and a randomized pause before every request.
 * A 202 response with an empty body is the catalog's soft block and is retried exactly once.
 */
public class BrowserSession implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(BrowserSession.class);
    private static final String ACCEPT_HTML =
        "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8";

    private final ResolverProperties properties;
    private final HttpClient client;
    private final List<String> userAgents;

    public BrowserSession(ResolverProperties properties) {
        this.properties = properties;
        this.userAgents = properties.getUserAgents();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public HttpFetchResult get(String url) {
        HttpFetchResult first = executeOnce(url, 1);
        if (!isSoftBlock(first)) {
            return first;
        }
        log.debug("Soft block (202) from {}, retrying once after {} ms", url, properties.getSoftBlockRetryDelayMs());
        if (!sleep(properties.getSoftBlockRetryDelayMs())) {
            return errorResult(url, first.userAgent(), 1, first.fetchedAt(), "interrupted", "interrupted during soft block wait");
        }
        HttpFetchResult second = executeOnce(url, 2);
        if (isSoftBlock(second)) {
            log.warn("Still soft blocked after retry: {}", url);
            return errorResult(url, second.userAgent(), 2, Instant.now(), HttpFetchResult.SOFT_BLOCKED, "202 Accepted twice");
        }
        return second;
    }

    private HttpFetchResult executeOnce(String url, int attempt) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, null, attempt, startedAt, "invalid_url", "URL missing host or malformed");
        }
        String userAgent = nextUserAgent();
        if (!sleep(randomDelayMs())) {
            return errorResult(url, userAgent, attempt, startedAt, "interrupted", "interrupted before request");
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", userAgent)
            .header("Accept", ACCEPT_HTML)
            .header("Accept-Language", "en-US,en;q=0.9")
            .header("Referer", referer(uri))
            .header("Sec-Ch-Ua", "\"Chromium\";v=\"124\", \"Google Chrome\";v=\"124\", \"Not-A.Brand\";v=\"99\"")
            .header("Sec-Ch-Ua-Mobile", "?0")
            .header("Sec-Ch-Ua-Platform", "\"Windows\"")
            .header("Sec-Fetch-Dest", "document")
            .header("Sec-Fetch-Mode", "navigate")
            .header("Sec-Fetch-Site", "same-origin")
            .header("Sec-Fetch-User", "?1")
            .header("Upgrade-Insecure-Requests", "1")
            .header("Cache-Control", "max-age=0")
            .GET()
            .build();

        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] bytes = response.body();
            String body = bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                body,
                userAgent,
                attempt,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, userAgent, attempt, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, userAgent, attempt, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, userAgent, attempt, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, userAgent, attempt, startedAt, "http_error", e.getMessage());
        }
    }

    private boolean isSoftBlock(HttpFetchResult result) {
        return result.errorCode() == null
            && result.statusCode() == 202
            && (result.body() == null || result.body().isBlank());
    }

    private String nextUserAgent() {
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }

    private long randomDelayMs() {
        int min = properties.getMinRequestDelayMs();
        int max = properties.getMaxRequestDelayMs();
        if (max <= 0) {
            return 0;
        }
        if (max <= min) {
            return min;
        }
        return ThreadLocalRandom.current().nextLong(min, max + 1L);
    }

    private boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String referer(URI uri) {
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme();
        String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
        return scheme + "://" + uri.getHost() + port + "/";
    }

    private HttpFetchResult errorResult(String url, String userAgent, int attempt, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            userAgent,
            attempt,
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
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
