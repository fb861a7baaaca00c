package com.standings.harvester.harvest.http;

import com.standings.harvester.config.HarvesterProperties;
import com.standings.harvester.harvest.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/**
 * Single-shot GET against the standings endpoint. Remote failures come back as an
 * {@link HttpFetchResult} with an error code instead of an exception; retrying is the caller's
 * job.
 */
@Service
public class StandingsHttpClient {

    private final HarvesterProperties properties;
    private final HttpClient client;

    public StandingsHttpClient(
        HarvesterProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult fetchPage(int pageNumber) {
        return get(properties.getSource().pageUrl(pageNumber));
    }

    public HttpFetchResult get(String url) {
        Instant startedAt = Instant.now();
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
        if (uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host");
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", "application/json")
            .GET()
            .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new HttpFetchResult(
                url,
                response.statusCode(),
                response.body(),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", describe(e));
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", describe(e));
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    // Connection failures often carry no message of their own; keep the exception types for classification.
    private static String describe(Throwable error) {
        StringBuilder text = new StringBuilder(error.getClass().getSimpleName());
        if (error.getMessage() != null) {
            text.append(": ").append(error.getMessage());
        }
        Throwable cause = error.getCause();
        if (cause != null && cause != error) {
            text.append(" (").append(cause.getClass().getSimpleName());
            if (cause.getMessage() != null) {
                text.append(": ").append(cause.getMessage());
            }
            text.append(')');
        }
        return text.toString();
    }
}
