package com.codefarm.shorturl.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Posts log lines to the remote log service on a background executor. Network errors, timeouts
 * and non-2xx responses are logged locally and dropped.
 */
public class RemoteLogSink implements LogSink {

    private static final Logger log = LoggerFactory.getLogger(RemoteLogSink.class);

    private final RestClient restClient;
    private final String path;
    private final Executor executor;
    private volatile String authToken;

    public RemoteLogSink(RestClient restClient, String path, Executor executor, String authToken) {
        this.restClient = restClient;
        this.path = path;
        this.executor = executor;
        setAuthToken(authToken);
    }

    /**
     * Replaces the bearer token for subsequent calls; null or blank removes it.
     */
    public void setAuthToken(String token) {
        this.authToken = (token == null || token.isBlank()) ? null : token.trim();
    }

    @Override
    public CompletableFuture<Void> log(String stack, String level, String packageName, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("stack", lower(stack));
        body.put("level", lower(level));
        body.put("package", lower(packageName));
        body.put("message", message);
        try {
            return CompletableFuture.runAsync(() -> send(body), executor)
                    .exceptionally(ex -> {
                        log.warn("Log sink delivery failed: {}", ex.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException ex) {
            log.warn("Log sink queue full, dropping {} message", body.get("level"));
            return CompletableFuture.completedFuture(null);
        }
    }

    private void send(Map<String, String> body) {
        String token = authToken;
        restClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (token != null) {
                        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + token);
                    }
                })
                .body(body)
                .retrieve()
                .toBodilessEntity();
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
