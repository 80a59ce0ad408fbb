package com.codeflag.feeder.piston;

import com.codeflag.feeder.config.FeederProperties;
import com.codeflag.feeder.piston.dto.PistonExecuteRequest;
import com.codeflag.feeder.piston.dto.PistonExecuteResponse;
import com.codeflag.feeder.piston.dto.PistonRuntime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * HTTP client for the Piston execution engine.
 *
 * Two endpoints: GET /runtimes at startup, POST /execute per task. Calls
 * block the listener thread that owns the task; the number of such threads
 * is the feeder's concurrency bound.
 *
 * Every failure surfaces as a {@link PistonException} whose kind separates
 * timeouts, connection errors, rate limiting, other HTTP statuses and
 * unparseable bodies.
 */
@Component
public class PistonClient {

    private static final Logger log = LoggerFactory.getLogger(PistonClient.class);

    private static final int      TOO_MANY_REQUESTS = 429;
    private static final Duration RUNTIMES_TIMEOUT  = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public PistonClient(FeederProperties props, ObjectMapper objectMapper) {
        this.baseUrl = stripTrailingSlash(props.pistonUrl());
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** @return every runtime the engine has installed */
    public List<PistonRuntime> runtimes() {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/runtimes"))
                .timeout(RUNTIMES_TIMEOUT)
                .header("Accept", "application/json")
                .GET()
                .build();
        String body = send(req, "runtimes");
        try {
            return json.readValue(body, new TypeReference<List<PistonRuntime>>() {});
        } catch (JsonProcessingException e) {
            throw new PistonException(PistonException.Kind.RESPONSE, "Failed to parse runtimes response", e);
        }
    }

    /**
     * Run one program.
     *
     * @param timeout wall-clock limit for the whole HTTP exchange
     */
    public PistonExecuteResponse execute(PistonExecuteRequest request, Duration timeout) {
        String body;
        try {
            body = json.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/execute"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        String respBody = send(req, "execute " + request.language() + "-" + request.version());
        try {
            PistonExecuteResponse response = json.readValue(respBody, PistonExecuteResponse.class);
            if (response == null) {
                throw new PistonException(PistonException.Kind.RESPONSE, "Empty execute response");
            }
            return response;
        } catch (JsonProcessingException e) {
            throw new PistonException(PistonException.Kind.RESPONSE,
                    "Failed to parse execute response: " + e.getOriginalMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String send(HttpRequest req, String opName) {
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new PistonException(PistonException.Kind.TIMEOUT,
                    opName + " timed out after " + req.timeout().map(Duration::toMillis).orElse(0L) + " ms", e);
        } catch (IOException e) {
            throw new PistonException(PistonException.Kind.CONNECTION,
                    opName + " failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PistonException(PistonException.Kind.CONNECTION, opName + " interrupted", e);
        }

        int status = resp.statusCode();
        if (status == TOO_MANY_REQUESTS) {
            log.warn("{} rate limited by execution engine", opName);
            throw new PistonException(PistonException.Kind.RATE_LIMITED, status,
                    opName + " rate limited (HTTP 429)", null);
        }
        if (status < 200 || status >= 300) {
            throw new PistonException(PistonException.Kind.HTTP_STATUS, status,
                    opName + " failed: HTTP " + status + ": " + resp.body(), null);
        }
        return resp.body();
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
