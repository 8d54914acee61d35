package com.gridbot.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.gridbot.application.exchange.AuthClockSkewException;
import com.gridbot.application.exchange.ExchangeException;
import com.gridbot.application.exchange.OrderRejectedException;
import com.gridbot.application.exchange.RateLimitedException;
import com.gridbot.application.exchange.TransientNetworkException;
import com.gridbot.application.metrics.TradingMetrics;
import com.gridbot.application.ports.Sleeper;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Minimal Bitkub REST client (v3) with retries, rate-limit waits and clock-offset correction.
 *
 * <p>Every call goes through the shared {@link RequestGate}; the permit is held for one HTTP attempt
 * only. Signed requests are re-stamped and re-signed on each attempt.
 *
 * <p>Failure mapping:
 * <ul>
 *   <li>IOException / HTTP 5xx: retried up to {@code maxAttempts}, then {@link TransientNetworkException}</li>
 *   <li>HTTP 429: waits {@code Retry-After} (or the default), up to {@code maxRateLimitWaits}, then
 *       {@link RateLimitedException}</li>
 *   <li>HTTP 401 or error 6/7/8: offset refresh and one retry, then {@link AuthClockSkewException}</li>
 *   <li>any other 4xx or non-zero {@code error}: {@link OrderRejectedException}</li>
 * </ul>
 */
public final class BitkubHttpClient {

    private static final Logger log = LoggerFactory.getLogger(BitkubHttpClient.class);

    public static final String EXCHANGE_ID = "bitkub";
    public static final String DEFAULT_BASE_URL = "https://api.bitkub.com";

    /** Invalid signature, missing timestamp, invalid timestamp. */
    static final Set<Integer> AUTH_ERROR_CODES = Set.of(6, 7, 8);

    private static final MediaType JSON = MediaType.parse("application/json");

    private final String baseUrl;
    private final String apiKey;
    private final String apiSecret;
    private final OkHttpClient http;
    private final RetryPolicy retry;
    private final RequestGate gate;
    private final Sleeper sleeper;
    private final TradingMetrics metrics;
    private final ClockOffset clockOffset;
    private final ObjectMapper om = JsonMapper.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();

    public BitkubHttpClient(String baseUrl,
                            String apiKey,
                            String apiSecret,
                            OkHttpClient http,
                            RetryPolicy retry,
                            RequestGate gate,
                            Sleeper sleeper,
                            TradingMetrics metrics,
                            Clock clock,
                            Duration timeSyncInterval) {
        this.baseUrl = stripTrailingSlash(firstNonBlank(baseUrl, DEFAULT_BASE_URL));
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiSecret = apiSecret == null ? "" : apiSecret;
        this.http = Objects.requireNonNull(http, "http");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clockOffset = new ClockOffset(this::serverTime, clock, timeSyncInterval);
    }

    public ClockOffset clockOffset() {
        return clockOffset;
    }

    /** GET /api/v3/servertime, epoch millis. */
    public long serverTime() throws ExchangeException {
        JsonNode root = execute("GET", "/api/v3/servertime", Map.of(), null, false);
        if (root.isNumber() || root.isTextual()) {
            return root.asLong();
        }
        throw new ExchangeException("Unexpected servertime payload: " + root);
    }

    public JsonNode publicGet(String path, Map<String, String> query) throws ExchangeException {
        return execute("GET", path, query, null, false);
    }

    public JsonNode signedGet(String path, Map<String, String> query) throws ExchangeException {
        return execute("GET", path, query, null, true);
    }

    /** Body is serialised compactly, in map iteration order. */
    public JsonNode signedPost(String path, Map<String, Object> body) throws ExchangeException {
        String json;
        try {
            json = om.writeValueAsString(body == null ? Map.of() : body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise request body for " + path, e);
        }
        return execute("POST", path, Map.of(), json, true);
    }

    private JsonNode execute(String method, String path, Map<String, String> query, String body, boolean signed)
            throws ExchangeException {
        if (signed && (apiKey.isBlank() || apiSecret.isBlank())) {
            throw new IllegalStateException("BITKUB_API_KEY/BITKUB_API_SECRET are not configured");
        }

        HttpUrl url = buildUrl(path, query);
        int failures = 0;
        int rateLimitWaits = 0;
        boolean authRetried = false;

        while (true) {
            Request request = buildRequest(method, url, body, signed);
            Reply reply;
            try {
                reply = gate.call(() -> send(request));
            } catch (IOException e) {
                failures++;
                if (failures >= retry.maxAttempts()) {
                    throw new TransientNetworkException(method + " " + path + " failed after " + failures + " attempts", e);
                }
                log.warn("[HTTP] {} {} attempt {} failed: {}", method, path, failures, e.toString());
                backoff(failures - 1, "io");
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientNetworkException("Interrupted waiting for a request slot: " + path, e);
            }

            if (reply.code() == 429) {
                if (rateLimitWaits >= retry.maxRateLimitWaits()) {
                    throw new RateLimitedException("Rate limited on " + path + " after " + rateLimitWaits + " waits",
                            reply.retryAfter(retry.rateLimitDefault()));
                }
                rateLimitWaits++;
                Duration wait = reply.retryAfter(retry.rateLimitDefault());
                log.warn("[HTTP] {} {} rate limited, waiting {} ms ({}/{})",
                        method, path, wait.toMillis(), rateLimitWaits, retry.maxRateLimitWaits());
                metrics.exchangeRetry(EXCHANGE_ID, "rate_limit");
                pause(wait);
                continue;
            }

            if (reply.code() >= 500) {
                failures++;
                if (failures >= retry.maxAttempts()) {
                    throw new TransientNetworkException(method + " " + path + " failed after " + failures
                            + " attempts: HTTP " + reply.code());
                }
                log.warn("[HTTP] {} {} attempt {} got HTTP {}", method, path, failures, reply.code());
                backoff(failures - 1, "http_5xx");
                continue;
            }

            JsonNode root = parse(reply.body());
            int errorCode = root != null && root.isObject() ? root.path("error").asInt(0) : 0;
            boolean authFailure = reply.code() == 401 || AUTH_ERROR_CODES.contains(errorCode);

            if (authFailure && signed) {
                int code = errorCode != 0 ? errorCode : reply.code();
                if (authRetried) {
                    throw new AuthClockSkewException("Signature/timestamp rejected on " + path
                            + " after clock resync (code " + code + ")", code);
                }
                authRetried = true;
                log.warn("[SYNC] {} {} rejected with code {}, refreshing server time", method, path, code);
                metrics.exchangeRetry(EXCHANGE_ID, "auth");
                clockOffset.refresh();
                continue;
            }

            if (reply.code() >= 400) {
                throw new OrderRejectedException(method + " " + path + " rejected: HTTP " + reply.code()
                        + " " + abbreviate(reply.body()), errorCode != 0 ? errorCode : reply.code());
            }
            if (root == null) {
                throw new ExchangeException("Unparseable response from " + path + ": " + abbreviate(reply.body()));
            }
            if (errorCode != 0) {
                throw new OrderRejectedException(method + " " + path + " rejected: error " + errorCode, errorCode);
            }
            return root;
        }
    }

    private Reply send(Request request) throws IOException {
        try (Response resp = http.newCall(request).execute()) {
            ResponseBody rb = resp.body();
            return new Reply(resp.code(), rb != null ? rb.string() : "", resp.header("Retry-After"));
        }
    }

    private HttpUrl buildUrl(String path, Map<String, String> query) {
        HttpUrl.Builder b = Objects.requireNonNull(HttpUrl.parse(baseUrl + path), "bad url: " + baseUrl + path)
                .newBuilder();
        query.forEach(b::addQueryParameter);
        return b.build();
    }

    private Request buildRequest(String method, HttpUrl url, String body, boolean signed) throws ExchangeException {
        Headers.Builder headers = new Headers.Builder()
                .add("Accept", "application/json")
                .add("Content-Type", "application/json");
        if (signed) {
            long ts = clockOffset.timestampMs();
            String target = url.encodedPath() + (url.encodedQuery() != null ? "?" + url.encodedQuery() : "");
            headers.add("X-BTK-APIKEY", apiKey)
                    .add("X-BTK-TIMESTAMP", String.valueOf(ts))
                    .add("X-BTK-SIGN", Signer.sign(apiSecret, ts, method, target, body));
        }
        Request.Builder rb = new Request.Builder().url(url).headers(headers.build());
        if ("POST".equals(method)) {
            rb.post(RequestBody.create(body == null ? "{}" : body, JSON));
        } else {
            rb.get();
        }
        return rb.build();
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("[HTTP] non-JSON response: {}", abbreviate(body));
            return null;
        }
    }

    private void backoff(int retryIndex, String reason) throws ExchangeException {
        metrics.exchangeRetry(EXCHANGE_ID, reason);
        pause(retry.delayFor(retryIndex));
    }

    private void pause(Duration d) throws ExchangeException {
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientNetworkException("Interrupted during backoff", e);
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 300 ? s : s.substring(0, 300) + "...(+)";
    }

    private static String firstNonBlank(String a, String fallback) {
        if (a != null && !a.isBlank()) return a;
        return fallback;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record Reply(int code, String body, String retryAfterHeader) {

        Duration retryAfter(Duration fallback) {
            if (retryAfterHeader == null || retryAfterHeader.isBlank()) return fallback;
            try {
                long seconds = Long.parseLong(retryAfterHeader.trim());
                return seconds < 0 ? fallback : Duration.ofSeconds(seconds);
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
    }
}
