package com.gridbot.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridbot.application.config.ConfigKey;
import com.gridbot.application.exchange.ExchangeClient;
import com.gridbot.application.exchange.ExchangeException;
import com.gridbot.application.exchange.OrderRejectedException;
import com.gridbot.application.metrics.TradingMetrics;
import com.gridbot.application.ports.ConfigPort;
import com.gridbot.application.ports.Sleeper;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.OrderResult;
import com.gridbot.domain.order.OrderStatus;
import com.gridbot.domain.order.Side;
import com.gridbot.exchange.BitkubHttpClient;
import com.gridbot.exchange.RequestGate;
import com.gridbot.exchange.RetryPolicy;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Bitkub (v3) implementation of the exchange port.
 *
 * <p>All Bitkub-specific mapping stays here in infrastructure. Orders are sent with the order's
 * client id; after submission the order is polled until it fills or the fill timeout elapses, then
 * the remainder is cancelled and the actual fill is reported.
 */
public final class BitkubExchangeClient implements ExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(BitkubExchangeClient.class);

    public static final long DEFAULT_HTTP_TIMEOUT_MS = 12_000;
    public static final long DEFAULT_TIME_SYNC_SECONDS = 300;
    public static final long DEFAULT_FILL_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_FILL_POLL_MS = 2_000;

    static final int TRADES_FETCH = 10;
    static final int HISTORY_FETCH = 100;
    private static final int MEMO_SIZE = 256;
    private static final MathContext MC = MathContext.DECIMAL64;

    private final BitkubHttpClient http;
    private final Sleeper sleeper;
    private final Duration fillTimeout;
    private final Duration fillPoll;

    private final Map<String, OrderResult> memo = Collections.synchronizedMap(
            new LinkedHashMap<String, OrderResult>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, OrderResult> eldest) {
                    return size() > MEMO_SIZE;
                }
            });

    public BitkubExchangeClient(BitkubHttpClient http, Sleeper sleeper, Duration fillTimeout, Duration fillPoll) {
        this.http = Objects.requireNonNull(http, "http");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.fillTimeout = Objects.requireNonNull(fillTimeout, "fillTimeout");
        this.fillPoll = Objects.requireNonNull(fillPoll, "fillPoll");
        if (fillPoll.isZero() || fillPoll.isNegative()) {
            throw new IllegalArgumentException("fillPoll must be > 0");
        }
    }

    /**
     * Builds the client from configuration. The client owns one request gate, shared by every loop using it.
     */
    public static BitkubExchangeClient fromConfig(ConfigPort config, TradingMetrics metrics, Clock clock) {
        Objects.requireNonNull(config, "config");
        long timeoutMs = config.getInt(ConfigKey.EXCHANGE_HTTP_TIMEOUT_MS.key(), (int) DEFAULT_HTTP_TIMEOUT_MS);
        OkHttpClient ok = new OkHttpClient.Builder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();

        BitkubHttpClient http = new BitkubHttpClient(
                config.get(ConfigKey.EXCHANGE_BASE_URL.key(), BitkubHttpClient.DEFAULT_BASE_URL),
                config.getSecret(ConfigKey.BITKUB_API_KEY.key()),
                config.getSecret(ConfigKey.BITKUB_API_SECRET.key()),
                ok,
                RetryPolicy.from(config),
                new RequestGate(config.getInt(ConfigKey.EXCHANGE_MAX_CONCURRENT_REQUESTS.key(), RequestGate.DEFAULT_PERMITS)),
                Sleeper.SYSTEM,
                metrics,
                clock,
                Duration.ofSeconds(config.getInt(ConfigKey.EXCHANGE_TIME_SYNC_SECONDS.key(), (int) DEFAULT_TIME_SYNC_SECONDS)));

        return new BitkubExchangeClient(http, Sleeper.SYSTEM,
                Duration.ofMillis(config.getInt(ConfigKey.EXCHANGE_FILL_TIMEOUT_MS.key(), (int) DEFAULT_FILL_TIMEOUT_MS)),
                Duration.ofMillis(config.getInt(ConfigKey.EXCHANGE_FILL_POLL_MS.key(), (int) DEFAULT_FILL_POLL_MS)));
    }

    @Override
    public String id() {
        return BitkubHttpClient.EXCHANGE_ID;
    }

    /**
     * Newest public trade. Rows come either as {@code [ts, rate, amount, ...]} or as objects with
     * {@code ts/rat/amt} or {@code ts/rate/amount}; rows with a non-positive rate or amount are skipped.
     */
    @Override
    public PriceTick getPrice(MarketSymbol symbol) throws ExchangeException {
        JsonNode root = http.publicGet("/api/v3/market/trades",
                Map.of("sym", toBitkubSymbol(symbol), "lmt", String.valueOf(TRADES_FETCH)));
        JsonNode rows = root.isArray() ? root : root.path("result");

        long bestTs = Long.MIN_VALUE;
        BigDecimal bestRate = null;
        if (rows.isArray()) {
            for (JsonNode row : rows) {
                JsonNode ts;
                JsonNode rate;
                JsonNode amount;
                if (row.isArray() && row.size() >= 3) {
                    ts = row.get(0);
                    rate = row.get(1);
                    amount = row.get(2);
                } else if (row.isObject() && row.has("ts") && row.has("rat") && row.has("amt")) {
                    ts = row.get("ts");
                    rate = row.get("rat");
                    amount = row.get("amt");
                } else if (row.isObject() && row.has("ts") && row.has("rate") && row.has("amount")) {
                    ts = row.get("ts");
                    rate = row.get("rate");
                    amount = row.get("amount");
                } else {
                    continue;
                }
                BigDecimal r = decimal(rate);
                BigDecimal a = decimal(amount);
                if (r == null || a == null || r.signum() <= 0 || a.signum() <= 0) continue;
                long t = ts.asLong(Long.MIN_VALUE);
                if (t == Long.MIN_VALUE) continue;
                // sort by ts, newest wins; on equal ts keep the later row
                if (t >= bestTs) {
                    bestTs = t;
                    bestRate = r;
                }
            }
        }
        if (bestRate == null) {
            throw new ExchangeException("No valid trades for " + symbol + " (lmt=" + TRADES_FETCH + ")");
        }
        return new PriceTick(symbol, bestRate, toInstant(bestTs));
    }

    @Override
    public OrderResult placeOrder(Order order) throws ExchangeException {
        Objects.requireNonNull(order, "order");
        OrderResult previous = memo.get(order.clientId());
        if (previous != null) {
            log.info("[ORDER] clientId={} already settled as {}, not resubmitting", order.clientId(), previous.status());
            return previous;
        }

        String orderId;
        try {
            orderId = submit(order);
        } catch (OrderRejectedException e) {
            // a retried submission may be refused because the first one went through
            Optional<OrderResult> existing = findByClientId(order.symbol(), order.clientId());
            if (existing.isEmpty()) throw e;
            log.warn("[ORDER] clientId={} rejected ({}) but already known to the exchange as {}",
                    order.clientId(), e.getMessage(), existing.get().orderId());
            orderId = existing.get().orderId();
            if (existing.get().status().isTerminal()) {
                return remember(order.clientId(), existing.get());
            }
        }

        return remember(order.clientId(), awaitFill(order, orderId));
    }

    private String submit(Order order) throws ExchangeException {
        MarketSymbol s = order.symbol();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sym", toBitkubSymbol(s));
        if (order.side() == Side.BUY) {
            BigDecimal refPrice = order.isMarket() ? getPrice(s).price() : order.limitPrice();
            // bids are sized in quote currency
            body.put("amt", order.quantity().multiply(refPrice).setScale(2, RoundingMode.DOWN));
        } else {
            body.put("amt", order.quantity());
        }
        body.put("rat", order.isMarket() ? BigDecimal.ZERO : order.limitPrice());
        body.put("typ", order.isMarket() ? "market" : "limit");
        body.put("client_id", order.clientId());

        String path = order.side() == Side.BUY ? "/api/v3/market/place-bid" : "/api/v3/market/place-ask";
        JsonNode result = http.signedPost(path, body).path("result");
        String orderId = text(result, "id");
        if (orderId == null) {
            throw new ExchangeException("Order acknowledged without an id: " + result);
        }
        log.info("[ORDER] {} {} {} @ {} -> id={} clientId={}",
                order.side(), order.quantity(), s, order.isMarket() ? "MARKET" : order.limitPrice(),
                orderId, order.clientId());
        return orderId;
    }

    private OrderResult awaitFill(Order order, String orderId) throws ExchangeException {
        long polls = Math.max(1, fillTimeout.toMillis() / fillPoll.toMillis());
        OrderResult last = null;
        for (long i = 0; i <= polls; i++) {
            last = withClientId(getOrderStatus(order.symbol(), orderId, order.side()), order.clientId());
            if (last.status().isTerminal()) {
                return last;
            }
            if (i < polls) {
                pause(fillPoll);
            }
        }

        log.warn("[ORDER] id={} not filled within {} ms (filled so far {}), cancelling remainder",
                orderId, fillTimeout.toMillis(), last.filledQty());
        try {
            cancelOrder(order.symbol(), orderId, order.side());
        } catch (OrderRejectedException e) {
            // the order may have completed between the last poll and the cancel
            log.info("[ORDER] cancel of id={} refused: {}", orderId, e.getMessage());
        }

        OrderResult settled = withClientId(getOrderStatus(order.symbol(), orderId, order.side()), order.clientId());
        if (settled.status().isTerminal()) {
            return settled;
        }
        if (settled.filledQty().signum() > 0 && settled.avgPrice() != null) {
            return new OrderResult(OrderStatus.FILLED, order.clientId(), orderId, settled.filledQty(),
                    settled.avgPrice(), settled.fee(), "partial fill, remainder cancelled");
        }
        return OrderResult.cancelled(order.clientId(), orderId, "not filled within " + fillTimeout.toMillis() + " ms");
    }

    @Override
    public OrderResult getOrderStatus(MarketSymbol symbol, String orderId, Side side) throws ExchangeException {
        JsonNode result = http.signedGet("/api/v3/market/order-info", orderQuery(symbol, orderId, side))
                .path("result");
        return toResult(orderId, side, result);
    }

    @Override
    public void cancelOrder(MarketSymbol symbol, String orderId, Side side) throws ExchangeException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sym", toBitkubSymbol(symbol));
        body.put("id", orderId);
        body.put("sd", toBitkubSide(side));
        http.signedPost("/api/v3/market/cancel-order", body);
        log.info("[ORDER] cancel requested id={} {}", orderId, symbol);
    }

    /**
     * Open orders first, then recent order history.
     */
    @Override
    public Optional<OrderResult> findByClientId(MarketSymbol symbol, String clientId) throws ExchangeException {
        Objects.requireNonNull(clientId, "clientId");
        String sym = toBitkubSymbol(symbol);

        JsonNode open = http.signedGet("/api/v3/market/my-open-orders", Map.of("sym", sym)).path("result");
        Optional<OrderResult> found = lookup(symbol, clientId, open, "id");
        if (found.isPresent()) return found;

        JsonNode history = http.signedGet("/api/v3/market/my-order-history",
                Map.of("sym", sym, "lmt", String.valueOf(HISTORY_FETCH))).path("result");
        return lookup(symbol, clientId, history, "order_id");
    }

    private Optional<OrderResult> lookup(MarketSymbol symbol, String clientId, JsonNode rows, String idField)
            throws ExchangeException {
        if (!rows.isArray()) return Optional.empty();
        for (JsonNode row : rows) {
            String ci = firstText(row, "client_id", "ci");
            if (!clientId.equals(ci)) continue;
            String orderId = firstText(row, idField, "id");
            Side side = fromBitkubSide(text(row, "side"));
            if (orderId == null || side == null) continue;
            return Optional.of(withClientId(getOrderStatus(symbol, orderId, side), clientId));
        }
        return Optional.empty();
    }

    @Override
    public long getServerTime() throws ExchangeException {
        return http.serverTime();
    }

    @Override
    public BigDecimal getAvailable(String asset) throws ExchangeException {
        Objects.requireNonNull(asset, "asset");
        JsonNode result = http.signedPost("/api/v3/market/balances", Map.of()).path("result");
        JsonNode entry = result.path(asset.toUpperCase(Locale.ROOT));
        BigDecimal available = decimal(entry.isObject() ? entry.path("available") : entry);
        return available == null ? BigDecimal.ZERO : available;
    }

    /**
     * Maps an order-info payload. Bid amounts are quote currency, ask amounts are base; the base
     * quantity of a bid fill is {@code amount / rate}.
     */
    OrderResult toResult(String orderId, Side side, JsonNode r) {
        BigDecimal baseFilled = BigDecimal.ZERO;
        BigDecimal quoteFilled = BigDecimal.ZERO;
        BigDecimal fee = BigDecimal.ZERO;

        JsonNode history = r.path("history");
        if (history.isArray() && history.size() > 0) {
            for (JsonNode h : history) {
                BigDecimal amount = decimal(h.path("amount"));
                BigDecimal rate = decimal(h.path("rate"));
                if (amount == null || rate == null || amount.signum() <= 0 || rate.signum() <= 0) continue;
                BigDecimal base = side == Side.BUY ? amount.divide(rate, MC) : amount;
                baseFilled = baseFilled.add(base);
                quoteFilled = quoteFilled.add(base.multiply(rate));
                BigDecimal f = decimal(h.path("fee"));
                if (f != null) fee = fee.add(f);
            }
        } else {
            BigDecimal filled = decimal(r.path("filled"));
            BigDecimal rate = decimal(r.path("rate"));
            if (filled != null && rate != null && filled.signum() > 0 && rate.signum() > 0) {
                baseFilled = side == Side.BUY ? filled.divide(rate, MC) : filled;
                quoteFilled = baseFilled.multiply(rate);
            }
        }
        if (fee.signum() == 0) {
            BigDecimal f = decimal(r.path("fee"));
            if (f != null && baseFilled.signum() > 0) fee = f;
        }

        BigDecimal avg = baseFilled.signum() > 0 ? quoteFilled.divide(baseFilled, MC) : null;
        String clientId = firstText(r, "client_id", "ci");
        String status = Objects.requireNonNullElse(text(r, "status"), "").toLowerCase(Locale.ROOT);

        return switch (status) {
            case "filled" -> baseFilled.signum() > 0
                    ? OrderResult.filled(clientId, orderId, baseFilled, avg, fee)
                    : new OrderResult(OrderStatus.SUBMITTED, clientId, orderId, BigDecimal.ZERO, null, fee,
                            "filled without fill details");
            case "cancelled", "canceled" -> baseFilled.signum() > 0
                    ? new OrderResult(OrderStatus.FILLED, clientId, orderId, baseFilled, avg, fee,
                            "partial fill, remainder cancelled")
                    : OrderResult.cancelled(clientId, orderId, "cancelled");
            default -> new OrderResult(OrderStatus.SUBMITTED, clientId, orderId, baseFilled, avg, fee, status);
        };
    }

    private OrderResult remember(String clientId, OrderResult result) {
        if (result.status().isTerminal()) {
            memo.put(clientId, result);
        }
        return result;
    }

    private static OrderResult withClientId(OrderResult r, String clientId) {
        if (clientId.equals(r.clientId())) return r;
        return new OrderResult(r.status(), clientId, r.orderId(), r.filledQty(), r.avgPrice(), r.fee(), r.message());
    }

    private Map<String, String> orderQuery(MarketSymbol symbol, String orderId, Side side) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put("sym", toBitkubSymbol(symbol));
        q.put("id", orderId);
        q.put("sd", toBitkubSide(side));
        return q;
    }

    private void pause(Duration d) throws ExchangeException {
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException("Interrupted while waiting for a fill", e);
        }
    }

    static String toBitkubSymbol(MarketSymbol s) {
        // Bitkub v3 uses BASE_QUOTE like XRP_THB
        return s.key();
    }

    private static String toBitkubSide(Side side) {
        return side == Side.BUY ? "buy" : "sell";
    }

    private static Side fromBitkubSide(String side) {
        if (side == null) return null;
        return switch (side.toLowerCase(Locale.ROOT)) {
            case "buy", "bid" -> Side.BUY;
            case "sell", "ask" -> Side.SELL;
            default -> null;
        };
    }

    /** Bitkub reports trade timestamps in seconds on some endpoints and millis on others. */
    private static Instant toInstant(long ts) {
        return ts < 100_000_000_000L ? Instant.ofEpochSecond(ts) : Instant.ofEpochMilli(ts);
    }

    private static BigDecimal decimal(JsonNode n) {
        if (n == null || n.isMissingNode() || n.isNull()) return null;
        if (n.isNumber()) return n.decimalValue();
        if (n.isTextual()) {
            try {
                return new BigDecimal(n.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.path(field);
        if (v.isMissingNode() || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    private static String firstText(JsonNode n, String a, String b) {
        String v = text(n, a);
        return v != null ? v : text(n, b);
    }
}
