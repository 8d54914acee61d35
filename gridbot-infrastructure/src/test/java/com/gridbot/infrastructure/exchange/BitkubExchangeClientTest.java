package com.gridbot.infrastructure.exchange;

import com.gridbot.application.exchange.ExchangeException;
import com.gridbot.application.exchange.OrderRejectedException;
import com.gridbot.application.metrics.TradingMetrics;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.OrderResult;
import com.gridbot.domain.order.OrderStatus;
import com.gridbot.domain.order.Side;
import com.gridbot.exchange.BitkubHttpClient;
import com.gridbot.exchange.RequestGate;
import com.gridbot.exchange.RetryPolicy;
import com.gridbot.exchange.StubBitkub;
import com.gridbot.exchange.TickingClock;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.gridbot.exchange.StubBitkub.ok;
import static com.gridbot.exchange.StubBitkub.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BitkubExchangeClientTest {

    private static final MarketSymbol XRP = MarketSymbol.parse("XRP_THB");
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private static final String TRADES = "/api/v3/market/trades";
    private static final String PLACE_BID = "/api/v3/market/place-bid";
    private static final String PLACE_ASK = "/api/v3/market/place-ask";
    private static final String ORDER_INFO = "/api/v3/market/order-info";
    private static final String CANCEL = "/api/v3/market/cancel-order";
    private static final String OPEN_ORDERS = "/api/v3/market/my-open-orders";
    private static final String HISTORY = "/api/v3/market/my-order-history";

    private final StubBitkub stub = StubBitkub.withServerTime(NOW.toEpochMilli());
    private final List<Duration> sleeps = new ArrayList<>();

    private final BitkubExchangeClient client = client(Duration.ofSeconds(4), Duration.ofSeconds(2));

    private BitkubExchangeClient client(Duration fillTimeout, Duration fillPoll) {
        OkHttpClient ok = new OkHttpClient.Builder().addInterceptor(stub).build();
        RetryPolicy retry = new RetryPolicy(3, Duration.ofMillis(100), 2.0, Duration.ofSeconds(1),
                null, Duration.ofSeconds(1), 3);
        BitkubHttpClient http = new BitkubHttpClient("https://api.test", "key", "secret", ok, retry,
                new RequestGate(4), sleeps::add, TradingMetrics.inMemory(), new TickingClock(NOW), Duration.ofMinutes(5));
        return new BitkubExchangeClient(http, sleeps::add, fillTimeout, fillPoll);
    }

    private static Order buy(String clientId) {
        return new Order(clientId, XRP, Side.BUY, new BigDecimal("4"), new BigDecimal("20.02"));
    }

    private static Order sell(String clientId) {
        return new Order(clientId, XRP, Side.SELL, new BigDecimal("5"), new BigDecimal("21"));
    }

    private static String ack(String id) {
        return "{\"error\":0,\"result\":{\"id\":\"" + id + "\",\"typ\":\"limit\"}}";
    }

    @Test
    void priceIsTheNewestValidTradeAcrossRowFormats() throws Exception {
        stub.on(TRADES, ok("{\"error\":0,\"result\":["
                + "[1704067200, 20.50, 10],"
                + "{\"ts\":1704067260, \"rat\":\"20.70\", \"amt\":\"5\"},"
                + "{\"ts\":1704067290, \"rate\":99, \"amount\":0},"
                + "{\"ts\":1704067230, \"rate\":20.6, \"amount\":1}"
                + "]}"));

        PriceTick tick = client.getPrice(XRP);

        assertThat(tick.price()).isEqualByComparingTo("20.70");
        assertThat(tick.timestamp()).isEqualTo(Instant.ofEpochSecond(1704067260));
        assertThat(stub.calls(TRADES).get(0).query("sym")).isEqualTo("XRP_THB");
        assertThat(stub.calls(TRADES).get(0).query("lmt")).isEqualTo("10");
    }

    @Test
    void noValidTradesIsAnExchangeError() {
        stub.on(TRADES, ok("{\"error\":0,\"result\":[[1704067200, 0, 1], \"junk\"]}"));

        assertThatThrownBy(() -> client.getPrice(XRP))
                .isInstanceOf(ExchangeException.class)
                .hasMessageContaining("No valid trades");
    }

    @Test
    void tradesErrorCodeIsRejected() {
        stub.on(TRADES, ok("{\"error\":11}"));

        assertThatThrownBy(() -> client.getPrice(XRP)).isInstanceOf(OrderRejectedException.class);
    }

    @Test
    void limitBuyIsSizedInQuoteAndReportsTheFill() throws Exception {
        stub.on(PLACE_BID, ok(ack("101")))
                .on(ORDER_INFO, ok("{\"error\":0,\"result\":{\"id\":\"101\",\"status\":\"filled\",\"rate\":20.02,"
                        + "\"history\":[{\"amount\":80.08,\"rate\":20.02,\"fee\":0.2}]}}"));

        OrderResult r = client.placeOrder(buy("cid-1"));

        assertThat(stub.calls(PLACE_BID).get(0).body())
                .isEqualTo("{\"sym\":\"XRP_THB\",\"amt\":80.08,\"rat\":20.02,\"typ\":\"limit\",\"client_id\":\"cid-1\"}");
        assertThat(r.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(r.orderId()).isEqualTo("101");
        assertThat(r.clientId()).isEqualTo("cid-1");
        assertThat(r.filledQty()).isEqualByComparingTo("4");
        assertThat(r.avgPrice()).isEqualByComparingTo("20.02");
        assertThat(r.fee()).isEqualByComparingTo("0.2");
        assertThat(stub.calls(ORDER_INFO).get(0).query("sd")).isEqualTo("buy");
    }

    @Test
    void partialFillIsCancelledAtTimeoutAndReportedFilled() throws Exception {
        String partial = "{\"ts\":1704067200,\"amount\":2,\"rate\":21,\"fee\":0.1}";
        stub.on(PLACE_ASK, ok(ack("202")))
                .on(ORDER_INFO,
                        ok("{\"error\":0,\"result\":{\"status\":\"unfilled\",\"history\":[]}}"),
                        ok("{\"error\":0,\"result\":{\"status\":\"unfilled\",\"history\":[" + partial + "]}}"),
                        ok("{\"error\":0,\"result\":{\"status\":\"unfilled\",\"history\":[" + partial + "]}}"),
                        ok("{\"error\":0,\"result\":{\"status\":\"cancelled\",\"history\":[" + partial + "]}}"))
                .on(CANCEL, ok("{\"error\":0}"));

        OrderResult r = client.placeOrder(sell("cid-2"));

        assertThat(r.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(r.filledQty()).isEqualByComparingTo("2");
        assertThat(r.avgPrice()).isEqualByComparingTo("21");
        assertThat(stub.calls(CANCEL)).hasSize(1);
        assertThat(stub.calls(CANCEL).get(0).body()).isEqualTo("{\"sym\":\"XRP_THB\",\"id\":\"202\",\"sd\":\"sell\"}");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @Test
    void zeroFillAtTimeoutIsCancelled() throws Exception {
        stub.on(PLACE_ASK, ok(ack("203")))
                .on(ORDER_INFO,
                        ok("{\"error\":0,\"result\":{\"status\":\"unfilled\"}}"),
                        ok("{\"error\":0,\"result\":{\"status\":\"unfilled\"}}"),
                        ok("{\"error\":0,\"result\":{\"status\":\"unfilled\"}}"),
                        ok("{\"error\":0,\"result\":{\"status\":\"cancelled\"}}"))
                .on(CANCEL, ok("{\"error\":0}"));

        OrderResult r = client.placeOrder(sell("cid-3"));

        assertThat(r.status()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(r.filledQty()).isEqualByComparingTo("0");
    }

    @Test
    void settledClientIdIsNotSubmittedTwice() throws Exception {
        stub.on(PLACE_BID, ok(ack("101")))
                .always(ORDER_INFO, ok("{\"error\":0,\"result\":{\"status\":\"filled\","
                        + "\"history\":[{\"amount\":80.08,\"rate\":20.02,\"fee\":0.2}]}}"));
        Order order = buy("cid-4");

        OrderResult first = client.placeOrder(order);
        OrderResult second = client.placeOrder(order);

        assertThat(second).isEqualTo(first);
        assertThat(stub.calls(PLACE_BID)).hasSize(1);
    }

    @Test
    void retriedSubmissionRejectedAsDuplicateResolvesTheOriginalOrder() throws Exception {
        stub.on(PLACE_BID, status(503, "busy"), ok("{\"error\":19}"))
                .on(OPEN_ORDERS, ok("{\"error\":0,\"result\":[]}"))
                .on(HISTORY, ok("{\"error\":0,\"result\":["
                        + "{\"order_id\":\"900\",\"side\":\"sell\",\"client_id\":\"other\"},"
                        + "{\"order_id\":\"555\",\"side\":\"buy\",\"client_id\":\"cid-5\"}]}"))
                .always(ORDER_INFO, ok("{\"error\":0,\"result\":{\"status\":\"filled\","
                        + "\"history\":[{\"amount\":80.08,\"rate\":20.02,\"fee\":0.2}]}}"));

        OrderResult r = client.placeOrder(buy("cid-5"));

        assertThat(r.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(r.orderId()).isEqualTo("555");
        assertThat(r.clientId()).isEqualTo("cid-5");
        assertThat(stub.calls(PLACE_BID)).hasSize(2);
        assertThat(stub.calls(PLACE_BID).get(1).body()).contains("\"client_id\":\"cid-5\"");
    }

    @Test
    void rejectionForUnknownClientIdPropagates() {
        stub.on(PLACE_BID, ok("{\"error\":18}"))
                .on(OPEN_ORDERS, ok("{\"error\":0,\"result\":[]}"))
                .on(HISTORY, ok("{\"error\":0,\"result\":[]}"));

        assertThatThrownBy(() -> client.placeOrder(buy("cid-6")))
                .isInstanceOfSatisfying(OrderRejectedException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(18));
    }

    @Test
    void findByClientIdPrefersOpenOrders() throws Exception {
        stub.on(OPEN_ORDERS, ok("{\"error\":0,\"result\":[{\"id\":\"77\",\"side\":\"sell\",\"ci\":\"cid-7\"}]}"))
                .on(ORDER_INFO, ok("{\"error\":0,\"result\":{\"status\":\"unfilled\"}}"));

        Optional<OrderResult> r = client.findByClientId(XRP, "cid-7");

        assertThat(r).isPresent();
        assertThat(r.get().status()).isEqualTo(OrderStatus.SUBMITTED);
        assertThat(r.get().orderId()).isEqualTo("77");
        assertThat(stub.calls(HISTORY)).isEmpty();
        assertThat(stub.calls(ORDER_INFO).get(0).query("sd")).isEqualTo("sell");
    }

    @Test
    void availableBalanceIsReadPerAsset() throws Exception {
        stub.always("/api/v3/market/balances",
                ok("{\"error\":0,\"result\":{\"THB\":{\"available\":1000.5,\"reserved\":0}}}"));

        assertThat(client.getAvailable("thb")).isEqualByComparingTo("1000.5");
        assertThat(client.getAvailable("XRP")).isEqualByComparingTo("0");
    }

    @Test
    void serverTimeComesFromTheExchange() throws Exception {
        assertThat(client.getServerTime()).isEqualTo(NOW.toEpochMilli());
    }
}
