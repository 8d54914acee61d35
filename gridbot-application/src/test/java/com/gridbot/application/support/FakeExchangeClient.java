package com.gridbot.application.support;

import com.gridbot.application.exchange.ExchangeClient;
import com.gridbot.application.exchange.ExchangeException;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.OrderResult;
import com.gridbot.domain.order.Side;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scriptable exchange for loop tests. Prices and order outcomes are queued; an empty order script
 * fills the order completely at its limit price without fee.
 */
public class FakeExchangeClient implements ExchangeClient {

    @FunctionalInterface
    public interface OrderScript {
        OrderResult apply(Order order) throws ExchangeException;
    }

    private final Deque<Object> prices = new ArrayDeque<>();
    private final Deque<OrderScript> orderScripts = new ArrayDeque<>();
    private final List<Order> placed = new ArrayList<>();
    private final Map<String, OrderResult> known = new HashMap<>();
    private final Map<String, BigDecimal> balances = new HashMap<>();
    private Instant nextTime = Instant.parse("2024-01-01T00:00:00Z");

    public FakeExchangeClient price(String px) {
        nextTime = nextTime.plusSeconds(60);
        return priceAt(px, nextTime);
    }

    public FakeExchangeClient priceAt(String px, Instant at) {
        prices.addLast(new BigDecimal(px));
        prices.addLast(at);
        return this;
    }

    public FakeExchangeClient priceFailure(ExchangeException e) {
        prices.addLast(e);
        prices.addLast(Instant.EPOCH);
        return this;
    }

    public FakeExchangeClient nextOrder(OrderScript script) {
        orderScripts.addLast(script);
        return this;
    }

    /** Makes the exchange report {@code result} when asked for {@code clientId}. */
    public FakeExchangeClient knows(String clientId, OrderResult result) {
        known.put(clientId, result);
        return this;
    }

    public FakeExchangeClient balance(String asset, String amount) {
        balances.put(asset, new BigDecimal(amount));
        return this;
    }

    public List<Order> placed() {
        return placed;
    }

    public static OrderScript fillAtLimit() {
        return o -> OrderResult.filled(o.clientId(), "ex-" + o.clientId(), o.quantity(), o.limitPrice(), BigDecimal.ZERO);
    }

    @Override
    public String id() {
        return "fake";
    }

    @Override
    public PriceTick getPrice(MarketSymbol symbol) throws ExchangeException {
        if (prices.isEmpty()) throw new IllegalStateException("No price scripted");
        Object px = prices.removeFirst();
        Instant at = (Instant) prices.removeFirst();
        if (px instanceof ExchangeException e) throw e;
        return new PriceTick(symbol, (BigDecimal) px, at);
    }

    @Override
    public OrderResult placeOrder(Order order) throws ExchangeException {
        placed.add(order);
        OrderScript script = orderScripts.isEmpty() ? fillAtLimit() : orderScripts.removeFirst();
        OrderResult r = script.apply(order);
        known.put(order.clientId(), r);
        return r;
    }

    @Override
    public OrderResult getOrderStatus(MarketSymbol symbol, String orderId, Side side) {
        return known.values().stream()
                .filter(r -> orderId.equals(r.orderId()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown order " + orderId));
    }

    @Override
    public void cancelOrder(MarketSymbol symbol, String orderId, Side side) {
    }

    @Override
    public Optional<OrderResult> findByClientId(MarketSymbol symbol, String clientId) {
        return Optional.ofNullable(known.get(clientId));
    }

    @Override
    public long getServerTime() {
        return nextTime.toEpochMilli();
    }

    @Override
    public BigDecimal getAvailable(String asset) {
        return balances.getOrDefault(asset, BigDecimal.ZERO);
    }
}
