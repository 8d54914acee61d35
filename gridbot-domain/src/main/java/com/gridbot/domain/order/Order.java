package com.gridbot.domain.order;

import com.gridbot.domain.market.MarketSymbol;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * Order request with a client-assigned idempotency token.
 *
 * <p>The request fields are immutable; only {@link #status()} moves forward along
 * NEW -> SUBMITTED -> {FILLED | REJECTED | CANCELLED}. Retried submissions of the same order carry
 * the same {@link #clientId()}, which lets the exchange recognise a duplicate.
 */
public final class Order {

    private final String clientId;
    private final MarketSymbol symbol;
    private final Side side;
    private final BigDecimal quantity;
    private final BigDecimal limitPrice;

    private volatile OrderStatus status = OrderStatus.NEW;

    public Order(String clientId, MarketSymbol symbol, Side side, BigDecimal quantity, BigDecimal limitPrice) {
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.side = Objects.requireNonNull(side, "side");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.limitPrice = limitPrice;
        if (clientId.isBlank()) throw new IllegalArgumentException("clientId must not be blank");
        if (quantity.signum() <= 0) throw new IllegalArgumentException("quantity must be > 0, got " + quantity);
        if (limitPrice != null && limitPrice.signum() <= 0) {
            throw new IllegalArgumentException("limitPrice must be > 0, got " + limitPrice);
        }
    }

    public static Order limit(MarketSymbol symbol, Side side, BigDecimal quantity, BigDecimal limitPrice) {
        return new Order(newClientId(), symbol, side, quantity, Objects.requireNonNull(limitPrice, "limitPrice"));
    }

    public static Order market(MarketSymbol symbol, Side side, BigDecimal quantity) {
        return new Order(newClientId(), symbol, side, quantity, null);
    }

    /** Fresh idempotency token. */
    public static String newClientId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public String clientId() { return clientId; }

    public MarketSymbol symbol() { return symbol; }

    public Side side() { return side; }

    /** Requested base quantity. */
    public BigDecimal quantity() { return quantity; }

    /** Limit price, or null for a market order. */
    public BigDecimal limitPrice() { return limitPrice; }

    public boolean isMarket() { return limitPrice == null; }

    public OrderStatus status() { return status; }

    public synchronized void transitionTo(OrderStatus next) {
        Objects.requireNonNull(next, "next");
        if (status == next) return;
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException("Order " + clientId + ": illegal transition " + status + " -> " + next);
        }
        status = next;
    }

    @Override
    public String toString() {
        return "Order{" + side + " " + quantity + " " + symbol
                + (limitPrice == null ? " @MARKET" : " @" + limitPrice)
                + ", clientId=" + clientId + ", status=" + status + "}";
    }
}
