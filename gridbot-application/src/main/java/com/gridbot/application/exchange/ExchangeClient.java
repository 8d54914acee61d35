package com.gridbot.application.exchange;

import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.OrderResult;
import com.gridbot.domain.order.Side;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Exchange-agnostic port for market data and order execution.
 *
 * Implementations own retries, backoff and clock-offset correction; callers only see the final
 * outcome. No implementation mutates positions or hysteresis state.
 */
public interface ExchangeClient {

    String id();

    /** Last traded price. */
    PriceTick getPrice(MarketSymbol symbol) throws ExchangeException;

    /**
     * Submits the order and waits for its final outcome (FILLED, CANCELLED after a fill timeout, ...).
     *
     * Submitting an order whose {@link Order#clientId()} was already accepted returns the original
     * result instead of trading twice.
     *
     * @throws OrderRejectedException when the exchange refuses the order
     */
    OrderResult placeOrder(Order order) throws ExchangeException;

    OrderResult getOrderStatus(MarketSymbol symbol, String orderId, Side side) throws ExchangeException;

    void cancelOrder(MarketSymbol symbol, String orderId, Side side) throws ExchangeException;

    /** Looks up an order by its idempotency token; empty when the exchange never saw it. */
    Optional<OrderResult> findByClientId(MarketSymbol symbol, String clientId) throws ExchangeException;

    /** Exchange clock, epoch millis. */
    long getServerTime() throws ExchangeException;

    /** Free balance of {@code asset}. */
    BigDecimal getAvailable(String asset) throws ExchangeException;
}
