package com.gridbot.application.paper;

import com.gridbot.application.exchange.ExchangeClient;
import com.gridbot.application.exchange.ExchangeException;
import com.gridbot.application.exchange.OrderRejectedException;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.OrderResult;
import com.gridbot.domain.order.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated exchange used for dry runs and backtests. Never places real orders.
 *
 * <p>Every order fills immediately through the {@link PaperExecutionModel}. Balances are tracked in
 * memory; the trade loop's balance check keeps them from going negative. Submitting the same client
 * id twice returns the first result.
 */
public final class PaperExchangeClient implements ExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(PaperExchangeClient.class);

    private final PriceSource prices;
    private final PaperExecutionModel executionModel;
    private final Clock clock;

    private final Map<String, BigDecimal> balances = new ConcurrentHashMap<>();
    private final Map<String, OrderResult> byClientId = new ConcurrentHashMap<>();
    private final Map<String, OrderResult> byOrderId = new ConcurrentHashMap<>();
    private final AtomicLong orderSeq = new AtomicLong();

    public PaperExchangeClient(PriceSource prices, PaperExecutionModel executionModel,
                               Map<String, BigDecimal> initialBalances, Clock clock) {
        this.prices = Objects.requireNonNull(prices, "prices");
        this.executionModel = Objects.requireNonNull(executionModel, "executionModel");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (initialBalances != null) {
            initialBalances.forEach((asset, amount) -> balances.put(asset.toUpperCase(Locale.ROOT), amount));
        }
    }

    @Override
    public String id() {
        return "paper";
    }

    @Override
    public PriceTick getPrice(MarketSymbol symbol) throws ExchangeException {
        return prices.latest(symbol);
    }

    @Override
    public synchronized OrderResult placeOrder(Order order) throws ExchangeException {
        Objects.requireNonNull(order, "order");
        OrderResult previous = byClientId.get(order.clientId());
        if (previous != null) {
            log.info("[PAPER] duplicate clientId={}, returning first result", order.clientId());
            return previous;
        }

        BigDecimal last = order.isMarket() ? prices.latest(order.symbol()).price() : null;
        PaperExecutionModel.PaperFill fill = executionModel.fill(order, last);
        if (fill.price().signum() <= 0) {
            throw new OrderRejectedException("Paper fill price must be > 0: " + fill.price(), 0);
        }

        MarketSymbol s = order.symbol();
        if (fill.side() == Side.BUY) {
            adjust(s.quote(), fill.notional().add(fill.fee()).negate());
            adjust(s.base(), fill.quantity());
        } else {
            adjust(s.base(), fill.quantity().negate());
            adjust(s.quote(), fill.notional().subtract(fill.fee()));
        }

        String orderId = "paper-" + orderSeq.incrementAndGet();
        OrderResult result = OrderResult.filled(order.clientId(), orderId, fill.quantity(), fill.price(), fill.fee());
        byClientId.put(order.clientId(), result);
        byOrderId.put(orderId, result);
        log.info("[PAPER] {} {} {} @ {} fee={} orderId={}", fill.side(), fill.quantity(), s, fill.price(), fill.fee(), orderId);
        return result;
    }

    @Override
    public OrderResult getOrderStatus(MarketSymbol symbol, String orderId, Side side) throws ExchangeException {
        OrderResult r = byOrderId.get(orderId);
        if (r == null) throw new OrderRejectedException("Unknown paper order " + orderId, 0);
        return r;
    }

    @Override
    public void cancelOrder(MarketSymbol symbol, String orderId, Side side) throws ExchangeException {
        // paper orders fill on submission, there is never anything left to cancel
        if (!byOrderId.containsKey(orderId)) {
            throw new OrderRejectedException("Unknown paper order " + orderId, 0);
        }
    }

    @Override
    public Optional<OrderResult> findByClientId(MarketSymbol symbol, String clientId) {
        return Optional.ofNullable(byClientId.get(clientId));
    }

    @Override
    public long getServerTime() {
        return clock.millis();
    }

    @Override
    public BigDecimal getAvailable(String asset) {
        return balances.getOrDefault(asset.toUpperCase(Locale.ROOT), BigDecimal.ZERO);
    }

    /** Copy of the simulated wallet. */
    public Map<String, BigDecimal> balances() {
        return Map.copyOf(balances);
    }

    private void adjust(String asset, BigDecimal delta) {
        balances.merge(asset.toUpperCase(Locale.ROOT), delta, BigDecimal::add);
    }
}
