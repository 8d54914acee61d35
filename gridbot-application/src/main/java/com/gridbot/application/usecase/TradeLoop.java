package com.gridbot.application.usecase;

import com.gridbot.application.config.SymbolSettings;
import com.gridbot.application.exchange.ExchangeClient;
import com.gridbot.application.exchange.ExchangeException;
import com.gridbot.application.exchange.OrderRejectedException;
import com.gridbot.application.execution.CancellationToken;
import com.gridbot.application.ledger.PersistenceException;
import com.gridbot.application.ledger.PositionLedger;
import com.gridbot.application.metrics.TradingMetrics;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.OrderResult;
import com.gridbot.domain.order.OrderStatus;
import com.gridbot.domain.order.Side;
import com.gridbot.domain.portfolio.Fill;
import com.gridbot.domain.portfolio.InsufficientPositionException;
import com.gridbot.domain.portfolio.Position;
import com.gridbot.domain.signal.Decision;
import com.gridbot.domain.signal.HysteresisState;
import com.gridbot.domain.signal.TradeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * One symbol's trading cycle: price -> decision -> cooldown -> sizing -> balance -> order -> ledger.
 *
 * <p>Only a FILLED result changes the position and the hysteresis state, and both change in one
 * persisted write. Every order is recorded in the ledger before it is sent. An order whose outcome
 * is unknown (network failure after submission, or a restart) is looked up by its client id at the
 * start of the next cycle, before anything new is decided.
 *
 * <p>{@link PersistenceException} and {@link InsufficientPositionException} halt this loop for good;
 * every other failure is logged and the next cycle tries again.
 *
 * <p>Not thread-safe: the scheduler runs at most one cycle of a symbol at a time.
 */
public class TradeLoop {

    private static final Logger log = LoggerFactory.getLogger(TradeLoop.class);

    private final SymbolSettings settings;
    private final MarketSymbol symbol;
    private final ExchangeClient exchange;
    private final PositionLedger ledger;
    private final DecisionPolicy policy;
    private final OrderSizer sizer;
    private final OrderCooldownGuard cooldown;
    private final boolean checkBalances;
    private final TradingMetrics metrics;
    private final Clock clock;

    private PriceTick lastTick;
    private PendingOrder pending;
    private volatile String haltReason;

    public TradeLoop(SymbolSettings settings,
                     ExchangeClient exchange,
                     PositionLedger ledger,
                     DecisionPolicy policy,
                     OrderSizer sizer,
                     OrderCooldownGuard cooldown,
                     boolean checkBalances,
                     TradingMetrics metrics,
                     Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.symbol = settings.symbol();
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sizer = Objects.requireNonNull(sizer, "sizer");
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.checkBalances = checkBalances;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public MarketSymbol symbol() {
        return symbol;
    }

    public boolean isHalted() {
        return haltReason != null;
    }

    public String haltReason() {
        return haltReason;
    }

    public boolean hasPendingOrder() {
        return pending != null || ledger.openOrder(symbol).isPresent();
    }

    public CycleResult runCycle(CancellationToken token) {
        if (haltReason != null) {
            return CycleResult.of(symbol, CycleOutcome.HALTED, haltReason);
        }
        MDC.put("symbol", symbol.key());
        try {
            return cycle(token);
        } catch (PersistenceException | InsufficientPositionException e) {
            return halt(e);
        } finally {
            MDC.remove("symbol");
        }
    }

    /**
     * Settles the order left unresolved by the last cycle, if any. Used at shutdown; must not run
     * while a cycle of this loop is in progress.
     *
     * @return true when no order is left pending
     */
    public boolean resolvePendingOrder() {
        if (haltReason != null) {
            return !hasPendingOrder();
        }
        MDC.put("symbol", symbol.key());
        try {
            restorePending();
            if (pending != null) {
                reconcile();
            }
        } catch (PersistenceException | InsufficientPositionException e) {
            halt(e);
        } finally {
            MDC.remove("symbol");
        }
        return pending == null;
    }

    private CycleResult halt(RuntimeException e) {
        haltReason = e.getClass().getSimpleName() + ": " + e.getMessage();
        metrics.cycleFailed(symbol);
        log.error("[HALT] {} trading stopped: {}", symbol, haltReason, e);
        return CycleResult.of(symbol, CycleOutcome.HALTED, haltReason);
    }

    private void restorePending() {
        if (pending != null) return;
        ledger.openOrder(symbol).ifPresent(open -> {
            log.warn("[SYNC] {} resuming {} order clientId={} submitted {}", symbol, open.side(),
                    open.clientId(), open.submittedAt());
            pending = PendingOrder.restore(symbol, open);
        });
    }

    private CycleResult cycle(CancellationToken token) {
        restorePending();
        if (pending != null) {
            CycleResult unresolved = reconcile();
            if (unresolved != null) return unresolved;
        }
        if (token.isCancelled()) {
            return CycleResult.of(symbol, CycleOutcome.SKIPPED, "cancelled");
        }

        PriceTick tick;
        try {
            tick = exchange.getPrice(symbol);
        } catch (ExchangeException e) {
            metrics.cycleFailed(symbol);
            log.warn("[PRICE] {} price unavailable: {}", symbol, e.getMessage());
            return CycleResult.of(symbol, CycleOutcome.ERROR, "price unavailable: " + e.getMessage());
        }
        if (tick.isOlderThan(lastTick)) {
            log.debug("[SKIP] {} stale tick {} (last {})", symbol, tick.timestamp(), lastTick.timestamp());
            return CycleResult.of(symbol, CycleOutcome.SKIPPED, "stale tick");
        }
        lastTick = tick;

        Position position = ledger.position(symbol);
        log.info("[PRICE] {} px={} pos={} avg_cost={} unrealized={} realized={}",
                symbol, tick.price(), position.quantity(), position.averageCost(),
                position.unrealizedPnl(tick.price()), position.realizedPnl());

        HysteresisState state = ledger.hysteresis(symbol);
        Decision decision = policy.decide(state, tick);
        log.info("[HYST] {} last_trade_px={} band={} -> band={} move={} action={}",
                symbol, state.lastTradePrice(), state.currentBand(), decision.newBand(),
                decision.movePct(), decision.action());

        if (!decision.isActionable()) {
            log.info("[HOLD] {} {}", symbol, decision.reason());
            return new CycleResult(symbol, CycleOutcome.HOLD, TradeAction.HOLD, decision.reason());
        }

        if (cooldown.isCoolingDown(symbol)) {
            log.info("[COOLDOWN] {} {} suppressed, {}s left", symbol, decision.action(),
                    cooldown.remaining(symbol).toSeconds());
            return new CycleResult(symbol, CycleOutcome.SKIPPED, decision.action(), "cooldown");
        }

        Optional<Order> sized = sizer.size(symbol, decision, settings.grid().orderNotional(), position);
        if (sized.isEmpty()) {
            String why = decision.action() == TradeAction.SELL && !position.isOpen()
                    ? "no position to sell" : "order size rounds to zero";
            log.info("[SKIP] {} {}: {}", symbol, decision.action(), why);
            return new CycleResult(symbol, CycleOutcome.SKIPPED, decision.action(), why);
        }
        Order order = sized.get();

        if (checkBalances) {
            try {
                String shortfall = balanceShortfall(order);
                if (shortfall != null) {
                    log.warn("[SKIP] {} {}", symbol, shortfall);
                    return new CycleResult(symbol, CycleOutcome.SKIPPED, decision.action(), shortfall);
                }
            } catch (ExchangeException e) {
                metrics.cycleFailed(symbol);
                log.warn("[SKIP] {} balance check failed: {}", symbol, e.getMessage());
                return new CycleResult(symbol, CycleOutcome.ERROR, decision.action(), "balance check failed: " + e.getMessage());
            }
        }

        if (token.isCancelled()) {
            return new CycleResult(symbol, CycleOutcome.SKIPPED, decision.action(), "cancelled");
        }
        return submit(order, decision);
    }

    private CycleResult submit(Order order, Decision decision) {
        order.transitionTo(OrderStatus.SUBMITTED);
        PendingOrder submitted = new PendingOrder(order, decision, clock.instant());
        ledger.markSubmitted(symbol, submitted.toOpenOrder());
        pending = submitted;
        metrics.orderSubmitted(symbol, order.side());
        log.info("[{}] {} submitting qty={} limit={} clientId={} ({})", order.side(), symbol,
                order.quantity(), order.limitPrice(), order.clientId(), decision.reason());

        OrderResult result;
        try {
            result = exchange.placeOrder(order);
        } catch (OrderRejectedException e) {
            order.transitionTo(OrderStatus.REJECTED);
            ledger.clearOpenOrder(symbol);
            pending = null;
            metrics.orderRejected(symbol);
            log.warn("[{}] {} rejected: {}", order.side(), symbol, e.getMessage());
            return new CycleResult(symbol, CycleOutcome.REJECTED, decision.action(), e.getMessage());
        } catch (ExchangeException e) {
            metrics.cycleFailed(symbol);
            log.warn("[{}] {} outcome unknown, will reconcile clientId={}: {}",
                    order.side(), symbol, order.clientId(), e.getMessage());
            return new CycleResult(symbol, CycleOutcome.PENDING, decision.action(), e.getMessage());
        }
        return settle(pending, result);
    }

    /**
     * Resolves the pending order.
     *
     * @return null when it is resolved and the cycle may go on deciding, otherwise the result to report
     */
    private CycleResult reconcile() {
        PendingOrder p = pending;
        Order order = p.order();
        Optional<OrderResult> found;
        try {
            found = exchange.findByClientId(symbol, order.clientId());
            if (found.isPresent() && !found.get().status().isTerminal() && found.get().orderId() != null) {
                // still open on the book: cancel the rest and take whatever filled
                exchange.cancelOrder(symbol, found.get().orderId(), order.side());
                found = Optional.of(exchange.getOrderStatus(symbol, found.get().orderId(), order.side()));
            }
        } catch (ExchangeException e) {
            metrics.cycleFailed(symbol);
            log.warn("[SYNC] {} pending order {} still unresolved: {}", symbol, order.clientId(), e.getMessage());
            return new CycleResult(symbol, CycleOutcome.PENDING, p.decision().action(), e.getMessage());
        }

        if (found.isEmpty()) {
            log.info("[SYNC] {} order {} never reached the exchange, dropped", symbol, order.clientId());
            order.transitionTo(OrderStatus.REJECTED);
            ledger.clearOpenOrder(symbol);
            pending = null;
            return null;
        }
        OrderResult result = found.get();
        if (!result.status().isTerminal()) {
            return new CycleResult(symbol, CycleOutcome.PENDING, p.decision().action(), "order still open");
        }
        log.info("[SYNC] {} order {} resolved as {}", symbol, order.clientId(), result.status());
        CycleResult settled = settle(p, result);
        return settled.outcome() == CycleOutcome.FILLED ? settled : null;
    }

    private CycleResult settle(PendingOrder p, OrderResult result) {
        Order order = p.order();
        Decision decision = p.decision();
        switch (result.status()) {
            case FILLED -> {
                Fill fill = new Fill(symbol, order.side(), result.filledQty(), result.avgPrice(),
                        result.fee(), order.clientId(), clock.instant());
                Position after = ledger.recordFill(fill, HysteresisState.afterFill(decision));
                order.transitionTo(OrderStatus.FILLED);
                pending = null;
                cooldown.markTraded(symbol);
                metrics.orderFilled(symbol, order.side());
                log.info("[{}] {} filled qty={} px={} fee={} orderId={}", order.side(), symbol,
                        result.filledQty(), result.avgPrice(), result.fee(), result.orderId());
                log.info("[POS] {} qty={} avg_cost={} realized={} fees={}", symbol,
                        after.quantity(), after.averageCost(), after.realizedPnl(), after.feesPaid());
                return new CycleResult(symbol, CycleOutcome.FILLED, decision.action(),
                        order.side() + " " + result.filledQty() + " @ " + result.avgPrice());
            }
            case REJECTED, CANCELLED -> {
                order.transitionTo(result.status());
                ledger.clearOpenOrder(symbol);
                pending = null;
                metrics.orderRejected(symbol);
                log.warn("[{}] {} {}: {}", order.side(), symbol, result.status(), result.message());
                CycleOutcome outcome = result.status() == OrderStatus.REJECTED ? CycleOutcome.REJECTED : CycleOutcome.CANCELLED;
                return new CycleResult(symbol, outcome, decision.action(), result.message());
            }
            default -> {
                log.warn("[{}] {} non-final status {} for clientId={}, will reconcile",
                        order.side(), symbol, result.status(), order.clientId());
                return new CycleResult(symbol, CycleOutcome.PENDING, decision.action(), "status " + result.status());
            }
        }
    }

    private String balanceShortfall(Order order) throws ExchangeException {
        if (order.side() == Side.BUY) {
            BigDecimal needed = order.quantity().multiply(order.limitPrice())
                    .multiply(BigDecimal.ONE.add(sizer.feeRate()));
            BigDecimal available = exchange.getAvailable(symbol.quote());
            if (available.compareTo(needed) < 0) {
                return "insufficient " + symbol.quote() + ": available=" + available + " needed=" + needed;
            }
        } else {
            BigDecimal available = exchange.getAvailable(symbol.base());
            if (available.compareTo(order.quantity()) < 0) {
                return "insufficient " + symbol.base() + ": available=" + available + " needed=" + order.quantity();
            }
        }
        return null;
    }
}
