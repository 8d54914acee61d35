package com.gridbot.application.usecase;

import com.gridbot.application.config.SymbolSettings;
import com.gridbot.application.exchange.OrderRejectedException;
import com.gridbot.application.exchange.TransientNetworkException;
import com.gridbot.application.execution.CancellationToken;
import com.gridbot.application.ledger.PersistenceException;
import com.gridbot.application.ledger.PositionLedger;
import com.gridbot.application.ledger.SymbolState;
import com.gridbot.application.metrics.TradingMetrics;
import com.gridbot.application.ports.PositionStore;
import com.gridbot.application.ports.impl.InMemoryPositionStore;
import com.gridbot.application.service.TradeLoopFactory;
import com.gridbot.application.support.FakeExchangeClient;
import com.gridbot.application.support.MutableClock;
import com.gridbot.domain.grid.GridConfig;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.OrderResult;
import com.gridbot.domain.order.Side;
import com.gridbot.domain.portfolio.Position;
import com.gridbot.domain.signal.HysteresisState;
import com.gridbot.domain.signal.TradeAction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TradeLoopTest {

    private static final MarketSymbol XRP = MarketSymbol.parse("XRP_THB");

    private final GridConfig grid = GridConfig.ofLineCount(bd("90"), bd("110"), 3, bd("100"));
    private final SymbolSettings settings = new SymbolSettings(XRP, grid, bd("0.01"));
    private final FakeExchangeClient exchange = new FakeExchangeClient();
    private final InMemoryPositionStore store = new InMemoryPositionStore();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final TradingMetrics metrics = TradingMetrics.inMemory();
    private final CancellationToken token = new CancellationToken();
    private PositionLedger ledger = new PositionLedger(store, clock);

    @Test
    void buyHoldSellScenarioUpdatesLedgerOnlyOnFills() {
        seed(bd("1"), bd("100"), new HysteresisState(bd("100"), 1));
        exchange.price("95").price("94").price("105");
        TradeLoop loop = loop(Duration.ZERO, false);

        CycleResult buy = loop.runCycle(token);
        assertThat(buy.outcome()).isEqualTo(CycleOutcome.FILLED);
        assertThat(buy.action()).isEqualTo(TradeAction.BUY);
        Order buyOrder = exchange.placed().get(0);
        assertThat(buyOrder.side()).isEqualTo(Side.BUY);
        assertThat(buyOrder.limitPrice()).isEqualByComparingTo("95");
        assertThat(buyOrder.quantity()).isEqualByComparingTo("1.052631");
        assertThat(ledger.hysteresis(XRP)).isEqualTo(new HysteresisState(bd("95"), 0));

        CycleResult hold = loop.runCycle(token);
        assertThat(hold.outcome()).isEqualTo(CycleOutcome.HOLD);
        assertThat(exchange.placed()).hasSize(1);

        CycleResult sell = loop.runCycle(token);
        assertThat(sell.outcome()).isEqualTo(CycleOutcome.FILLED);
        assertThat(sell.action()).isEqualTo(TradeAction.SELL);
        assertThat(exchange.placed().get(1).quantity()).isEqualByComparingTo("0.952380");

        Position p = ledger.position(XRP);
        assertThat(p.quantity()).isEqualByComparingTo("1.100251");
        assertThat(p.realizedPnl()).isPositive();
        assertThat(ledger.hysteresis(XRP)).isEqualTo(new HysteresisState(bd("105"), 1));
        assertThat(metrics.registry().get("gridbot.orders.filled").tag("side", "BUY").counter().count()).isEqualTo(1.0);
        assertThat(metrics.registry().get("gridbot.orders.filled").tag("side", "SELL").counter().count()).isEqualTo(1.0);
    }

    @Test
    void rejectedOrderLeavesStateAndCooldownUntouched() {
        exchange.price("85").price("85");
        exchange.nextOrder(o -> {
            throw new OrderRejectedException("insufficient balance", 18);
        });
        TradeLoop loop = loop(Duration.ofSeconds(90), false);

        CycleResult rejected = loop.runCycle(token);

        assertThat(rejected.outcome()).isEqualTo(CycleOutcome.REJECTED);
        assertThat(ledger.hysteresis(XRP)).isEqualTo(HysteresisState.initial());
        assertThat(ledger.position(XRP).isOpen()).isFalse();
        assertThat(loop.hasPendingOrder()).isFalse();
        assertThat(metrics.registry().get("gridbot.orders.rejected").counter().count()).isEqualTo(1.0);

        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.FILLED);
    }

    @Test
    void sameTickIsRetriedAfterRejection() {
        Instant t = Instant.parse("2024-02-01T10:00:00Z");
        exchange.priceAt("85", t).priceAt("85", t);
        exchange.nextOrder(o -> {
            throw new OrderRejectedException("insufficient balance", 18);
        });
        TradeLoop loop = loop(Duration.ZERO, false);

        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.REJECTED);
        CycleResult retry = loop.runCycle(token);

        assertThat(retry.outcome()).isEqualTo(CycleOutcome.FILLED);
        assertThat(exchange.placed()).hasSize(2);
    }

    @Test
    void cancelledWithoutFillChangesNothing() {
        exchange.price("85");
        exchange.nextOrder(o -> OrderResult.cancelled(o.clientId(), "77", "fill timeout"));
        TradeLoop loop = loop(Duration.ZERO, false);

        CycleResult r = loop.runCycle(token);

        assertThat(r.outcome()).isEqualTo(CycleOutcome.CANCELLED);
        SymbolState after = ledger.state(XRP);
        assertThat(after.position()).isEqualTo(Position.flat(XRP));
        assertThat(after.hysteresis()).isEqualTo(HysteresisState.initial());
        assertThat(after.appliedTokens()).isEmpty();
        assertThat(after.openOrder()).isNull();
    }

    @Test
    void unknownOutcomeIsReconciledByClientIdInsteadOfResubmitted() {
        exchange.price("85");
        exchange.nextOrder(o -> {
            exchange.knows(o.clientId(),
                    OrderResult.filled(o.clientId(), "501", o.quantity(), o.limitPrice(), bd("0.25")));
            throw new TransientNetworkException("read timed out");
        });
        TradeLoop loop = loop(Duration.ZERO, false);

        CycleResult first = loop.runCycle(token);
        assertThat(first.outcome()).isEqualTo(CycleOutcome.PENDING);
        assertThat(loop.hasPendingOrder()).isTrue();
        assertThat(ledger.position(XRP).isOpen()).isFalse();

        CycleResult second = loop.runCycle(token);
        assertThat(second.outcome()).isEqualTo(CycleOutcome.FILLED);
        assertThat(loop.hasPendingOrder()).isFalse();
        assertThat(exchange.placed()).hasSize(1);

        Order order = exchange.placed().get(0);
        assertThat(ledger.position(XRP).quantity()).isEqualByComparingTo(order.quantity());
        assertThat(ledger.position(XRP).feesPaid()).isEqualByComparingTo("0.25");
        assertThat(ledger.state(XRP).appliedTokens()).containsExactly(order.clientId());
        assertThat(ledger.hysteresis(XRP).lastTradePrice()).isEqualByComparingTo("85");
    }

    @Test
    void orderInFlightAtRestartIsReconciledNotResubmitted() {
        exchange.price("85");
        exchange.nextOrder(o -> {
            exchange.knows(o.clientId(),
                    OrderResult.filled(o.clientId(), "502", o.quantity(), o.limitPrice(), BigDecimal.ZERO));
            throw new TransientNetworkException("read timed out");
        });
        assertThat(loop(Duration.ZERO, false).runCycle(token).outcome()).isEqualTo(CycleOutcome.PENDING);
        String clientId = exchange.placed().get(0).clientId();
        assertThat(store.load(XRP).orElseThrow().openOrder().clientId()).isEqualTo(clientId);

        // process restart: new ledger and loop over the same store
        ledger = new PositionLedger(store, clock);
        ledger.load(XRP);
        TradeLoop restarted = loop(Duration.ZERO, false);
        assertThat(restarted.hasPendingOrder()).isTrue();

        CycleResult resumed = restarted.runCycle(token);

        assertThat(resumed.outcome()).isEqualTo(CycleOutcome.FILLED);
        assertThat(exchange.placed()).hasSize(1);
        assertThat(ledger.position(XRP).quantity()).isEqualByComparingTo(exchange.placed().get(0).quantity());
        assertThat(ledger.hysteresis(XRP).lastTradePrice()).isEqualByComparingTo("85");
        assertThat(ledger.state(XRP).appliedTokens()).containsExactly(clientId);
        assertThat(store.load(XRP).orElseThrow().openOrder()).isNull();
        assertThat(restarted.hasPendingOrder()).isFalse();
    }

    @Test
    void pendingOrderIsResolvedOnRequest() {
        exchange.price("85");
        exchange.nextOrder(o -> {
            exchange.knows(o.clientId(), OrderResult.cancelled(o.clientId(), "503", "expired"));
            throw new TransientNetworkException("read timed out");
        });
        TradeLoop loop = loop(Duration.ZERO, false);
        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.PENDING);

        assertThat(loop.resolvePendingOrder()).isTrue();

        assertThat(loop.hasPendingOrder()).isFalse();
        assertThat(ledger.position(XRP).isOpen()).isFalse();
        assertThat(store.load(XRP).orElseThrow().openOrder()).isNull();
    }

    @Test
    void orderTheExchangeNeverSawIsDroppedAndTradingContinues() {
        exchange.price("85").price("85");
        exchange.nextOrder(o -> {
            throw new TransientNetworkException("connection reset");
        });
        TradeLoop loop = loop(Duration.ZERO, false);

        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.PENDING);
        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.FILLED);

        assertThat(exchange.placed()).hasSize(2);
        assertThat(exchange.placed().get(0).clientId()).isNotEqualTo(exchange.placed().get(1).clientId());
        assertThat(ledger.state(XRP).appliedTokens()).containsExactly(exchange.placed().get(1).clientId());
    }

    @Test
    void persistenceFailureHaltsBeforeAnythingIsSent() {
        PositionStore failing = mock(PositionStore.class);
        when(failing.load(any())).thenReturn(Optional.empty());
        doThrow(new PersistenceException("disk full")).when(failing).save(any());
        ledger = new PositionLedger(failing, clock);
        exchange.price("85").price("85");
        TradeLoop loop = loop(Duration.ZERO, false);

        CycleResult r = loop.runCycle(token);

        assertThat(r.outcome()).isEqualTo(CycleOutcome.HALTED);
        assertThat(loop.isHalted()).isTrue();
        assertThat(loop.haltReason()).contains("disk full");
        assertThat(ledger.position(XRP).isOpen()).isFalse();

        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.HALTED);
        assertThat(exchange.placed()).isEmpty();
    }

    @Test
    void staleTickIsDropped() {
        Instant t = Instant.parse("2024-02-01T10:00:00Z");
        exchange.priceAt("105", t).priceAt("85", t.minusSeconds(1));
        TradeLoop loop = loop(Duration.ZERO, false);

        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.HOLD);
        CycleResult stale = loop.runCycle(token);

        assertThat(stale.outcome()).isEqualTo(CycleOutcome.SKIPPED);
        assertThat(stale.message()).isEqualTo("stale tick");
        assertThat(exchange.placed()).isEmpty();
    }

    @Test
    void sellWithoutPositionIsSkipped() {
        seed(BigDecimal.ZERO, null, new HysteresisState(bd("95"), 0));
        exchange.price("105");
        TradeLoop loop = loop(Duration.ZERO, false);

        CycleResult r = loop.runCycle(token);

        assertThat(r.outcome()).isEqualTo(CycleOutcome.SKIPPED);
        assertThat(r.action()).isEqualTo(TradeAction.SELL);
        assertThat(r.message()).isEqualTo("no position to sell");
        assertThat(exchange.placed()).isEmpty();
    }

    @Test
    void cooldownSuppressesTradesUntilItExpires() {
        seed(bd("1"), bd("100"), new HysteresisState(bd("100"), 1));
        exchange.price("95").price("105").price("106");
        TradeLoop loop = loop(Duration.ofSeconds(90), false);

        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.FILLED);

        CycleResult cooling = loop.runCycle(token);
        assertThat(cooling.outcome()).isEqualTo(CycleOutcome.SKIPPED);
        assertThat(cooling.message()).isEqualTo("cooldown");

        clock.advance(Duration.ofSeconds(91));
        CycleResult sell = loop.runCycle(token);
        assertThat(sell.outcome()).isEqualTo(CycleOutcome.FILLED);
        assertThat(sell.action()).isEqualTo(TradeAction.SELL);
    }

    @Test
    void missingQuoteBalanceSkipsBuy() {
        exchange.balance("THB", "50").price("85");
        TradeLoop loop = loop(Duration.ZERO, true);

        CycleResult r = loop.runCycle(token);

        assertThat(r.outcome()).isEqualTo(CycleOutcome.SKIPPED);
        assertThat(r.message()).startsWith("insufficient THB");
        assertThat(exchange.placed()).isEmpty();
    }

    @Test
    void cancelledTokenPlacesNoOrder() {
        exchange.price("85");
        TradeLoop loop = loop(Duration.ZERO, false);
        token.cancel();

        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.SKIPPED);
        assertThat(exchange.placed()).isEmpty();
    }

    @Test
    void priceFailureIsReportedAndRetriedNextCycle() {
        exchange.priceFailure(new TransientNetworkException("503")).price("105");
        TradeLoop loop = loop(Duration.ZERO, false);

        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.ERROR);
        assertThat(loop.runCycle(token).outcome()).isEqualTo(CycleOutcome.HOLD);
        assertThat(metrics.registry().get("gridbot.cycles.failed").counter().count()).isEqualTo(1.0);
    }

    private TradeLoop loop(Duration cooldown, boolean checkBalances) {
        return new TradeLoop(settings, exchange, ledger, TradeLoopFactory.gridPolicy(settings),
                new OrderSizer(BigDecimal.ZERO, BigDecimal.ZERO, 2, 6),
                new OrderCooldownGuard(cooldown, clock), checkBalances, metrics, clock);
    }

    private void seed(BigDecimal qty, BigDecimal avg, HysteresisState hysteresis) {
        Position p = new Position(XRP, qty, avg, BigDecimal.ZERO, BigDecimal.ZERO);
        store.save(new SymbolState(XRP, p, hysteresis, List.of(), null));
        ledger = new PositionLedger(store, clock);
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }
}
