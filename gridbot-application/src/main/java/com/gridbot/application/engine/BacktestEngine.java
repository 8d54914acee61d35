package com.gridbot.application.engine;

import com.gridbot.application.config.SymbolSettings;
import com.gridbot.application.config.TradingConfig;
import com.gridbot.application.execution.CancellationToken;
import com.gridbot.application.ledger.PositionLedger;
import com.gridbot.application.metrics.TradingMetrics;
import com.gridbot.application.paper.PaperExchangeClient;
import com.gridbot.application.paper.PaperExecutionModel;
import com.gridbot.application.ports.impl.InMemoryPositionStore;
import com.gridbot.application.service.TradeLoopFactory;
import com.gridbot.application.usecase.CycleOutcome;
import com.gridbot.application.usecase.CycleResult;
import com.gridbot.application.usecase.DecisionPolicy;
import com.gridbot.application.usecase.TradeLoop;
import com.gridbot.domain.market.Candle;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.portfolio.Position;
import com.gridbot.domain.signal.TradeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Offline simulation: replays candle closes through the same {@link TradeLoop} as live trading, with
 * the paper exchange, an in-memory ledger and a clock that follows the candles.
 *
 * Each candle is one cycle; its close is the tick price and its close time the tick time.
 */
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private final TradingConfig config;

    public BacktestEngine(TradingConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public BacktestReport run(SymbolSettings settings, List<Candle> candles) {
        return run(settings, candles, TradeLoopFactory.policyFor(config.strategy(), settings));
    }

    public BacktestReport run(SymbolSettings settings, List<Candle> candles, DecisionPolicy policy) {
        Objects.requireNonNull(settings, "settings");
        if (candles == null || candles.isEmpty()) {
            throw new IllegalArgumentException("Backtest needs at least one candle");
        }
        MarketSymbol symbol = settings.symbol();

        ReplayClock clock = new ReplayClock(Instant.ofEpochMilli(candles.get(0).closeTime()));
        Candle[] cursor = new Candle[1];
        PaperExchangeClient exchange = new PaperExchangeClient(
                s -> new PriceTick(s, BigDecimal.valueOf(cursor[0].close()), Instant.ofEpochMilli(cursor[0].closeTime())),
                new PaperExecutionModel(config.feeRate(), config.slippageRate()),
                Map.of(symbol.quote(), config.paperInitialQuote()),
                clock);
        PositionLedger ledger = new PositionLedger(new InMemoryPositionStore(), clock);
        TradeLoop loop = new TradeLoopFactory(config, TradingMetrics.inMemory(), clock)
                .create(settings, exchange, ledger, policy);

        CancellationToken token = new CancellationToken();
        int buys = 0;
        int sells = 0;
        int skipped = 0;
        boolean halted = false;
        for (Candle c : candles) {
            cursor[0] = c;
            clock.set(Instant.ofEpochMilli(c.closeTime()));
            CycleResult r = loop.runCycle(token);
            if (r.outcome() == CycleOutcome.FILLED) {
                if (r.action() == TradeAction.BUY) buys++;
                else sells++;
            } else if (r.outcome() == CycleOutcome.SKIPPED) {
                skipped++;
            } else if (r.outcome() == CycleOutcome.HALTED) {
                halted = true;
                break;
            }
        }

        BigDecimal last = BigDecimal.valueOf(cursor[0].close());
        Position pos = ledger.position(symbol);
        BigDecimal endQuote = exchange.getAvailable(symbol.quote());
        BigDecimal equity = endQuote.add(exchange.getAvailable(symbol.base()).multiply(last));

        BacktestReport report = new BacktestReport(symbol, candles.size(), buys, sells, skipped, pos, last,
                config.paperInitialQuote(), endQuote, equity, halted);
        log.info("Backtest {}: candles={} buys={} sells={} realized={} unrealized={} fees={} equity={} net={}",
                symbol, report.candles(), buys, sells, report.realizedPnl(), report.unrealizedPnl(),
                pos.feesPaid(), equity, report.netPnl());
        return report;
    }

    /** Clock pinned to the candle being replayed. */
    static final class ReplayClock extends Clock {
        private volatile Instant now;

        ReplayClock(Instant start) {
            this.now = start;
        }

        void set(Instant instant) {
            this.now = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
