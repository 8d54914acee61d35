package com.gridbot.application.service;

import com.gridbot.application.config.StrategySettings;
import com.gridbot.application.config.SymbolSettings;
import com.gridbot.application.config.TradingConfig;
import com.gridbot.application.exchange.ExchangeClient;
import com.gridbot.application.ledger.PositionLedger;
import com.gridbot.application.metrics.TradingMetrics;
import com.gridbot.application.usecase.DecisionPolicy;
import com.gridbot.application.usecase.GridDecisionPolicy;
import com.gridbot.application.usecase.IndicatorDecisionPolicy;
import com.gridbot.application.usecase.OrderCooldownGuard;
import com.gridbot.application.usecase.OrderSizer;
import com.gridbot.application.usecase.TradeLoop;
import com.gridbot.domain.signal.HysteresisSignal;

import java.time.Clock;
import java.util.Objects;

/**
 * Builds a {@link TradeLoop} per symbol from the trading config. Used by the CLI for live and dry
 * runs and by the backtest.
 */
public class TradeLoopFactory {

    private final TradingConfig config;
    private final TradingMetrics metrics;
    private final Clock clock;
    private final OrderSizer sizer;
    private final OrderCooldownGuard cooldown;

    public TradeLoopFactory(TradingConfig config, TradingMetrics metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sizer = new OrderSizer(config.feeRate(), config.slippageRate(), config.priceScale(), config.qtyScale());
        this.cooldown = new OrderCooldownGuard(config.cooldown(), clock);
    }

    public TradeLoop create(SymbolSettings settings, ExchangeClient exchange, PositionLedger ledger) {
        return create(settings, exchange, ledger, policyFor(config.strategy(), settings));
    }

    public TradeLoop create(SymbolSettings settings, ExchangeClient exchange, PositionLedger ledger, DecisionPolicy policy) {
        return new TradeLoop(settings, exchange, ledger, policy, sizer, cooldown,
                config.checkBalances(), metrics, clock);
    }

    /** A fresh policy for one symbol; indicator policies keep per-symbol candles. */
    public static DecisionPolicy policyFor(StrategySettings strategy, SymbolSettings settings) {
        if (strategy.type() == StrategySettings.Type.INDICATOR) {
            return new IndicatorDecisionPolicy(settings.grid(), strategy.newIndicator(), strategy.params(),
                    strategy.candlePeriod(), strategy.lookback(), strategy.minCandles());
        }
        return gridPolicy(settings);
    }

    public static DecisionPolicy gridPolicy(SymbolSettings settings) {
        return new GridDecisionPolicy(new HysteresisSignal(settings.grid(), settings.minMovePct()));
    }
}
