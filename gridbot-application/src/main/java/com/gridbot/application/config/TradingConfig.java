package com.gridbot.application.config;

import com.gridbot.application.ports.ConfigPort;
import com.gridbot.domain.grid.GridConfig;
import com.gridbot.domain.market.MarketSymbol;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable trading settings, read once at startup.
 *
 * <p>Per-symbol grid keys ({@code grid.XRP_THB.lower}) take precedence over the shared ones
 * ({@code grid.lower}). A grid is defined either by {@code center}/{@code stepPct}/{@code levelsDown}/
 * {@code levelsUp}, or by {@code lower}/{@code upper} plus {@code spacing} or {@code lines}.
 * Percent settings ({@code stepPct}, {@code hysteresis.minMovePct}) are in percent, e.g. 0.7.
 */
public record TradingConfig(List<SymbolSettings> symbols,
                            Duration refresh,
                            boolean dryRun,
                            BigDecimal slippageBps,
                            BigDecimal feeRate,
                            int priceScale,
                            int qtyScale,
                            Duration cooldown,
                            boolean checkBalances,
                            String stateDir,
                            BigDecimal paperInitialQuote,
                            StrategySettings strategy) {

    public static final BigDecimal DEFAULT_STEP_PCT = new BigDecimal("0.7");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public TradingConfig {
        symbols = List.copyOf(symbols);
        Objects.requireNonNull(refresh, "refresh");
        Objects.requireNonNull(cooldown, "cooldown");
        strategy = strategy == null ? StrategySettings.grid() : strategy;
        if (symbols.isEmpty()) throw new IllegalArgumentException("At least one symbol must be configured");
        if (refresh.isZero() || refresh.isNegative()) throw new IllegalArgumentException("refresh must be > 0");
        if (feeRate.signum() < 0) throw new IllegalArgumentException("feeRate must be >= 0");
        if (slippageBps.signum() < 0) throw new IllegalArgumentException("slippageBps must be >= 0");
    }

    public static TradingConfig from(ConfigPort c) {
        Objects.requireNonNull(c, "config");

        String raw = c.get(ConfigKey.SYMBOLS.key(), "");
        List<SymbolSettings> settings = new ArrayList<>();
        for (String token : raw.split(",")) {
            if (token.isBlank()) continue;
            settings.add(symbolSettings(c, MarketSymbol.parse(token)));
        }

        return new TradingConfig(
                settings,
                Duration.ofSeconds(c.getInt(ConfigKey.REFRESH_SEC.key(), 60)),
                c.getBoolean(ConfigKey.DRY_RUN.key(), true),
                decimal(c, ConfigKey.SLIPPAGE_BPS.key(), "8"),
                decimal(c, ConfigKey.FEE_RATE.key(), "0.0025"),
                c.getInt(ConfigKey.PRICE_SCALE.key(), 2),
                c.getInt(ConfigKey.QTY_SCALE.key(), 6),
                Duration.ofSeconds(c.getInt(ConfigKey.COOLDOWN_SEC.key(), 0)),
                c.getBoolean(ConfigKey.CHECK_BALANCES.key(), true),
                c.get(ConfigKey.STATE_DIR.key(), "state"),
                decimal(c, ConfigKey.PAPER_INITIAL_QUOTE.key(), "10000"),
                StrategySettings.from(c)
        );
    }

    static SymbolSettings symbolSettings(ConfigPort c, MarketSymbol symbol) {
        String own = "grid." + symbol.key() + ".";
        BigDecimal notional = firstDecimal(c, "order." + symbol.key() + ".notional", ConfigKey.ORDER_NOTIONAL.key(), "100");

        GridConfig grid;
        BigDecimal defaultMovePct;
        String center = lookup(c, own, "center");
        if (center != null) {
            BigDecimal stepPct = new BigDecimal(orDefault(lookup(c, own, "stepPct"), DEFAULT_STEP_PCT.toPlainString()));
            int down = Integer.parseInt(orDefault(lookup(c, own, "levelsDown"), "10"));
            int up = Integer.parseInt(orDefault(lookup(c, own, "levelsUp"), "10"));
            grid = GridConfig.fromCenter(new BigDecimal(center), stepPct, down, up, notional);
            defaultMovePct = stepPct;
        } else {
            String lower = lookup(c, own, "lower");
            String upper = lookup(c, own, "upper");
            if (lower == null || upper == null) {
                throw new IllegalArgumentException("Grid for " + symbol + " needs grid.center or grid.lower + grid.upper");
            }
            String spacing = lookup(c, own, "spacing");
            grid = spacing != null
                    ? GridConfig.ofSpacing(new BigDecimal(lower), new BigDecimal(upper), new BigDecimal(spacing), notional)
                    : GridConfig.ofLineCount(new BigDecimal(lower), new BigDecimal(upper),
                    Integer.parseInt(orDefault(lookup(c, own, "lines"), "10")), notional);
            defaultMovePct = DEFAULT_STEP_PCT;
        }

        BigDecimal movePct = firstDecimal(c, "hysteresis." + symbol.key() + ".minMovePct",
                ConfigKey.MIN_MOVE_PCT.key(), defaultMovePct.toPlainString());
        return new SymbolSettings(symbol, grid, movePct.divide(HUNDRED, MathContext.DECIMAL64));
    }

    /** Slippage as a fraction (8 bps = 0.0008). */
    public BigDecimal slippageRate() {
        return slippageBps.divide(BigDecimal.valueOf(10_000), MathContext.DECIMAL64);
    }

    private static String lookup(ConfigPort c, String ownPrefix, String name) {
        String v = c.get(ownPrefix + name, null);
        if (v == null || v.isBlank()) v = c.get("grid." + name, null);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static BigDecimal firstDecimal(ConfigPort c, String specific, String shared, String defaultValue) {
        String v = c.get(specific, null);
        if (v == null || v.isBlank()) v = c.get(shared, defaultValue);
        return new BigDecimal(v.trim());
    }

    private static BigDecimal decimal(ConfigPort c, String key, String defaultValue) {
        return new BigDecimal(c.get(key, defaultValue).trim());
    }

    private static String orDefault(String v, String defaultValue) {
        return v == null ? defaultValue : v;
    }
}
