package com.gridbot.cli.tools;

import com.gridbot.application.config.SymbolSettings;
import com.gridbot.application.config.TradingConfig;
import com.gridbot.application.engine.BacktestEngine;
import com.gridbot.application.engine.BacktestReport;
import com.gridbot.domain.market.Candle;
import com.gridbot.domain.market.MarketSymbol;

import java.io.IOException;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Replays a candle CSV through the grid loop for one configured symbol.
 *
 * Usage:
 *   java -jar gridbot-cli.jar backtest <candles.csv> [--symbol XRP_THB]
 *
 * Exit codes:
 *   0: report printed
 *   1: bad arguments or unreadable input
 */
public final class BacktestTool {

    private final PrintStream out;

    public BacktestTool(PrintStream out) {
        this.out = out;
    }

    public int run(TradingConfig config, Path csv, String symbol) {
        if (csv == null) {
            out.println("Usage: backtest <candles.csv> [--symbol BASE_QUOTE]");
            return 1;
        }
        if (!Files.isRegularFile(csv)) {
            out.println("Candle file not found: " + csv.toAbsolutePath());
            return 1;
        }

        SymbolSettings settings;
        try {
            settings = pick(config, symbol);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            return 1;
        }

        List<Candle> candles;
        try {
            candles = CandleCsv.read(csv);
        } catch (IOException | IllegalArgumentException e) {
            out.println("Cannot read candles from " + csv + ": " + e.getMessage());
            return 1;
        }
        if (candles.isEmpty()) {
            out.println("No candles in " + csv);
            return 1;
        }

        BacktestReport report = new BacktestEngine(config).run(settings, candles);
        print(report);
        return 0;
    }

    static SymbolSettings pick(TradingConfig config, String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return config.symbols().get(0);
        }
        MarketSymbol wanted = MarketSymbol.parse(symbol);
        return config.symbols().stream()
                .filter(s -> s.symbol().equals(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Symbol " + wanted + " is not configured"));
    }

    private void print(BacktestReport r) {
        out.println("=== Backtest " + r.symbol() + " ===");
        out.println("candles:        " + r.candles());
        out.println("trades:         " + r.trades() + " (buys " + r.buys() + ", sells " + r.sells()
                + ", skipped " + r.skipped() + ")");
        out.println("final qty:      " + r.finalPosition().quantity().stripTrailingZeros().toPlainString());
        out.println("last price:     " + (r.lastPrice() == null ? "-" : r.lastPrice().toPlainString()));
        out.println("realized P&L:   " + money(r.realizedPnl()));
        out.println("unrealized P&L: " + money(r.unrealizedPnl()));
        out.println("fees paid:      " + money(r.finalPosition().feesPaid()));
        out.println("equity:         " + money(r.startQuote()) + " -> " + money(r.equity())
                + " (net " + money(r.netPnl()) + ")");
        if (r.halted()) {
            out.println("HALTED: the loop stopped before the last candle, see log");
        }
    }

    private static String money(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
