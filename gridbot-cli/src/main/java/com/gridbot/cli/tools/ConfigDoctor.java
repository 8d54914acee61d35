package com.gridbot.cli.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gridbot.application.config.ConfigKey;
import com.gridbot.application.config.ConfigValidationResult;
import com.gridbot.application.config.ConfigValidator;
import com.gridbot.application.config.SymbolSettings;
import com.gridbot.application.config.TradingConfig;
import com.gridbot.application.ports.ConfigPort;
import com.gridbot.domain.grid.GridConfig;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;

/**
 * Configuration diagnostics.
 *
 * Usage:
 *   java -jar gridbot-cli.jar validate-config [--config DIR] [--full] [--json]
 *
 * Exit codes:
 *   0: OK (warnings allowed)
 *   2: Problems found
 */
public final class ConfigDoctor {

    public static final int OK = 0;
    public static final int PROBLEMS = 2;

    private static final String[] SECRET_KEYS = {
            ConfigKey.BITKUB_API_KEY.key(),
            ConfigKey.BITKUB_API_SECRET.key()
    };

    private static final String[] CONFIG_KEYS = {
            ConfigKey.SYMBOLS.key(),
            ConfigKey.DRY_RUN.key(),
            ConfigKey.REFRESH_SEC.key(),
            ConfigKey.EXCHANGE_BASE_URL.key(),
            ConfigKey.STRATEGY_TYPE.key(),
            ConfigKey.STATE_DIR.key()
    };

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ObjectMapper om = new ObjectMapper();
    private final PrintStream out;
    private final Clock clock;

    public ConfigDoctor(PrintStream out, Clock clock) {
        this.out = out;
        this.clock = clock;
    }

    public int run(ConfigPort cfg, boolean full, boolean json) {
        ConfigValidationResult res = new ConfigValidator().validate(cfg);
        int code = res.isValid() ? OK : PROBLEMS;

        if (json) {
            out.println(toJson(cfg, res, full));
            return code;
        }

        if (full) {
            out.println("\nConfig");
            for (String k : CONFIG_KEYS) {
                out.println(" - " + k + " = " + cfg.get(k, "<unset>"));
            }
            out.println("\nSecrets (masked)");
            for (String k : SECRET_KEYS) {
                out.println(" - " + k + " = " + mask(cfg.getSecret(k)));
            }
            if (res.isValid()) printGrids(TradingConfig.from(cfg));
            out.println();
        }

        for (String w : res.warnings()) {
            out.println("WARN: " + w);
        }
        if (res.isValid()) {
            out.println("Config OK.");
            return OK;
        }

        out.println("Config problems:");
        for (String err : res.errors()) {
            out.println(" - " + err);
        }
        out.println("\nTips:");
        out.println(" - Put settings in config/config.properties and keys in config/secrets.properties or config/.env");
        out.println(" - Or set env overrides like GRIDBOT_SYMBOLS, BITKUB_API_KEY, BITKUB_API_SECRET");
        return PROBLEMS;
    }

    private void printGrids(TradingConfig trading) {
        String mode = trading.dryRun() ? "paper" : "live";
        out.println("\nGrids (" + mode + ", strategy " + trading.strategy().type().name().toLowerCase(Locale.ROOT) + ")");
        for (SymbolSettings s : trading.symbols()) {
            GridConfig g = s.grid();
            out.println(" - " + s.symbol() + ": " + g.lineCount() + " lines " + plain(g.lower()) + " .. " + plain(g.upper())
                    + ", notional " + plain(g.orderNotional())
                    + ", min move " + plain(percent(s.minMovePct())) + "%"
                    + ", net per step " + plain(percent(netPerStep(s, trading))) + "%");
        }
    }

    /** Min move less the two fees of a buy/sell round trip, as a fraction. */
    static BigDecimal netPerStep(SymbolSettings s, TradingConfig trading) {
        return s.minMovePct().subtract(trading.feeRate().multiply(BigDecimal.valueOf(2)));
    }

    /** {@code <empty>} when unset, {@code ***} for short values, otherwise first and last two characters. */
    static String mask(String v) {
        if (v == null || v.isBlank()) return "<empty>";
        String t = v.trim();
        if (t.length() <= 6) return "***";
        return t.substring(0, 2) + "***" + t.substring(t.length() - 2);
    }

    private static BigDecimal percent(BigDecimal fraction) {
        return fraction.multiply(HUNDRED);
    }

    private static String plain(BigDecimal v) {
        return v.stripTrailingZeros().toPlainString();
    }

    String toJson(ConfigPort cfg, ConfigValidationResult res, boolean full) {
        ObjectNode root = om.createObjectNode();
        root.put("ok", res.isValid());
        root.put("generated_at_utc", clock.instant().toString());
        ArrayNode errors = root.putArray("errors");
        res.errors().forEach(errors::add);
        ArrayNode warnings = root.putArray("warnings");
        res.warnings().forEach(warnings::add);
        if (full) {
            ObjectNode config = root.putObject("config");
            for (String k : CONFIG_KEYS) {
                config.put(k, cfg.get(k, null));
            }
            ObjectNode secrets = root.putObject("secrets_masked");
            for (String k : SECRET_KEYS) {
                secrets.put(k, mask(cfg.getSecret(k)));
            }
            if (res.isValid()) {
                TradingConfig trading = TradingConfig.from(cfg);
                ArrayNode grids = root.putArray("grids");
                for (SymbolSettings s : trading.symbols()) {
                    ObjectNode g = grids.addObject();
                    g.put("symbol", s.symbol().key());
                    g.put("lines", s.grid().lineCount());
                    g.put("lower", s.grid().lower());
                    g.put("upper", s.grid().upper());
                    g.put("order_notional", s.grid().orderNotional());
                    g.put("min_move_pct", percent(s.minMovePct()));
                    g.put("net_per_step_pct", percent(netPerStep(s, trading)));
                }
            }
        }
        try {
            return om.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render report", e);
        }
    }
}
