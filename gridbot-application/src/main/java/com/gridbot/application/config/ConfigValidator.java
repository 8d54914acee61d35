package com.gridbot.application.config;

import com.gridbot.application.ports.ConfigPort;

import java.math.BigDecimal;

public final class ConfigValidator {

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        boolean dryRun = config.getBoolean(ConfigKey.DRY_RUN.key(), true);
        for (ConfigKey k : ConfigKey.values()) {
            if (k.isOptional()) continue;
            // keys are only needed for live trading
            if (k.isSecret() && dryRun) continue;

            String v = k.isSecret() ? config.getSecret(k.key()) : config.get(k.key());
            if (v == null || v.isBlank()) {
                res.addError("Missing required " + (k.isSecret() ? "secret" : "config") + ": " + k.key());
            }
        }

        String url = config.get(ConfigKey.EXCHANGE_BASE_URL.key(), "");
        if (!url.isBlank() && !(url.startsWith("http://") || url.startsWith("https://"))) {
            res.addError(ConfigKey.EXCHANGE_BASE_URL.key() + " must start with http:// or https://");
        }

        if (!res.isValid()) return res;

        TradingConfig trading;
        try {
            trading = TradingConfig.from(config);
        } catch (IllegalArgumentException e) {
            res.addError("Invalid trading config: " + e.getMessage());
            return res;
        }

        if (trading.strategy().type() == StrategySettings.Type.INDICATOR) {
            try {
                trading.strategy().newIndicator();
            } catch (IllegalArgumentException e) {
                res.addError(e.getMessage());
            }
        }

        // round trip costs two fees; a grid step below that never pays
        BigDecimal roundTripFeePct = trading.feeRate().multiply(BigDecimal.valueOf(200));
        for (SymbolSettings s : trading.symbols()) {
            BigDecimal minMovePct = s.minMovePct().multiply(BigDecimal.valueOf(100));
            if (minMovePct.compareTo(roundTripFeePct) <= 0) {
                res.addWarning(s.symbol() + ": min move " + minMovePct.stripTrailingZeros().toPlainString()
                        + "% <= round-trip fee " + roundTripFeePct.stripTrailingZeros().toPlainString()
                        + "%, grid profit before slippage is not positive");
            }
        }
        return res;
    }
}
