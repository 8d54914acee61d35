package com.gridbot.application.config;

import com.gridbot.application.support.MapConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigValidatorTest {

    private final ConfigValidator validator = new ConfigValidator();

    @Test
    void dryRunNeedsNoKeys() {
        ConfigValidationResult r = validator.validate(base());

        assertThat(r.isValid()).isTrue();
        assertThat(r.errors()).isEmpty();
    }

    @Test
    void liveTradingRequiresKeys() {
        ConfigValidationResult r = validator.validate(base().with("dryRun", "false"));

        assertThat(r.isValid()).isFalse();
        assertThat(r.errors()).anyMatch(e -> e.contains("BITKUB_API_KEY"))
                .anyMatch(e -> e.contains("BITKUB_API_SECRET"));

        ConfigValidationResult ok = validator.validate(base()
                .with("dryRun", "false")
                .with("BITKUB_API_KEY", "k")
                .with("BITKUB_API_SECRET", "s"));
        assertThat(ok.isValid()).isTrue();
    }

    @Test
    void missingSymbolsIsAnError() {
        ConfigValidationResult r = validator.validate(new MapConfig().with("grid.lower", "1").with("grid.upper", "2"));

        assertThat(r.errors()).containsExactly("Missing required config: symbols");
    }

    @Test
    void invertedGridIsAnError() {
        ConfigValidationResult r = validator.validate(base().with("grid.lower", "30"));

        assertThat(r.isValid()).isFalse();
        assertThat(r.errors().get(0)).startsWith("Invalid trading config").contains("lower must be < upper");
    }

    @Test
    void unknownIndicatorClassIsAnError() {
        ConfigValidationResult r = validator.validate(base()
                .with("strategyType", "indicator")
                .with("strategy.indicatorClass", "com.example.NoSuchIndicator"));

        assertThat(r.isValid()).isFalse();
        assertThat(r.errors()).anyMatch(e -> e.contains("com.example.NoSuchIndicator"));
    }

    @Test
    void badBaseUrlIsAnError() {
        ConfigValidationResult r = validator.validate(base().with("exchange.baseUrl", "api.bitkub.com"));

        assertThat(r.isValid()).isFalse();
    }

    @Test
    void stepBelowRoundTripFeeWarns() {
        ConfigValidationResult r = validator.validate(new MapConfig()
                .with("symbols", "XRP_THB")
                .with("grid.center", "32")
                .with("grid.stepPct", "0.4")
                .with("order.feeRate", "0.0025"));

        assertThat(r.isValid()).isTrue();
        assertThat(r.warnings()).singleElement().asString().contains("XRP/THB").contains("0.5%");
    }

    private static MapConfig base() {
        return new MapConfig()
                .with("symbols", "XRP_THB")
                .with("grid.lower", "10")
                .with("grid.upper", "20");
    }
}
