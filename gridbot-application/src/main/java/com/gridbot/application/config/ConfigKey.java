package com.gridbot.application.config;

/**
 * Known configuration keys.
 * Secrets are stored in secrets.properties or the environment, never in config.properties.
 */
public enum ConfigKey {
    BITKUB_API_KEY("BITKUB_API_KEY", true, false),
    BITKUB_API_SECRET("BITKUB_API_SECRET", true, false),
    EXCHANGE_BASE_URL("exchange.baseUrl", false, true),
    EXCHANGE_HTTP_TIMEOUT_MS("exchange.httpTimeoutMs", false, true),
    EXCHANGE_MAX_CONCURRENT_REQUESTS("exchange.maxConcurrentRequests", false, true),
    EXCHANGE_TIME_SYNC_SECONDS("exchange.timeSyncSeconds", false, true),
    EXCHANGE_FILL_TIMEOUT_MS("exchange.fillTimeoutMs", false, true),
    EXCHANGE_FILL_POLL_MS("exchange.fillPollMs", false, true),

    RETRY_MAX_ATTEMPTS("retry.maxAttempts", false, true),
    RETRY_BASE_DELAY_MS("retry.baseDelayMs", false, true),
    RETRY_MULTIPLIER("retry.multiplier", false, true),
    RETRY_MAX_DELAY_MS("retry.maxDelayMs", false, true),
    RETRY_JITTER_MS("retry.jitterMs", false, true),
    RETRY_RATE_LIMIT_DEFAULT_MS("retry.rateLimitDefaultMs", false, true),
    RETRY_MAX_RATE_LIMIT_WAITS("retry.maxRateLimitWaits", false, true),

    SYMBOLS("symbols", false, false),
    DRY_RUN("dryRun", false, true),
    REFRESH_SEC("refreshSec", false, true),
    ORDER_NOTIONAL("order.notional", false, true),
    SLIPPAGE_BPS("order.slippageBps", false, true),
    FEE_RATE("order.feeRate", false, true),
    PRICE_SCALE("order.priceScale", false, true),
    QTY_SCALE("order.qtyScale", false, true),
    COOLDOWN_SEC("cooldownSec", false, true),
    MIN_MOVE_PCT("hysteresis.minMovePct", false, true),
    CHECK_BALANCES("order.checkBalances", false, true),

    STRATEGY_TYPE("strategyType", false, true),
    STRATEGY_INDICATOR_CLASS("strategy.indicatorClass", false, true),
    STRATEGY_CANDLE_SEC("strategy.candleSec", false, true),
    STRATEGY_LOOKBACK("strategy.lookback", false, true),
    STRATEGY_MIN_CANDLES("strategy.minCandles", false, true),
    STRATEGY_PARAMS("strategy.params", false, true),

    STATE_DIR("state.dir", false, true),
    PAPER_INITIAL_QUOTE("paper.initialQuoteBalance", false, true);

    private final String key;
    private final boolean secret;
    private final boolean optional;

    ConfigKey(String key, boolean secret, boolean optional) {
        this.key = key;
        this.secret = secret;
        this.optional = optional;
    }

    public String key() { return key; }
    public boolean isSecret() { return secret; }
    public boolean isOptional() { return optional; }
}
