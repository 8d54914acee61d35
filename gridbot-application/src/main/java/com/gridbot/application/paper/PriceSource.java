package com.gridbot.application.paper;

import com.gridbot.application.exchange.ExchangeException;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.market.PriceTick;

/**
 * Where the paper exchange reads prices from: the live exchange in dry-run mode, a candle replay in
 * backtests.
 */
@FunctionalInterface
public interface PriceSource {

    PriceTick latest(MarketSymbol symbol) throws ExchangeException;
}
