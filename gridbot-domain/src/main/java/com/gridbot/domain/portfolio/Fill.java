package com.gridbot.domain.portfolio;

import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.order.Side;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A confirmed execution to be applied to the ledger.
 *
 * @param clientId idempotency token of the order that produced this fill, null for manual fills
 * @param feeQuote fee charged in quote currency
 */
public record Fill(MarketSymbol symbol,
                   Side side,
                   BigDecimal qtyBase,
                   BigDecimal price,
                   BigDecimal feeQuote,
                   String clientId,
                   Instant timestamp) {

    public Fill {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(qtyBase, "qtyBase");
        Objects.requireNonNull(price, "price");
        feeQuote = feeQuote == null ? BigDecimal.ZERO : feeQuote;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        if (qtyBase.signum() <= 0) throw new IllegalArgumentException("qtyBase must be > 0, got " + qtyBase);
        if (price.signum() <= 0) throw new IllegalArgumentException("price must be > 0, got " + price);
    }

    public static Fill of(MarketSymbol symbol, Side side, BigDecimal qtyBase, BigDecimal price) {
        return new Fill(symbol, side, qtyBase, price, BigDecimal.ZERO, null, Instant.now());
    }
}
