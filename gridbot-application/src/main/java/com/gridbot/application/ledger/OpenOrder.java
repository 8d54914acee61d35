package com.gridbot.application.ledger;

import com.gridbot.domain.order.Side;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * An order handed to the exchange whose outcome is not known yet, persisted with the symbol's
 * record before submission so that a restart can look it up by {@code clientId} instead of trading
 * again.
 *
 * @param decisionPrice price of the decision that produced the order
 * @param decisionBand  grid band of that decision
 */
public record OpenOrder(String clientId,
                        Side side,
                        BigDecimal quantity,
                        BigDecimal limitPrice,
                        BigDecimal decisionPrice,
                        int decisionBand,
                        Instant submittedAt) {

    public OpenOrder {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(decisionPrice, "decisionPrice");
        if (quantity.signum() <= 0) throw new IllegalArgumentException("quantity must be > 0: " + quantity);
        if (decisionPrice.signum() <= 0) {
            throw new IllegalArgumentException("decisionPrice must be > 0: " + decisionPrice);
        }
    }
}
