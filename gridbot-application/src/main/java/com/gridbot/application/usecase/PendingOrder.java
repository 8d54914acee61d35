package com.gridbot.application.usecase;

import com.gridbot.application.ledger.OpenOrder;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.OrderStatus;
import com.gridbot.domain.order.Side;
import com.gridbot.domain.signal.Decision;
import com.gridbot.domain.signal.TradeAction;

import java.time.Instant;

/**
 * An order whose submission did not return a final result, with the decision that produced it.
 */
record PendingOrder(Order order, Decision decision, Instant submittedAt) {

    OpenOrder toOpenOrder() {
        return new OpenOrder(order.clientId(), order.side(), order.quantity(), order.limitPrice(),
                decision.price(), decision.newBand(), submittedAt);
    }

    /** Rebuilds the in-flight order from the persisted record of a previous run. */
    static PendingOrder restore(MarketSymbol symbol, OpenOrder open) {
        Order order = new Order(open.clientId(), symbol, open.side(), open.quantity(), open.limitPrice());
        order.transitionTo(OrderStatus.SUBMITTED);
        TradeAction action = open.side() == Side.BUY ? TradeAction.BUY : TradeAction.SELL;
        Decision decision = new Decision(action, open.decisionPrice(), open.decisionBand(), null,
                "resumed unresolved order");
        return new PendingOrder(order, decision, open.submittedAt());
    }
}
