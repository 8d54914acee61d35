package com.gridbot.application.paper;

import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.OrderResult;
import com.gridbot.domain.order.OrderStatus;
import com.gridbot.domain.order.Side;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PaperExchangeClientTest {

    private static final MarketSymbol XRP = MarketSymbol.parse("XRP_THB");

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final PaperExchangeClient client = new PaperExchangeClient(
            s -> new PriceTick(s, new BigDecimal("20"), clock.instant()),
            new PaperExecutionModel(new BigDecimal("0.0025"), new BigDecimal("0.001")),
            Map.of("THB", new BigDecimal("1000")),
            clock);

    @Test
    void limitBuyFillsAtLimitAndMovesBalances() throws Exception {
        Order order = Order.limit(XRP, Side.BUY, new BigDecimal("4"), new BigDecimal("20.02"));

        OrderResult r = client.placeOrder(order);

        assertThat(r.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(r.avgPrice()).isEqualByComparingTo("20.02");
        assertThat(r.filledQty()).isEqualByComparingTo("4");
        // 80.08 * 0.0025
        assertThat(r.fee()).isEqualByComparingTo("0.2002");
        assertThat(client.getAvailable("XRP")).isEqualByComparingTo("4");
        assertThat(client.getAvailable("THB")).isEqualByComparingTo("919.7198");
    }

    @Test
    void marketSellFillsBelowLastPrice() throws Exception {
        client.placeOrder(Order.limit(XRP, Side.BUY, new BigDecimal("4"), new BigDecimal("20")));

        OrderResult r = client.placeOrder(Order.market(XRP, Side.SELL, new BigDecimal("4")));

        assertThat(r.avgPrice()).isEqualByComparingTo("19.98");
        assertThat(client.getAvailable("XRP")).isEqualByComparingTo("0");
    }

    @Test
    void sameClientIdFillsOnce() throws Exception {
        Order order = Order.limit(XRP, Side.BUY, new BigDecimal("1"), new BigDecimal("20"));

        OrderResult first = client.placeOrder(order);
        OrderResult second = client.placeOrder(order);

        assertThat(second).isEqualTo(first);
        assertThat(client.getAvailable("XRP")).isEqualByComparingTo("1");
        assertThat(client.findByClientId(XRP, order.clientId())).contains(first);
        assertThat(client.getOrderStatus(XRP, first.orderId(), Side.BUY)).isEqualTo(first);
    }
}
