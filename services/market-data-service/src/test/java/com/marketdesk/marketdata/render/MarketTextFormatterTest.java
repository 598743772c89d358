package com.marketdesk.marketdata.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.marketdesk.marketdata.dto.Order;
import com.marketdesk.marketdata.dto.Quote;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class MarketTextFormatterTest {
  private final MarketTextFormatter formatter = new MarketTextFormatter();

  @Test
  void quoteShowsSignedChangeAndKnownFieldsOnly() {
    Quote quote =
        new Quote(
            "AAPL",
            new BigDecimal("190.5"),
            new BigDecimal("1.234"),
            new BigDecimal("0.65"),
            null,
            null,
            new BigDecimal("192"),
            null,
            null,
            null,
            "USD",
            OffsetDateTime.parse("2025-01-10T12:00:00Z"));

    assertThat(formatter.quote(quote))
        .isEqualTo("AAPL: 190.50 USD (+1.23, +0.65%)\nHigh: 192.00\nAs of 2025-01-10T12:00Z");
  }

  @Test
  void missingPriceUsesPlaceholder() {
    Quote quote =
        new Quote(
            "XYZ", null, new BigDecimal("-2"), null, null, null, null, null, null, null, null, null);

    assertThat(formatter.quote(quote)).isEqualTo("XYZ: — (-2.00, —%)");
  }

  @Test
  void ordersAreBulletLinesUpToLimit() {
    List<Order> orders =
        List.of(
            new Order("1", "2025-01-10T12:00:00Z", "buy", "BTC", "0.001000", "filled"),
            new Order("2", "2025-01-10T11:00:00Z", "sell", "ETH", "0.002000", "filled"),
            new Order("3", "2025-01-10T10:00:00Z", "buy", "BTC", "0.003000", "filled"));

    assertThat(formatter.orders(orders, 2))
        .isEqualTo(
            "• 2025-01-10T12:00:00Z | BUY 0.001000 BTC — filled\n"
                + "• 2025-01-10T11:00:00Z | SELL 0.002000 ETH — filled");
  }

  @Test
  void noOrdersExplainsWhy() {
    assertThat(formatter.orders(List.of(), 5)).isEqualTo(MarketTextFormatter.NO_ORDERS);
  }
}
