package com.marketdesk.marketdata.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketdesk.marketdata.client.ValidationException;
import com.marketdesk.marketdata.dto.OrderBook;
import com.marketdesk.marketdata.dto.OrderBookLevel;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DepthChartRendererTest {
  private final DepthChartRenderer renderer = new DepthChartRenderer();

  private static OrderBookLevel level(String price, String size) {
    return new OrderBookLevel(new BigDecimal(price), new BigDecimal(size));
  }

  private static final List<OrderBookLevel> BIDS = List.of(level("100", "5"), level("99", "3"));
  private static final List<OrderBookLevel> ASKS = List.of(level("101", "2"), level("102", "6"));

  @Test
  void barsScaleAgainstLargestSizeOnTheirOwnSide() {
    assertThat(DepthChartRenderer.barLengths(BIDS, 18)).containsExactly(18, 11);
    assertThat(DepthChartRenderer.barLengths(ASKS, 18)).containsExactly(6, 18);
  }

  @Test
  void tinyPositiveSizesStillGetOneBlock() {
    List<OrderBookLevel> levels = List.of(level("1", "1000"), level("2", "0.01"), level("3", "0"));

    assertThat(DepthChartRenderer.barLengths(levels, 18)).containsExactly(18, 1, 0);
  }

  @Test
  void rendersHeaderMidAndOneRowPerLevel() {
    String chart =
        renderer.render(new OrderBook("BTC-USD", BIDS, ASKS, new BigDecimal("100.5")), 18);

    List<String> lines = chart.lines().toList();
    assertThat(lines.get(0)).isEqualTo("BTC-USD depth");
    assertThat(lines.get(1)).isEqualTo("Mid: 100.5");
    assertThat(lines).hasSize(4);
    String first = lines.get(2);
    assertThat(first)
        .isEqualTo(
            "█".repeat(18)
                + " "
                + "     100"
                + " | "
                + "101     "
                + " "
                + "█".repeat(6)
                + " ".repeat(12));
    assertThat(lines.get(3)).startsWith("█".repeat(11) + " ".repeat(7) + "       99 | 102");
  }

  @Test
  void shorterSideIsPaddedWithBlankCells() {
    String chart =
        renderer.render("ETH-USD", List.of(level("10", "1")), List.of(), 4, null);

    List<String> lines = chart.lines().toList();
    assertThat(lines).hasSize(2);
    assertThat(lines.get(1)).isEqualTo("████       10 | " + " ".repeat(4 + 1 + 8));
  }

  @Test
  void longPricesWidenThePriceColumnOnEveryRow() {
    String chart =
        renderer.render(
            "BTC-USD",
            List.of(level("101234.56", "1")),
            List.of(level("101234.57", "2"), level("101234.55", "1")),
            18,
            null);

    List<String> rows = chart.lines().skip(1).toList();
    assertThat(rows).hasSize(2);
    int gutter = 18 + 1 + "101234.56".length();
    for (String row : rows) {
      assertThat(row.indexOf(" | ")).as(row).isEqualTo(gutter);
      assertThat(row).hasSize(2 * gutter + 3);
    }
    assertThat(rows.get(1)).startsWith(" ".repeat(gutter) + " | 101234.55 ");
  }

  @Test
  void atMostTwelveLevelsPerSide() {
    List<OrderBookLevel> many = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      many.add(level(Integer.toString(100 - i), "1"));
    }

    String chart = renderer.render("X", many, many, 5, null);

    assertThat(chart.lines().count()).isEqualTo(1 + 12);
    assertThat(chart).contains(" 89 | ").doesNotContain(" 88 ");
  }

  @Test
  void emptyBookSaysSo() {
    assertThat(renderer.render("X", List.of(), List.of(), 18, null)).isEqualTo("X depth\n(no levels)");
  }

  @Test
  void widthMustBePositive() {
    assertThatThrownBy(() -> renderer.render("X", BIDS, ASKS, 0, null))
        .isInstanceOf(ValidationException.class);
  }
}
