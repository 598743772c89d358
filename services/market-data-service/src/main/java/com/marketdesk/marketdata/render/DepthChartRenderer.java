package com.marketdesk.marketdata.render;

import com.marketdesk.marketdata.client.ValidationException;
import com.marketdesk.marketdata.dto.OrderBook;
import com.marketdesk.marketdata.dto.OrderBookLevel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Two-column text depth chart: bid bar and price on the left, ask price and bar on the right.
 *
 * <p>Levels are drawn in the order given (bids best-first descending, asks best-first
 * ascending). Bars are scaled against the largest size on their own side only.
 */
@Component
public class DepthChartRenderer {
  public static final int DEFAULT_WIDTH = 18;
  static final int MAX_LEVELS = 12;
  static final int PRICE_WIDTH = 8;
  static final String BAR = "█";
  static final String GUTTER = " | ";

  public String render(OrderBook book) {
    return render(book, DEFAULT_WIDTH);
  }

  public String render(OrderBook book, int width) {
    return render(book.symbol(), book.bids(), book.asks(), width, book.midPrice());
  }

  public String render(
      String symbol,
      List<OrderBookLevel> bids,
      List<OrderBookLevel> asks,
      int width,
      BigDecimal midPrice) {
    if (width < 1) {
      throw new ValidationException("Depth chart width must be positive");
    }
    List<OrderBookLevel> shownBids = head(bids);
    List<OrderBookLevel> shownAsks = head(asks);

    List<String> lines = new ArrayList<>();
    lines.add((symbol == null ? "" : symbol + " ") + "depth");
    if (midPrice != null) {
      lines.add("Mid: " + midPrice.toPlainString());
    }
    if (shownBids.isEmpty() && shownAsks.isEmpty()) {
      lines.add("(no levels)");
      return String.join("\n", lines);
    }

    int[] bidBars = barLengths(shownBids, width);
    int[] askBars = barLengths(shownAsks, width);
    int priceWidth = priceWidth(shownBids, shownAsks);
    String blank = " ".repeat(width + 1 + priceWidth);
    int rows = Math.max(shownBids.size(), shownAsks.size());
    for (int i = 0; i < rows; i++) {
      String left =
          i < shownBids.size()
              ? TextTable.padRight(BAR.repeat(bidBars[i]), width)
                  + " "
                  + TextTable.padLeft(shownBids.get(i).price().toPlainString(), priceWidth)
              : blank;
      String right =
          i < shownAsks.size()
              ? TextTable.padRight(shownAsks.get(i).price().toPlainString(), priceWidth)
                  + " "
                  + TextTable.padRight(BAR.repeat(askBars[i]), width)
              : blank;
      lines.add(left + GUTTER + right);
    }
    return String.join("\n", lines);
  }

  /**
   * {@code round(size / maxSize * width)}, at least 1 for any positive size. Non-positive sizes
   * get no bar.
   */
  public static int[] barLengths(List<OrderBookLevel> levels, int width) {
    int[] out = new int[levels.size()];
    BigDecimal max = BigDecimal.ZERO;
    for (OrderBookLevel level : levels) {
      if (level.size().compareTo(max) > 0) {
        max = level.size();
      }
    }
    if (max.signum() <= 0) {
      return out;
    }
    BigDecimal scale = BigDecimal.valueOf(width);
    for (int i = 0; i < levels.size(); i++) {
      BigDecimal size = levels.get(i).size();
      if (size.signum() <= 0) {
        continue;
      }
      int length = size.multiply(scale).divide(max, 0, RoundingMode.HALF_UP).intValueExact();
      out[i] = Math.max(1, length);
    }
    return out;
  }

  /** {@link #PRICE_WIDTH}, or wider when a shown price needs more room. */
  static int priceWidth(List<OrderBookLevel> bids, List<OrderBookLevel> asks) {
    int widest = PRICE_WIDTH;
    for (OrderBookLevel level : bids) {
      widest = Math.max(widest, level.price().toPlainString().length());
    }
    for (OrderBookLevel level : asks) {
      widest = Math.max(widest, level.price().toPlainString().length());
    }
    return widest;
  }

  private static List<OrderBookLevel> head(List<OrderBookLevel> levels) {
    if (levels == null) {
      return List.of();
    }
    return levels.size() <= MAX_LEVELS ? levels : levels.subList(0, MAX_LEVELS);
  }
}
