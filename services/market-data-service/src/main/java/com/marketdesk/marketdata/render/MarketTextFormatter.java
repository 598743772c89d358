package com.marketdesk.marketdata.render;

import com.marketdesk.marketdata.dto.Order;
import com.marketdesk.marketdata.dto.Quote;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class MarketTextFormatter {
  static final String NO_ORDERS =
      "No Information: orders unavailable (LIVE disabled or not configured).";

  public String quote(Quote q) {
    StringBuilder sb = new StringBuilder();
    sb.append(q.symbol()).append(": ").append(price(q.price()));
    if (q.currency() != null) {
      sb.append(' ').append(q.currency());
    }
    if (q.change() != null || q.changePercent() != null) {
      sb.append(" (")
          .append(signed(q.change()))
          .append(", ")
          .append(signed(q.changePercent()))
          .append("%)");
    }
    appendLine(sb, "Bid", q.bid());
    appendLine(sb, "Ask", q.ask());
    appendLine(sb, "High", q.high());
    appendLine(sb, "Low", q.low());
    appendLine(sb, "Open", q.open());
    appendLine(sb, "Prev close", q.previousClose());
    if (q.time() != null) {
      sb.append("\nAs of ").append(q.time());
    }
    return sb.toString();
  }

  /** One bullet per order, at most {@code limit} lines. */
  public String orders(List<Order> orders, int limit) {
    if (orders == null || orders.isEmpty()) {
      return NO_ORDERS;
    }
    List<String> lines = new ArrayList<>();
    for (Order o : orders) {
      if (lines.size() >= limit) break;
      lines.add(
          "• "
              + o.timestamp()
              + " | "
              + o.side().toUpperCase(Locale.ROOT)
              + " "
              + o.quantity()
              + " "
              + o.symbol()
              + " — "
              + o.status());
    }
    return String.join("\n", lines);
  }

  private static void appendLine(StringBuilder sb, String label, BigDecimal value) {
    if (value != null) {
      sb.append('\n').append(label).append(": ").append(price(value));
    }
  }

  static String price(BigDecimal value) {
    return value == null ? "—" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }

  private static String signed(BigDecimal value) {
    if (value == null) {
      return "—";
    }
    String text = value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    return value.signum() > 0 ? "+" + text : text;
  }
}
