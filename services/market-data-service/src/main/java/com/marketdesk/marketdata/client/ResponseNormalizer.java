package com.marketdesk.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketdesk.marketdata.dto.OptionContract;
import com.marketdesk.marketdata.dto.Order;
import com.marketdesk.marketdata.dto.OrderBookLevel;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps the field-name variants seen in upstream payloads onto canonical records.
 *
 * <p>Each canonical order field has an ordered candidate list; the first candidate present with a
 * non-null, non-blank value wins:
 *
 * <ul>
 *   <li>id: {@code id}, {@code order_id}
 *   <li>timestamp: {@code created_at}, {@code timestamp}
 *   <li>side: {@code side}
 *   <li>symbol: {@code symbol}, {@code crypto_symbol}
 *   <li>quantity: {@code quantity}, {@code notional}
 *   <li>status: {@code status}
 * </ul>
 *
 * When no candidate is present the field is {@link Order#PLACEHOLDER}.
 */
@Component
public class ResponseNormalizer {
  private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

  static final List<String> ID = List.of("id", "order_id");
  static final List<String> TIMESTAMP = List.of("created_at", "timestamp");
  static final List<String> SIDE = List.of("side");
  static final List<String> SYMBOL = List.of("symbol", "crypto_symbol");
  static final List<String> QUANTITY = List.of("quantity", "notional");
  static final List<String> STATUS = List.of("status");

  public Order toOrder(JsonNode row) {
    return new Order(
        firstText(row, ID),
        firstText(row, TIMESTAMP),
        firstText(row, SIDE),
        firstText(row, SYMBOL),
        firstText(row, QUANTITY),
        firstText(row, STATUS));
  }

  public List<Order> toOrders(JsonNode root) {
    List<Order> orders = new ArrayList<>();
    for (JsonNode row : rows(root)) {
      orders.add(toOrder(row));
    }
    return orders;
  }

  /**
   * Rows of a list payload: the {@code results} array, a single {@code results} object, or a
   * top-level array. Anything else yields no rows.
   */
  public List<JsonNode> rows(JsonNode root) {
    List<JsonNode> rows = new ArrayList<>();
    if (root == null || root.isNull() || root.isMissingNode()) {
      return rows;
    }
    JsonNode results = root.get("results");
    if (results != null && results.isArray()) {
      results.forEach(rows::add);
    } else if (results != null && results.isObject()) {
      rows.add(results);
    } else if (root.isArray()) {
      root.forEach(rows::add);
    }
    return rows;
  }

  /** Levels as {@code [price, size]} arrays or objects with price and quantity/size. */
  public List<OrderBookLevel> toLevels(JsonNode levels) {
    List<OrderBookLevel> out = new ArrayList<>();
    if (levels == null || !levels.isArray()) {
      return out;
    }
    for (JsonNode level : levels) {
      BigDecimal price;
      BigDecimal size;
      if (level.isArray()) {
        price = decimal(level.get(0));
        size = decimal(level.get(1));
      } else {
        price = decimal(level, List.of("price"));
        size = decimal(level, List.of("quantity", "size"));
      }
      if (price == null || size == null) {
        throw new DataException("Order book level without price or size: " + level);
      }
      out.add(new OrderBookLevel(price, size));
    }
    return out;
  }

  public OptionContract toOptionContract(JsonNode row) {
    return new OptionContract(
        decimal(row, List.of("strike")),
        decimal(row, List.of("bid")),
        decimal(row, List.of("ask")),
        decimal(row, List.of("lastPrice", "last")),
        decimal(row, List.of("impliedVolatility")),
        longValue(row, List.of("openInterest")),
        longValue(row, List.of("volume")));
  }

  public static String firstText(JsonNode row, List<String> candidates) {
    JsonNode value = first(row, candidates);
    return value == null ? Order.PLACEHOLDER : value.asText();
  }

  public static BigDecimal decimal(JsonNode row, List<String> candidates) {
    return decimal(first(row, candidates));
  }

  /** Like {@link #decimal(JsonNode, List)}, but an unparseable value reads as absent. */
  public static BigDecimal optionalDecimal(JsonNode row, List<String> candidates) {
    JsonNode value = first(row, candidates);
    try {
      return decimal(value);
    } catch (DataException e) {
      log.debug("Ignoring non-numeric {}: {}", candidates, value);
      return null;
    }
  }

  public static Long longValue(JsonNode row, List<String> candidates) {
    JsonNode value = first(row, candidates);
    if (value == null) {
      return null;
    }
    if (value.isNumber()) {
      return value.asLong();
    }
    try {
      return new BigDecimal(value.asText().trim()).longValue();
    } catch (NumberFormatException e) {
      throw new DataException("Not a number: " + value.asText(), e);
    }
  }

  /**
   * Epoch seconds or ISO-8601 text. Text without an offset is read as UTC. Null when every
   * candidate is absent or the value cannot be read as a time.
   */
  public static OffsetDateTime dateTime(JsonNode row, List<String> candidates) {
    JsonNode value = first(row, candidates);
    if (value == null) {
      return null;
    }
    if (value.isNumber()) {
      return Instant.ofEpochSecond(value.asLong()).atOffset(ZoneOffset.UTC);
    }
    String text = value.asText().trim();
    try {
      return OffsetDateTime.parse(text);
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(text).atOffset(ZoneOffset.UTC);
      } catch (DateTimeParseException ignored) {
        log.debug("Ignoring unreadable time {}: {}", candidates, text);
        return null;
      }
    }
  }

  static JsonNode first(JsonNode row, List<String> candidates) {
    if (row == null) {
      return null;
    }
    for (String field : candidates) {
      JsonNode value = row.get(field);
      if (value == null || value.isNull()) {
        continue;
      }
      if (value.isTextual() && value.asText().isBlank()) {
        continue;
      }
      return value;
    }
    return null;
  }

  private static BigDecimal decimal(JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      return value.decimalValue();
    }
    String text = value.asText();
    if (text == null || text.isBlank()) {
      return null;
    }
    try {
      return new BigDecimal(text.trim());
    } catch (NumberFormatException e) {
      throw new DataException("Not a number: " + text, e);
    }
  }
}
