package com.marketdesk.marketdata.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Bids best-first (descending), asks best-first (ascending), exactly as upstream sent them.
 * Consumers must not re-sort.
 */
public record OrderBook(
    String symbol, List<OrderBookLevel> bids, List<OrderBookLevel> asks, BigDecimal midPrice) {

  public OrderBook {
    bids = List.copyOf(bids);
    asks = List.copyOf(asks);
  }
}
