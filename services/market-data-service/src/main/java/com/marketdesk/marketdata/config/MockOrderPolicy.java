package com.marketdesk.marketdata.config;

/** What {@code listOrders} returns when live trading calls are disabled or not configured. */
public enum MockOrderPolicy {
  SYNTHETIC,
  EMPTY
}
