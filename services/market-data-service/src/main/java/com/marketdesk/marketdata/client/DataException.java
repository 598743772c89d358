package com.marketdesk.marketdata.client;

/** Upstream answered, but the expected row or field is missing or unreadable. */
public class DataException extends MarketDataException {
  public DataException(String message) {
    super(message);
  }

  public DataException(String message, Throwable cause) {
    super(message, cause);
  }
}
