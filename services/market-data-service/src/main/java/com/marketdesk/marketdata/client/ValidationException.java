package com.marketdesk.marketdata.client;

/** Caller input rejected before or instead of an upstream call. */
public class ValidationException extends MarketDataException {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
