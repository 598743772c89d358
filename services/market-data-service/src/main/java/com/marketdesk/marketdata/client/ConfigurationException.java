package com.marketdesk.marketdata.client;

/** Credentials absent or malformed. */
public class ConfigurationException extends MarketDataException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
