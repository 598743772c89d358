package com.marketdesk.marketdata.dto;

import com.marketdesk.marketdata.client.ValidationException;
import java.util.Locale;

public enum OptionType {
  CALL("calls"),
  PUT("puts");

  private final String chainField;

  OptionType(String chainField) {
    this.chainField = chainField;
  }

  /** Name of the contract array in the upstream options payload. */
  public String chainField() {
    return chainField;
  }

  public static OptionType parse(String value) {
    if (value != null) {
      switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "call", "calls", "c":
          return CALL;
        case "put", "puts", "p":
          return PUT;
        default:
          break;
      }
    }
    throw new ValidationException("Option type must be call or put");
  }
}
