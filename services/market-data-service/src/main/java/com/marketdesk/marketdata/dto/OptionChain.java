package com.marketdesk.marketdata.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record OptionChain(
    String ticker,
    OptionType type,
    LocalDate expiry,
    BigDecimal underlyingPrice,
    List<OptionContract> contracts) {

  public OptionChain {
    contracts = List.copyOf(contracts);
  }
}
