package com.marketdesk.marketdata.dto;

import java.math.BigDecimal;

/** {@code impliedVolatility} is a fraction (0.25 = 25%). */
public record OptionContract(
    BigDecimal strike,
    BigDecimal bid,
    BigDecimal ask,
    BigDecimal last,
    BigDecimal impliedVolatility,
    Long openInterest,
    Long volume) {}
