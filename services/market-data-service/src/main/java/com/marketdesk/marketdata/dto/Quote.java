package com.marketdesk.marketdata.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/** Any price field may be null; a missing price is rendered as a placeholder. */
public record Quote(
    String symbol,
    BigDecimal price,
    BigDecimal change,
    BigDecimal changePercent,
    BigDecimal bid,
    BigDecimal ask,
    BigDecimal high,
    BigDecimal low,
    BigDecimal previousClose,
    BigDecimal open,
    String currency,
    OffsetDateTime time) {}
