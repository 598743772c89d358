package com.marketdesk.marketdata.dto;

import java.math.BigDecimal;

public record OrderBookLevel(BigDecimal price, BigDecimal size) {}
