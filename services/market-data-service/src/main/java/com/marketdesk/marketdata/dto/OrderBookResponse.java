package com.marketdesk.marketdata.dto;

public record OrderBookResponse(String correlationId, OrderBook orderBook) {}
