package com.marketdesk.marketdata.dto;

public record QuoteResponse(String correlationId, Quote quote) {}
