package com.marketdesk.marketdata.dto;

import java.util.List;

public record OrdersResponse(String correlationId, int limit, boolean live, List<Order> orders) {}
