package com.marketdesk.marketdata.api;

import com.marketdesk.marketdata.dto.OrdersResponse;
import com.marketdesk.marketdata.usecase.MarketDataUseCase;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/market/v1/orders")
@Validated
public class OrdersController {
  private final MarketDataUseCase marketDataUseCase;

  public OrdersController(MarketDataUseCase marketDataUseCase) {
    this.marketDataUseCase = marketDataUseCase;
  }

  @GetMapping
  public OrdersResponse listOrders(
      @RequestParam(defaultValue = "5") @Min(1) @Max(20) int limit,
      @RequestParam(required = false) String correlationId) {
    return new OrdersResponse(
        correlationId, limit, marketDataUseCase.liveOrders(), marketDataUseCase.listOrders(limit));
  }
}
