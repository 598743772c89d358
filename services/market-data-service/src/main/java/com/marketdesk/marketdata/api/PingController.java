package com.marketdesk.marketdata.api;

import com.marketdesk.marketdata.usecase.MarketDataUseCase;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PingController {
  private final MarketDataUseCase marketDataUseCase;

  public PingController(MarketDataUseCase marketDataUseCase) {
    this.marketDataUseCase = marketDataUseCase;
  }

  @GetMapping("/ping")
  public Map<String, String> ping() {
    return Map.of(
        "service", "market-data-service",
        "status", "ok",
        "orders", marketDataUseCase.liveOrders() ? "live" : "mock");
  }
}
