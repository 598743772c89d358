package com.marketdesk.marketdata.api;

import com.marketdesk.marketdata.dto.QuoteResponse;
import com.marketdesk.marketdata.usecase.MarketDataUseCase;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/market/v1/quotes")
@Validated
public class QuotesController {
  private final MarketDataUseCase marketDataUseCase;

  public QuotesController(MarketDataUseCase marketDataUseCase) {
    this.marketDataUseCase = marketDataUseCase;
  }

  @GetMapping
  public QuoteResponse getQuote(
      @RequestParam @NotBlank String symbol,
      @RequestParam(required = false) String correlationId) {
    return new QuoteResponse(correlationId, marketDataUseCase.getQuote(symbol));
  }
}
