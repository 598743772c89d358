package com.marketdesk.marketdata.api;

import com.marketdesk.marketdata.dto.OrderBookResponse;
import com.marketdesk.marketdata.dto.QuoteResponse;
import com.marketdesk.marketdata.render.DepthChartRenderer;
import com.marketdesk.marketdata.usecase.MarketDataUseCase;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/market/v1/crypto")
@Validated
public class CryptoController {
  private final MarketDataUseCase marketDataUseCase;

  public CryptoController(MarketDataUseCase marketDataUseCase) {
    this.marketDataUseCase = marketDataUseCase;
  }

  @GetMapping("/quote")
  public QuoteResponse getQuote(
      @RequestParam @NotBlank String base,
      @RequestParam(defaultValue = "USD") String counter,
      @RequestParam(required = false) String correlationId) {
    return new QuoteResponse(correlationId, marketDataUseCase.getCryptoQuote(base, counter));
  }

  @GetMapping("/orderbook")
  public OrderBookResponse getOrderBook(
      @RequestParam @NotBlank String symbol,
      @RequestParam(required = false) String correlationId) {
    return new OrderBookResponse(correlationId, marketDataUseCase.getCryptoOrderBook(symbol));
  }

  @GetMapping(value = "/depth", produces = MediaType.TEXT_PLAIN_VALUE)
  public String getDepthChart(
      @RequestParam @NotBlank String symbol,
      @RequestParam(defaultValue = "" + DepthChartRenderer.DEFAULT_WIDTH) @Min(1) @Max(60)
          int width) {
    return marketDataUseCase.renderDepthChart(symbol, width);
  }
}
