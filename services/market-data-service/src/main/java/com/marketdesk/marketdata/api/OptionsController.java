package com.marketdesk.marketdata.api;

import com.marketdesk.marketdata.usecase.MarketDataUseCase;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/market/v1/options")
@Validated
public class OptionsController {
  private final MarketDataUseCase marketDataUseCase;

  public OptionsController(MarketDataUseCase marketDataUseCase) {
    this.marketDataUseCase = marketDataUseCase;
  }

  /** Strike window around the underlying, as a text table. Expiry is {@code MM/DD/YY}. */
  @GetMapping(produces = MediaType.TEXT_PLAIN_VALUE)
  public String getOptionsSlice(
      @RequestParam @NotBlank String ticker,
      @RequestParam @NotBlank String type,
      @RequestParam @NotBlank String expiry) {
    return marketDataUseCase.getOptionsSlice(ticker, type, expiry);
  }
}
