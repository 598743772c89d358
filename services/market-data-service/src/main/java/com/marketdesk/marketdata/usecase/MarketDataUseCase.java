package com.marketdesk.marketdata.usecase;

import com.marketdesk.marketdata.dto.OptionChain;
import com.marketdesk.marketdata.dto.Order;
import com.marketdesk.marketdata.dto.OrderBook;
import com.marketdesk.marketdata.dto.Quote;
import java.util.List;

public interface MarketDataUseCase {
  Quote getQuote(String symbol);

  Quote getCryptoQuote(String base, String counter);

  OrderBook getCryptoOrderBook(String symbol);

  String renderDepthChart(String symbol, int width);

  OptionChain getOptionChain(String ticker, String type, String expiry);

  String getOptionsSlice(String ticker, String type, String expiry);

  List<Order> listOrders(int limit);

  boolean liveOrders();
}
