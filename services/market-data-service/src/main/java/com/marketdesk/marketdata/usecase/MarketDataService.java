package com.marketdesk.marketdata.usecase;

import com.marketdesk.marketdata.client.MarketDataClient;
import com.marketdesk.marketdata.dto.OptionChain;
import com.marketdesk.marketdata.dto.Order;
import com.marketdesk.marketdata.dto.OrderBook;
import com.marketdesk.marketdata.dto.Quote;
import com.marketdesk.marketdata.render.DepthChartRenderer;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class MarketDataService implements MarketDataUseCase {
  private final MarketDataClient client;
  private final DepthChartRenderer depthChartRenderer;

  public MarketDataService(MarketDataClient client, DepthChartRenderer depthChartRenderer) {
    this.client = client;
    this.depthChartRenderer = depthChartRenderer;
  }

  @Override
  public Quote getQuote(String symbol) {
    return client.getQuote(symbol);
  }

  @Override
  public Quote getCryptoQuote(String base, String counter) {
    return client.getCryptoQuote(base, counter);
  }

  @Override
  public OrderBook getCryptoOrderBook(String symbol) {
    return client.getCryptoOrderBook(symbol);
  }

  @Override
  public String renderDepthChart(String symbol, int width) {
    return depthChartRenderer.render(client.getCryptoOrderBook(symbol), width);
  }

  @Override
  public OptionChain getOptionChain(String ticker, String type, String expiry) {
    return client.getOptionChain(ticker, type, expiry);
  }

  @Override
  public String getOptionsSlice(String ticker, String type, String expiry) {
    return client.getOptionsSlice(ticker, type, expiry);
  }

  @Override
  public List<Order> listOrders(int limit) {
    return client.listOrders(limit);
  }

  @Override
  public boolean liveOrders() {
    return client.liveOrders();
  }
}
