package com.marketdesk.marketdata.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.marketdesk.marketdata.client.ConfigurationException;
import com.marketdesk.marketdata.client.DataException;
import com.marketdesk.marketdata.client.UpstreamException;
import com.marketdesk.marketdata.client.ValidationException;
import com.marketdesk.marketdata.dto.Order;
import com.marketdesk.marketdata.dto.Quote;
import com.marketdesk.marketdata.render.MarketTextFormatter;
import com.marketdesk.marketdata.usecase.MarketDataUseCase;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChatCommandHandlerTest {
  private MarketDataUseCase market;
  private ChatCommandHandler handler;

  @BeforeEach
  void setUp() {
    market = mock(MarketDataUseCase.class);
    handler = new ChatCommandHandler(market, new CommandRegistry(), new MarketTextFormatter());
  }

  private OutgoingMessage reply(String text) {
    ChatResponse response =
        handler.handle(new ChatMessageEnvelope("telegram", "42", "u-1", text, "corr-1"));
    assertThat(response.messages()).hasSize(1);
    return response.messages().get(0);
  }

  private static Quote quote(String symbol, String price) {
    return new Quote(
        symbol, new BigDecimal(price), null, null, null, null, null, null, null, null, null, null);
  }

  @Test
  void blankAndUnknownInput() {
    assertThat(reply("   ").text()).isEqualTo("Empty message. /help");
    assertThat(reply(null).text()).isEqualTo("Empty message. /help");
    assertThat(reply("/moon").text()).isEqualTo("Unknown command. /help");
    verifyNoInteractions(market);
  }

  @Test
  void helpAndStartListEveryCommand() {
    String help = reply("/help").text();

    assertThat(help).startsWith("Commands:");
    assertThat(help).contains("/quote <SYMBOL>", "/crypto", "/book", "/options", "/orders");
    assertThat(reply("/start").text()).isEqualTo(help);
  }

  @Test
  void quoteCommandFormatsQuote() {
    when(market.getQuote("AAPL")).thenReturn(quote("AAPL", "190.5"));

    OutgoingMessage msg = reply("/quote@market_bot AAPL");

    assertThat(msg.text()).isEqualTo("AAPL: 190.50");
    assertThat(msg.preformatted()).isFalse();
  }

  @Test
  void missingArgumentsShowUsage() {
    assertThat(reply("/quote").text()).isEqualTo("Usage: /quote <SYMBOL>");
    assertThat(reply("/options AAPL call").text()).startsWith("Usage: /options");
    verifyNoInteractions(market);
  }

  @Test
  void cryptoDefaultsCounterToUsd() {
    when(market.getCryptoQuote("btc", "USD")).thenReturn(quote("BTC-USD", "65000"));

    assertThat(reply("/crypto btc").text()).startsWith("BTC-USD: 65000.00");
  }

  @Test
  void bookNormalizesPairAndReturnsPreformattedChart() {
    when(market.renderDepthChart("ETH-USD", 30)).thenReturn("ETH-USD depth\n(no levels)");

    OutgoingMessage msg = reply("/book eth width=30");

    assertThat(msg.preformatted()).isTrue();
    assertThat(msg.text()).startsWith("ETH-USD depth");
  }

  @Test
  void bookRejectsOutOfRangeWidth() {
    assertThat(reply("/book BTC-USD width=0").text()).isEqualTo("width must be between 1 and 60.");
    verifyNoInteractions(market);
  }

  @Test
  void optionsSliceIsPreformatted() {
    when(market.getOptionsSlice("AAPL", "call", "01/15/25")).thenReturn("AAPL CALL 2025-01-15");

    OutgoingMessage msg = reply("/options AAPL call 01/15/25");

    assertThat(msg.preformatted()).isTrue();
    assertThat(msg.text()).isEqualTo("AAPL CALL 2025-01-15");
  }

  @Test
  void ordersUseDefaultPositionalOrNamedLimit() {
    Order order = new Order("mock-1", "2025-01-10T12:00:00Z", "buy", "BTC", "0.001000", "filled");
    when(market.listOrders(anyInt())).thenReturn(List.of(order));

    assertThat(reply("/orders").text())
        .isEqualTo("• 2025-01-10T12:00:00Z | BUY 0.001000 BTC — filled");
    verify(market).listOrders(5);
    reply("/orders 3");
    verify(market).listOrders(3);
    reply("/orders limit=7");
    verify(market).listOrders(7);
  }

  @Test
  void ordersOutsideRangeAreRejected() {
    assertThat(reply("/orders 21").text()).isEqualTo("limit must be between 1 and 20.");
    assertThat(reply("/orders zero").text()).isEqualTo("limit must be between 1 and 20.");
    verifyNoInteractions(market);
  }

  @Test
  void noOrdersExplainsMockOrDisabledMode() {
    when(market.listOrders(5)).thenReturn(List.of());

    assertThat(reply("/orders").text())
        .isEqualTo("No Information: orders unavailable (LIVE disabled or not configured).");
  }

  @Test
  void failuresBecomeShortReplies() {
    when(market.getQuote(anyString())).thenThrow(new ValidationException("Symbol is required"));
    assertThat(reply("/quote X").text()).isEqualTo("Symbol is required");

    when(market.getCryptoQuote(anyString(), anyString()))
        .thenThrow(new ConfigurationException("missing key"));
    assertThat(reply("/crypto BTC").text()).isEqualTo("Trading API is not configured.");

    when(market.getOptionsSlice(anyString(), anyString(), anyString()))
        .thenThrow(new DataException("No contracts found"));
    assertThat(reply("/options AAPL put 01/15/25").text()).isEqualTo("No data: No contracts found");

    when(market.renderDepthChart(anyString(), anyInt())).thenThrow(new IllegalStateException("x"));
    assertThat(reply("/book BTC").text()).isEqualTo("Error fetching data. Check logs.");
  }

  @Test
  void upstreamStatusesMapToFriendlyText() {
    when(market.listOrders(anyInt()))
        .thenThrow(new UpstreamException("Trading API", 401, "{}"))
        .thenThrow(new UpstreamException("Trading API", 429, ""))
        .thenThrow(new UpstreamException("Trading API", 503, ""))
        .thenThrow(new UpstreamException("Trading API", "timed out", new RuntimeException()));

    assertThat(reply("/orders").text()).startsWith("Not authorized upstream (/orders)");
    assertThat(reply("/orders").text()).startsWith("Too many requests (/orders)");
    assertThat(reply("/orders").text()).isEqualTo("Upstream error (/orders): HTTP 503");
    assertThat(reply("/orders").text()).isEqualTo("Upstream unreachable (/orders).");
  }

  @Test
  void parseSplitsArgsAndOptions() {
    ChatCommandHandler.Parsed p = ChatCommandHandler.parse("/BOOK@bot  btc-usd  Width=20 x=");

    assertThat(p.cmd()).isEqualTo("/book");
    assertThat(p.args()).containsExactly("btc-usd", "x=");
    assertThat(p.options()).containsEntry("width", "20");
    assertThat(p.arg(5)).isNull();
  }
}
