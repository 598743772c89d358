package com.marketdesk.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketdesk.marketdata.client.signing.RequestSigner;
import com.marketdesk.marketdata.client.signing.SignedRequest;
import com.marketdesk.marketdata.config.CredentialConfig;
import com.marketdesk.marketdata.config.MockOrderPolicy;
import com.marketdesk.marketdata.dto.OptionChain;
import com.marketdesk.marketdata.dto.OptionContract;
import com.marketdesk.marketdata.dto.OptionType;
import com.marketdesk.marketdata.dto.Order;
import com.marketdesk.marketdata.dto.OrderBook;
import com.marketdesk.marketdata.dto.OrderBookLevel;
import com.marketdesk.marketdata.dto.Quote;
import com.marketdesk.marketdata.render.ExpiryParser;
import com.marketdesk.marketdata.render.OptionsSliceFormatter;
import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Quotes and options from the public quote host, crypto quotes, order books and orders from the
 * signed trading API.
 *
 * <p>Every call is a single request/response: no caching and no retries. Signatures are computed
 * right before each trading call.
 */
@Component
public class MarketDataClient {
  private static final Logger log = LoggerFactory.getLogger(MarketDataClient.class);

  static final String QUOTE_PATH = "/v7/finance/quote?symbols=";
  static final String OPTIONS_PATH = "/v7/finance/options/";
  static final String TRADING_PAIRS_PATH = "/api/v1/crypto/trading/trading_pairs/?symbol=";
  static final String BEST_BID_ASK_PATH = "/api/v1/crypto/marketdata/best_bid_ask/?symbol=";
  static final String ORDER_BOOK_PATH = "/api/v1/crypto/marketdata/order_book/?symbol=";
  static final String ORDERS_PATH = "/api/v1/crypto/trading/orders/?limit=";

  static final String DEFAULT_COUNTER = "USD";
  public static final int MAX_ORDER_LIMIT = 20;
  private static final BigDecimal MOCK_QUANTITY_STEP = new BigDecimal("0.001");
  private static final BigDecimal TWO = BigDecimal.valueOf(2);

  private final HttpGateway quotes;
  private final HttpGateway trading;
  private final RequestSigner signer;
  private final ResponseNormalizer normalizer;
  private final OptionsSliceFormatter optionsFormatter;
  private final CredentialConfig credentials;
  private final Clock clock;

  public MarketDataClient(
      @Qualifier("quoteGateway") HttpGateway quotes,
      @Qualifier("tradingGateway") HttpGateway trading,
      RequestSigner signer,
      ResponseNormalizer normalizer,
      OptionsSliceFormatter optionsFormatter,
      CredentialConfig credentials,
      Clock clock) {
    this.quotes = quotes;
    this.trading = trading;
    this.signer = signer;
    this.normalizer = normalizer;
    this.optionsFormatter = optionsFormatter;
    this.credentials = credentials;
    this.clock = clock;
  }

  public Quote getQuote(String symbol) {
    String ticker = requireSymbol(symbol, "Symbol");
    JsonNode root =
        quotes.get(QUOTE_PATH + encode(ticker), HttpGateway.jsonHeaders()).requireJson("Quote");
    JsonNode result = root.path("quoteResponse").path("result");
    if (!result.isArray() || result.isEmpty()) {
      throw new DataException("No quote data for " + ticker);
    }
    JsonNode q = result.get(0);
    return new Quote(
        q.hasNonNull("symbol") ? q.get("symbol").asText() : ticker,
        ResponseNormalizer.optionalDecimal(q, List.of("regularMarketPrice")),
        ResponseNormalizer.optionalDecimal(q, List.of("regularMarketChange")),
        ResponseNormalizer.optionalDecimal(q, List.of("regularMarketChangePercent")),
        ResponseNormalizer.optionalDecimal(q, List.of("bid")),
        ResponseNormalizer.optionalDecimal(q, List.of("ask")),
        ResponseNormalizer.optionalDecimal(q, List.of("regularMarketDayHigh")),
        ResponseNormalizer.optionalDecimal(q, List.of("regularMarketDayLow")),
        ResponseNormalizer.optionalDecimal(q, List.of("regularMarketPreviousClose")),
        ResponseNormalizer.optionalDecimal(q, List.of("regularMarketOpen")),
        q.hasNonNull("currency") ? q.get("currency").asText() : null,
        ResponseNormalizer.dateTime(q, List.of("regularMarketTime")));
  }

  public Quote getCryptoQuote(String base) {
    return getCryptoQuote(base, DEFAULT_COUNTER);
  }

  /** Confirms the {@code BASE-COUNTER} pair exists, then reads its best bid/ask. */
  public Quote getCryptoQuote(String base, String counter) {
    requireCredentials();
    String symbol = resolveTradingPair(base, counter == null ? DEFAULT_COUNTER : counter);
    JsonNode root = signedGet(BEST_BID_ASK_PATH + encode(symbol));
    List<JsonNode> rows = normalizer.rows(root);
    if (rows.isEmpty()) {
      throw new DataException("No market data returned for " + symbol);
    }
    JsonNode item = rows.get(0);
    return new Quote(
        symbol,
        ResponseNormalizer.optionalDecimal(item, List.of("mid_price")),
        ResponseNormalizer.optionalDecimal(item, List.of("change")),
        ResponseNormalizer.optionalDecimal(item, List.of("change_percent")),
        ResponseNormalizer.optionalDecimal(item, List.of("bid_price")),
        ResponseNormalizer.optionalDecimal(item, List.of("ask_price")),
        ResponseNormalizer.optionalDecimal(item, List.of("high_price")),
        ResponseNormalizer.optionalDecimal(item, List.of("low_price")),
        null,
        null,
        null,
        ResponseNormalizer.dateTime(item, List.of("as_of", "updated_at")));
  }

  /** Levels come back in the order upstream sent them. */
  public OrderBook getCryptoOrderBook(String symbol) {
    requireCredentials();
    String pair = requireSymbol(symbol, "Symbol").toUpperCase(Locale.ROOT);
    JsonNode root = signedGet(ORDER_BOOK_PATH + encode(pair));
    List<JsonNode> rows = normalizer.rows(root);
    JsonNode book = rows.isEmpty() ? root : rows.get(0);
    if (book == null || (!book.has("bids") && !book.has("asks"))) {
      throw new DataException("No order book returned for " + pair);
    }
    List<OrderBookLevel> bids = normalizer.toLevels(book.get("bids"));
    List<OrderBookLevel> asks = normalizer.toLevels(book.get("asks"));
    BigDecimal mid = ResponseNormalizer.optionalDecimal(book, List.of("mid_price"));
    if (mid == null && !bids.isEmpty() && !asks.isEmpty()) {
      mid = bids.get(0).price().add(asks.get(0).price()).divide(TWO);
    }
    return new OrderBook(pair, bids, asks, mid);
  }

  public OptionChain getOptionChain(String ticker, String type, String expiry) {
    String symbol = requireSymbol(ticker, "Ticker").toUpperCase(Locale.ROOT);
    OptionType optionType = OptionType.parse(type);
    LocalDate expiryDate = ExpiryParser.parse(expiry);
    long epochSeconds = expiryDate.atStartOfDay(ZoneOffset.UTC).toEpochSecond();

    JsonNode root =
        quotes
            .get(
                OPTIONS_PATH + encode(symbol) + "?date=" + epochSeconds,
                HttpGateway.jsonHeaders())
            .requireJson("Options");
    JsonNode result = root.path("optionChain").path("result");
    if (!result.isArray() || result.isEmpty()) {
      throw new DataException("No options data for " + symbol);
    }
    JsonNode chain = result.get(0);
    BigDecimal underlying =
        ResponseNormalizer.optionalDecimal(chain.path("quote"), List.of("regularMarketPrice"));
    JsonNode rows = chain.path("options").path(0).path(optionType.chainField());
    if (!rows.isArray() || rows.isEmpty()) {
      throw new DataException("No contracts found");
    }
    List<OptionContract> contracts = new ArrayList<>();
    for (JsonNode row : rows) {
      OptionContract contract = normalizer.toOptionContract(row);
      if (contract.strike() == null) {
        log.debug("Skipping {} contract without strike: {}", symbol, row);
        continue;
      }
      contracts.add(contract);
    }
    if (contracts.isEmpty()) {
      throw new DataException("No contracts found");
    }
    return new OptionChain(symbol, optionType, expiryDate, underlying, contracts);
  }

  public String getOptionsSlice(String ticker, String type, String expiry) {
    return optionsFormatter.render(getOptionChain(ticker, type, expiry));
  }

  /**
   * Live orders when trading is enabled and configured; otherwise the configured mock policy
   * (synthetic orders or none).
   */
  public List<Order> listOrders(int limit) {
    if (limit < 1 || limit > MAX_ORDER_LIMIT) {
      throw new ValidationException("limit must be between 1 and " + MAX_ORDER_LIMIT);
    }
    if (!credentials.liveEnabled()) {
      log.debug("Live orders disabled (live={}), mock policy {}", credentials.live(), mockPolicy());
      return mockPolicy() == MockOrderPolicy.EMPTY ? List.of() : syntheticOrders(limit);
    }
    JsonNode root = signedGet(ORDERS_PATH + limit);
    return normalizer.toOrders(root);
  }

  public boolean liveOrders() {
    return credentials.liveEnabled();
  }

  /** {@code mock-1..n}, one hour apart going back from now, buy/sell and BTC/ETH alternating. */
  List<Order> syntheticOrders(int limit) {
    Instant now = clock.instant();
    List<Order> orders = new ArrayList<>();
    for (int i = 0; i < limit; i++) {
      boolean even = i % 2 == 0;
      orders.add(
          new Order(
              "mock-" + (i + 1),
              now.minus(Duration.ofHours(i)).toString(),
              even ? "buy" : "sell",
              even ? "BTC" : "ETH",
              MOCK_QUANTITY_STEP.multiply(BigDecimal.valueOf(i + 1L)).setScale(6).toPlainString(),
              "filled"));
    }
    return orders;
  }

  private String resolveTradingPair(String base, String counter) {
    String symbol =
        requireSymbol(base, "Base asset").toUpperCase(Locale.ROOT)
            + "-"
            + requireSymbol(counter, "Counter asset").toUpperCase(Locale.ROOT);
    JsonNode root = signedGet(TRADING_PAIRS_PATH + encode(symbol));
    boolean found =
        normalizer.rows(root).stream()
            .anyMatch(p -> p.hasNonNull("symbol") && symbol.equals(p.get("symbol").asText()));
    if (!found) {
      throw new ValidationException("Trading pair not found: " + symbol);
    }
    return symbol;
  }

  private JsonNode signedGet(String path) {
    SignedRequest signed = signer.sign("GET", path, "", credentials);
    Map<String, String> headers = HttpGateway.jsonHeaders();
    headers.put("x-api-key", credentials.apiKey());
    headers.put("x-signature", signed.signature());
    headers.put("x-timestamp", signed.timestamp());
    return trading.get(path, headers).requireJson(trading.name());
  }

  private void requireCredentials() {
    if (!credentials.hasCredentials()) {
      throw new ConfigurationException(
          "Missing trading API credentials (RH_API_KEY, RH_PRIVATE_KEY)");
    }
  }

  private MockOrderPolicy mockPolicy() {
    return credentials.mockOrders() == null ? MockOrderPolicy.SYNTHETIC : credentials.mockOrders();
  }

  private static String requireSymbol(String value, String what) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(what + " is required");
    }
    return value.trim();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
