package com.marketdesk.marketdata.chat;

import com.marketdesk.marketdata.chat.CommandRegistry.CommandDef;
import com.marketdesk.marketdata.client.ConfigurationException;
import com.marketdesk.marketdata.client.DataException;
import com.marketdesk.marketdata.client.MarketDataClient;
import com.marketdesk.marketdata.client.UpstreamException;
import com.marketdesk.marketdata.client.ValidationException;
import com.marketdesk.marketdata.dto.Order;
import com.marketdesk.marketdata.render.DepthChartRenderer;
import com.marketdesk.marketdata.render.MarketTextFormatter;
import com.marketdesk.marketdata.usecase.MarketDataUseCase;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns one chat command line into a reply. Failures become short user-facing text; details go
 * to the log.
 */
@Service
@Slf4j
public class ChatCommandHandler {
  static final int DEFAULT_ORDER_LIMIT = 5;
  static final int MAX_ORDER_LIMIT = MarketDataClient.MAX_ORDER_LIMIT;
  static final int MAX_DEPTH_WIDTH = 60;

  private final MarketDataUseCase market;
  private final CommandRegistry registry;
  private final MarketTextFormatter formatter;

  public ChatCommandHandler(
      MarketDataUseCase market, CommandRegistry registry, MarketTextFormatter formatter) {
    this.market = market;
    this.registry = registry;
    this.formatter = formatter;
  }

  public ChatResponse handle(ChatMessageEnvelope env) {
    String input = env.text() == null ? "" : env.text().trim();
    if (input.isBlank()) {
      return ChatResponse.ofText("Empty message. /help");
    }

    Parsed p = parse(input);
    CommandDef def = registry.byCommand(p.cmd());
    if (def == null) {
      return ChatResponse.ofText("Unknown command. /help");
    }

    try {
      return switch (def.code()) {
        case "help" -> doHelp();
        case "quote" -> doQuote(p);
        case "crypto" -> doCrypto(p);
        case "book" -> doBook(p);
        case "options" -> doOptions(p);
        case "orders" -> doOrders(p);
        default -> ChatResponse.ofText("Unknown command. /help");
      };
    } catch (ValidationException e) {
      return ChatResponse.ofText(e.getMessage());
    } catch (ConfigurationException e) {
      log.warn("{} failed, trading API not configured: {}", p.cmd(), e.getMessage());
      return ChatResponse.ofText("Trading API is not configured.");
    } catch (UpstreamException e) {
      log.error("{} failed: upstream status={} body={}", p.cmd(), e.status(), e.body(), e);
      return ChatResponse.ofText(friendlyMessage(p.cmd(), e));
    } catch (DataException e) {
      log.warn("{} returned no data: {}", p.cmd(), e.getMessage());
      return ChatResponse.ofText("No data: " + e.getMessage());
    } catch (Exception e) {
      log.error("{} failed (correlationId={})", p.cmd(), env.correlationId(), e);
      return ChatResponse.ofText("Error fetching data. Check logs.");
    }
  }

  /* =========================
  Command handlers
  ========================= */

  private ChatResponse doHelp() {
    StringBuilder sb = new StringBuilder("Commands:");
    for (CommandDef def : registry.all()) {
      sb.append("\n").append(def.usage()).append(" - ").append(def.description());
    }
    return ChatResponse.ofText(sb.toString());
  }

  private ChatResponse doQuote(Parsed p) {
    String symbol = p.arg(0);
    if (symbol == null) {
      return usage("quote");
    }
    return ChatResponse.ofText(formatter.quote(market.getQuote(symbol)));
  }

  private ChatResponse doCrypto(Parsed p) {
    String base = p.arg(0);
    if (base == null) {
      return usage("crypto");
    }
    String counter = p.arg(1) == null ? "USD" : p.arg(1);
    return ChatResponse.ofText(formatter.quote(market.getCryptoQuote(base, counter)));
  }

  private ChatResponse doBook(Parsed p) {
    String pair = p.arg(0);
    if (pair == null) {
      return usage("book");
    }
    if (!pair.contains("-")) {
      pair = pair + "-USD";
    }
    Integer width = parseInt(p.options().get("width"));
    if (width == null) width = DepthChartRenderer.DEFAULT_WIDTH;
    if (width < 1 || width > MAX_DEPTH_WIDTH) {
      return ChatResponse.ofText("width must be between 1 and " + MAX_DEPTH_WIDTH + ".");
    }
    return ChatResponse.of(
        OutgoingMessage.pre(market.renderDepthChart(pair.toUpperCase(Locale.ROOT), width)));
  }

  private ChatResponse doOptions(Parsed p) {
    String ticker = p.arg(0);
    String type = p.arg(1);
    String expiry = p.arg(2);
    if (ticker == null || type == null || expiry == null) {
      return usage("options");
    }
    return ChatResponse.of(OutgoingMessage.pre(market.getOptionsSlice(ticker, type, expiry)));
  }

  private ChatResponse doOrders(Parsed p) {
    String raw = p.arg(0) != null ? p.arg(0) : p.options().get("limit");
    Integer limit = raw == null ? Integer.valueOf(DEFAULT_ORDER_LIMIT) : parseInt(raw);
    if (limit == null || limit < 1 || limit > MAX_ORDER_LIMIT) {
      return ChatResponse.ofText("limit must be between 1 and " + MAX_ORDER_LIMIT + ".");
    }
    List<Order> orders = market.listOrders(limit);
    return ChatResponse.ofText(formatter.orders(orders, limit));
  }

  /* =========================
  Parsing helpers
  ========================= */

  static Parsed parse(String input) {
    String[] tokens = input.trim().split("\\s+");
    String cmd = tokens[0].toLowerCase(Locale.ROOT);
    int at = cmd.indexOf('@');
    if (at > 0) {
      cmd = cmd.substring(0, at);
    }
    List<String> args = new ArrayList<>();
    Map<String, String> options = new HashMap<>();
    for (String token : Arrays.asList(tokens).subList(1, tokens.length)) {
      int pos = token.indexOf('=');
      if (pos > 0 && pos < token.length() - 1) {
        options.put(token.substring(0, pos).toLowerCase(Locale.ROOT), token.substring(pos + 1));
      } else {
        args.add(token);
      }
    }
    return new Parsed(cmd, List.copyOf(args), Map.copyOf(options));
  }

  private ChatResponse usage(String code) {
    CommandDef def =
        registry.all().stream().filter(d -> d.code().equals(code)).findFirst().orElseThrow();
    return ChatResponse.ofText("Usage: " + def.usage());
  }

  private static Integer parseInt(String value) {
    if (value == null || value.isBlank()) return null;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String friendlyMessage(String op, UpstreamException e) {
    return switch (e.status()) {
      case 0 -> "Upstream unreachable (" + op + ").";
      case 400 -> "Bad request (" + op + ").";
      case 401, 403 -> "Not authorized upstream (" + op + "). Check API credentials.";
      case 404 -> "Not found (" + op + ").";
      case 429 -> "Too many requests (" + op + "). Try again later.";
      default -> "Upstream error (" + op + "): HTTP " + e.status();
    };
  }

  record Parsed(String cmd, List<String> args, Map<String, String> options) {
    String arg(int index) {
      return index < args.size() ? args.get(index) : null;
    }
  }
}
