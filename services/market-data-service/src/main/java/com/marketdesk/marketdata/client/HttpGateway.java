package com.marketdesk.marketdata.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Executes one HTTP call against a single upstream host and maps the outcome.
 *
 * <p>The path is appended to the base URL verbatim, so a signed path is exactly the path sent.
 * Paths outside {@code apiRoot} are rejected before any I/O.
 */
public class HttpGateway {
  private static final Logger log = LoggerFactory.getLogger(HttpGateway.class);

  private final String name;
  private final String baseUrl;
  private final String apiRoot;
  private final WebClient webClient;
  private final Duration timeout;
  private final ObjectMapper objectMapper;

  public HttpGateway(
      String name,
      String baseUrl,
      String apiRoot,
      WebClient webClient,
      Duration timeout,
      ObjectMapper objectMapper) {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new ConfigurationException("Missing base URL for " + name);
    }
    this.name = name;
    this.baseUrl = stripTrailingSlashes(baseUrl.trim());
    this.apiRoot = apiRoot;
    this.webClient = webClient;
    this.timeout = timeout;
    this.objectMapper = objectMapper;
  }

  public String name() {
    return name;
  }

  public String apiRoot() {
    return apiRoot;
  }

  public GatewayResponse get(String path, Map<String, String> headers) {
    return execute("GET", path, headers, "");
  }

  public GatewayResponse execute(
      String method, String path, Map<String, String> headers, String body) {
    if (path == null || !path.startsWith(apiRoot)) {
      throw new ValidationException(name + " path must start with " + apiRoot + ": " + path);
    }
    URI uri = URI.create(baseUrl + path);
    log.info("{} request {} {}", name, method, path);

    RawResponse raw;
    try {
      WebClient.RequestBodySpec request =
          webClient
              .method(HttpMethod.valueOf(method.toUpperCase(Locale.ROOT)))
              .uri(uri)
              .headers(h -> (headers == null ? Map.<String, String>of() : headers).forEach(h::set));
      WebClient.RequestHeadersSpec<?> spec =
          body == null || body.isEmpty() ? request : request.bodyValue(body);
      raw =
          spec.exchangeToMono(
                  clientResponse ->
                      clientResponse
                          .bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .map(
                              text ->
                                  new RawResponse(
                                      clientResponse.statusCode().value(),
                                      clientResponse.headers().contentType().orElse(null),
                                      text)))
              .block(timeout);
    } catch (MarketDataException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("{} transport failure on {} {}: {}", name, method, path, e.getMessage());
      throw new UpstreamException(name, String.valueOf(e.getMessage()), e);
    }
    if (raw == null) {
      throw new UpstreamException(name, "empty response", null);
    }

    if (raw.status() < 200 || raw.status() >= 300) {
      log.warn("{} returned HTTP {} for {} {}", name, raw.status(), method, path);
      throw new UpstreamException(name, raw.status(), raw.body());
    }

    String contentType = raw.contentType() == null ? "" : raw.contentType().toString();
    JsonNode json = null;
    if (isJson(raw.contentType()) && !raw.body().isBlank()) {
      try {
        json = objectMapper.readTree(raw.body());
      } catch (JsonProcessingException e) {
        throw new DataException(name + " returned malformed JSON", e);
      }
    }
    return new GatewayResponse(raw.status(), contentType, json, raw.body());
  }

  /** Headers every trading call carries; signers add key, signature and timestamp on top. */
  public static Map<String, String> jsonHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", "application/json; charset=utf-8");
    headers.put("Accept", MediaType.APPLICATION_JSON_VALUE);
    return headers;
  }

  static boolean isJson(MediaType contentType) {
    if (contentType == null) {
      return false;
    }
    if (MediaType.APPLICATION_JSON.isCompatibleWith(contentType)) {
      return true;
    }
    String subtype = contentType.getSubtype();
    return subtype != null && subtype.endsWith("+json");
  }

  private static String stripTrailingSlashes(String url) {
    String out = url;
    while (out.endsWith("/")) {
      out = out.substring(0, out.length() - 1);
    }
    return out;
  }

  private record RawResponse(int status, MediaType contentType, String body) {}
}
