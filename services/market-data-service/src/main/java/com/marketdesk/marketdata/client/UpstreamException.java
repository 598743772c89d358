package com.marketdesk.marketdata.client;

/**
 * Non-2xx answer or transport failure. Status {@code 0} means no HTTP response was received.
 * The raw body is kept for diagnostics.
 */
public class UpstreamException extends MarketDataException {
  private final int status;
  private final String body;

  public UpstreamException(String upstream, int status, String body) {
    super(upstream + " error " + status + (body == null || body.isBlank() ? "" : " " + body));
    this.status = status;
    this.body = body == null ? "" : body;
  }

  public UpstreamException(String upstream, String message, Throwable cause) {
    super(upstream + " request failed: " + message, cause);
    this.status = 0;
    this.body = "";
  }

  public int status() {
    return status;
  }

  public String body() {
    return body;
  }
}
