package com.marketdesk.marketdata.client.signing;

import com.marketdesk.marketdata.config.CredentialConfig;
import java.util.Locale;

/** One pending request as seen by a signer. Built per call and never reused. */
public record SigningContext(
    String method, String path, String body, String timestamp, CredentialConfig credentials) {

  public SigningContext {
    method = method.toUpperCase(Locale.ROOT);
    body = body == null ? "" : body;
  }
}
