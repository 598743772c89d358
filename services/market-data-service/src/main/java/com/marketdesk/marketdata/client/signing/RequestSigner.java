package com.marketdesk.marketdata.client.signing;

import com.marketdesk.marketdata.config.CredentialConfig;
import com.marketdesk.marketdata.config.SigningScheme;
import java.time.Clock;

/**
 * Produces the timestamp and base64 signature headers for a trading API request.
 *
 * <p>Each implementation owns its message field order and timestamp unit.
 */
public interface RequestSigner {

  SigningScheme scheme();

  /**
   * Signs {@code method path body} with a timestamp read from the clock at call time.
   *
   * @param body request body, {@code ""} for GET
   */
  SignedRequest sign(String method, String path, String body, CredentialConfig credentials);

  static RequestSigner forScheme(SigningScheme scheme, Clock clock) {
    return switch (scheme) {
      case HMAC_SHA256 -> new HmacRequestSigner(clock);
      case ED25519 -> new Ed25519RequestSigner(clock);
    };
  }
}
