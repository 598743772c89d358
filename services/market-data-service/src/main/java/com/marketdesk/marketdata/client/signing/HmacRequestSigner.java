package com.marketdesk.marketdata.client.signing;

import com.marketdesk.marketdata.client.ConfigurationException;
import com.marketdesk.marketdata.config.CredentialConfig;
import com.marketdesk.marketdata.config.SigningScheme;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/** {@code base64(HMAC_SHA256(secret, timestampMillis + METHOD + path + body))}. */
public final class HmacRequestSigner implements RequestSigner {
  private static final String ALGORITHM = "HmacSHA256";

  private final Clock clock;

  public HmacRequestSigner(Clock clock) {
    this.clock = clock;
  }

  @Override
  public SigningScheme scheme() {
    return SigningScheme.HMAC_SHA256;
  }

  @Override
  public SignedRequest sign(String method, String path, String body, CredentialConfig credentials) {
    if (credentials == null || !credentials.hasSecret()) {
      throw new ConfigurationException("Missing shared secret for HMAC signing (RH_SHARED_SECRET)");
    }
    SigningContext ctx =
        new SigningContext(method, path, body, Long.toString(clock.millis()), credentials);
    return new SignedRequest(ctx.timestamp(), signature(ctx));
  }

  static String message(SigningContext ctx) {
    return ctx.timestamp() + ctx.method() + ctx.path() + ctx.body();
  }

  private static String signature(SigningContext ctx) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(
          new SecretKeySpec(
              ctx.credentials().secret().getBytes(StandardCharsets.UTF_8), ALGORITHM));
      byte[] digest = mac.doFinal(message(ctx).getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(digest);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to calculate HMAC-SHA256 signature", e);
    }
  }
}
