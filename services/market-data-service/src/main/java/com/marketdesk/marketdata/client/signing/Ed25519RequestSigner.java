package com.marketdesk.marketdata.client.signing;

import com.marketdesk.marketdata.client.ConfigurationException;
import com.marketdesk.marketdata.client.ValidationException;
import com.marketdesk.marketdata.config.CredentialConfig;
import com.marketdesk.marketdata.config.SigningScheme;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.EdECPrivateKeySpec;
import java.security.spec.NamedParameterSpec;
import java.time.Clock;
import java.util.Base64;

/**
 * {@code base64(Ed25519(seed, apiKey + timestampSeconds + path + METHOD + body))}.
 *
 * <p>The configured secret is the base64 RFC 8032 private key, i.e. the 32-byte seed the keypair
 * is derived from. Ed25519 is deterministic, so equal messages give equal signatures.
 */
public final class Ed25519RequestSigner implements RequestSigner {
  static final int SEED_LENGTH = 32;
  private static final String ALGORITHM = "Ed25519";

  private final Clock clock;

  public Ed25519RequestSigner(Clock clock) {
    this.clock = clock;
  }

  @Override
  public SigningScheme scheme() {
    return SigningScheme.ED25519;
  }

  @Override
  public SignedRequest sign(String method, String path, String body, CredentialConfig credentials) {
    if (credentials == null || !credentials.hasSecret()) {
      throw new ConfigurationException("Missing RH_PRIVATE_KEY (base64 seed)");
    }
    if (!credentials.hasApiKey()) {
      throw new ConfigurationException("Missing RH_API_KEY");
    }
    PrivateKey key = privateKey(credentials.secret());
    long seconds = clock.millis() / 1000;
    SigningContext ctx =
        new SigningContext(method, path, body, Long.toString(seconds), credentials);
    return new SignedRequest(ctx.timestamp(), signature(key, message(ctx)));
  }

  static String message(SigningContext ctx) {
    return ctx.credentials().apiKey() + ctx.timestamp() + ctx.path() + ctx.method() + ctx.body();
  }

  static PrivateKey privateKey(String seedBase64) {
    byte[] seed;
    try {
      seed = Base64.getDecoder().decode(seedBase64.trim());
    } catch (IllegalArgumentException e) {
      throw new ValidationException("RH_PRIVATE_KEY is not valid base64", e);
    }
    if (seed.length != SEED_LENGTH) {
      throw new ValidationException("RH_PRIVATE_KEY must be a 32-byte base64 seed");
    }
    try {
      return KeyFactory.getInstance(ALGORITHM)
          .generatePrivate(new EdECPrivateKeySpec(NamedParameterSpec.ED25519, seed));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Ed25519 is not available in this JVM", e);
    }
  }

  private static String signature(PrivateKey key, String message) {
    try {
      Signature signer = Signature.getInstance(ALGORITHM);
      signer.initSign(key);
      signer.update(message.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(signer.sign());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to calculate Ed25519 signature", e);
    }
  }
}
