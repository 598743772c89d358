package com.marketdesk.marketdata.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Trading API credentials and switches, bound once at startup and shared read-only.
 *
 * <p>{@code secret} holds the shared HMAC secret for {@link SigningScheme#HMAC_SHA256} or the
 * base64 32-byte Ed25519 seed for {@link SigningScheme#ED25519}.
 */
@ConfigurationProperties(prefix = "trading")
public record CredentialConfig(
    String apiKey,
    String secret,
    String account,
    String baseUrl,
    boolean live,
    @DefaultValue("ED25519") SigningScheme signing,
    @DefaultValue("SYNTHETIC") MockOrderPolicy mockOrders,
    @DefaultValue("10s") Duration timeout) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }

  public boolean hasSecret() {
    return secret != null && !secret.isBlank();
  }

  public boolean hasCredentials() {
    return hasApiKey() && hasSecret();
  }

  /** Live calls need both the flag and a complete credential set. */
  public boolean liveEnabled() {
    return live && hasCredentials();
  }

  @Override
  public String toString() {
    return "CredentialConfig[apiKey="
        + (hasApiKey() ? "***" : "<none>")
        + ", secret="
        + (hasSecret() ? "***" : "<none>")
        + ", account="
        + account
        + ", baseUrl="
        + baseUrl
        + ", live="
        + live
        + ", signing="
        + signing
        + ", mockOrders="
        + mockOrders
        + "]";
  }
}
