package com.marketdesk.marketdata.client.signing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketdesk.marketdata.client.ConfigurationException;
import com.marketdesk.marketdata.config.CredentialConfig;
import com.marketdesk.marketdata.config.MockOrderPolicy;
import com.marketdesk.marketdata.config.SigningScheme;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class HmacRequestSignerTest {
  private static final String PATH = "/api/v1/crypto/trading/orders/?limit=3";
  private static final Instant NOW = Instant.ofEpochMilli(1_700_000_000_123L);

  private final CredentialConfig credentials =
      new CredentialConfig(
          "key-1",
          "shared-secret",
          "acct",
          "https://trading.example.test",
          true,
          SigningScheme.HMAC_SHA256,
          MockOrderPolicy.SYNTHETIC,
          Duration.ofSeconds(5));

  @Test
  void signsMillisTimestampMethodPathBody() {
    RequestSigner signer = new HmacRequestSigner(Clock.fixed(NOW, ZoneOffset.UTC));

    SignedRequest signed = signer.sign("get", PATH, "", credentials);

    assertThat(signed.timestamp()).isEqualTo("1700000000123");
    // base64(HMAC_SHA256("shared-secret", "1700000000123GET" + PATH))
    assertThat(signed.signature()).isEqualTo("pHsdjBG8c6/bUbiODdvIZITjvECyk2EUHIk70XJDEjM=");
  }

  @Test
  void sameTimestampGivesSameSignature_differentTimestampDoesNot() {
    SignedRequest a = new HmacRequestSigner(Clock.fixed(NOW, ZoneOffset.UTC)).sign("GET", PATH, "", credentials);
    SignedRequest b = new HmacRequestSigner(Clock.fixed(NOW, ZoneOffset.UTC)).sign("GET", PATH, "", credentials);
    SignedRequest c =
        new HmacRequestSigner(Clock.fixed(NOW.plusMillis(1), ZoneOffset.UTC))
            .sign("GET", PATH, "", credentials);

    assertThat(a).isEqualTo(b);
    assertThat(c.signature()).isNotEqualTo(a.signature());
  }

  @Test
  void messageIsTimestampMethodPathBody() {
    SigningContext ctx = new SigningContext("post", "/api/v1/x", "{\"a\":1}", "42", credentials);

    assertThat(HmacRequestSigner.message(ctx)).isEqualTo("42POST/api/v1/x{\"a\":1}");
  }

  @Test
  void missingSecretIsConfigurationError() {
    CredentialConfig noSecret =
        new CredentialConfig(
            "key-1", " ", null, null, true, SigningScheme.HMAC_SHA256, null, Duration.ofSeconds(5));

    assertThatThrownBy(
            () -> new HmacRequestSigner(Clock.systemUTC()).sign("GET", PATH, "", noSecret))
        .isInstanceOf(ConfigurationException.class);
  }
}
