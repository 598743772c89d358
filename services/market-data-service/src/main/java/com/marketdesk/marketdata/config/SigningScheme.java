package com.marketdesk.marketdata.config;

public enum SigningScheme {
  /** Millisecond timestamp, {@code ts + METHOD + path + body}, shared-secret HMAC. */
  HMAC_SHA256,
  /** Second timestamp, {@code apiKey + ts + path + method + body}, Ed25519 from a 32-byte seed. */
  ED25519
}
