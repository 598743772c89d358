package com.marketdesk.marketdata.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Public (unsigned) quote and options host. */
@ConfigurationProperties(prefix = "market.quotes")
public record MarketProperties(String baseUrl, Duration timeout) {}
