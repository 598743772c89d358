package com.marketdesk.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketdesk.marketdata.client.HttpGateway;
import com.marketdesk.marketdata.client.signing.RequestSigner;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class MarketClientConfig {
  private static final Logger log = LoggerFactory.getLogger(MarketClientConfig.class);

  static final String QUOTES_API_ROOT = "/v7/finance/";
  static final String TRADING_API_ROOT = "/api/v1/";

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RequestSigner requestSigner(CredentialConfig credentials, Clock clock) {
    log.info(
        "Trading API: signing={} live={} credentials={}",
        credentials.signing(),
        credentials.live(),
        credentials.hasCredentials() ? "present" : "absent");
    return RequestSigner.forScheme(credentials.signing(), clock);
  }

  @Bean
  public HttpGateway quoteGateway(MarketProperties properties, ObjectMapper objectMapper) {
    return new HttpGateway(
        "Quotes",
        properties.baseUrl(),
        QUOTES_API_ROOT,
        webClient(properties.timeout()),
        properties.timeout(),
        objectMapper);
  }

  @Bean
  public HttpGateway tradingGateway(CredentialConfig credentials, ObjectMapper objectMapper) {
    return new HttpGateway(
        "Trading API",
        credentials.baseUrl(),
        TRADING_API_ROOT,
        webClient(credentials.timeout()),
        credentials.timeout(),
        objectMapper);
  }

  private static WebClient webClient(Duration timeout) {
    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(timeout.toMillis()))
            .doOnConnected(
                conn ->
                    conn.addHandlerLast(
                        new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS)));
    return WebClient.builder().clientConnector(new ReactorClientHttpConnector(httpClient)).build();
  }
}
