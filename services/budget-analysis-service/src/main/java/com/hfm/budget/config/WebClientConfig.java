package com.hfm.budget.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Outbound HTTP client for the transaction service and the clock the analysis reads "now" from.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Value("${transaction-service.url:http://localhost:8100}")
    private String transactionServiceUrl;

    @Value("${transaction-service.connect-timeout-ms:2000}")
    private int connectTimeoutMs;

    @Value("${transaction-service.timeout:10s}")
    private Duration responseTimeout;

    @Value("${transaction-service.max-in-memory-size:10485760}")
    private int maxInMemorySize;

    @Bean("transactionServiceWebClient")
    public WebClient transactionServiceWebClient(WebClient.Builder builder) {
        log.info("Configuring transaction-service WebClient - URL: {}, Connect: {}ms, Response: {}",
                transactionServiceUrl, connectTimeoutMs, responseTimeout);

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .responseTimeout(responseTimeout);

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();

        return builder
                .baseUrl(transactionServiceUrl)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
