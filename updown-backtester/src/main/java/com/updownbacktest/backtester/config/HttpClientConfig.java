package com.updownbacktest.backtester.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP clients for the market metadata API and the asset candle feed.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final BacktestProperties properties;

    @Bean
    public RestTemplate gammaRestTemplate(RestTemplateBuilder builder) {
        return build(builder, properties.getClients().getGammaBaseUrl());
    }

    @Bean
    public RestTemplate binanceRestTemplate(RestTemplateBuilder builder) {
        return build(builder, properties.getClients().getBinanceBaseUrl());
    }

    private RestTemplate build(RestTemplateBuilder builder, String rootUri) {
        BacktestProperties.Clients clients = properties.getClients();
        return builder
                .rootUri(rootUri)
                .setConnectTimeout(Duration.ofMillis(clients.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(clients.getReadTimeoutMs()))
                .build();
    }
}
