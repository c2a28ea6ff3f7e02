package com.lendora.lending.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client shared by the price oracle and credit gate clients.
 *
 * The response timeout follows the slower of the two configured call timeouts; the time limiters
 * in {@link ResilienceConfig} bound the whole call on top of it.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RestTemplateConfig {

    private final LendingProperties properties;

    @Value("${http.client.connection-timeout:2000}")
    private int connectionTimeout;

    @Value("${http.client.max-connections:50}")
    private int maxConnections;

    @Value("${http.client.max-connections-per-route:20}")
    private int maxConnectionsPerRoute;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        Duration responseTimeout = responseTimeout();

        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(maxConnections);
        connectionManager.setDefaultMaxPerRoute(maxConnectionsPerRoute);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectionTimeout))
                .build());

        HttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(Timeout.ofMilliseconds(connectionTimeout))
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeout.toMillis()))
                        .build())
                .build();

        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(httpClient);

        log.info("RestTemplate configured with connection timeout: {}ms, response timeout: {}, max connections: {}",
                connectionTimeout, responseTimeout, maxConnections);

        return builder
                .requestFactory(() -> requestFactory)
                .defaultHeader("X-Service-Name", "lending-service")
                .build();
    }

    Duration responseTimeout() {
        Duration oracle = properties.getOracle().getTimeout();
        Duration creditGate = properties.getCreditGate().getTimeout();
        return oracle.compareTo(creditGate) >= 0 ? oracle : creditGate;
    }
}
