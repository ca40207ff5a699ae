package com.flagship.crypto_settlement.config;

import io.micrometer.core.instrument.MeterRegistry;
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
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * HTTP client for the mirror node.
 *
 * Pooled Apache HttpClient 5 connections with connect and response timeouts
 * below the matcher's check budget, plus logging and metrics interceptors.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class MirrorNodeConfig {

    private final MeterRegistry meterRegistry;

    @Value("${hedera.mirror.connect-timeout-ms:3000}")
    private int connectTimeout;

    @Value("${hedera.mirror.read-timeout-ms:6000}")
    private int readTimeout;

    @Value("${hedera.mirror.max-connections:50}")
    private int maxConnections;

    @Value("${hedera.mirror.max-connections-per-route:20}")
    private int maxConnectionsPerRoute;

    @Bean
    public RestTemplate mirrorNodeRestTemplate(RestTemplateBuilder builder) {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(maxConnections);
        connectionManager.setDefaultMaxPerRoute(maxConnectionsPerRoute);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout))
            .build());

        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofMilliseconds(connectTimeout))
            .setResponseTimeout(Timeout.ofMilliseconds(readTimeout))
            .build();

        HttpClient httpClient = HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .build();

        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(httpClient);

        RestTemplate restTemplate = builder
            .requestFactory(() -> requestFactory)
            .additionalInterceptors(acceptJsonInterceptor(), loggingInterceptor(), metricsInterceptor())
            .build();

        log.info("Mirror node RestTemplate configured: connectTimeout={}ms, readTimeout={}ms, maxConnections={}",
            connectTimeout, readTimeout, maxConnections);

        return restTemplate;
    }

    private ClientHttpRequestInterceptor acceptJsonInterceptor() {
        return (request, body, execution) -> {
            request.getHeaders().setAccept(List.of(MediaType.APPLICATION_JSON));
            return execution.execute(request, body);
        };
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            log.debug("Mirror request: {} {}", request.getMethod(), request.getURI());

            ClientHttpResponse response = execution.execute(request, body);

            log.debug("Mirror response: {} {} status={} duration={}ms",
                request.getMethod(), request.getURI().getPath(), response.getStatusCode(),
                System.currentTimeMillis() - startTime);
            return response;
        };
    }

    private ClientHttpRequestInterceptor metricsInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            String host = request.getURI().getHost();
            try {
                ClientHttpResponse response = execution.execute(request, body);
                meterRegistry.counter("mirror.client.requests",
                    "host", host,
                    "status", String.valueOf(response.getStatusCode().value())
                ).increment();
                return response;
            } catch (Exception e) {
                meterRegistry.counter("mirror.client.errors",
                    "host", host,
                    "exception", e.getClass().getSimpleName()
                ).increment();
                throw e;
            } finally {
                meterRegistry.timer("mirror.client.duration", "host", host)
                    .record(Duration.ofMillis(System.currentTimeMillis() - startTime));
            }
        };
    }
}
