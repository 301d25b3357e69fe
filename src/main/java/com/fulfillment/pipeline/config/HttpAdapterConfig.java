package com.fulfillment.pipeline.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client shared by the real collaborator adapters. Socket timeouts sit below the
 * Resilience4j time limits so a hung connection fails the attempt on its own.
 */
@Configuration
@ConditionalOnProperty(name = "fulfillment.adapters.mock.enabled", havingValue = "false")
public class HttpAdapterConfig {

    @Bean(name = "downstreamRestTemplate")
    public RestTemplate downstreamRestTemplate(
            @Value("${fulfillment.adapters.http.connect-timeout-ms:3000}") int connectTimeoutMs,
            @Value("${fulfillment.adapters.http.read-timeout-ms:55000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
