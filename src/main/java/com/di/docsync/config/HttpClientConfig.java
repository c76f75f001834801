package com.di.docsync.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Outbound HTTP for the document index and for pre-authorized file URLs.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, IndexProperties indexProperties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(indexProperties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(indexProperties.getReadTimeoutMs()))
                .build();
    }
}
