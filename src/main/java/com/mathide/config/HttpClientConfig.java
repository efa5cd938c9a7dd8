package com.mathide.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client used to reach the model-completion service.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate llmRestTemplate(
            RestTemplateBuilder builder,
            @Value("${mathide.llm.connect-timeout-seconds:10}") long connectTimeoutSeconds,
            @Value("${mathide.llm.read-timeout-seconds:60}") long readTimeoutSeconds
    ) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(readTimeoutSeconds))
                .build();
    }
}
