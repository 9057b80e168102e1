package com.tableflow.tableflow_automation.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    // Used by webhook action nodes; outbound deliveries build their own per-timeout templates
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, AutomationProperties properties) {
        Duration timeout = properties.getWebhooks().getDefaultTimeout();
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
