package com.nearbyproducts.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, AppProperties appProperties) {
        AppProperties.Search search = appProperties.getSearch();
        return builder
            .setConnectTimeout(Duration.ofMillis(search.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(search.getReadTimeoutMs()))
            .build();
    }
}
