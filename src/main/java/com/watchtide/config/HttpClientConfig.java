package com.watchtide.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, WatchtideProperties properties) {
        return builder
                .setConnectTimeout(properties.getGoogle().getConnectTimeout())
                .setReadTimeout(properties.getGoogle().getReadTimeout())
                .build();
    }
}
