package org.rostilos.reviewpipe.analysisengine.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestTemplateConfiguration {

    @Bean("reviewRestTemplate")
    public RestTemplate reviewRestTemplate(RestTemplateBuilder builder, ReviewPipeProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(properties.getAi().getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofMinutes(properties.getAi().getReadTimeoutMinutes()))
                .build();
    }
}
