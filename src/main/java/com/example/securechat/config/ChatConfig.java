package com.example.securechat.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class ChatConfig {

    /**
     * Server-side timestamps for sessions, messages and encryption metadata.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * RestTemplate for the generation backend.
     * - read timeout bounds how long a chat turn waits before the fallback reply
     */
    @Bean
    @Qualifier("generationRestTemplate")
    public RestTemplate generationRestTemplate(RestTemplateBuilder builder, ChatProperties properties) {
        ChatProperties.Generation generation = properties.getGeneration();
        return builder
                .setConnectTimeout(generation.getConnectTimeout())
                .setReadTimeout(generation.getReadTimeout())
                .build();
    }
}
