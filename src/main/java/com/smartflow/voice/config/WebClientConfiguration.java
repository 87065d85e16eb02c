package com.smartflow.voice.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient shared by the backend clients. Per-call deadlines are applied by each client;
 * the connector only bounds connection setup and the slowest configured backend.
 */
@Configuration
public class WebClientConfiguration {

    private static final int CONNECT_TIMEOUT_MILLIS = 3000;

    private final SmartflowProperties properties;

    public WebClientConfiguration(SmartflowProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        Duration slowest = properties.getPrimary().getTimeout();
        if (properties.getCompute().getWakeTimeout().compareTo(slowest) > 0) {
            slowest = properties.getCompute().getWakeTimeout();
        }

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .responseTimeout(slowest);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
