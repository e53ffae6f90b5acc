package com.example.reportsync.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for WebClient instances.
 *
 * CRITICAL: every outbound client has connect/read/write timeouts so a hanging
 * GitHub call cannot pin a queue worker forever.
 */
@Configuration
public class WebClientConfig {

    /**
     * WebClient for GitHub API calls.
     *
     * Base URL: report-sync.github.api-base-url (https://api.github.com)
     * Timeout: report-sync.github.timeout-seconds (20)
     * Buffer: 16MB, attachment uploads are base64 encoded in the request body
     */
    @Bean("githubWebClient")
    public WebClient githubWebClient(
            @Value("${report-sync.github.api-base-url:https://api.github.com}") String baseUrl,
            @Value("${report-sync.github.timeout-seconds:20}") int timeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }
}
