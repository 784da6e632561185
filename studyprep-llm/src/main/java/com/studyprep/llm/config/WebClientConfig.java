package com.studyprep.llm.config;

import com.studyprep.llm.client.GeminiConfig;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient configuration for embedding API calls.
 *
 * A single embedContent response is roughly 768 floats of JSON, so 2MB of buffer is plenty.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_SIZE = 2 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder(GeminiConfig geminiConfig) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(geminiConfig.getTimeoutSeconds()))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, geminiConfig.getConnectTimeoutMillis());

        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
