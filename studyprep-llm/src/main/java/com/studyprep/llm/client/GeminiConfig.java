package com.studyprep.llm.client;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "gemini")
@Getter
@Setter
public class GeminiConfig {
    private String apiKey;
    private String embeddingModel = "text-embedding-004";
    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
    private int timeoutSeconds = 30;
    private int connectTimeoutMillis = 10000;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
