package com.studyprep.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.studyprep.common.exception.EmbeddingNotConfiguredException;
import com.studyprep.common.exception.EmbeddingUpstreamException;
import com.studyprep.common.exception.InvalidInputException;
import com.studyprep.common.exception.MalformedEmbeddingResponseException;
import com.studyprep.llm.client.GeminiConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Embedding provider backed by the Gemini {@code embedContent} endpoint.
 */
@Component
@Slf4j
public class GeminiEmbeddingProvider implements EmbeddingProvider {

    private final GeminiConfig config;
    private final WebClient webClient;

    public GeminiEmbeddingProvider(GeminiConfig config, WebClient.Builder webClientBuilder) {
        this.config = config;
        this.webClient = webClientBuilder.build();
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Text to embed must not be blank");
        }
        if (!config.hasApiKey()) {
            throw new EmbeddingNotConfiguredException("AI is not configured. Missing GEMINI_API_KEY.");
        }

        String content = text.trim();
        String apiKey = config.getApiKey().trim();
        String url = String.format("%s/models/%s:embedContent?key=%s",
            config.getBaseUrl(), config.getEmbeddingModel(), apiKey);

        Map<String, Object> request = Map.of(
            "model", "models/" + config.getEmbeddingModel(),
            "content", Map.of(
                "parts", List.of(Map.of("text", content))
            )
        );

        log.debug("[EMBED] Requesting embedding | url={} | textLength={}",
            url.replace(apiKey, "***"), content.length());

        long start = System.currentTimeMillis();
        JsonNode response;
        try {
            response = webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .onErrorMap(GeminiEmbeddingProvider::isUnreadableBody, e -> new MalformedEmbeddingResponseException(
                    "Embedding response body could not be read: " + e.getMessage(), unreadableCause(e)))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .onErrorMap(TimeoutException.class, e -> new EmbeddingUpstreamException(
                    "Embedding provider did not respond within " + config.getTimeoutSeconds() + "s", 0, e))
                .block();
        } catch (WebClientResponseException e) {
            log.error("[EMBED] Provider returned error | status={} | body={}",
                e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new EmbeddingUpstreamException(
                "Embedding provider returned HTTP " + e.getStatusCode().value(), e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            log.error("[EMBED] Provider unreachable | error={}", e.getMessage());
            throw new EmbeddingUpstreamException("Embedding provider unreachable: " + e.getMessage(), 0, e);
        }

        float[] values = parseValues(response);
        log.debug("[EMBED] Embedding received | dimensions={} | time={}ms",
            values.length, System.currentTimeMillis() - start);
        return values;
    }

    /**
     * A 2xx body that failed to decode. WebClient reports an oversized body wrapped in a
     * {@link WebClientResponseException}, so the cause is checked as well.
     */
    private static boolean isUnreadableBody(Throwable error) {
        return unreadableCause(error) != null;
    }

    private static Throwable unreadableCause(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof CodecException || t instanceof DataBufferLimitException) {
                return t;
            }
        }
        return null;
    }

    /**
     * Accepts {@code {"embedding": {"values": [...]}}} as well as {@code {"embedding": [...]}}.
     */
    static float[] parseValues(JsonNode response) {
        if (response == null) {
            throw new MalformedEmbeddingResponseException("Empty response from embedding provider");
        }
        JsonNode embedding = response.get("embedding");
        if (embedding == null || embedding.isNull()) {
            throw new MalformedEmbeddingResponseException("Response has no embedding field");
        }
        JsonNode values = embedding.isArray() ? embedding : embedding.get("values");
        if (values == null || !values.isArray()) {
            throw new MalformedEmbeddingResponseException("Embedding values are not an array");
        }
        if (values.isEmpty()) {
            throw new MalformedEmbeddingResponseException("Embedding values are empty");
        }

        float[] result = new float[values.size()];
        for (int i = 0; i < values.size(); i++) {
            JsonNode value = values.get(i);
            if (!value.isNumber()) {
                throw new MalformedEmbeddingResponseException("Non-numeric embedding value at index " + i);
            }
            float component = value.floatValue();
            if (Float.isNaN(component) || Float.isInfinite(component)) {
                throw new MalformedEmbeddingResponseException("Non-finite embedding value at index " + i);
            }
            result[i] = component;
        }
        return result;
    }

    @Override
    public String getModelName() {
        return config.getEmbeddingModel();
    }
}
