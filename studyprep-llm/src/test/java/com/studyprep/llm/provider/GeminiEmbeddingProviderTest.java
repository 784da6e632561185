package com.studyprep.llm.provider;

import com.studyprep.common.exception.EmbeddingNotConfiguredException;
import com.studyprep.common.exception.EmbeddingUpstreamException;
import com.studyprep.common.exception.InvalidInputException;
import com.studyprep.common.exception.MalformedEmbeddingResponseException;
import com.studyprep.llm.client.GeminiConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeminiEmbeddingProviderTest {

    private GeminiConfig config;
    private final List<ClientRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        config = new GeminiConfig();
        config.setApiKey("test-key");
        config.setBaseUrl("https://gemini.test/v1beta");
        config.setTimeoutSeconds(1);
    }

    @Test
    void postsOnceToEmbedContentAndReadsNestedValues() {
        GeminiEmbeddingProvider provider = providerReturning(HttpStatus.OK,
            "{\"embedding\": {\"values\": [0.25, -0.5, 1.0]}}");

        float[] vector = provider.embed("What is a derivative?");

        assertThat(vector).containsExactly(0.25f, -0.5f, 1.0f);
        assertThat(requests).hasSize(1);
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString())
            .isEqualTo("https://gemini.test/v1beta/models/text-embedding-004:embedContent?key=test-key");
    }

    @Test
    void acceptsBareArrayUnderEmbedding() {
        GeminiEmbeddingProvider provider = providerReturning(HttpStatus.OK, "{\"embedding\": [1, 2]}");

        assertThat(provider.embed("limits")).containsExactly(1f, 2f);
    }

    @Test
    void blankTextIsRejectedWithoutCallingUpstream() {
        GeminiEmbeddingProvider provider = providerReturning(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> provider.embed("   ")).isInstanceOf(InvalidInputException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    void missingApiKeyMeansNotConfigured() {
        config.setApiKey(" ");
        GeminiEmbeddingProvider provider = providerReturning(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> provider.embed("limits"))
            .isInstanceOf(EmbeddingNotConfiguredException.class)
            .hasMessageContaining("GEMINI_API_KEY");
        assertThat(requests).isEmpty();
    }

    @Test
    void non2xxBecomesUpstreamErrorWithStatusAndNoRetry() {
        GeminiEmbeddingProvider provider = providerReturning(HttpStatus.TOO_MANY_REQUESTS,
            "{\"error\": {\"message\": \"quota\"}}");

        assertThatThrownBy(() -> provider.embed("limits"))
            .isInstanceOfSatisfying(EmbeddingUpstreamException.class,
                e -> assertThat(e.getStatusCode()).isEqualTo(429));
        assertThat(requests).hasSize(1);
    }

    @Test
    void connectionFailureBecomesUpstreamErrorWithoutStatus() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.error(new WebClientRequestException(new IOException("Connection reset"),
                request.method(), request.url(), HttpHeaders.EMPTY));
        });
        GeminiEmbeddingProvider provider = new GeminiEmbeddingProvider(config, builder);

        assertThatThrownBy(() -> provider.embed("limits"))
            .isInstanceOfSatisfying(EmbeddingUpstreamException.class,
                e -> assertThat(e.getStatusCode()).isZero());
        assertThat(requests).hasSize(1);
    }

    @Test
    void slowProviderTimesOutAsUpstreamError() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.never());
        GeminiEmbeddingProvider provider = new GeminiEmbeddingProvider(config, builder);

        assertThatThrownBy(() -> provider.embed("limits"))
            .isInstanceOf(EmbeddingUpstreamException.class)
            .hasMessageContaining("did not respond");
    }

    @Test
    void missingEmbeddingFieldIsMalformed() {
        GeminiEmbeddingProvider provider = providerReturning(HttpStatus.OK, "{\"something\": 1}");

        assertThatThrownBy(() -> provider.embed("limits")).isInstanceOf(MalformedEmbeddingResponseException.class);
    }

    @Test
    void nonNumericValueIsMalformed() {
        GeminiEmbeddingProvider provider = providerReturning(HttpStatus.OK,
            "{\"embedding\": {\"values\": [0.1, \"x\"]}}");

        assertThatThrownBy(() -> provider.embed("limits"))
            .isInstanceOf(MalformedEmbeddingResponseException.class)
            .hasMessageContaining("index 1");
    }

    @Test
    void truncatedJsonBodyIsMalformed() {
        GeminiEmbeddingProvider provider = providerReturning(HttpStatus.OK, "{\"embedding\": [0.1, 0.2");

        assertThatThrownBy(() -> provider.embed("limits"))
            .isInstanceOf(MalformedEmbeddingResponseException.class)
            .hasCauseInstanceOf(DecodingException.class);
        assertThat(requests).hasSize(1);
    }

    @Test
    void oversizedBodyIsMalformed() {
        WebClient.Builder builder = WebClient.builder()
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16))
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body("{\"embedding\": {\"values\": [0.1, 0.2, 0.3, 0.4, 0.5]}}")
                    .build());
            });
        GeminiEmbeddingProvider provider = new GeminiEmbeddingProvider(config, builder);

        assertThatThrownBy(() -> provider.embed("limits"))
            .isInstanceOf(MalformedEmbeddingResponseException.class);
    }

    @Test
    void requestBodyCarriesTrimmedText() {
        GeminiEmbeddingProvider provider = providerReturning(HttpStatus.OK, "{\"embedding\": [1, 2]}");

        provider.embed("  What is a derivative?\n");

        assertThat(bodyOf(requests.get(0)))
            .contains("\"text\":\"What is a derivative?\"")
            .doesNotContain("\\n");
    }

    @Test
    void emptyValuesAreMalformed() {
        GeminiEmbeddingProvider provider = providerReturning(HttpStatus.OK, "{\"embedding\": {\"values\": []}}");

        assertThatThrownBy(() -> provider.embed("limits")).isInstanceOf(MalformedEmbeddingResponseException.class);
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest httpRequest = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(httpRequest, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return httpRequest.getBodyAsString().block();
    }

    private GeminiEmbeddingProvider providerReturning(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
        });
        return new GeminiEmbeddingProvider(config, builder);
    }
}
