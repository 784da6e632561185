package com.studyprep.llm.service;

import com.studyprep.common.exception.DimensionMismatchException;
import com.studyprep.common.exception.EmbeddingUpstreamException;
import com.studyprep.common.exception.InvalidInputException;
import com.studyprep.llm.provider.EmbeddingProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    @Mock
    private EmbeddingProvider provider;

    private EmbeddingService embeddingService;

    @BeforeEach
    void setUp() {
        lenient().when(provider.getModelName()).thenReturn("text-embedding-004");
        embeddingService = new EmbeddingService(provider, 3);
    }

    @Test
    void exactLengthPassesThrough() {
        when(provider.embed("limits")).thenReturn(new float[]{1f, 2f, 3f});

        assertThat(embeddingService.generateEmbedding("limits")).containsExactly(1f, 2f, 3f);
    }

    @Test
    void longerOutputIsTruncated() {
        when(provider.embed("limits")).thenReturn(new float[]{1f, 2f, 3f, 4f, 5f});

        assertThat(embeddingService.generateEmbedding("limits")).containsExactly(1f, 2f, 3f);
    }

    @Test
    void shorterOutputIsNeverPadded() {
        when(provider.embed("limits")).thenReturn(new float[]{1f, 2f});

        assertThatThrownBy(() -> embeddingService.generateEmbedding("limits"))
            .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void blankTextNeverReachesProvider() {
        assertThatThrownBy(() -> embeddingService.generateEmbedding(""))
            .isInstanceOf(InvalidInputException.class);
        verify(provider, never()).embed(anyString());
    }

    @Test
    void providerFailurePropagatesAfterSingleCall() {
        when(provider.embed(anyString())).thenThrow(new EmbeddingUpstreamException("down", 503));

        assertThatThrownBy(() -> embeddingService.generateEmbedding("limits"))
            .isInstanceOf(EmbeddingUpstreamException.class);
        verify(provider, times(1)).embed("limits");
    }
}
