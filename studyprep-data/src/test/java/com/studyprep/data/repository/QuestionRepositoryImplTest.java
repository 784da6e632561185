package com.studyprep.data.repository;

import com.studyprep.data.entity.Question;
import com.studyprep.data.entity.User;
import com.studyprep.data.vector.NeighborHit;
import com.studyprep.data.vector.QuestionVectorStore;
import com.studyprep.data.vector.VectorWriteResult;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuestionRepositoryImplTest {

    private static final int DIMENSIONS = 4;

    @Mock
    private EntityManager entityManager;

    @Mock
    private QuestionVectorStore vectorStore;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private TypedQuery<Question> typedQuery;

    private QuestionRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        lenient().when(vectorStore.getDimensions()).thenReturn(DIMENSIONS);
        lenient().doAnswer(invocation -> {
            Question question = invocation.getArgument(0);
            question.setId(UUID.randomUUID());
            return null;
        }).when(entityManager).persist(any(Question.class));

        repository = new QuestionRepositoryImpl(vectorStore, transactionManager);
        ReflectionTestUtils.setField(repository, "entityManager", entityManager);
    }

    @Test
    void writesRowBeforeVectorAndAttachesStoredEmbedding() {
        float[] embedding = {0.1f, 0.2f, 0.3f, 0.4f};
        when(vectorStore.upsertVector(any(UUID.class), eq(embedding))).thenReturn(VectorWriteResult.stored());

        Question created = repository.createWithEmbedding(newQuestion(), embedding);

        InOrder order = inOrder(entityManager, transactionManager, vectorStore);
        order.verify(entityManager).persist(created);
        order.verify(transactionManager).commit(any());
        order.verify(vectorStore).upsertVector(created.getId(), embedding);
        assertThat(created.getEmbedding()).containsExactly(embedding);
    }

    @Test
    void skippedVectorWriteStillReturnsCreatedQuestion() {
        when(vectorStore.upsertVector(any(UUID.class), any(float[].class)))
            .thenReturn(VectorWriteResult.skipped(VectorWriteResult.SkipReason.CAPABILITY_UNAVAILABLE));

        Question created = repository.createWithEmbedding(newQuestion(), new float[DIMENSIONS]);

        assertThat(created.getId()).isNotNull();
        assertThat(created.getEmbedding()).isNull();
    }

    @Test
    void noEmbeddingMeansNoVectorWrite() {
        Question created = repository.createWithEmbedding(newQuestion(), null);

        assertThat(created.getId()).isNotNull();
        assertThat(created.getEmbedding()).isNull();
        verify(vectorStore, never()).upsertVector(any(), any());
    }

    @Test
    void malformedEmbeddingIsRejectedNotStored() {
        Question created = repository.createWithEmbedding(newQuestion(), new float[]{0.1f, 0.2f});

        assertThat(created.getId()).isNotNull();
        assertThat(created.getEmbedding()).isNull();
        verify(vectorStore, never()).upsertVector(any(), any());
    }

    @Test
    void searchKeepsDistanceOrderAndDropsRowsDeletedMeanwhile() {
        Question first = savedQuestion("Limits");
        Question second = savedQuestion("Derivatives");
        UUID deleted = UUID.randomUUID();
        when(vectorStore.nearestNeighbors(any(float[].class), anyInt())).thenReturn(List.of(
            new NeighborHit(second.getId(), 0.1d),
            new NeighborHit(deleted, 0.2d),
            new NeighborHit(first.getId(), 0.3d)));
        when(entityManager.createQuery(anyString(), eq(Question.class))).thenReturn(typedQuery);
        when(typedQuery.setParameter(eq("ids"), any())).thenReturn(typedQuery);
        when(typedQuery.getResultList()).thenReturn(List.of(first, second));

        List<QuestionRepositoryCustom.ScoredQuestion> results = repository.searchByEmbedding(new float[DIMENSIONS], 3);

        assertThat(results).extracting(QuestionRepositoryCustom.ScoredQuestion::getId)
            .containsExactly(second.getId(), first.getId());
        assertThat(results).extracting(QuestionRepositoryCustom.ScoredQuestion::getDistance)
            .containsExactly(0.1d, 0.3d);
    }

    @Test
    void searchWithoutHitsSkipsRowLookup() {
        when(vectorStore.nearestNeighbors(any(float[].class), anyInt())).thenReturn(List.of());

        assertThat(repository.searchByEmbedding(new float[DIMENSIONS], 3)).isEmpty();
        verify(entityManager, never()).createQuery(anyString(), eq(Question.class));
    }

    private static Question newQuestion() {
        return Question.builder()
            .title("Derivative of x^2")
            .type("Math")
            .description("How do I differentiate x squared?")
            .user(User.builder().id(UUID.randomUUID()).email("student@example.com").build())
            .build();
    }

    private static Question savedQuestion(String title) {
        Question question = newQuestion();
        question.setId(UUID.randomUUID());
        question.setTitle(title);
        return question;
    }
}
