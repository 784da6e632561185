package com.studyprep.data.repository;

import com.studyprep.data.entity.Question;

import java.util.List;
import java.util.UUID;

public interface QuestionRepositoryCustom {

    /**
     * Persist a new question row and, when an embedding is supplied, store it afterwards.
     * The row is committed before the vector write, so this must not run inside a
     * surrounding transaction. A vector write that is skipped or rejected leaves the
     * question without an embedding; it never fails the creation.
     *
     * @param question  unsaved question
     * @param embedding vector of the configured dimensions, or null
     * @return the saved question; {@code getEmbedding()} is non-null only if the vector was stored
     */
    Question createWithEmbedding(Question question, float[] embedding);

    /**
     * Nearest questions to {@code embedding}, closest first. Questions without a stored
     * vector are never returned.
     */
    List<ScoredQuestion> searchByEmbedding(float[] embedding, int limit);

    /**
     * Question with its distance to the query vector.
     */
    class ScoredQuestion {
        private final Question question;
        private final double distance;

        public ScoredQuestion(Question question, double distance) {
            this.question = question;
            this.distance = distance;
        }

        public Question getQuestion() { return question; }
        public double getDistance() { return distance; }

        public UUID getId() { return question.getId(); }
    }
}
