package com.studyprep.data.repository;

import com.studyprep.data.entity.Question;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface QuestionRepository extends JpaRepository<Question, UUID>, QuestionRepositoryCustom {

    @Query("SELECT q FROM Question q LEFT JOIN FETCH q.user ORDER BY q.createdAt DESC")
    List<Question> findAllWithUser();

    @Query("SELECT q FROM Question q LEFT JOIN FETCH q.user WHERE q.id = :id")
    Optional<Question> findByIdWithUser(@Param("id") UUID id);

    @Query("""
        SELECT q FROM Question q
        JOIN FETCH q.user u
        WHERE u.id = :userId
        ORDER BY q.createdAt DESC
        """)
    List<Question> findByUserIdWithUser(@Param("userId") UUID userId);

    /**
     * The embedding is a column of the question row, so this single statement removes
     * the row and its vector together.
     */
    @Modifying
    @Transactional
    @Query(value = "DELETE FROM questions WHERE id = :id", nativeQuery = true)
    int deleteQuestionById(@Param("id") UUID id);
}
