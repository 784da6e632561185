package com.studyprep.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "questions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "type", nullable = false)
    private String type;

    @Column(name = "description", nullable = false, columnDefinition = "TEXT")
    private String description;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "images", columnDefinition = "text[]")
    @Builder.Default
    private List<String> images = new ArrayList<>();

    // Nullable: the question outlives its author (ON DELETE SET NULL)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private User user;

    @CreationTimestamp
    @Column(name = "created_at")
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // The vector(768) column is owned by QuestionVectorStore and is never mapped by Hibernate.
    // Populated only on the instance returned from createWithEmbedding when the vector was stored.
    @Transient
    private float[] embedding;

    public UUID getUserId() {
        return user != null ? user.getId() : null;
    }

    public boolean belongsTo(UUID userId) {
        return userId != null && userId.equals(getUserId());
    }

    /**
     * Text that is embedded for semantic search.
     */
    public String getEmbeddingText() {
        return title.trim() + " " + description.trim();
    }
}
