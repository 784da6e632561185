package com.studyprep.core.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class QuestionDetails {
    private UUID id;
    private String title;
    private String type;
    private String description;
    private List<String> images;
    private AuthorInfo author;
    private Instant createdAt;
    private Instant updatedAt;
    private Double distance; // Only set on semantic search results
}
