package com.studyprep.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.studyprep.core.model.AuthorInfo;
import com.studyprep.core.model.QuestionDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QuestionResponse {
    private UUID id;
    private String title;
    private String type;
    private String description;
    private List<String> images;
    private Author author;
    private Instant createdAt;
    private Instant updatedAt;
    private Double distance;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Author {
        private UUID id;
        private String displayName;
    }

    public static QuestionResponse from(QuestionDetails details) {
        AuthorInfo author = details.getAuthor();
        return QuestionResponse.builder()
            .id(details.getId())
            .title(details.getTitle())
            .type(details.getType())
            .description(details.getDescription())
            .images(details.getImages())
            .author(Author.builder()
                .id(author.getId())
                .displayName(author.getDisplayName())
                .build())
            .createdAt(details.getCreatedAt())
            .updatedAt(details.getUpdatedAt())
            .distance(details.getDistance())
            .build();
    }
}
