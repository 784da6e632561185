package com.studyprep.core.mapper;

import com.studyprep.core.model.AuthorInfo;
import com.studyprep.core.model.QuestionDetails;
import com.studyprep.data.entity.Question;
import com.studyprep.data.entity.User;
import com.studyprep.data.repository.QuestionRepositoryCustom;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns question rows into {@link QuestionDetails}. Every read path goes through here,
 * so a missing owner always renders as the deleted-user placeholder.
 */
@Component
public class QuestionMapper {

    public QuestionDetails toDetails(Question question) {
        return toDetails(question, null);
    }

    public QuestionDetails toDetails(QuestionRepositoryCustom.ScoredQuestion scored) {
        return toDetails(scored.getQuestion(), scored.getDistance());
    }

    public AuthorInfo toAuthor(User user) {
        if (user == null) {
            return AuthorInfo.deletedUser();
        }
        return AuthorInfo.builder()
            .id(user.getId())
            .displayName(user.getDisplayName())
            .deleted(false)
            .build();
    }

    private QuestionDetails toDetails(Question question, Double distance) {
        List<String> images = question.getImages() != null ? List.copyOf(question.getImages()) : List.of();
        return QuestionDetails.builder()
            .id(question.getId())
            .title(question.getTitle())
            .type(question.getType())
            .description(question.getDescription())
            .images(images)
            .author(toAuthor(question.getUser()))
            .createdAt(question.getCreatedAt())
            .updatedAt(question.getUpdatedAt())
            .distance(distance)
            .build();
    }
}
