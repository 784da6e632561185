package com.studyprep.core.question;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Partial update. Null fields are left unchanged.
 */
@Data
@Builder
public class UpdateQuestionCommand {
    private String title;
    private String type;
    private String description;
    private List<String> images;
}
