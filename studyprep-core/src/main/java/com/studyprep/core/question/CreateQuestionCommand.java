package com.studyprep.core.question;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@Builder
public class CreateQuestionCommand {
    private UUID userId;
    private String title;
    private String type;
    private String description;
    private List<String> images;
}
