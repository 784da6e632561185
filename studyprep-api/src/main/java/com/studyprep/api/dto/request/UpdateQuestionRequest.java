package com.studyprep.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * All fields optional; only those present are changed.
 */
@Data
public class UpdateQuestionRequest {

    @Size(max = 255, message = "Title must be at most 255 characters")
    private String title;

    @Size(max = 100, message = "Type must be at most 100 characters")
    private String type;

    private String description;

    private List<String> images;
}
