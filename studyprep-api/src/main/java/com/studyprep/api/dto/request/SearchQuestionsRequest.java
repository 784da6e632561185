package com.studyprep.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SearchQuestionsRequest {

    @NotBlank(message = "Query is required")
    private String query;

    private Integer limit; // Defaults to 3, capped server-side
}
