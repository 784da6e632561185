package com.studyprep.api.controller;

import com.studyprep.api.dto.request.CreateQuestionRequest;
import com.studyprep.api.dto.request.SearchQuestionsRequest;
import com.studyprep.api.dto.request.UpdateQuestionRequest;
import com.studyprep.api.dto.response.QuestionResponse;
import com.studyprep.api.dto.response.QuestionSearchResponse;
import com.studyprep.core.model.QuestionDetails;
import com.studyprep.core.question.CreateQuestionCommand;
import com.studyprep.core.question.QuestionService;
import com.studyprep.core.question.UpdateQuestionCommand;
import com.studyprep.core.search.SemanticSearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/questions")
@RequiredArgsConstructor
@Slf4j
public class QuestionController {

    private final QuestionService questionService;
    private final SemanticSearchService semanticSearchService;

    @GetMapping
    public ResponseEntity<Map<String, List<QuestionResponse>>> getAllQuestions() {
        return ResponseEntity.ok(Map.of("questions", toResponses(questionService.getAllQuestions())));
    }

    @GetMapping("/my")
    public ResponseEntity<Map<String, List<QuestionResponse>>> getMyQuestions(Authentication authentication) {
        UUID userId = UUID.fromString(authentication.getName());
        return ResponseEntity.ok(Map.of("questions", toResponses(questionService.getQuestionsByUser(userId))));
    }

    @GetMapping("/{questionId}")
    public ResponseEntity<Map<String, QuestionResponse>> getQuestion(@PathVariable UUID questionId) {
        return ResponseEntity.ok(Map.of("question", QuestionResponse.from(questionService.getQuestion(questionId))));
    }

    @PostMapping
    public ResponseEntity<Map<String, QuestionResponse>> createQuestion(
            @Valid @RequestBody CreateQuestionRequest request,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());
        log.debug("Create question request | userId={} | type={}", userId, request.getType());

        CreateQuestionCommand command = CreateQuestionCommand.builder()
            .userId(userId)
            .title(request.getTitle())
            .type(request.getType())
            .description(request.getDescription())
            .images(request.getImages())
            .build();

        QuestionResponse created = QuestionResponse.from(questionService.createQuestion(command));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("question", created));
    }

    @PutMapping("/{questionId}")
    public ResponseEntity<Map<String, QuestionResponse>> updateQuestion(
            @PathVariable UUID questionId,
            @Valid @RequestBody UpdateQuestionRequest request,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());

        UpdateQuestionCommand command = UpdateQuestionCommand.builder()
            .title(request.getTitle())
            .type(request.getType())
            .description(request.getDescription())
            .images(request.getImages())
            .build();

        QuestionResponse updated = QuestionResponse.from(questionService.updateQuestion(questionId, userId, command));
        return ResponseEntity.ok(Map.of("question", updated));
    }

    @DeleteMapping("/{questionId}")
    public ResponseEntity<Map<String, Boolean>> deleteQuestion(
            @PathVariable UUID questionId,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());
        questionService.deleteQuestion(questionId, userId);
        return ResponseEntity.ok(Map.of("success", true));
    }

    /**
     * Semantic search over previously asked questions, closest first.
     */
    @PostMapping("/search")
    public ResponseEntity<QuestionSearchResponse> searchQuestions(@Valid @RequestBody SearchQuestionsRequest request) {
        List<QuestionResponse> results = toResponses(semanticSearchService.search(request.getQuery(), request.getLimit()));

        return ResponseEntity.ok(QuestionSearchResponse.builder()
            .questions(results)
            .query(request.getQuery())
            .count(results.size())
            .build());
    }

    private static List<QuestionResponse> toResponses(List<QuestionDetails> details) {
        return details.stream()
            .map(QuestionResponse::from)
            .collect(Collectors.toList());
    }
}
