package com.studyprep.core.question;

import com.studyprep.common.exception.InvalidInputException;
import com.studyprep.common.exception.ResourceNotFoundException;
import com.studyprep.core.mapper.QuestionMapper;
import com.studyprep.core.model.QuestionDetails;
import com.studyprep.data.entity.Question;
import com.studyprep.data.entity.User;
import com.studyprep.data.repository.QuestionRepository;
import com.studyprep.data.repository.UserRepository;
import com.studyprep.llm.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionService {

    private final QuestionRepository questionRepository;
    private final UserRepository userRepository;
    private final EmbeddingService embeddingService;
    private final QuestionMapper questionMapper;

    /**
     * Create a question. The embedding is best-effort: any failure to produce or store it
     * leaves the question without a vector and the creation still succeeds.
     * Not transactional: the row commits before the vector write.
     */
    public QuestionDetails createQuestion(CreateQuestionCommand command) {
        String title = requireText(command.getTitle(), "title");
        String type = requireText(command.getType(), "type");
        String description = requireText(command.getDescription(), "description");

        User owner = userRepository.findById(command.getUserId())
            .orElseThrow(() -> new ResourceNotFoundException("User", command.getUserId()));

        Question question = Question.builder()
            .title(title)
            .type(type)
            .description(description)
            .images(cleanImages(command.getImages()))
            .user(owner)
            .build();

        float[] embedding = null;
        try {
            embedding = embeddingService.generateEmbedding(question.getEmbeddingText());
        } catch (RuntimeException e) {
            log.warn("[QUESTION] Embedding failed, creating without vector | userId={} | errorType={} | error={}",
                owner.getId(), e.getClass().getSimpleName(), e.getMessage());
        }

        Question saved = questionRepository.createWithEmbedding(question, embedding);
        log.info("[QUESTION] Question created | questionId={} | userId={} | embedded={}",
            saved.getId(), owner.getId(), saved.getEmbedding() != null);
        return questionMapper.toDetails(saved);
    }

    @Transactional(readOnly = true)
    public List<QuestionDetails> getAllQuestions() {
        return questionRepository.findAllWithUser().stream()
            .map(questionMapper::toDetails)
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public QuestionDetails getQuestion(UUID questionId) {
        return questionMapper.toDetails(findQuestion(questionId));
    }

    @Transactional(readOnly = true)
    public List<QuestionDetails> getQuestionsByUser(UUID userId) {
        return questionRepository.findByUserIdWithUser(userId).stream()
            .map(questionMapper::toDetails)
            .collect(Collectors.toList());
    }

    /**
     * Apply a partial update. The stored embedding is left as it was.
     */
    @Transactional
    public QuestionDetails updateQuestion(UUID questionId, UUID actorId, UpdateQuestionCommand command) {
        Question question = findQuestion(questionId);
        checkCanModify(question, actorId);

        if (command.getTitle() != null) {
            question.setTitle(requireText(command.getTitle(), "title"));
        }
        if (command.getType() != null) {
            question.setType(requireText(command.getType(), "type"));
        }
        if (command.getDescription() != null) {
            question.setDescription(requireText(command.getDescription(), "description"));
        }
        if (command.getImages() != null) {
            question.setImages(cleanImages(command.getImages()));
        }

        // Flush so @UpdateTimestamp is applied before the result is mapped
        Question saved = questionRepository.saveAndFlush(question);
        log.info("[QUESTION] Question updated | questionId={} | actorId={}", questionId, actorId);
        return questionMapper.toDetails(saved);
    }

    /**
     * Delete a question together with its stored vector.
     */
    @Transactional
    public void deleteQuestion(UUID questionId, UUID actorId) {
        Question question = findQuestion(questionId);
        checkCanModify(question, actorId);

        questionRepository.deleteQuestionById(questionId);
        log.info("[QUESTION] Question deleted | questionId={} | actorId={}", questionId, actorId);
    }

    private Question findQuestion(UUID questionId) {
        return questionRepository.findByIdWithUser(questionId)
            .orElseThrow(() -> new ResourceNotFoundException("Question", questionId));
    }

    private void checkCanModify(Question question, UUID actorId) {
        if (question.belongsTo(actorId)) {
            return;
        }
        boolean admin = actorId != null && userRepository.findById(actorId)
            .map(User::isAdmin)
            .orElse(false);
        if (!admin) {
            log.warn("[QUESTION] Modification denied | questionId={} | actorId={}", question.getId(), actorId);
            throw new AccessDeniedException("Only the author or an admin can modify this question");
        }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " is required");
        }
        return value.trim();
    }

    private static List<String> cleanImages(List<String> images) {
        if (images == null) {
            return new ArrayList<>();
        }
        return images.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(url -> !url.isEmpty())
            .collect(Collectors.toList());
    }
}
