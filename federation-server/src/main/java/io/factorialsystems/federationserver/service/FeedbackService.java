package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.dto.FeedbackQuestionRequest;
import io.factorialsystems.federationserver.dto.FeedbackResponseRequest;
import io.factorialsystems.federationserver.exception.ConflictException;
import io.factorialsystems.federationserver.exception.ExpiredException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.FeedbackQuestionMapper;
import io.factorialsystems.federationserver.mapper.FeedbackResponseMapper;
import io.factorialsystems.federationserver.model.DeletionOutcome;
import io.factorialsystems.federationserver.model.FeedbackCategory;
import io.factorialsystems.federationserver.model.FeedbackQuestion;
import io.factorialsystems.federationserver.model.FeedbackResponse;
import io.factorialsystems.federationserver.model.FeedbackStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Feedback questions published by admins and the member responses to them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    static final String QUESTION_NOT_FOUND = "Feedback question not found";
    static final String RESPONSE_NOT_FOUND = "Feedback response not found";
    static final String QUESTION_INACTIVE = "This feedback question is no longer active";
    static final String QUESTION_EXPIRED = "This feedback question has expired";
    static final String ALREADY_RESPONDED = "You have already submitted feedback for this question";

    private final FeedbackQuestionMapper questionMapper;
    private final FeedbackResponseMapper responseMapper;
    private final Clock clock;

    // Questions

    public List<FeedbackQuestion> findOpenQuestions() {
        return questionMapper.findOpen(OffsetDateTime.now(clock));
    }

    public List<FeedbackQuestion> findAllQuestions() {
        return questionMapper.findAll();
    }

    public FeedbackQuestion findQuestion(String id) {
        FeedbackQuestion question = questionMapper.findById(id);
        if (question == null) {
            throw new ResourceNotFoundException(QUESTION_NOT_FOUND);
        }
        return question;
    }

    @Transactional
    public FeedbackQuestion createQuestion(FeedbackQuestionRequest request, String creatorId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        FeedbackQuestion question = FeedbackQuestion.builder()
                .id(UUID.randomUUID().toString())
                .title(request.getTitle().trim())
                .description(request.getDescription())
                .category(request.getCategory() == null ? FeedbackCategory.GENERAL : FeedbackCategory.fromValue(request.getCategory()))
                .isActive(request.getIsActive() == null || request.getIsActive())
                .expiresAt(request.getExpiresAt())
                .createdById(creatorId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        int result = questionMapper.insert(question);
        if (result <= 0) {
            throw new RuntimeException("Failed to create feedback question");
        }

        log.info("Created feedback question: id={}, category={}", question.getId(), question.getCategory());
        return question;
    }

    /**
     * Title and description are always replaced. Category, active flag and expiry change only when supplied.
     */
    @Transactional
    public FeedbackQuestion updateQuestion(String id, FeedbackQuestionRequest request) {
        FeedbackQuestion question = findQuestion(id);
        question.setTitle(request.getTitle().trim());
        question.setDescription(request.getDescription());
        if (request.getCategory() != null) {
            question.setCategory(FeedbackCategory.fromValue(request.getCategory()));
        }
        if (request.getIsActive() != null) {
            question.setIsActive(request.getIsActive());
        }
        if (request.getExpiresAt() != null) {
            question.setExpiresAt(request.getExpiresAt());
        }
        question.setUpdatedAt(OffsetDateTime.now(clock));

        int result = questionMapper.update(question);
        if (result <= 0) {
            throw new ResourceNotFoundException(QUESTION_NOT_FOUND);
        }

        log.info("Updated feedback question: {}", id);
        return question;
    }

    /**
     * Deletes an unanswered question. A question with responses is deactivated instead so the
     * responses keep their reference.
     */
    @Transactional
    public DeletionOutcome deleteQuestion(String id) {
        if (questionMapper.deleteIfUnanswered(id) > 0) {
            log.info("Deleted feedback question: {}", id);
            return DeletionOutcome.DELETED;
        }

        int result = questionMapper.deactivate(id, OffsetDateTime.now(clock));
        if (result <= 0) {
            throw new ResourceNotFoundException(QUESTION_NOT_FOUND);
        }
        log.info("Feedback question {} has responses, deactivated instead of deleted", id);
        return DeletionOutcome.DEACTIVATED;
    }

    // Responses

    public List<FeedbackResponse> findAllResponses() {
        return responseMapper.findAll();
    }

    public List<FeedbackResponse> findResponsesByUser(String userId) {
        return responseMapper.findByUser(userId);
    }

    public List<FeedbackResponse> findResponsesByQuestion(String questionId) {
        return responseMapper.findByQuestion(questionId);
    }

    public FeedbackResponse findResponse(String id) {
        FeedbackResponse response = responseMapper.findById(id);
        if (response == null) {
            throw new ResourceNotFoundException(RESPONSE_NOT_FOUND);
        }
        return response;
    }

    /**
     * Records the user's single response to an open question. The open-question check and the
     * one-per-user rule are enforced by the insert itself.
     */
    @Transactional
    public FeedbackResponse submitResponse(FeedbackResponseRequest request, String userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        requireAcceptsResponse(findQuestion(request.getFeedbackId()), userId, now);

        FeedbackResponse response = FeedbackResponse.builder()
                .id(UUID.randomUUID().toString())
                .feedbackId(request.getFeedbackId())
                .response(request.getResponse())
                .rating(request.getRating())
                .status(FeedbackStatus.PENDING)
                .createdById(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        int result = responseMapper.insertIfOpen(response);
        if (result <= 0) {
            FeedbackQuestion current = questionMapper.findById(request.getFeedbackId());
            if (current == null) {
                throw new ResourceNotFoundException(QUESTION_NOT_FOUND);
            }
            requireAcceptsResponse(current, userId, now);
            log.warn("Feedback response by {} on question {} matched no row", userId, request.getFeedbackId());
            throw new ConflictException(ALREADY_RESPONDED);
        }

        log.info("User {} responded to feedback question {}", userId, request.getFeedbackId());
        return response;
    }

    /**
     * Stores the admin's comment and marks the response addressed.
     */
    @Transactional
    public FeedbackResponse commentOnResponse(String id, String adminComment) {
        int result = responseMapper.updateReview(id, adminComment, FeedbackStatus.ADDRESSED, OffsetDateTime.now(clock));
        if (result <= 0) {
            throw new ResourceNotFoundException(RESPONSE_NOT_FOUND);
        }
        log.info("Admin comment added to feedback response {}", id);
        return findResponse(id);
    }

    @Transactional
    public FeedbackResponse updateResponseStatus(String id, FeedbackStatus status) {
        int result = responseMapper.updateStatus(id, status, OffsetDateTime.now(clock));
        if (result <= 0) {
            throw new ResourceNotFoundException(RESPONSE_NOT_FOUND);
        }
        log.info("Feedback response {} status set to {}", id, status);
        return findResponse(id);
    }

    @Transactional
    public void deleteResponse(String id) {
        int result = responseMapper.delete(id);
        if (result <= 0) {
            throw new ResourceNotFoundException(RESPONSE_NOT_FOUND);
        }
        log.info("Deleted feedback response: {}", id);
    }

    private void requireAcceptsResponse(FeedbackQuestion question, String userId, OffsetDateTime now) {
        if (!Boolean.TRUE.equals(question.getIsActive())) {
            throw new ExpiredException(QUESTION_INACTIVE);
        }
        if (!question.isOpen(now)) {
            throw new ExpiredException(QUESTION_EXPIRED);
        }
        if (responseMapper.existsForUser(question.getId(), userId)) {
            log.warn("User {} already responded to feedback question {}", userId, question.getId());
            throw new ConflictException(ALREADY_RESPONDED);
        }
    }
}
