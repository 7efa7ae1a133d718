package io.factorialsystems.federationserver.controller;

import io.factorialsystems.federationserver.dto.AdminCommentRequest;
import io.factorialsystems.federationserver.dto.FeedbackQuestionRequest;
import io.factorialsystems.federationserver.dto.FeedbackResponseRequest;
import io.factorialsystems.federationserver.dto.ResponseStatusRequest;
import io.factorialsystems.federationserver.model.DeletionOutcome;
import io.factorialsystems.federationserver.model.FeedbackQuestion;
import io.factorialsystems.federationserver.model.FeedbackResponse;
import io.factorialsystems.federationserver.model.FeedbackStatus;
import io.factorialsystems.federationserver.security.AuthenticatedUser;
import io.factorialsystems.federationserver.service.FeedbackService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/feedback")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackService feedbackService;
    private final RequestValidator requestValidator;

    // ---- Questions ----

    /**
     * Active, unexpired questions (public)
     */
    @GetMapping("/questions")
    public ResponseEntity<List<FeedbackQuestion>> getOpenQuestions() {
        log.info("Listing open feedback questions");
        return ResponseEntity.ok(feedbackService.findOpenQuestions());
    }

    /**
     * Every question with its creator (admin only)
     */
    @GetMapping("/questions/admin")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<FeedbackQuestion>> getAllQuestions() {
        log.info("Listing all feedback questions");
        return ResponseEntity.ok(feedbackService.findAllQuestions());
    }

    @GetMapping("/questions/{id}")
    public ResponseEntity<FeedbackQuestion> getQuestion(@PathVariable String id) {
        log.info("Getting feedback question: {}", id);
        return ResponseEntity.ok(feedbackService.findQuestion(id));
    }

    @PostMapping("/questions")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<FeedbackQuestion> createQuestion(@RequestBody FeedbackQuestionRequest request,
                                                           Authentication authentication) {
        requestValidator.validate(request);
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("Admin {} creating feedback question", caller.id());

        return ResponseEntity.ok(feedbackService.createQuestion(request, caller.id()));
    }

    @PutMapping("/questions/{id}")
    @PreAuthorize("@accessPolicy.adminFor('FEEDBACK_QUESTION', #id, authentication)")
    public ResponseEntity<FeedbackQuestion> updateQuestion(@PathVariable String id,
                                                           @RequestBody FeedbackQuestionRequest request) {
        requestValidator.validate(request);
        log.info("Updating feedback question: {}", id);

        return ResponseEntity.ok(feedbackService.updateQuestion(id, request));
    }

    /**
     * Delete a question, or deactivate it when it already has responses
     */
    @DeleteMapping("/questions/{id}")
    @PreAuthorize("@accessPolicy.adminFor('FEEDBACK_QUESTION', #id, authentication)")
    public ResponseEntity<Map<String, Object>> deleteQuestion(@PathVariable String id) {
        log.info("Deleting feedback question: {}", id);

        DeletionOutcome outcome = feedbackService.deleteQuestion(id);
        String msg = outcome == DeletionOutcome.DELETED
                ? "Feedback question removed"
                : "Feedback question deactivated (has responses)";
        return ResponseEntity.ok(Map.of("msg", msg));
    }

    // ---- Responses ----

    @PostMapping("/responses")
    public ResponseEntity<FeedbackResponse> submitResponse(@RequestBody FeedbackResponseRequest request,
                                                           Authentication authentication) {
        requestValidator.validate(request);
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("User {} responding to feedback question {}", caller.id(), request.getFeedbackId());

        return ResponseEntity.ok(feedbackService.submitResponse(request, caller.id()));
    }

    @GetMapping("/responses/me")
    public ResponseEntity<List<FeedbackResponse>> getMyResponses(Authentication authentication) {
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("Listing feedback responses of user {}", caller.id());

        return ResponseEntity.ok(feedbackService.findResponsesByUser(caller.id()));
    }

    @GetMapping("/responses/admin")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<FeedbackResponse>> getAllResponses() {
        log.info("Listing all feedback responses");
        return ResponseEntity.ok(feedbackService.findAllResponses());
    }

    @GetMapping("/responses/question/{questionId}")
    @PreAuthorize("@accessPolicy.adminFor('FEEDBACK_QUESTION', #questionId, authentication)")
    public ResponseEntity<List<FeedbackResponse>> getResponsesForQuestion(@PathVariable String questionId) {
        log.info("Listing feedback responses for question {}", questionId);
        return ResponseEntity.ok(feedbackService.findResponsesByQuestion(questionId));
    }

    /**
     * Add an admin comment; the response becomes addressed
     */
    @PutMapping("/responses/{id}/comment")
    @PreAuthorize("@accessPolicy.adminFor('FEEDBACK_RESPONSE', #id, authentication)")
    public ResponseEntity<FeedbackResponse> commentOnResponse(@PathVariable String id,
                                                              @RequestBody AdminCommentRequest request) {
        requestValidator.validate(request);
        log.info("Commenting on feedback response: {}", id);

        return ResponseEntity.ok(feedbackService.commentOnResponse(id, request.getAdminComment()));
    }

    @PutMapping("/responses/{id}/status")
    @PreAuthorize("@accessPolicy.adminFor('FEEDBACK_RESPONSE', #id, authentication)")
    public ResponseEntity<FeedbackResponse> updateResponseStatus(@PathVariable String id,
                                                                 @RequestBody ResponseStatusRequest request) {
        requestValidator.validate(request);
        log.info("Setting status of feedback response {} to {}", id, request.getStatus());

        return ResponseEntity.ok(feedbackService.updateResponseStatus(id, FeedbackStatus.fromValue(request.getStatus())));
    }

    @DeleteMapping("/responses/{id}")
    @PreAuthorize("@accessPolicy.ownerOrAdmin('FEEDBACK_RESPONSE', #id, authentication)")
    public ResponseEntity<Map<String, Object>> deleteResponse(@PathVariable String id) {
        log.info("Deleting feedback response: {}", id);

        feedbackService.deleteResponse(id);
        return ResponseEntity.ok(Map.of("msg", "Feedback response removed"));
    }
}
