package io.factorialsystems.federationserver.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.OffsetDateTime;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeedbackResponse {
    private String id;
    private String feedbackId;
    private String response;
    private Integer rating;

    @Builder.Default
    private FeedbackStatus status = FeedbackStatus.PENDING;

    private String adminComment;
    private String createdById;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    // Relationships
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private FeedbackQuestionSummary feedback;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private UserSummary createdBy;
}
