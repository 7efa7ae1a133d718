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
public class FeedbackQuestion {
    private String id;
    private String title;
    private String description;

    @Builder.Default
    private FeedbackCategory category = FeedbackCategory.GENERAL;

    @Builder.Default
    private Boolean isActive = true;

    private OffsetDateTime expiresAt;
    private String createdById;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    // Relationships
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private UserSummary createdBy;

    /**
     * Whether the question still accepts responses at the given instant.
     */
    public boolean isOpen(OffsetDateTime now) {
        return Boolean.TRUE.equals(isActive) && (expiresAt == null || expiresAt.isAfter(now));
    }
}
