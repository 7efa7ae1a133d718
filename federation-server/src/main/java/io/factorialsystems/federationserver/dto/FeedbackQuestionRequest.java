package io.factorialsystems.federationserver.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Create and update body for feedback questions. On update, category, isActive and expiresAt are
 * left unchanged when omitted.
 */
@Getter
@Setter
@NoArgsConstructor
public class FeedbackQuestionRequest {

    @NotBlank(message = "Title is required")
    private String title;

    @NotBlank(message = "Description is required")
    private String description;

    @Pattern(regexp = "general|technical|feature|service|other", flags = Pattern.Flag.CASE_INSENSITIVE,
            message = "Category must be valid")
    private String category;

    private Boolean isActive;

    private OffsetDateTime expiresAt;
}
