package io.factorialsystems.federationserver.model;

import lombok.*;

import java.time.OffsetDateTime;

/**
 * A post on the site feed. redirectUrl is set if and only if type is {@link UpdateType#BLOGS}.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Update {
    private String id;
    private UpdateType type;
    private String title;
    private String content;
    private String imageUrl;
    private String redirectUrl;
    private String createdById;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    // Relationships
    private UserSummary createdBy;
}
