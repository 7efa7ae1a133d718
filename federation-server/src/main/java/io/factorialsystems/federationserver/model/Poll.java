package io.factorialsystems.federationserver.model;

import lombok.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Poll {
    private String id;
    private String question;

    @Builder.Default
    private List<PollOption> options = new ArrayList<>();

    private OffsetDateTime expiresAt;

    @Builder.Default
    private List<String> votedBy = new ArrayList<>();

    private String createdById;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    // Relationships
    private UserSummary createdBy;

    public boolean isExpired(OffsetDateTime now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }

    public boolean hasVoted(String userId) {
        return votedBy != null && votedBy.contains(userId);
    }

    public boolean hasOption(int index) {
        return index >= 0 && options != null && index < options.size();
    }

    public int totalVotes() {
        return options == null ? 0 : options.stream().mapToInt(PollOption::getVotes).sum();
    }
}
