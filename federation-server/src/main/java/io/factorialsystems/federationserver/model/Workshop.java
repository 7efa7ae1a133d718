package io.factorialsystems.federationserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
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
public class Workshop {
    private String id;
    private String title;
    private String description;
    private OffsetDateTime date;
    private String location;
    private int capacity;

    @Builder.Default
    private List<String> registeredUsers = new ArrayList<>();

    private String createdById;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    // Relationships
    private UserSummary createdBy;

    public boolean isRegistered(String userId) {
        return registeredUsers != null && registeredUsers.contains(userId);
    }

    public int registrationCount() {
        return registeredUsers == null ? 0 : registeredUsers.size();
    }

    @JsonIgnore
    public boolean isFull() {
        return registrationCount() >= capacity;
    }
}
