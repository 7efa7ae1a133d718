package io.factorialsystems.federationserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.OffsetDateTime;

@Getter
@Setter
@ToString(exclude = "password")
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {
    private String id;
    private String username;
    private String email;

    @JsonIgnore
    private String password;

    private UserRole role;
    private UserStatus status;
    private OffsetDateTime expiryDate;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    @JsonIgnore
    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    /**
     * Flips the account to inactive once its membership has lapsed.
     *
     * @return true if the status changed
     */
    public boolean expireIfLapsed(OffsetDateTime now) {
        if (status == UserStatus.ACTIVE && expiryDate != null && expiryDate.isBefore(now)) {
            status = UserStatus.INACTIVE;
            return true;
        }
        return false;
    }
}
