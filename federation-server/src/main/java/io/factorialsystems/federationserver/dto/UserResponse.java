package io.factorialsystems.federationserver.dto;

import io.factorialsystems.federationserver.model.User;
import io.factorialsystems.federationserver.model.UserRole;
import io.factorialsystems.federationserver.model.UserStatus;
import lombok.*;

import java.time.OffsetDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserResponse {
    private String id;
    private String username;
    private String email;
    private UserRole role;
    private UserStatus status;
    private OffsetDateTime expiryDate;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .role(user.getRole())
                .status(user.getStatus())
                .expiryDate(user.getExpiryDate())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
