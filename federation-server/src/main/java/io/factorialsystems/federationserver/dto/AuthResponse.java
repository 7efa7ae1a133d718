package io.factorialsystems.federationserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.factorialsystems.federationserver.model.UserRole;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {
    private String token;
    private UserRole role;
}
