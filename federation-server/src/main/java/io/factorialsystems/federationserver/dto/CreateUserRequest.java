package io.factorialsystems.federationserver.dto;

import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Admin-issued account creation. Role defaults to member.
 */
@Getter
@Setter
@NoArgsConstructor
public class CreateUserRequest extends RegisterRequest {

    @Pattern(regexp = "member|admin", flags = Pattern.Flag.CASE_INSENSITIVE, message = "Role must be member or admin")
    private String role;
}
