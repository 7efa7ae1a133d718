package io.factorialsystems.federationserver.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class LoginRequest {

    @NotBlank(message = "Please include a valid email")
    @Email(message = "Please include a valid email")
    private String email;

    @NotBlank(message = "Password is required")
    private String password;
}
