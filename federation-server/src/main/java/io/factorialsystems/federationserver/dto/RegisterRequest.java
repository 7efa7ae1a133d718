package io.factorialsystems.federationserver.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class RegisterRequest {

    @NotBlank(message = "Username is required")
    @Size(max = 50, message = "Username can not be more than 50 characters")
    private String username;

    @NotBlank(message = "Please include a valid email")
    @Email(message = "Please include a valid email")
    private String email;

    @NotBlank(message = "Please enter a password with 6 or more characters")
    @Size(min = 6, message = "Please enter a password with 6 or more characters")
    private String password;
}
