package io.factorialsystems.federationserver.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class PollRequest {

    @NotBlank(message = "Question is required")
    @Size(max = 200, message = "Question can not be more than 200 characters")
    private String question;

    @NotNull(message = "At least two options are required")
    @Size(min = 2, message = "At least two options are required")
    private List<@NotBlank(message = "Option text is required") String> options;

    @NotNull(message = "Expiration date is required")
    private OffsetDateTime expiresAt;
}
