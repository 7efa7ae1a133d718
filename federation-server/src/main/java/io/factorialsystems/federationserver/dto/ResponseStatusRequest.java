package io.factorialsystems.federationserver.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class ResponseStatusRequest {

    @NotBlank(message = "Status must be valid")
    @Pattern(regexp = "pending|viewed|addressed", flags = Pattern.Flag.CASE_INSENSITIVE, message = "Status must be valid")
    private String status;
}
