package io.factorialsystems.federationserver.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class AdminCommentRequest {

    @NotBlank(message = "Comment is required")
    private String adminComment;
}
