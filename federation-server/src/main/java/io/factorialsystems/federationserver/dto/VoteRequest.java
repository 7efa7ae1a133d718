package io.factorialsystems.federationserver.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class VoteRequest {

    /**
     * Zero-based index into the poll's options. Older clients send it as {@code optionIndex}.
     */
    @NotNull(message = "Option is required")
    @JsonAlias("optionIndex")
    private Integer optionId;
}
