package io.factorialsystems.federationserver.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class ReactivateRequest {

    @NotNull(message = "Months is required")
    @Min(value = 1, message = "Months must be at least 1")
    private Integer months;
}
