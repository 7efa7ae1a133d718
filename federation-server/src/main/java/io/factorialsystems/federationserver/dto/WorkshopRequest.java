package io.factorialsystems.federationserver.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@NoArgsConstructor
public class WorkshopRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 100, message = "Title can not be more than 100 characters")
    private String title;

    @NotBlank(message = "Description is required")
    @Size(max = 500, message = "Description can not be more than 500 characters")
    private String description;

    @NotNull(message = "Date is required")
    private OffsetDateTime date;

    @NotBlank(message = "Location is required")
    private String location;

    @NotNull(message = "Capacity is required")
    @PositiveOrZero(message = "Capacity can not be negative")
    private Integer capacity;
}
