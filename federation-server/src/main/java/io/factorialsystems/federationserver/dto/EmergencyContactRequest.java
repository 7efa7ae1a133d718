package io.factorialsystems.federationserver.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class EmergencyContactRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 50, message = "Name can not be more than 50 characters")
    private String name;

    @NotBlank(message = "Number is required")
    private String number;

    @NotBlank(message = "Category is required")
    @Pattern(regexp = "Fire|Police|Ambulance|Electrician|Plumber|Other", flags = Pattern.Flag.CASE_INSENSITIVE,
            message = "Category must be one of Fire, Police, Ambulance, Electrician, Plumber, Other")
    private String category;
}
