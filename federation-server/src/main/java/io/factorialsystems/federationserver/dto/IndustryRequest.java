package io.factorialsystems.federationserver.dto;

import io.factorialsystems.federationserver.model.Product;
import io.factorialsystems.federationserver.model.Vacancy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Body of industry create and update calls. On update every field is optional and only the
 * supplied ones are applied, but a supplied required field may not be blank.
 */
@Getter
@Setter
@NoArgsConstructor
public class IndustryRequest {

    private static final String NOT_BLANK = "(?s).*\\S.*";

    @NotNull(groups = OnCreate.class, message = "Name is required")
    @Pattern(regexp = NOT_BLANK, message = "Name is required")
    @Size(max = 50, message = "Name can not be more than 50 characters")
    private String name;

    @NotNull(groups = OnCreate.class, message = "Description is required")
    @Pattern(regexp = NOT_BLANK, message = "Description is required")
    @Size(max = 500, message = "Description can not be more than 500 characters")
    private String description;

    private List<@Valid @NotNull(message = "Product is required") Product> products;

    private List<@NotBlank(message = "Material can not be blank") String> materials;

    @NotNull(groups = OnCreate.class, message = "GST information is required")
    @Pattern(regexp = NOT_BLANK, message = "GST information is required")
    private String gstInfo;

    @NotNull(groups = OnCreate.class, message = "Contact number is required")
    @Pattern(regexp = NOT_BLANK, message = "Contact number is required")
    private String contactNumber;

    private Vacancy vacancy;

    private List<@NotBlank(message = "Image URL can not be blank") String> images;
}
