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
public class UpdateRequest {

    @NotBlank(message = "Type is required")
    @Pattern(regexp = "news|announcement|blogs|gallery|notices|workshop", flags = Pattern.Flag.CASE_INSENSITIVE,
            message = "Type must be one of news, announcement, blogs, gallery, notices, workshop")
    private String type;

    @NotBlank(message = "Title is required")
    @Size(max = 100, message = "Title can not be more than 100 characters")
    private String title;

    @NotBlank(message = "Content is required")
    @Size(max = 1000, message = "Content can not be more than 1000 characters")
    private String content;

    private String imageUrl;

    private String redirectUrl;
}
