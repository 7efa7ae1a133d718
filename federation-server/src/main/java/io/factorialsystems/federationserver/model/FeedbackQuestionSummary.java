package io.factorialsystems.federationserver.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedbackQuestionSummary {
    private String id;
    private String title;
    private String description;
    private FeedbackCategory category;
}
