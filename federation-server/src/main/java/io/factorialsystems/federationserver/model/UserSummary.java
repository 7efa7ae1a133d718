package io.factorialsystems.federationserver.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * Display fields of a referenced user, joined in on read.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummary {
    private String id;
    private String username;
    private String email;
}
