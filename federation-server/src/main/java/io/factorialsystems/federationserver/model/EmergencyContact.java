package io.factorialsystems.federationserver.model;

import lombok.*;

import java.time.OffsetDateTime;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencyContact {
    private String id;
    private String name;
    private String number;
    private EmergencyCategory category;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
