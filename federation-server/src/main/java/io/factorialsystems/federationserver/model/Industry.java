package io.factorialsystems.federationserver.model;

import lombok.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Industry {
    private String id;
    private String name;
    private String description;

    @Builder.Default
    private List<Product> products = new ArrayList<>();

    @Builder.Default
    private List<String> materials = new ArrayList<>();

    private String gstInfo;
    private String contactNumber;
    private Vacancy vacancy;

    @Builder.Default
    private List<String> images = new ArrayList<>();

    private String ownerId;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    // Relationships
    private UserSummary owner;
}
