package io.factorialsystems.federationserver.model;

import lombok.*;

/**
 * Minimal projection used by authorization checks: a resource id and the id of the user that owns it.
 * ownerId is null for global resources.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class ResourceOwnership {
    private String id;
    private String ownerId;
}
