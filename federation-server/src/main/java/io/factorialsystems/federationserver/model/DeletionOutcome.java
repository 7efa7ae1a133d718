package io.factorialsystems.federationserver.model;

/**
 * Result of deleting a record that may be referenced by others.
 */
public enum DeletionOutcome {
    DELETED,
    DEACTIVATED
}
