package io.factorialsystems.federationserver.dto;

/**
 * Validation group for constraints that apply only when a resource is first created.
 */
public interface OnCreate {
}
