package io.factorialsystems.federationserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when an action would duplicate an existing record or membership.
 */
public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
