package io.factorialsystems.federationserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a referenced resource does not exist.
 */
public class ResourceNotFoundException extends ApiException {

    public ResourceNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
