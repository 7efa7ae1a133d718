package io.factorialsystems.federationserver.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for failures that map to a specific HTTP status and a client-visible message.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    protected ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }
}
