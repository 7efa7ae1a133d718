package io.factorialsystems.federationserver.exception;

import org.springframework.http.HttpStatus;

public class CapacityExceededException extends ApiException {

    public CapacityExceededException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
