package io.factorialsystems.federationserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when acting on a poll or feedback question that is no longer open.
 */
public class ExpiredException extends ApiException {

    public ExpiredException(String message) {
        super(HttpStatus.GONE, message);
    }
}
