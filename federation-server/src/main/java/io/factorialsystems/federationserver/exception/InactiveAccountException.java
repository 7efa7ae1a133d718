package io.factorialsystems.federationserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown at login for accounts that are inactive or whose membership has lapsed.
 */
public class InactiveAccountException extends ApiException {

    public InactiveAccountException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
