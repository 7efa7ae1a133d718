package io.factorialsystems.federationserver.controller;

import io.factorialsystems.federationserver.exception.RequestValidationException;
import io.factorialsystems.federationserver.exception.RequestValidationException.FieldViolation;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Runs bean validation on request bodies of protected routes. Controllers call it from inside the
 * handler so that existence and authorization checks run before input validation.
 */
@Component
@RequiredArgsConstructor
public class RequestValidator {

    private final Validator validator;

    public <T> T validate(T request, Class<?>... groups) {
        if (request == null) {
            throw new RequestValidationException("body", "Request body is required");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request, groups);
        if (!violations.isEmpty()) {
            List<FieldViolation> errors = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> new FieldViolation(v.getPropertyPath().toString(), v.getMessage()))
                    .toList();
            throw new RequestValidationException(errors);
        }
        return request;
    }
}
