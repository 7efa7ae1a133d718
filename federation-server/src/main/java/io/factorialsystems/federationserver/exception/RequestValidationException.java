package io.factorialsystems.federationserver.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Carries one or more field-level input errors. Rendered as {@code {"errors": [{"field", "msg"}]}}.
 */
@Getter
public class RequestValidationException extends ApiException {

    private final List<FieldViolation> violations;

    public RequestValidationException(List<FieldViolation> violations) {
        super(HttpStatus.BAD_REQUEST, violations.isEmpty() ? "Validation failed" : violations.get(0).msg());
        this.violations = List.copyOf(violations);
    }

    public RequestValidationException(String field, String msg) {
        this(List.of(new FieldViolation(field, msg)));
    }

    public record FieldViolation(String field, String msg) {
    }
}
