package com.ai.reservation.exception;

import lombok.Getter;

import java.util.List;

/**
 * Missing or out-of-range input. {@link #getFields()} lists the offending
 * field names in wire form, e.g. {@code party_size}.
 */
@Getter
public class ValidationException extends ReservationException {

    private final List<String> fields;

    public ValidationException(List<String> fields, String message) {
        super(ErrorCode.INVALID_INPUT, message);
        this.fields = List.copyOf(fields);
    }

    public static ValidationException missing(List<String> fields) {
        return new ValidationException(fields, "Missing reservation details: " + String.join(", ", fields));
    }

    public static ValidationException invalid(String field, String message) {
        return new ValidationException(List.of(field), message);
    }
}
