package com.ai.reservation.exception;

import lombok.Getter;

/**
 * Base of every recoverable booking failure. Conversation handlers turn these
 * into spoken guidance; the HTTP layer maps any that escape to JSON errors.
 */
@Getter
public abstract class ReservationException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ReservationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
