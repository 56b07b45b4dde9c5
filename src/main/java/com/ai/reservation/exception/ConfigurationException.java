package com.ai.reservation.exception;

/**
 * Input that names something the restaurant is not configured for (an unknown
 * time slot) or a configured resource that ran out (confirmation numbers).
 */
public class ConfigurationException extends ReservationException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION, message);
    }
}
