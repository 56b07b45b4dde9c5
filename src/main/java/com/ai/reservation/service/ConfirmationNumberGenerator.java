package com.ai.reservation.service;

import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Six-digit, speakable confirmation numbers in {@code 100000..999999}.
 * Uniqueness is enforced by the caller.
 */
@Component
public class ConfirmationNumberGenerator {

    private static final int LOWEST = 100_000;
    private static final int SPAN = 900_000;

    private final Random random;

    public ConfirmationNumberGenerator(Random random) {
        this.random = random;
    }

    public String next() {
        return String.valueOf(LOWEST + random.nextInt(SPAN));
    }
}
