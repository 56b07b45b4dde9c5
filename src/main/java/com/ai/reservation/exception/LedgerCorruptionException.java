package com.ai.reservation.exception;

/**
 * A slot counter no longer agrees with its occupancy set. Never caught by the
 * conversation layer.
 */
public class LedgerCorruptionException extends IllegalStateException {

    public LedgerCorruptionException(String message) {
        super(message);
    }
}
