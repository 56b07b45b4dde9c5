package com.ai.reservation.conversation;

import com.ai.reservation.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view over the loosely typed JSON arguments of a tool invocation.
 */
public final class IntentArguments {

    private static final IntentArguments EMPTY = new IntentArguments(Collections.emptyMap());

    private final Map<String, Object> values;

    private IntentArguments(Map<String, Object> values) {
        this.values = values;
    }

    public static IntentArguments of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return new IntentArguments(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static IntentArguments empty() {
        return EMPTY;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    /**
     * Trimmed string value, or null when absent or blank.
     */
    public String getString(String key) {
        Object v = values.get(key);
        return v == null ? null : StringUtils.trimToNull(v.toString());
    }

    /**
     * Accepts JSON numbers and digit strings alike; the value must fit an {@code int} exactly.
     *
     * @throws ValidationException if present but not a whole number in {@code int} range
     */
    public Integer getInteger(String key) {
        Object v = values.get(key);
        if (v == null) return null;
        String s = StringUtils.trimToEmpty(v.toString());
        if (!(v instanceof Number) && !NumberUtils.isDigits(s)) {
            throw ValidationException.invalid(key, key + " must be a whole number");
        }
        try {
            return NumberUtils.createBigDecimal(s).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw ValidationException.invalid(key, key + " must be a whole number between "
                    + Integer.MIN_VALUE + " and " + Integer.MAX_VALUE);
        }
    }

    /**
     * @throws ValidationException if present but not an ISO {@code YYYY-MM-DD} date
     */
    public LocalDate getDate(String key) {
        String s = getString(key);
        if (s == null) return null;
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            throw ValidationException.invalid(key, key + " must use the YYYY-MM-DD format");
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
