package com.ai.reservation.conversation;

import com.ai.reservation.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IntentArguments")
class IntentArgumentsTest {

    @Test
    @DisplayName("numbers arrive as JSON numbers or digit strings")
    void integers() {
        IntentArguments args = IntentArguments.of(Map.of("a", 4, "b", " 6 ", "c", 2.0));

        assertThat(args.getInteger("a")).isEqualTo(4);
        assertThat(args.getInteger("b")).isEqualTo(6);
        assertThat(args.getInteger("c")).isEqualTo(2);
        assertThat(args.getInteger("missing")).isNull();
    }

    @Test
    @DisplayName("non-integral numbers are rejected with the field name")
    void invalidIntegers() {
        IntentArguments args = IntentArguments.of(Map.of("party_size", "four", "half", 2.5));

        assertThatThrownBy(() -> args.getInteger("party_size"))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getFields()).containsExactly("party_size"));
        assertThatThrownBy(() -> args.getInteger("half")).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("numbers beyond the int range are rejected instead of wrapping")
    void outOfRangeIntegers() {
        IntentArguments args = IntentArguments.of(Map.of(
                "party_size", 4294967298L,
                "huge", new BigInteger("18446744073709551618"),
                "digits", "4294967298",
                "exponent", 1.0E12));

        assertThatThrownBy(() -> args.getInteger("party_size"))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getFields()).containsExactly("party_size"));
        assertThatThrownBy(() -> args.getInteger("huge")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> args.getInteger("digits")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> args.getInteger("exponent")).isInstanceOf(ValidationException.class);
        assertThat(IntentArguments.of(Map.of("max", (long) Integer.MAX_VALUE)).getInteger("max"))
                .isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    @DisplayName("dates must be ISO formatted")
    void dates() {
        IntentArguments args = IntentArguments.of(Map.of("date", "2030-06-14", "bad", "14/06/2030"));

        assertThat(args.getDate("date")).isEqualTo(LocalDate.of(2030, 6, 14));
        assertThatThrownBy(() -> args.getDate("bad")).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("blank strings read as absent")
    void blankStrings() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("name", "   ");
        raw.put("phone", null);
        IntentArguments args = IntentArguments.of(raw);

        assertThat(args.getString("name")).isNull();
        assertThat(args.has("name")).isTrue();
        assertThat(args.has("phone")).isFalse();
        assertThat(IntentArguments.of(null).has("name")).isFalse();
    }
}
