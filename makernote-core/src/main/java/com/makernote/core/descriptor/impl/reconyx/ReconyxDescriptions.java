package com.makernote.core.descriptor.impl.reconyx;

import com.makernote.core.descriptor.base.DescriptionRules;

import java.util.Optional;

/**
 * Value renderings shared by the Reconyx trail camera makernotes.
 */
final class ReconyxDescriptions {

    private ReconyxDescriptions() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Renders a {@code [index, count]} pair as {@code "index/count"}.
     *
     * @return the pair, or empty for fewer than two values
     */
    static Optional<String> sequence(int[] sequence) {
        return sequence.length < 2 ? Optional.empty() : Optional.of(sequence[0] + "/" + sequence[1]);
    }

    static String voltage(double volts) {
        return DescriptionRules.decimal(volts, "0.000");
    }

    /**
     * Single character field; a zero byte renders as empty text.
     */
    static String character(int value) {
        return value == 0 ? "" : String.valueOf((char) (value & 0xFF));
    }

    static String fahrenheit(int value) {
        return (short) value + "°F";
    }

    static String celsius(int value) {
        return (short) value + "°C";
    }
}
