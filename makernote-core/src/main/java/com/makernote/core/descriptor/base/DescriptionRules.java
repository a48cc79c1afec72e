package com.makernote.core.descriptor.base;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Formatting algorithms shared by all vendor descriptors.
 *
 * <p>Every method is a pure function of its arguments. Descriptors reach these through
 * {@link AbstractTagDescriptor}; tests use them directly.
 */
public final class DescriptionRules {

    /** Moon phases as reported by trail cameras, indexed from 0. */
    public static final String[] MOON_PHASES = {
        "New", "Waxing Crescent", "First Quarter", "Waxing Gibbous",
        "Full", "Waning Gibbous", "Last Quarter", "Waning Crescent"
    };

    /** Day names indexed from 0 = Sunday. */
    public static final String[] DAY_NAMES = {
        "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    };

    /** Label used by bit-flag descriptions when no flag is set. */
    public static final String NO_FLAGS = "(none)";

    private static final DecimalFormatSymbols ROOT_SYMBOLS = DecimalFormatSymbols.getInstance(Locale.ROOT);

    private DescriptionRules() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Renders the conventional fallback for an unrecognized code.
     *
     * @param value raw value
     * @return {@code "Unknown (value)"}
     */
    public static String unknown(Object value) {
        return "Unknown (" + value + ")";
    }

    /**
     * Selects {@code labels[value - base]}.
     *
     * @return label, or empty when out of range or the slot is {@code null}
     */
    public static Optional<String> indexed(long value, int base, String... labels) {
        long index = value - base;
        if (index < 0 || index >= labels.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(labels[(int) index]);
    }

    /**
     * Selects {@code labels[value - base]}, falling back to {@link #unknown(Object)}.
     */
    public static String indexedOrUnknown(long value, int base, String... labels) {
        return indexed(value, base, labels).orElseGet(() -> unknown(value));
    }

    /**
     * Decomposes a bit field, least significant bit first.
     *
     * <p>Each label is either {@code null} (bit ignored), a {@code String} (appended when the
     * bit is set) or a {@code String[2]} holding the unset and set labels.
     *
     * @param value bit field
     * @param labels per-bit labels
     * @return labels joined with {@code ", "}; empty text when nothing applies
     */
    public static String bitFlags(long value, Object... labels) {
        List<String> parts = new ArrayList<>();
        long remaining = value;
        for (Object label : labels) {
            boolean set = (remaining & 1) == 1;
            if (label instanceof String[] pair) {
                if (pair.length != 2) {
                    throw new IllegalArgumentException("Bit label pairs must have two entries");
                }
                parts.add(pair[set ? 1 : 0]);
            } else if (set && label instanceof String text) {
                parts.add(text);
            }
            remaining >>= 1;
        }
        return String.join(", ", parts);
    }

    /**
     * Lists the labels of set bits, or {@value #NO_FLAGS} for zero.
     *
     * <p>A non-zero value whose set bits are all unlabelled renders as
     * {@link #unknown(Object)}.
     *
     * @param value bit field
     * @param labels label per bit, lowest bit first
     * @return description
     */
    public static String flagsOrNone(long value, String... labels) {
        if (value == 0) {
            return NO_FLAGS;
        }
        String flags = bitFlags(value, (Object[]) labels);
        return flags.isEmpty() ? unknown(value) : flags;
    }

    /**
     * Renders version components, for example {@code [0, 1, 0, 0]} with two major digits
     * as {@code "1.00"}.
     *
     * <p>Components below {@code '0'} are treated as binary digits and shifted into the
     * ASCII digit range; a leading {@code '0'} is dropped.
     *
     * @param components up to four components, bytes or characters
     * @param majorDigits number of components before the dot
     * @return version text
     */
    public static String versionString(int[] components, int majorDigits) {
        StringBuilder version = new StringBuilder();
        for (int i = 0; i < 4 && i < components.length; i++) {
            if (i == majorDigits) {
                version.append('.');
            }
            char c = (char) components[i];
            if (c < '0') {
                c += '0';
            }
            if (i == 0 && c == '0') {
                continue;
            }
            version.append(c);
        }
        return version.toString();
    }

    public static String join(int[] values) {
        StringJoiner joiner = new StringJoiner(" ");
        for (int value : values) {
            joiner.add(Integer.toString(value));
        }
        return joiner.toString();
    }

    public static String join(short[] values) {
        StringJoiner joiner = new StringJoiner(" ");
        for (short value : values) {
            joiner.add(Short.toString(value));
        }
        return joiner.toString();
    }

    /**
     * Looks up a space-joined value in a table of literal keys.
     *
     * @return mapped label, or {@code "Unknown (joined)"}
     */
    public static String matchJoined(String joined, Map<String, String> table) {
        String label = table.get(joined);
        return label != null ? label : unknown(joined);
    }

    /**
     * Formats a number with a {@link DecimalFormat} pattern, independent of the default locale.
     */
    public static String decimal(double value, String pattern) {
        return new DecimalFormat(pattern, ROOT_SYMBOLS).format(value);
    }

    public static String fStop(double fStop) {
        return "f/" + decimal(fStop, "0.0");
    }

    public static String focalLength(double millimetres) {
        return decimal(millimetres, "0.#") + " mm";
    }
}
