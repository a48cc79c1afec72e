package com.makernote.core.tag;

import com.makernote.core.lang.Rational;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Read access to the decoded values of one makernote directory.
 *
 * <p>Implementations only need to supply {@link #getObject(int)}; every typed getter is
 * derived from it. Getters never throw for a missing tag or a value of the wrong shape,
 * they return an empty optional instead. Conversions mirror what a TIFF decoder produces:
 * <ul>
 *   <li>numbers narrow or widen to the requested type</li>
 *   <li>single-element arrays unwrap to their element</li>
 *   <li>numeric strings parse</li>
 *   <li>rationals render through {@link Rational#toSimpleString(boolean)}</li>
 *   <li>arrays render as space separated values</li>
 * </ul>
 *
 * <p>The binary decoder that fills a directory is not part of this library. Callers bridge
 * their decoder by implementing this interface, or by copying values into
 * {@link MapTagValues}.
 *
 * @see MapTagValues
 * @since 1.0.0
 */
public interface TagValues {

    /** Format used when a date/time value is rendered as text. */
    DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss", Locale.ROOT);

    /**
     * Returns the raw decoded value for a tag.
     *
     * @param tagId tag identifier
     * @return decoded value, or {@code null} when the tag is absent
     */
    Object getObject(int tagId);

    default boolean containsTag(int tagId) {
        return getObject(tagId) != null;
    }

    // ==================== Scalars ====================

    default OptionalInt getInt(int tagId) {
        Object value = unwrapSingle(getObject(tagId));
        if (value instanceof Number number) {
            return OptionalInt.of(number.intValue());
        }
        if (value instanceof Boolean bool) {
            return OptionalInt.of(bool ? 1 : 0);
        }
        if (value instanceof String text) {
            try {
                return OptionalInt.of(Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        }
        if (value instanceof byte[] bytes && bytes.length == 1) {
            return OptionalInt.of(bytes[0] & 0xFF);
        }
        return OptionalInt.empty();
    }

    default OptionalLong getLong(int tagId) {
        Object value = unwrapSingle(getObject(tagId));
        if (value instanceof Number number) {
            return OptionalLong.of(number.longValue());
        }
        if (value instanceof String text) {
            try {
                return OptionalLong.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    default OptionalDouble getDouble(int tagId) {
        Object value = unwrapSingle(getObject(tagId));
        if (value instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return OptionalDouble.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    default Optional<Float> getFloat(int tagId) {
        OptionalDouble value = getDouble(tagId);
        return value.isPresent() ? Optional.of((float) value.getAsDouble()) : Optional.empty();
    }

    default Optional<Rational> getRational(int tagId) {
        Object value = unwrapSingle(getObject(tagId));
        if (value instanceof Rational rational) {
            return Optional.of(rational);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return Optional.of(new Rational(((Number) value).longValue(), 1));
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Rational.parse(text));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    default Optional<LocalDateTime> getDateTime(int tagId) {
        Object value = unwrapSingle(getObject(tagId));
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime);
        }
        if (value instanceof String text) {
            try {
                return Optional.of(LocalDateTime.parse(text.trim(), DATE_TIME_FORMAT));
            } catch (DateTimeParseException e) {
                try {
                    return Optional.of(LocalDateTime.parse(text.trim()));
                } catch (DateTimeParseException ignored) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the value rendered as text.
     *
     * @param tagId tag identifier
     * @return text form, or empty when the tag is absent
     */
    default Optional<String> getString(int tagId) {
        Object value = getObject(tagId);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String text) {
            return Optional.of(text);
        }
        if (value instanceof byte[] bytes) {
            return Optional.of(joinArray(bytes));
        }
        if (value.getClass().isArray()) {
            return Optional.of(joinArray(value));
        }
        return Optional.of(formatScalar(value));
    }

    // ==================== Arrays ====================

    default Optional<Rational[]> getRationalArray(int tagId) {
        Object value = getObject(tagId);
        if (value instanceof Rational[] rationals) {
            return Optional.of(rationals);
        }
        if (value instanceof Rational rational) {
            return Optional.of(new Rational[]{rational});
        }
        return Optional.empty();
    }

    default Optional<String[]> getStringArray(int tagId) {
        Object value = getObject(tagId);
        if (value instanceof String[] strings) {
            return Optional.of(strings);
        }
        if (value instanceof String text) {
            return Optional.of(new String[]{text});
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            String[] result = new String[length];
            for (int i = 0; i < length; i++) {
                result[i] = formatScalar(Array.get(value, i));
            }
            return Optional.of(result);
        }
        return Optional.empty();
    }

    /**
     * Returns the value as bytes; numeric arrays are truncated element-wise and strings are
     * encoded as UTF-8.
     *
     * @param tagId tag identifier
     * @return byte array, or empty when the value has no byte form
     */
    default Optional<byte[]> getByteArray(int tagId) {
        Object value = getObject(tagId);
        if (value instanceof byte[] bytes) {
            return Optional.of(bytes);
        }
        if (value instanceof String text) {
            return Optional.of(text.getBytes(StandardCharsets.UTF_8));
        }
        if (value instanceof Number number) {
            return Optional.of(new byte[]{number.byteValue()});
        }
        if (value != null && value.getClass().isArray() && isNumericArray(value)) {
            int length = Array.getLength(value);
            byte[] result = new byte[length];
            for (int i = 0; i < length; i++) {
                result[i] = ((Number) Array.get(value, i)).byteValue();
            }
            return Optional.of(result);
        }
        return Optional.empty();
    }

    default Optional<short[]> getShortArray(int tagId) {
        Object value = getObject(tagId);
        if (value instanceof short[] shorts) {
            return Optional.of(shorts);
        }
        if (value instanceof Number number) {
            return Optional.of(new short[]{number.shortValue()});
        }
        if (value != null && value.getClass().isArray() && isNumericArray(value)) {
            int length = Array.getLength(value);
            short[] result = new short[length];
            for (int i = 0; i < length; i++) {
                result[i] = ((Number) Array.get(value, i)).shortValue();
            }
            return Optional.of(result);
        }
        return Optional.empty();
    }

    /**
     * Returns the value as ints. Bytes are widened unsigned, strings yield their characters.
     *
     * @param tagId tag identifier
     * @return int array, or empty when the value has no numeric array form
     */
    default Optional<int[]> getIntArray(int tagId) {
        Object value = getObject(tagId);
        if (value instanceof int[] ints) {
            return Optional.of(ints);
        }
        if (value instanceof byte[] bytes) {
            int[] result = new int[bytes.length];
            for (int i = 0; i < bytes.length; i++) {
                result[i] = bytes[i] & 0xFF;
            }
            return Optional.of(result);
        }
        if (value instanceof String text) {
            return Optional.of(text.chars().toArray());
        }
        if (value instanceof Number number) {
            return Optional.of(new int[]{number.intValue()});
        }
        if (value != null && value.getClass().isArray() && isNumericArray(value)) {
            int length = Array.getLength(value);
            int[] result = new int[length];
            for (int i = 0; i < length; i++) {
                result[i] = ((Number) Array.get(value, i)).intValue();
            }
            return Optional.of(result);
        }
        return Optional.empty();
    }

    // ==================== Conversion helpers ====================

    private static Object unwrapSingle(Object value) {
        if (value != null && value.getClass().isArray() && !(value instanceof byte[])
                && Array.getLength(value) == 1) {
            return Array.get(value, 0);
        }
        return value;
    }

    private static boolean isNumericArray(Object array) {
        int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            if (!(Array.get(array, i) instanceof Number)) {
                return false;
            }
        }
        return true;
    }

    private static String joinArray(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < bytes.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(bytes[i] & 0xFF);
        }
        return sb.toString();
    }

    private static String joinArray(Object array) {
        StringBuilder sb = new StringBuilder();
        int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(formatScalar(Array.get(array, i)));
        }
        return sb.toString();
    }

    private static String formatScalar(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Rational rational) {
            return rational.toSimpleString(true);
        }
        if (value instanceof Float || value instanceof Double) {
            return new DecimalFormat("0.###", DecimalFormatSymbols.getInstance(Locale.ROOT))
                .format(((Number) value).doubleValue());
        }
        if (value instanceof LocalDateTime dateTime) {
            return DATE_TIME_FORMAT.format(dateTime);
        }
        return value.toString();
    }
}
