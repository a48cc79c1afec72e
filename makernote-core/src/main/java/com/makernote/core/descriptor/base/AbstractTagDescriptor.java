package com.makernote.core.descriptor.base;

import com.makernote.core.descriptor.TagDescriptor;
import com.makernote.core.lang.Rational;
import com.makernote.core.tag.TagValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.function.DoubleFunction;
import java.util.function.IntFunction;

/**
 * Abstract base class for vendor descriptors providing the shared description rules.
 *
 * <p>Concrete descriptors override {@link #describe(int, TagValues)} with a {@code switch}
 * over the vendor's tag ids and delegate every other id to {@code super.describe(...)},
 * which renders the value's natural text form.
 *
 * <p>This class provides:
 * <ul>
 *   <li>Logger initialization (one logger per descriptor class)</li>
 *   <li>Indexed lookups ({@link #indexed(TagValues, int, String...)})</li>
 *   <li>Numeric, rational and byte-array formatting helpers</li>
 *   <li>The default description ({@link #defaultDescription(int, TagValues)})</li>
 * </ul>
 *
 * @see DescriptionRules
 * @since 1.0.0
 */
public abstract class AbstractTagDescriptor implements TagDescriptor {

    /** Arrays longer than this are summarised instead of printed. */
    private static final int MAX_INLINE_ARRAY_LENGTH = 16;

    /**
     * Logger instance for this descriptor.
     * Automatically initialized with the concrete descriptor class name.
     */
    protected final Logger log;

    protected AbstractTagDescriptor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return defaultDescription(tagId, values);
    }

    /**
     * Renders a value without vendor knowledge.
     *
     * @param tagId tag identifier
     * @param values decoded values
     * @return {@code [N values]} for long arrays, otherwise the value's text form
     */
    protected Optional<String> defaultDescription(int tagId, TagValues values) {
        Object value = values.getObject(tagId);
        if (value == null) {
            return Optional.empty();
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            if (length > MAX_INLINE_ARRAY_LENGTH) {
                return Optional.of("[" + length + " values]");
            }
        }
        return values.getString(tagId);
    }

    // ==================== Typed access ====================

    protected Optional<String> describeInt(TagValues values, int tagId, IntFunction<String> rule) {
        OptionalInt value = values.getInt(tagId);
        if (value.isEmpty()) {
            log.trace("Tag 0x{} has no integer value", Integer.toHexString(tagId));
            return Optional.empty();
        }
        return Optional.ofNullable(rule.apply(value.getAsInt()));
    }

    protected Optional<String> describeDouble(TagValues values, int tagId, DoubleFunction<String> rule) {
        OptionalDouble value = values.getDouble(tagId);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rule.apply(value.getAsDouble()));
    }

    protected Optional<String> intText(TagValues values, int tagId) {
        return describeInt(values, tagId, Integer::toString);
    }

    protected Optional<String> signedShortText(TagValues values, int tagId) {
        return describeInt(values, tagId, value -> Short.toString((short) value));
    }

    /**
     * Unsigned 16-bit value as text.
     */
    protected Optional<String> unsignedShortText(TagValues values, int tagId) {
        return describeInt(values, tagId, value -> Integer.toString(value & 0xFFFF));
    }

    /**
     * Unsigned 32-bit value as text.
     */
    protected Optional<String> unsignedIntText(TagValues values, int tagId) {
        OptionalLong value = values.getLong(tagId);
        return value.isPresent()
            ? Optional.of(Long.toString(value.getAsLong() & 0xFFFFFFFFL))
            : Optional.empty();
    }

    // ==================== Lookups ====================

    /**
     * Zero-based indexed description with {@code Unknown (N)} fallback.
     */
    protected Optional<String> indexed(TagValues values, int tagId, String... labels) {
        return indexed(values, tagId, 0, labels);
    }

    /**
     * Indexed description with a base offset and {@code Unknown (N)} fallback for
     * out-of-range values and {@code null} slots.
     *
     * @param values decoded values
     * @param tagId tag identifier
     * @param base value mapped to {@code labels[0]}
     * @param labels labels in value order
     * @return label, fallback text, or empty when the tag has no integer value
     */
    protected Optional<String> indexed(TagValues values, int tagId, int base, String... labels) {
        return describeInt(values, tagId, value -> DescriptionRules.indexedOrUnknown(value, base, labels));
    }

    protected Optional<String> bitFlags(TagValues values, int tagId, Object... labels) {
        return describeInt(values, tagId, value -> DescriptionRules.bitFlags(value, labels));
    }

    protected Optional<String> flagsOrNone(TagValues values, int tagId, String... labels) {
        return describeInt(values, tagId, value -> DescriptionRules.flagsOrNone(value, labels));
    }

    // ==================== Formatting ====================

    protected Optional<String> versionBytes(TagValues values, int tagId, int majorDigits) {
        return values.getIntArray(tagId).map(components -> DescriptionRules.versionString(components, majorDigits));
    }

    protected Optional<String> byteLength(TagValues values, int tagId) {
        return values.getByteArray(tagId)
            .map(bytes -> "(" + bytes.length + " byte" + (bytes.length == 1 ? "" : "s") + ")");
    }

    protected Optional<String> simpleRational(TagValues values, int tagId) {
        return values.getRational(tagId).map(rational -> rational.toSimpleString(true));
    }

    protected Optional<String> decimalRational(TagValues values, int tagId, int decimalPlaces) {
        return values.getRational(tagId)
            .map(rational -> String.format(Locale.ROOT, "%." + decimalPlaces + "f", rational.doubleValue()));
    }

    /**
     * Formats an integer value with a {@link String#format} pattern such as {@code "%d mm"}.
     */
    protected Optional<String> formattedInt(TagValues values, int tagId, String format) {
        return describeInt(values, tagId, value -> String.format(Locale.ROOT, format, value));
    }

    protected Optional<String> formattedString(TagValues values, int tagId, String format) {
        return values.getString(tagId).map(text -> String.format(Locale.ROOT, format, text));
    }

    /**
     * Decodes bytes up to the first NUL or non-ASCII byte.
     */
    protected Optional<String> sevenBitString(TagValues values, int tagId) {
        return values.getByteArray(tagId).map(bytes -> {
            int length = bytes.length;
            for (int i = 0; i < bytes.length; i++) {
                int b = bytes[i] & 0xFF;
                if (b == 0 || b > 0x7F) {
                    length = i;
                    break;
                }
            }
            return new String(bytes, 0, length, StandardCharsets.UTF_8);
        });
    }

    /**
     * Decodes bytes as ASCII and strips NUL and whitespace padding at both ends.
     */
    protected Optional<String> asciiString(TagValues values, int tagId) {
        return values.getByteArray(tagId)
            .map(bytes -> stripPadding(new String(bytes, StandardCharsets.US_ASCII)));
    }

    protected Optional<String> rationalOrDouble(TagValues values, int tagId) {
        Optional<Rational> rational = values.getRational(tagId);
        if (rational.isPresent()) {
            return Optional.of(rational.get().toSimpleString(true));
        }
        return describeDouble(values, tagId, value -> DescriptionRules.decimal(value, "0.###"));
    }

    /**
     * Date/time value in {@code yyyy:MM:dd HH:mm:ss} form.
     */
    protected Optional<String> dateTime(TagValues values, int tagId) {
        return values.getDateTime(tagId).map(TagValues.DATE_TIME_FORMAT::format);
    }

    /**
     * Non-empty string value, or empty.
     */
    protected Optional<String> nonEmptyString(TagValues values, int tagId) {
        return values.getString(tagId).filter(text -> !text.isEmpty());
    }

    private static String stripPadding(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isPadding(text.charAt(start))) {
            start++;
        }
        while (end > start && isPadding(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isPadding(char c) {
        return c == '\0' || c == ' ' || c == '\r' || c == '\n' || c == '\t';
    }
}
