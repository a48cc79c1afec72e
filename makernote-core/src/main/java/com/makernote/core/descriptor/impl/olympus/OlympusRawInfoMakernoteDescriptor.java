package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.lang.Rational;
import com.makernote.core.tag.TagValues;

import java.util.Optional;
import java.util.StringJoiner;

import static com.makernote.core.descriptor.impl.olympus.OlympusRawInfoMakernoteTags.*;

/**
 * Descriptions for the Olympus Raw Info sub-IFD.
 */
public final class OlympusRawInfoMakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_RAW_INFO_VERSION -> versionBytes(values, tagId, 4);
            case TAG_COLOR_MATRIX_2 -> values.getShortArray(tagId).map(DescriptionRules::join);
            case TAG_YCBCR_COEFFICIENTS -> values.getIntArray(tagId).map(OlympusRawInfoMakernoteDescriptor::yCbCrCoefficients);
            case TAG_LIGHT_SOURCE -> describeInt(values, tagId, value -> lightSource(value & 0xFFFF));
            default -> super.describe(tagId, values);
        };
    }

    /**
     * Pairs consecutive unsigned shorts into numerator and denominator.
     */
    static String yCbCrCoefficients(int[] pairs) {
        StringJoiner joiner = new StringJoiner(" ");
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            Rational coefficient = new Rational(pairs[i] & 0xFFFF, pairs[i + 1] & 0xFFFF);
            joiner.add(DescriptionRules.decimal(coefficient.doubleValue(), "0.##########"));
        }
        return joiner.toString();
    }

    static String lightSource(int value) {
        return switch (value) {
            case 0 -> "Unknown";
            case 16 -> "Shade";
            case 17 -> "Cloudy";
            case 18 -> "Fine Weather";
            case 20 -> "Tungsten (Incandescent)";
            case 22 -> "Evening Sunlight";
            case 33 -> "Daylight Fluorescent";
            case 34 -> "Day White Fluorescent";
            case 35 -> "Cool White Fluorescent";
            case 36 -> "White Fluorescent";
            case 256 -> "One Touch White Balance";
            case 512 -> "Custom 1-4";
            default -> DescriptionRules.unknown(value);
        };
    }
}
