package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.impl.olympus.OlympusRawDevelopmentMakernoteTags.*;

/**
 * Descriptions for the Olympus Raw Development sub-IFD.
 */
public final class OlympusRawDevelopmentMakernoteDescriptor extends AbstractTagDescriptor {

    static final String[] COLOR_SPACES = {"sRGB", "Adobe RGB", "Pro Photo RGB"};

    static final String[] ENGINES = {
        "High Speed", "High Function", "Advanced High Speed", "Advanced High Function"
    };

    static final String[] NOISE_REDUCTION_FLAGS = {
        "Noise Reduction", "Noise Filter", "Noise Filter (ISO Boost)"
    };

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_RAW_DEV_VERSION -> versionBytes(values, tagId, 4);
            case TAG_RAW_DEV_COLOR_SPACE -> indexed(values, tagId, COLOR_SPACES);
            case TAG_RAW_DEV_ENGINE -> indexed(values, tagId, ENGINES);
            case TAG_RAW_DEV_NOISE_REDUCTION -> describeInt(values, tagId,
                value -> DescriptionRules.flagsOrNone(value & 0xFFFF, NOISE_REDUCTION_FLAGS));
            case TAG_RAW_DEV_EDIT_STATUS -> describeInt(values, tagId, OlympusRawDevelopmentMakernoteDescriptor::editStatus);
            case TAG_RAW_DEV_SETTINGS -> describeInt(values, tagId, value -> DescriptionRules.flagsOrNone(value & 0xFFFF,
                "WB Color Temp", "WB Gray Point", "Saturation", "Contrast",
                "Sharpness", "Color Space", "High Function", "Noise Reduction"));
            default -> super.describe(tagId, values);
        };
    }

    static String editStatus(int value) {
        return switch (value) {
            case 0 -> "Original";
            case 1 -> "Edited (Landscape)";
            case 6, 8 -> "Edited (Portrait)";
            default -> DescriptionRules.unknown(value);
        };
    }
}
