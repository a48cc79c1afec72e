package com.makernote.core.descriptor.impl.kodak;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.base.DescriptionRules.unknown;
import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.*;

/**
 * Descriptions for the Kodak makernote.
 *
 * <p>Several fields changed encoding between camera generations, so color mode and flash
 * mode accept both the single-bit and the small-integer codes.
 */
public final class KodakMakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_QUALITY -> indexed(values, tagId, 1, "Fine", "Normal");
            case TAG_BURST_MODE -> indexed(values, tagId, "Off", "On");
            case TAG_SHUTTER_MODE -> describeInt(values, tagId, KodakMakernoteDescriptor::shutterMode);
            case TAG_FOCUS_MODE -> indexed(values, tagId, "Normal", null, "Macro");
            case TAG_WHITE_BALANCE -> indexed(values, tagId, "Auto", "Flash", "Tungsten", "Daylight");
            case TAG_FLASH_MODE -> describeInt(values, tagId, KodakMakernoteDescriptor::flashMode);
            case TAG_FLASH_FIRED -> indexed(values, tagId, "No", "Yes");
            case TAG_COLOR_MODE -> describeInt(values, tagId, KodakMakernoteDescriptor::colorMode);
            case TAG_SHARPNESS -> indexed(values, tagId, "Normal");
            default -> super.describe(tagId, values);
        };
    }

    static String shutterMode(int value) {
        return switch (value) {
            case 0 -> "Auto";
            case 8 -> "Aperture Priority";
            case 32 -> "Manual";
            default -> unknown(value);
        };
    }

    static String flashMode(int value) {
        return switch (value) {
            case 0x00 -> "Auto";
            case 0x10, 0x01 -> "Fill Flash";
            case 0x20, 0x02 -> "Off";
            case 0x40, 0x03 -> "Red Eye";
            default -> unknown(value);
        };
    }

    static String colorMode(int value) {
        return switch (value) {
            case 0x0001, 0x2000 -> "B&W";
            case 0x0002, 0x4000 -> "Sepia";
            case 0x0003 -> "B&W Yellow Filter";
            case 0x0004 -> "B&W Red Filter";
            case 0x0020, 0x0100 -> "Saturated Color";
            case 0x0040, 0x0200 -> "Neutral Color";
            default -> unknown(value);
        };
    }
}
