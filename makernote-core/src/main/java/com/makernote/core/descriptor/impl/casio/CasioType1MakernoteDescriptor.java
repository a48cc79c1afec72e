package com.makernote.core.descriptor.impl.casio;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.base.DescriptionRules.unknown;
import static com.makernote.core.descriptor.impl.casio.CasioType1MakernoteTags.*;

/**
 * Descriptions for the first Casio makernote layout.
 */
public final class CasioType1MakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_RECORDING_MODE -> indexed(values, tagId, 1,
                "Single shutter", "Panorama", "Night scene", "Portrait", "Landscape");
            case TAG_QUALITY -> indexed(values, tagId, 1, "Economy", "Normal", "Fine");
            case TAG_FOCUSING_MODE -> indexed(values, tagId, 2, "Macro", "Auto focus", "Manual focus", "Infinity");
            case TAG_FLASH_MODE -> indexed(values, tagId, 1, "Auto", "On", "Off", "Red eye reduction");
            case TAG_FLASH_INTENSITY -> describeInt(values, tagId, CasioType1MakernoteDescriptor::flashIntensity);
            case TAG_OBJECT_DISTANCE -> formattedInt(values, tagId, "%d mm");
            case TAG_WHITE_BALANCE -> describeInt(values, tagId, CasioType1MakernoteDescriptor::whiteBalance);
            case TAG_DIGITAL_ZOOM -> describeInt(values, tagId, CasioType1MakernoteDescriptor::digitalZoom);
            case TAG_SHARPNESS -> indexed(values, tagId, "Normal", "Soft", "Hard");
            case TAG_CONTRAST, TAG_SATURATION -> indexed(values, tagId, "Normal", "Low", "High");
            case TAG_CCD_SENSITIVITY -> describeInt(values, tagId, CasioType1MakernoteDescriptor::ccdSensitivity);
            default -> super.describe(tagId, values);
        };
    }

    static String ccdSensitivity(int value) {
        return switch (value) {
            case 64 -> "Normal";
            case 125 -> "+1.0";
            case 250 -> "+2.0";
            case 244 -> "+3.0";
            case 80 -> "Normal (ISO 80 equivalent)";
            case 100 -> "High";
            default -> unknown(value);
        };
    }

    static String digitalZoom(int value) {
        return switch (value) {
            case 0x10000 -> "No digital zoom";
            case 0x10001, 0x20000 -> "2x digital zoom";
            case 0x40000 -> "4x digital zoom";
            default -> unknown(value);
        };
    }

    static String whiteBalance(int value) {
        return switch (value) {
            case 1 -> "Auto";
            case 2 -> "Tungsten";
            case 3 -> "Daylight";
            case 4 -> "Florescent";
            case 5 -> "Shade";
            case 129 -> "Manual";
            default -> unknown(value);
        };
    }

    static String flashIntensity(int value) {
        return switch (value) {
            case 11 -> "Weak";
            case 13 -> "Normal";
            case 15 -> "Strong";
            default -> unknown(value);
        };
    }
}
