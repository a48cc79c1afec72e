package com.makernote.core.descriptor.impl.pentax;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.math.BigDecimal;
import java.util.Optional;

import static com.makernote.core.descriptor.impl.pentax.PentaxMakernoteTags.*;

/**
 * Descriptions for the early Pentax makernote.
 */
public final class PentaxMakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_CAPTURE_MODE -> indexed(values, tagId, "Auto", "Night-scene", "Manual", null, "Multiple");
            case TAG_QUALITY_LEVEL -> indexed(values, tagId, "Good", "Better", "Best");
            case TAG_FOCUS_MODE -> indexed(values, tagId, 2, "Custom", "Auto");
            case TAG_FLASH_MODE -> indexed(values, tagId, 1,
                "Auto", "Flash On", null, "Flash Off", null, "Red-eye Reduction");
            case TAG_WHITE_BALANCE -> indexed(values, tagId,
                "Auto", "Daylight", "Shade", "Tungsten", "Fluorescent", "Manual");
            case TAG_DIGITAL_ZOOM -> values.getFloat(tagId).map(PentaxMakernoteDescriptor::digitalZoom);
            case TAG_SHARPNESS -> indexed(values, tagId, "Normal", "Soft", "Hard");
            case TAG_CONTRAST, TAG_SATURATION -> indexed(values, tagId, "Normal", "Low", "High");
            case TAG_ISO_SPEED -> describeInt(values, tagId, PentaxMakernoteDescriptor::isoSpeed);
            case TAG_COLOUR -> indexed(values, tagId, 1, "Normal", "Black & White", "Sepia");
            default -> super.describe(tagId, values);
        };
    }

    /** Formats at single precision so 1.1f reads "1.1". */
    static String digitalZoom(float zoom) {
        if (zoom == 0) {
            return "Off";
        }
        return DescriptionRules.decimal(new BigDecimal(Float.toString(zoom)).doubleValue(), "0.0###########");
    }

    static String isoSpeed(int value) {
        return switch (value) {
            case 10, 100 -> "ISO 100";
            case 16, 200 -> "ISO 200";
            default -> DescriptionRules.unknown(value);
        };
    }
}
