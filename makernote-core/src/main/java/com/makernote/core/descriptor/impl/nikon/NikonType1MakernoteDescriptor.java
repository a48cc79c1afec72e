package com.makernote.core.descriptor.impl.nikon;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.lang.Rational;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.impl.nikon.NikonType1MakernoteTags.*;

/**
 * Descriptions for the first Nikon makernote layout.
 */
public final class NikonType1MakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_QUALITY -> indexed(values, tagId, 1,
                "VGA Basic", "VGA Normal", "VGA Fine", "SXGA Basic", "SXGA Normal", "SXGA Fine");
            case TAG_COLOR_MODE -> indexed(values, tagId, 1, "Color", "Monochrome");
            case TAG_IMAGE_ADJUSTMENT -> indexed(values, tagId,
                "Normal", "Bright +", "Bright -", "Contrast +", "Contrast -");
            case TAG_CCD_SENSITIVITY -> indexed(values, tagId,
                "ISO80", null, "ISO160", null, "ISO320", "ISO100");
            case TAG_WHITE_BALANCE -> indexed(values, tagId,
                "Auto", "Preset", "Daylight", "Incandescence", "Florescence", "Cloudy", "SpeedLight");
            case TAG_FOCUS -> values.getRational(tagId).map(NikonType1MakernoteDescriptor::focus);
            case TAG_DIGITAL_ZOOM -> values.getRational(tagId).map(NikonType1MakernoteDescriptor::digitalZoom);
            case TAG_CONVERTER -> indexed(values, tagId, "None", "Fisheye converter");
            default -> super.describe(tagId, values);
        };
    }

    // 1/0 is how these cameras record focus at infinity
    static String focus(Rational value) {
        return value.getNumerator() == 1 && value.getDenominator() == 0
            ? "Infinite"
            : value.toSimpleString(true);
    }

    static String digitalZoom(Rational value) {
        return value.getNumerator() == 0
            ? "No digital zoom"
            : value.toSimpleString(true) + "x digital zoom";
    }
}
