package com.makernote.core.descriptor.impl.nikon;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.base.DescriptionRules.unknown;
import static com.makernote.core.descriptor.impl.nikon.NikonPictureControl2Tags.*;

/**
 * Descriptions for the Nikon PictureControl 2 record.
 *
 * <p>Adjustment bytes are stored with a bias of {@code 0x80}: {@code 0x80} is the neutral
 * setting, {@code 0xff} means the adjustment does not apply to the selected control.
 */
public final class NikonPictureControl2Descriptor extends AbstractTagDescriptor {

    private static final int NEUTRAL = 0x80;
    private static final int NOT_APPLICABLE = 0xff;

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_PICTURE_CONTROL_NAME, TAG_PICTURE_CONTROL_BASE -> nonEmptyString(values, tagId).map(String::trim);
            case TAG_PICTURE_CONTROL_ADJUST -> indexed(values, tagId, "Default Settings", "Quick Adjust", "Full Control");
            case TAG_PICTURE_CONTROL_QUICK_ADJUST, TAG_SHARPNESS, TAG_CLARITY, TAG_CONTRAST, TAG_BRIGHTNESS,
                 TAG_SATURATION, TAG_HUE, TAG_TONING_SATURATION ->
                describeInt(values, tagId, NikonPictureControl2Descriptor::adjustment);
            case TAG_FILTER_EFFECT -> describeInt(values, tagId, NikonPictureControl2Descriptor::filterEffect);
            case TAG_TONING_EFFECT -> describeInt(values, tagId, NikonPictureControl2Descriptor::toningEffect);
            default -> super.describe(tagId, values);
        };
    }

    static String adjustment(int raw) {
        int value = raw & 0xFF;
        if (value == NOT_APPLICABLE) {
            return "n/a";
        }
        int offset = value - NEUTRAL;
        if (offset == 0) {
            return "Normal";
        }
        return offset > 0 ? "+" + offset : Integer.toString(offset);
    }

    static String filterEffect(int raw) {
        int value = raw & 0xFF;
        return switch (value) {
            case 0x80 -> "Off";
            case 0x81 -> "Yellow";
            case 0x82 -> "Orange";
            case 0x83 -> "Red";
            case 0x84 -> "Green";
            case 0xff -> "n/a";
            default -> unknown(value);
        };
    }

    static String toningEffect(int raw) {
        int value = raw & 0xFF;
        return switch (value) {
            case 0x80 -> "B&W";
            case 0x81 -> "Sepia";
            case 0x82 -> "Cyanotype";
            case 0x83 -> "Red";
            case 0x84 -> "Yellow";
            case 0x85 -> "Green";
            case 0x86 -> "Blue-green";
            case 0x87 -> "Blue";
            case 0x88 -> "Purple-blue";
            case 0x89 -> "Red-purple";
            case 0xff -> "n/a";
            default -> unknown(value);
        };
    }
}
