package com.makernote.core.descriptor.impl.sanyo;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.impl.sanyo.SanyoMakernoteTags.*;

/**
 * Descriptions for the Sanyo makernote.
 */
public final class SanyoMakernoteDescriptor extends AbstractTagDescriptor {

    private static final String[] QUALITIES = {"Normal", "Fine", "Super Fine"};

    private static final String[] COMPRESSIONS = {
        "Very Low", "Low", "Medium Low", "Medium", "Medium High", "High", "Very High", "Super High"
    };

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_SANYO_QUALITY -> describeInt(values, tagId, SanyoMakernoteDescriptor::quality);
            case TAG_MACRO -> indexed(values, tagId, "Normal", "Macro", "View", "Manual");
            case TAG_DIGITAL_ZOOM -> decimalRational(values, tagId, 3);
            case TAG_SEQUENTIAL_SHOT -> indexed(values, tagId, "None", "Standard", "Best", "Adjust Exposure");
            case TAG_WIDE_RANGE, TAG_COLOR_ADJUSTMENT_MODE, TAG_QUICK_SHOT, TAG_SELF_TIMER, TAG_VOICE_MEMO,
                 TAG_FLICKER_REDUCE, TAG_OPTICAL_ZOOM_ON, TAG_DIGITAL_ZOOM_ON, TAG_LIGHT_SOURCE_SPECIAL ->
                indexed(values, tagId, "Off", "On");
            case TAG_RECORD_SHUTTER_RELEASE -> indexed(values, tagId, "Record while down", "Press start, press stop");
            case TAG_RESAVED -> indexed(values, tagId, "No", "Yes");
            case TAG_SCENE_SELECT -> indexed(values, tagId, "Off", "Sport", "TV", "Night", "User 1", "User 2", "Lamp");
            case TAG_SEQUENCE_SHOT_INTERVAL -> indexed(values, tagId,
                "5 frames/sec", "10 frames/sec", "15 frames/sec", "20 frames/sec");
            case TAG_FLASH_MODE -> indexed(values, tagId, "Auto", "Force", "Disabled", "Red eye");
            default -> super.describe(tagId, values);
        };
    }

    /**
     * High byte selects the quality, low byte the compression level, e.g. {@code 0x0103}
     * is {@code "Fine/Medium"}.
     */
    static String quality(int value) {
        int quality = value >> 8;
        int compression = value & 0xFF;
        if (value < 0 || quality >= QUALITIES.length || compression >= COMPRESSIONS.length) {
            return DescriptionRules.unknown(value);
        }
        return QUALITIES[quality] + "/" + COMPRESSIONS[compression];
    }
}
