package com.makernote.core.descriptor.impl.leica;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.impl.leica.LeicaMakernoteTags.*;

/**
 * Descriptions for the Leica makernote.
 */
public final class LeicaMakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_QUALITY -> indexed(values, tagId, 1, "Fine", "Basic");
            case TAG_USER_PROFILE -> indexed(values, tagId, 1,
                "User Profile 1", "User Profile 2", "User Profile 3", "User Profile 0 (Dynamic)");
            case TAG_WHITE_BALANCE -> indexed(values, tagId,
                "Auto or Manual", "Daylight", "Fluorescent", "Tungsten", "Flash", "Cloudy", "Shadow");
            case TAG_EXTERNAL_SENSOR_BRIGHTNESS_VALUE, TAG_MEASURED_LV, TAG_APPROXIMATE_F_NUMBER,
                 TAG_WB_RED_LEVEL, TAG_WB_GREEN_LEVEL, TAG_WB_BLUE_LEVEL -> simpleRational(values, tagId);
            case TAG_CAMERA_TEMPERATURE -> formattedInt(values, tagId, "%d C");
            default -> super.describe(tagId, values);
        };
    }
}
