package com.makernote.core.descriptor.impl.dji;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.impl.dji.DjiMakernoteTags.*;

/**
 * Descriptions for the DJI makernote.
 */
public final class DjiMakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_AIRCRAFT_SPEED_X, TAG_AIRCRAFT_SPEED_Y, TAG_AIRCRAFT_SPEED_Z ->
                describeDouble(values, tagId, DjiMakernoteDescriptor::speed);
            case TAG_AIRCRAFT_PITCH, TAG_AIRCRAFT_YAW, TAG_AIRCRAFT_ROLL,
                 TAG_CAMERA_PITCH, TAG_CAMERA_YAW, TAG_CAMERA_ROLL ->
                describeDouble(values, tagId, DjiMakernoteDescriptor::angle);
            default -> super.describe(tagId, values);
        };
    }

    static String speed(double metresPerSecond) {
        return DescriptionRules.decimal(metresPerSecond, "0.##") + " m/s";
    }

    static String angle(double degrees) {
        return DescriptionRules.decimal(degrees, "0.##") + "°";
    }
}
