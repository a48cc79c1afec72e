package com.makernote.core.descriptor.impl.reconyx;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFireMakernoteTags.*;

/**
 * Descriptions for the Reconyx HyperFire makernote.
 */
public final class ReconyxHyperFireMakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_MAKERNOTE_VERSION, TAG_MOTION_SENSITIVITY,
                 TAG_CONTRAST, TAG_BRIGHTNESS, TAG_SHARPNESS, TAG_SATURATION -> unsignedShortText(values, tagId);
            case TAG_FIRMWARE_VERSION, TAG_TRIGGER_MODE, TAG_SERIAL_NUMBER, TAG_USER_LABEL -> values.getString(tagId);
            case TAG_SEQUENCE -> values.getIntArray(tagId)
                .flatMap(ReconyxDescriptions::sequence)
                .or(() -> defaultDescription(tagId, values));
            case TAG_EVENT_NUMBER -> unsignedIntText(values, tagId);
            case TAG_BATTERY_VOLTAGE -> describeDouble(values, tagId, ReconyxDescriptions::voltage);
            case TAG_DATE_TIME_ORIGINAL -> dateTime(values, tagId);
            case TAG_MOON_PHASE -> indexed(values, tagId, DescriptionRules.MOON_PHASES);
            case TAG_AMBIENT_TEMPERATURE_FAHRENHEIT, TAG_AMBIENT_TEMPERATURE -> signedShortText(values, tagId);
            case TAG_INFRARED_ILLUMINATOR -> indexed(values, tagId, "Off", "On");
            default -> super.describe(tagId, values);
        };
    }
}
