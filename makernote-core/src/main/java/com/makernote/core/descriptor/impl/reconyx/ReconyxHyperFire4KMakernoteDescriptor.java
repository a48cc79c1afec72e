package com.makernote.core.descriptor.impl.reconyx;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFire4KMakernoteTags.*;

/**
 * Descriptions for the Reconyx HyperFire 4K makernote.
 */
public final class ReconyxHyperFire4KMakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_MAKERNOTE_IDENTIFIER, TAG_USER_LABEL, TAG_CAMERA_SERIAL_NUMBER -> values.getString(tagId);
            case TAG_AGGREGATE_MAKERNOTE_VERSION, TAG_AGGREGATE_MAKERNOTE_SIZE, TAG_MAKERNOTE_INFO_VERSION,
                 TAG_EVENT_NUMBER, TAG_AMBIENT_LIGHT_READING -> unsignedIntText(values, tagId);
            case TAG_MAKERNOTE_INFO_SIZE, TAG_CAMERA_FIRMWARE_BUILD_YEAR, TAG_UIB_FIRMWARE_BUILD_YEAR, TAG_DATE_YEAR,
                 TAG_CONTRAST, TAG_BRIGHTNESS, TAG_SHARPNESS, TAG_SATURATION, TAG_MOTION_SENSOR_SENSITIVITY,
                 TAG_BATTERY_TYPE, TAG_RECNX_DIRECTORY_NUMBER, TAG_FILE_NUMBER -> unsignedShortText(values, tagId);
            case TAG_CAMERA_FIRMWARE_MAJOR, TAG_CAMERA_FIRMWARE_MINOR, TAG_CAMERA_FIRMWARE_BUILD_MONTH,
                 TAG_CAMERA_FIRMWARE_BUILD_DAY, TAG_UIB_FIRMWARE_MAJOR, TAG_UIB_FIRMWARE_MINOR,
                 TAG_UIB_FIRMWARE_BUILD_MONTH, TAG_UIB_FIRMWARE_BUILD_DAY, TAG_EVENT_SEQUENCE_NUMBER,
                 TAG_MAX_EVENT_SEQUENCE_NUMBER, TAG_TIME_SECONDS, TAG_TIME_MINUTES, TAG_TIME_HOURS,
                 TAG_DATE_DAY, TAG_DATE_MONTH -> describeInt(values, tagId, value -> Integer.toString(value & 0xFF));
            case TAG_CAMERA_FIRMWARE_REVISION, TAG_UIB_FIRMWARE_REVISION, TAG_EVENT_TYPE ->
                describeInt(values, tagId, ReconyxDescriptions::character);
            case TAG_DATE_DAY_OF_WEEK -> indexed(values, tagId, DescriptionRules.DAY_NAMES);
            case TAG_MOON_PHASE -> indexed(values, tagId, DescriptionRules.MOON_PHASES);
            case TAG_TEMPERATURE_FAHRENHEIT -> describeInt(values, tagId, ReconyxDescriptions::fahrenheit);
            case TAG_TEMPERATURE_CELSIUS -> describeInt(values, tagId, ReconyxDescriptions::celsius);
            case TAG_FLASH -> indexed(values, tagId, "Off", "On");
            case TAG_BATTERY_VOLTAGE_INSTANTANEOUS, TAG_BATTERY_VOLTAGE_AVERAGE ->
                describeDouble(values, tagId, ReconyxDescriptions::voltage);
            default -> super.describe(tagId, values);
        };
    }
}
