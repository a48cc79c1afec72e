package com.makernote.core.descriptor.impl.reconyx;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.time.format.DateTimeFormatter;
import java.util.Optional;

import static com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFire2MakernoteTags.*;

/**
 * Descriptions for the Reconyx HyperFire 2 makernote.
 *
 * <p>The firmware version is stored as {@code [major, minor, revision]} where the revision
 * is a character code, e.g. {@code [1, 2, 98]} renders as {@code "1.2b"}.
 */
public final class ReconyxHyperFire2MakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_FILE_NUMBER, TAG_DIRECTORY_NUMBER, TAG_CONTRAST, TAG_BRIGHTNESS, TAG_SHARPNESS, TAG_SATURATION,
                 TAG_AMBIENT_INFRARED, TAG_AMBIENT_LIGHT, TAG_MOTION_SENSITIVITY, TAG_BATTERY_TYPE ->
                unsignedShortText(values, tagId);
            case TAG_FIRMWARE_VERSION -> values.getIntArray(tagId)
                .map(ReconyxHyperFire2MakernoteDescriptor::firmwareVersion);
            case TAG_FIRMWARE_DATE -> values.getDateTime(tagId).map(DateTimeFormatter.ISO_LOCAL_DATE::format);
            case TAG_TRIGGER_MODE -> values.getString(tagId).map(ReconyxHyperFire2MakernoteDescriptor::triggerMode);
            case TAG_SEQUENCE -> values.getIntArray(tagId)
                .flatMap(ReconyxDescriptions::sequence)
                .or(() -> defaultDescription(tagId, values));
            case TAG_EVENT_NUMBER -> unsignedIntText(values, tagId);
            case TAG_DATE_TIME_ORIGINAL -> dateTime(values, tagId);
            case TAG_DAY_OF_WEEK -> indexed(values, tagId, DescriptionRules.DAY_NAMES);
            case TAG_MOON_PHASE -> indexed(values, tagId, DescriptionRules.MOON_PHASES);
            case TAG_AMBIENT_TEMPERATURE_FAHRENHEIT -> describeInt(values, tagId, ReconyxDescriptions::fahrenheit);
            case TAG_AMBIENT_TEMPERATURE -> describeInt(values, tagId, ReconyxDescriptions::celsius);
            case TAG_FLASH -> indexed(values, tagId, "Off", "On");
            case TAG_BATTERY_VOLTAGE, TAG_BATTERY_VOLTAGE_AVG -> describeDouble(values, tagId, ReconyxDescriptions::voltage);
            case TAG_USER_LABEL, TAG_SERIAL_NUMBER -> values.getString(tagId);
            default -> super.describe(tagId, values);
        };
    }

    static String firmwareVersion(int[] version) {
        if (version.length < 3) {
            return "";
        }
        return version[0] + "." + version[1] + ReconyxDescriptions.character(version[2]);
    }

    static String triggerMode(String mode) {
        return switch (mode) {
            case "M" -> "Motion Detection";
            case "P" -> "Point and Shoot";
            case "T" -> "Time Lapse";
            default -> "Unknown trigger mode";
        };
    }
}
