package com.makernote.core.descriptor.impl.casio;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.base.DescriptionRules.unknown;
import static com.makernote.core.descriptor.impl.casio.CasioType2MakernoteTags.*;

/**
 * Descriptions for the second Casio makernote layout.
 */
public final class CasioType2MakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_THUMBNAIL_DIMENSIONS -> thumbnailDimensions(values);
            case TAG_THUMBNAIL_SIZE -> formattedInt(values, tagId, "%d bytes");
            case TAG_THUMBNAIL_OFFSET, TAG_WHITE_BALANCE_BIAS, TAG_TIME_ZONE -> values.getString(tagId);
            case TAG_QUALITY_MODE -> indexed(values, tagId, 1, "Fine", "Super Fine");
            case TAG_IMAGE_SIZE -> describeInt(values, tagId, CasioType2MakernoteDescriptor::imageSize);
            case TAG_FOCUS_MODE_1 -> indexed(values, tagId, "Normal", "Macro");
            case TAG_ISO_SENSITIVITY -> describeInt(values, tagId, CasioType2MakernoteDescriptor::isoSensitivity);
            case TAG_WHITE_BALANCE_1 -> indexed(values, tagId,
                "Auto", "Daylight", "Shade", "Tungsten", "Florescent", "Manual");
            case TAG_FOCAL_LENGTH -> describeDouble(values, tagId,
                value -> DescriptionRules.focalLength(value / 10d));
            case TAG_SATURATION, TAG_CONTRAST, TAG_SHARPNESS -> indexed(values, tagId, "-1", "Normal", "+1");
            case TAG_PREVIEW_THUMBNAIL -> values.getByteArray(tagId)
                .map(bytes -> "<" + bytes.length + " bytes of image data>");
            case TAG_WHITE_BALANCE_2 -> describeInt(values, tagId, CasioType2MakernoteDescriptor::whiteBalance2);
            case TAG_OBJECT_DISTANCE -> formattedInt(values, tagId, "%d mm");
            case TAG_FLASH_DISTANCE, TAG_COLOUR_MODE, TAG_ENHANCEMENT, TAG_FILTER -> indexed(values, tagId, "Off");
            case TAG_RECORD_MODE -> indexed(values, tagId, 2, "Normal");
            case TAG_SELF_TIMER -> indexed(values, tagId, 1, "Off");
            case TAG_QUALITY -> indexed(values, tagId, 3, "Fine");
            case TAG_FOCUS_MODE_2 -> describeInt(values, tagId, value -> switch (value) {
                case 1 -> "Fixation";
                case 6 -> "Multi-Area Focus";
                default -> unknown(value);
            });
            case TAG_CCD_ISO_SENSITIVITY -> indexed(values, tagId, "Off", "On");
            default -> super.describe(tagId, values);
        };
    }

    private Optional<String> thumbnailDimensions(TagValues values) {
        Optional<int[]> dimensions = values.getIntArray(TAG_THUMBNAIL_DIMENSIONS);
        if (dimensions.isPresent() && dimensions.get().length == 2) {
            return Optional.of(dimensions.get()[0] + " x " + dimensions.get()[1] + " pixels");
        }
        return values.getString(TAG_THUMBNAIL_DIMENSIONS);
    }

    static String imageSize(int value) {
        return switch (value) {
            case 0 -> "640 x 480 pixels";
            case 4 -> "1600 x 1200 pixels";
            case 5 -> "2048 x 1536 pixels";
            case 20 -> "2288 x 1712 pixels";
            case 21 -> "2592 x 1944 pixels";
            case 22 -> "2304 x 1728 pixels";
            case 36 -> "3008 x 2008 pixels";
            default -> unknown(value);
        };
    }

    static String isoSensitivity(int value) {
        return switch (value) {
            case 3 -> "50";
            case 4 -> "64";
            case 6 -> "100";
            case 9 -> "200";
            default -> unknown(value);
        };
    }

    static String whiteBalance2(int value) {
        return switch (value) {
            case 0 -> "Manual";
            case 1 -> "Auto";
            case 4, 12 -> "Flash";
            default -> unknown(value);
        };
    }
}
