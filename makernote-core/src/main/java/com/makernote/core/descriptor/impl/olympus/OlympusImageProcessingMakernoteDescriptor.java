package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Map;
import java.util.Optional;

import static com.makernote.core.descriptor.impl.olympus.OlympusImageProcessingMakernoteTags.*;

/**
 * Descriptions for the Olympus Image Processing sub-IFD.
 */
public final class OlympusImageProcessingMakernoteDescriptor extends AbstractTagDescriptor {

    private static final Map<String, String> ASPECT_RATIOS = Map.ofEntries(
        Map.entry("1 1", "4:3"),
        Map.entry("1 4", "1:1"),
        Map.entry("2 1", "3:2 (RAW)"),
        Map.entry("2 2", "3:2"),
        Map.entry("3 1", "16:9 (RAW)"),
        Map.entry("3 3", "16:9"),
        Map.entry("4 1", "1:1 (RAW)"),
        Map.entry("4 4", "6:6"),
        Map.entry("5 5", "5:4"),
        Map.entry("6 6", "7:6"),
        Map.entry("7 7", "6:5"),
        Map.entry("8 8", "7:5"),
        Map.entry("9 1", "3:4 (RAW)"),
        Map.entry("9 9", "3:4")
    );

    private static final Map<String, String> KEYSTONE_COMPENSATION = Map.of(
        "0 0", "Off",
        "0 1", "On"
    );

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_IMAGE_PROCESSING_VERSION -> versionBytes(values, tagId, 4);
            case TAG_COLOR_MATRIX -> values.getShortArray(tagId).map(DescriptionRules::join);
            case TAG_NOISE_REDUCTION_2 -> describeInt(values, tagId, OlympusImageProcessingMakernoteDescriptor::noiseReduction);
            case TAG_DISTORTION_CORRECTION_2, TAG_SHADING_COMPENSATION_2 -> indexed(values, tagId, "Off", "On");
            case TAG_MULTIPLE_EXPOSURE_MODE -> values.getIntArray(tagId)
                .filter(mode -> mode.length > 0)
                .map(OlympusImageProcessingMakernoteDescriptor::multipleExposureMode);
            case TAG_ASPECT_RATIO -> bytePair(values, tagId, ASPECT_RATIOS);
            case TAG_KEYSTONE_COMPENSATION -> bytePair(values, tagId, KEYSTONE_COMPENSATION);
            case TAG_KEYSTONE_DIRECTION -> indexed(values, tagId, "Vertical", "Horizontal");
            default -> super.describe(tagId, values);
        };
    }

    static String noiseReduction(int value) {
        return DescriptionRules.flagsOrNone(value & 0xFFFF,
            "Noise Reduction", "Noise Filter", "Noise Filter (ISO Boost)");
    }

    static String multipleExposureMode(int[] mode) {
        String description = switch (mode[0] & 0xFFFF) {
            case 0 -> "Off";
            case 2 -> "On (2 frames)";
            case 3 -> "On (3 frames)";
            default -> DescriptionRules.unknown(mode[0] & 0xFFFF);
        };
        return mode.length > 1 ? description + "; " + (mode[1] & 0xFFFF) : description;
    }

    private static Optional<String> bytePair(TagValues values, int tagId, Map<String, String> table) {
        return values.getByteArray(tagId)
            .filter(bytes -> bytes.length >= 2)
            .map(bytes -> DescriptionRules.matchJoined((bytes[0] & 0xFF) + " " + (bytes[1] & 0xFF), table));
    }
}
