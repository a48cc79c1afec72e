package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

import static com.makernote.core.descriptor.impl.olympus.OlympusRawDevelopment2MakernoteTags.*;

/**
 * Descriptions for the Olympus Raw Development 2 sub-IFD.
 *
 * <p>Shares color space, engine and noise reduction tables with
 * {@link OlympusRawDevelopmentMakernoteDescriptor}.
 */
public final class OlympusRawDevelopment2MakernoteDescriptor extends AbstractTagDescriptor {

    private static final Map<Integer, String> ART_FILTERS = Map.ofEntries(
        Map.entry(0, "Off"),
        Map.entry(1, "Soft Focus"),
        Map.entry(2, "Pop Art"),
        Map.entry(3, "Pale & Light Color"),
        Map.entry(4, "Light Tone"),
        Map.entry(5, "Pin Hole"),
        Map.entry(6, "Grainy Film"),
        Map.entry(9, "Diorama"),
        Map.entry(10, "Cross Process"),
        Map.entry(12, "Fish Eye"),
        Map.entry(13, "Drawing"),
        Map.entry(14, "Gentle Sepia"),
        Map.entry(15, "Pale & Light Color II"),
        Map.entry(16, "Pop Art II"),
        Map.entry(17, "Pin Hole II"),
        Map.entry(18, "Pin Hole III"),
        Map.entry(19, "Grainy Film II"),
        Map.entry(20, "Dramatic Tone"),
        Map.entry(21, "Punk"),
        Map.entry(22, "Soft Focus 2"),
        Map.entry(23, "Sparkle"),
        Map.entry(24, "Watercolor"),
        Map.entry(25, "Key Line"),
        Map.entry(26, "Key Line II"),
        Map.entry(27, "Miniature"),
        Map.entry(28, "Reflection"),
        Map.entry(29, "Fragmented"),
        Map.entry(31, "Cross Process II"),
        Map.entry(32, "Dramatic Tone II"),
        Map.entry(33, "Watercolor I"),
        Map.entry(34, "Watercolor II"),
        Map.entry(35, "Diorama II"),
        Map.entry(36, "Vintage"),
        Map.entry(37, "Vintage II"),
        Map.entry(38, "Vintage III"),
        Map.entry(39, "Partial Color"),
        Map.entry(40, "Partial Color II"),
        Map.entry(41, "Partial Color III")
    );

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_RAW_DEV_VERSION -> versionBytes(values, tagId, 4);
            case TAG_RAW_DEV_EXPOSURE_BIAS_VALUE -> indexed(values, tagId, 1, "Color Temperature", "Gray Point");
            case TAG_RAW_DEV_COLOR_SPACE -> indexed(values, tagId, OlympusRawDevelopmentMakernoteDescriptor.COLOR_SPACES);
            case TAG_RAW_DEV_NOISE_REDUCTION -> describeInt(values, tagId, value -> DescriptionRules.flagsOrNone(
                value & 0xFFFF, OlympusRawDevelopmentMakernoteDescriptor.NOISE_REDUCTION_FLAGS));
            case TAG_RAW_DEV_ENGINE -> indexed(values, tagId, OlympusRawDevelopmentMakernoteDescriptor.ENGINES);
            case TAG_RAW_DEV_PICTURE_MODE -> describeInt(values, tagId, OlympusRawDevelopment2MakernoteDescriptor::pictureMode);
            case TAG_RAW_DEV_PM_BW_FILTER -> indexed(values, tagId, 1, "Neutral", "Yellow", "Orange", "Red", "Green");
            case TAG_RAW_DEV_PM_PICTURE_TONE -> indexed(values, tagId, 1, "Neutral", "Sepia", "Blue", "Purple", "Green");
            case TAG_RAW_DEV_ART_FILTER -> values.getIntArray(tagId)
                .filter(filter -> filter.length > 0)
                .map(OlympusRawDevelopment2MakernoteDescriptor::artFilter);
            default -> super.describe(tagId, values);
        };
    }

    static String pictureMode(int value) {
        return switch (value) {
            case 1 -> "Vivid";
            case 2 -> "Natural";
            case 3 -> "Muted";
            case 256 -> "Monotone";
            case 512 -> "Sepia";
            default -> DescriptionRules.unknown(value);
        };
    }

    /**
     * Names the filter in the first slot and appends the remaining parameters,
     * separated by {@code "; "}.
     */
    static String artFilter(int[] filter) {
        StringJoiner joiner = new StringJoiner("; ");
        joiner.add(ART_FILTERS.getOrDefault(filter[0], "[unknown]"));
        for (int i = 1; i < filter.length; i++) {
            joiner.add(Integer.toString(filter[i]));
        }
        return joiner.toString();
    }
}
