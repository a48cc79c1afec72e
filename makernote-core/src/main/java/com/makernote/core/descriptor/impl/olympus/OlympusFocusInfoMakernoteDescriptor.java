package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.lang.Rational;
import com.makernote.core.tag.TagValues;

import java.util.Map;
import java.util.Optional;

import static com.makernote.core.descriptor.impl.olympus.OlympusFocusInfoMakernoteTags.*;

/**
 * Descriptions for the Olympus Focus Info sub-IFD.
 */
public final class OlympusFocusInfoMakernoteDescriptor extends AbstractTagDescriptor {

    private static final int IMAGE_STABILIZATION_MODE_OFFSET = 43;

    private static final Map<String, String> FLASH_STATES = Map.of(
        "0", "Off",
        "1", "On",
        "0 0", "Off",
        "1 0", "On"
    );

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_FOCUS_INFO_VERSION -> versionBytes(values, tagId, 4);
            case TAG_AUTO_FOCUS, TAG_MACRO_LED -> indexed(values, tagId, "Off", "On");
            case TAG_FOCUS_DISTANCE -> values.getRational(tagId).map(OlympusFocusInfoMakernoteDescriptor::focusDistance);
            case TAG_AF_POINT -> signedShortText(values, tagId);
            case TAG_EXTERNAL_FLASH -> values.getIntArray(tagId)
                .filter(flash -> flash.length >= 2)
                .map(flash -> DescriptionRules.matchJoined(flash[0] + " " + flash[1], FLASH_STATES));
            case TAG_EXTERNAL_FLASH_BOUNCE -> indexed(values, tagId, "Bounce or Off", "Direct");
            case TAG_EXTERNAL_FLASH_ZOOM -> values.getIntArray(tagId)
                .filter(zoom -> zoom.length > 0)
                .map(zoom -> DescriptionRules.matchJoined(
                    zoom.length > 1 ? zoom[0] + " " + zoom[1] : Integer.toString(zoom[0]), FLASH_STATES));
            case TAG_MANUAL_FLASH -> values.getShortArray(tagId)
                .filter(flash -> flash.length >= 2)
                .map(OlympusFocusInfoMakernoteDescriptor::manualFlash);
            case TAG_SENSOR_TEMPERATURE -> values.getString(tagId);
            case TAG_IMAGE_STABILIZATION -> values.getByteArray(tagId)
                .filter(bytes -> bytes.length > IMAGE_STABILIZATION_MODE_OFFSET)
                .map(OlympusFocusInfoMakernoteDescriptor::imageStabilization);
            default -> super.describe(tagId, values);
        };
    }

    /**
     * Distance in metres; a numerator of zero or {@code 0xFFFFFFFF} means infinity.
     */
    static String focusDistance(Rational distance) {
        long numerator = distance.getNumerator();
        if (numerator == 0 || numerator == 0xFFFFFFFFL || numerator == -1) {
            return "inf";
        }
        return DescriptionRules.decimal(numerator / 1000.0, "0.###") + " m";
    }

    static String manualFlash(short[] flash) {
        if (flash[0] == 0) {
            return "Off";
        }
        if (flash[1] == 1) {
            return "Full";
        }
        return "On (1/" + flash[1] + " strength)";
    }

    static String imageStabilization(byte[] data) {
        if ((data[0] | data[1] | data[2] | data[3]) == 0) {
            return "Off";
        }
        return "On, " + ((data[IMAGE_STABILIZATION_MODE_OFFSET] & 1) > 0 ? "Mode 1" : "Mode 2");
    }
}
