package com.makernote.core.descriptor.impl.reconyx;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Locale;
import java.util.Optional;

import static com.makernote.core.descriptor.impl.reconyx.ReconyxUltraFireMakernoteTags.*;

/**
 * Descriptions for the Reconyx UltraFire makernote.
 */
public final class ReconyxUltraFireMakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_LABEL, TAG_CAMERA_VERSION, TAG_UIB_VERSION, TAG_BTL_VERSION, TAG_PEX_VERSION, TAG_EVENT_TYPE,
                 TAG_SERIAL_NUMBER, TAG_USER_LABEL -> values.getString(tagId);
            case TAG_MAKERNOTE_ID, TAG_MAKERNOTE_PUBLIC_ID -> values.getLong(tagId)
                .stream()
                .mapToObj(id -> String.format(Locale.ROOT, "0x%08x", id & 0xFFFFFFFFL))
                .findFirst();
            case TAG_MAKERNOTE_SIZE, TAG_EVENT_NUMBER -> unsignedIntText(values, tagId);
            case TAG_MAKERNOTE_PUBLIC_SIZE -> unsignedShortText(values, tagId);
            case TAG_AMBIENT_TEMPERATURE_FAHRENHEIT, TAG_AMBIENT_TEMPERATURE -> signedShortText(values, tagId);
            case TAG_SEQUENCE -> values.getIntArray(tagId)
                .flatMap(ReconyxDescriptions::sequence)
                .or(() -> defaultDescription(tagId, values));
            case TAG_DATE_TIME_ORIGINAL -> dateTime(values, tagId);
            case TAG_DAY_OF_WEEK -> indexed(values, tagId, DescriptionRules.DAY_NAMES);
            case TAG_MOON_PHASE -> indexed(values, tagId, DescriptionRules.MOON_PHASES);
            case TAG_FLASH -> indexed(values, tagId, "Off", "On");
            case TAG_BATTERY_VOLTAGE -> describeDouble(values, tagId, ReconyxDescriptions::voltage);
            default -> super.describe(tagId, values);
        };
    }
}
