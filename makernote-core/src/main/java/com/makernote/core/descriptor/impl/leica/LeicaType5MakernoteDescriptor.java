package com.makernote.core.descriptor.impl.leica;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.tag.TagValues;

import java.util.Locale;
import java.util.Optional;

import static com.makernote.core.descriptor.base.DescriptionRules.unknown;
import static com.makernote.core.descriptor.impl.leica.LeicaType5MakernoteTags.TAG_EXPOSURE_MODE;

/**
 * Descriptions for the Leica Type 5 makernote.
 */
public final class LeicaType5MakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        if (tagId == TAG_EXPOSURE_MODE) {
            return exposureMode(values);
        }
        return super.describe(tagId, values);
    }

    /**
     * Exposure mode is stored as four bytes; only the leading two vary in practice.
     */
    Optional<String> exposureMode(TagValues values) {
        Optional<int[]> bytes = values.getIntArray(TAG_EXPOSURE_MODE);
        if (bytes.isEmpty() || bytes.get().length < 4) {
            return Optional.empty();
        }
        int[] mode = bytes.get();
        String joined = String.format(Locale.ROOT, "%d %d %d %d", mode[0], mode[1], mode[2], mode[3]);
        return Optional.of(switch (joined) {
            case "0 0 0 0" -> "Program AE";
            case "1 0 0 0" -> "Aperture-priority AE";
            case "1 1 0 0" -> "Aperture-priority AE (1)";
            case "2 0 0 0" -> "Shutter speed priority AE";
            case "3 0 0 0" -> "Manual";
            default -> unknown(joined);
        });
    }
}
