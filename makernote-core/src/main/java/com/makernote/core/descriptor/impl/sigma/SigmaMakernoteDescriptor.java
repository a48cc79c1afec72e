package com.makernote.core.descriptor.impl.sigma;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.impl.sigma.SigmaMakernoteTags.*;

/**
 * Descriptions for the Sigma makernote.
 *
 * <p>Exposure and metering modes are stored as text whose first letter is the code; an
 * unrecognised code renders the stored text unchanged.
 */
public final class SigmaMakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_EXPOSURE_MODE -> nonEmptyString(values, tagId).map(SigmaMakernoteDescriptor::exposureMode);
            case TAG_METERING_MODE -> nonEmptyString(values, tagId).map(SigmaMakernoteDescriptor::meteringMode);
            default -> super.describe(tagId, values);
        };
    }

    static String exposureMode(String mode) {
        return switch (mode.charAt(0)) {
            case 'A' -> "Aperture Priority AE";
            case 'M' -> "Manual";
            case 'P' -> "Program AE";
            case 'S' -> "Shutter Speed Priority AE";
            default -> mode;
        };
    }

    static String meteringMode(String mode) {
        return switch (mode.charAt(0)) {
            case '8' -> "Multi Segment";
            case 'A' -> "Average";
            case 'C' -> "Center Weighted Average";
            default -> mode;
        };
    }
}
