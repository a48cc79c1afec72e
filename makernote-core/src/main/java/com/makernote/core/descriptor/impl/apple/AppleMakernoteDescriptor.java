package com.makernote.core.descriptor.impl.apple;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.lang.Rational;
import com.makernote.core.tag.TagValues;

import java.util.Locale;
import java.util.Optional;

import static com.makernote.core.descriptor.impl.apple.AppleMakernoteTags.TAG_ACCELERATION_VECTOR;
import static com.makernote.core.descriptor.impl.apple.AppleMakernoteTags.TAG_HDR_IMAGE_TYPE;

/**
 * Descriptions for the Apple makernote.
 *
 * <p>The {@code Run Time} tag holds a binary property list; it is rendered with the
 * default description.
 */
public final class AppleMakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_HDR_IMAGE_TYPE -> indexed(values, tagId, 3, "HDR Image", "Original Image");
            case TAG_ACCELERATION_VECTOR -> accelerationVector(values);
            default -> super.describe(tagId, values);
        };
    }

    /**
     * Renders the device's acceleration, in multiples of g, along its three axes.
     */
    Optional<String> accelerationVector(TagValues values) {
        Optional<Rational[]> vector = values.getRationalArray(TAG_ACCELERATION_VECTOR);
        if (vector.isEmpty() || vector.get().length != 3) {
            return Optional.empty();
        }
        Rational[] axes = vector.get();
        return Optional.of(axis(axes[0], "left", "right") + ", "
            + axis(axes[1], "down", "up") + ", "
            + axis(axes[2], "forward", "backward"));
    }

    private static String axis(Rational value, String positive, String negative) {
        return String.format(Locale.ROOT, "%.2fg %s",
            value.getAbsolute().doubleValue(), value.isPositive() ? positive : negative);
    }
}
