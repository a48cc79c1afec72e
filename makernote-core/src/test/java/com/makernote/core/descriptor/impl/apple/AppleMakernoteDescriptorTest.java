package com.makernote.core.descriptor.impl.apple;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import com.makernote.core.lang.Rational;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.apple.AppleMakernoteTags.TAG_ACCELERATION_VECTOR;
import static com.makernote.core.descriptor.impl.apple.AppleMakernoteTags.TAG_BURST_UUID;
import static com.makernote.core.descriptor.impl.apple.AppleMakernoteTags.TAG_HDR_IMAGE_TYPE;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AppleMakernoteDescriptor}.
 */
class AppleMakernoteDescriptorTest extends DescriptorTestBase {

    private final AppleMakernoteDescriptor descriptor = new AppleMakernoteDescriptor();

    @Override
    protected TagDescriptor descriptor() {
        return descriptor;
    }

    @Test
    void describe_hdrImageType_mapsFromThree() {
        assertThat(describe(TAG_HDR_IMAGE_TYPE, 3)).contains("HDR Image");
        assertThat(describe(TAG_HDR_IMAGE_TYPE, 4)).contains("Original Image");
        assertThat(describe(TAG_HDR_IMAGE_TYPE, 2)).contains("Unknown (2)");
    }

    @Test
    void describe_accelerationVector_namesDirectionPerAxis() {
        // Given: a device tilted left, up and backwards
        Rational[] vector = {new Rational(1, 2), new Rational(-1, 4), new Rational(0, 1)};

        // When
        var description = describe(TAG_ACCELERATION_VECTOR, vector);

        // Then: zero counts as the negative direction
        assertThat(description).contains("0.50g left, 0.25g up, 0.00g backward");
    }

    @Test
    void describe_accelerationVectorWrongLength_returnsEmpty() {
        Rational[] vector = {new Rational(1, 2), new Rational(1, 2)};

        assertThat(describe(TAG_ACCELERATION_VECTOR, vector)).isEmpty();
    }

    @Test
    void describe_plainTag_fallsBackToRawText() {
        assertThat(describe(TAG_BURST_UUID, "A1B2-C3")).contains("A1B2-C3");
        assertThat(describeAbsent(TAG_BURST_UUID)).isEmpty();
    }
}
