package com.makernote.core.descriptor.impl.leica;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.leica.LeicaType5MakernoteTags.TAG_EXPOSURE_MODE;
import static com.makernote.core.descriptor.impl.leica.LeicaType5MakernoteTags.TAG_LENS_MODEL;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LeicaType5MakernoteDescriptor}.
 */
class LeicaType5MakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new LeicaType5MakernoteDescriptor();
    }

    @Test
    void describe_exposureMode_matchesFourBytes() {
        assertThat(describe(TAG_EXPOSURE_MODE, new byte[]{1, 0, 0, 0})).contains("Aperture-priority AE");
        assertThat(describe(TAG_EXPOSURE_MODE, new byte[]{1, 1, 0, 0})).contains("Aperture-priority AE (1)");
        assertThat(describe(TAG_EXPOSURE_MODE, new int[]{3, 0, 0, 0})).contains("Manual");
    }

    @Test
    void describe_exposureModeUnlisted_returnsUnknownWithBytes() {
        assertThat(describe(TAG_EXPOSURE_MODE, new byte[]{9, 0, 0, 0})).contains("Unknown (9 0 0 0)");
    }

    @Test
    void describe_exposureModeTooShort_returnsEmpty() {
        assertThat(describe(TAG_EXPOSURE_MODE, new byte[]{1, 0})).isEmpty();
    }

    @Test
    void describe_lensModel_passesThrough() {
        assertThat(describe(TAG_LENS_MODEL, "Summilux-M 1:1.4/50")).contains("Summilux-M 1:1.4/50");
    }
}
