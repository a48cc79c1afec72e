package com.makernote.core.descriptor.impl.pentax;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.pentax.PentaxMakernoteTags.TAG_CAPTURE_MODE;
import static com.makernote.core.descriptor.impl.pentax.PentaxMakernoteTags.TAG_COLOUR;
import static com.makernote.core.descriptor.impl.pentax.PentaxMakernoteTags.TAG_DIGITAL_ZOOM;
import static com.makernote.core.descriptor.impl.pentax.PentaxMakernoteTags.TAG_FLASH_MODE;
import static com.makernote.core.descriptor.impl.pentax.PentaxMakernoteTags.TAG_FOCUS_MODE;
import static com.makernote.core.descriptor.impl.pentax.PentaxMakernoteTags.TAG_ISO_SPEED;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PentaxMakernoteDescriptor}.
 */
class PentaxMakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new PentaxMakernoteDescriptor();
    }

    @Test
    void describe_digitalZoom_zeroIsOff() {
        assertThat(describe(TAG_DIGITAL_ZOOM, 0.0f)).contains("Off");
        assertThat(describe(TAG_DIGITAL_ZOOM, 2.5f)).contains("2.5");
        assertThat(describe(TAG_DIGITAL_ZOOM, 2)).contains("2.0");
    }

    @Test
    void describe_digitalZoom_singlePrecisionRatios() {
        assertThat(describe(TAG_DIGITAL_ZOOM, 1.1f)).contains("1.1");
        assertThat(describe(TAG_DIGITAL_ZOOM, 1.3f)).contains("1.3");
        assertThat(describe(TAG_DIGITAL_ZOOM, 3.75f)).contains("3.75");
    }

    @Test
    void describe_isoSpeed_acceptsBothEncodings() {
        assertThat(describe(TAG_ISO_SPEED, 10)).contains("ISO 100");
        assertThat(describe(TAG_ISO_SPEED, 200)).contains("ISO 200");
        assertThat(describe(TAG_ISO_SPEED, 400)).contains("Unknown (400)");
    }

    @Test
    void describe_tablesWithGaps_holesAreUnknown() {
        assertThat(describe(TAG_CAPTURE_MODE, 4)).contains("Multiple");
        assertThat(describe(TAG_CAPTURE_MODE, 3)).contains("Unknown (3)");
        assertThat(describe(TAG_FLASH_MODE, 6)).contains("Red-eye Reduction");
        assertThat(describe(TAG_FLASH_MODE, 3)).contains("Unknown (3)");
        assertThat(describe(TAG_FOCUS_MODE, 3)).contains("Auto");
        assertThat(describe(TAG_COLOUR, 3)).contains("Sepia");
    }
}
