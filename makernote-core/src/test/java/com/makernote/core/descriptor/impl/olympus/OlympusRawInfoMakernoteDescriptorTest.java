package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.olympus.OlympusRawInfoMakernoteTags.TAG_LIGHT_SOURCE;
import static com.makernote.core.descriptor.impl.olympus.OlympusRawInfoMakernoteTags.TAG_RAW_INFO_VERSION;
import static com.makernote.core.descriptor.impl.olympus.OlympusRawInfoMakernoteTags.TAG_YCBCR_COEFFICIENTS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OlympusRawInfoMakernoteDescriptor}.
 */
class OlympusRawInfoMakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new OlympusRawInfoMakernoteDescriptor();
    }

    @Test
    void describe_yCbCrCoefficients_pairsToDecimals() {
        int[] pairs = {299, 1000, 587, 1000, 114, 1000};

        assertThat(describe(TAG_YCBCR_COEFFICIENTS, pairs)).contains("0.299 0.587 0.114");
    }

    @Test
    void describe_lightSource_namesPresets() {
        assertThat(describe(TAG_LIGHT_SOURCE, 0)).contains("Unknown");
        assertThat(describe(TAG_LIGHT_SOURCE, 512)).contains("Custom 1-4");
        assertThat(describe(TAG_LIGHT_SOURCE, 1)).contains("Unknown (1)");
    }

    @Test
    void describe_version_asciiDigits() {
        assertThat(describe(TAG_RAW_INFO_VERSION, "0100")).contains("100");
    }
}
