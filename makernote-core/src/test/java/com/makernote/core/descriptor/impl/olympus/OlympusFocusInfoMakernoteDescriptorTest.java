package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import com.makernote.core.lang.Rational;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.olympus.OlympusFocusInfoMakernoteTags.TAG_AF_POINT;
import static com.makernote.core.descriptor.impl.olympus.OlympusFocusInfoMakernoteTags.TAG_EXTERNAL_FLASH;
import static com.makernote.core.descriptor.impl.olympus.OlympusFocusInfoMakernoteTags.TAG_EXTERNAL_FLASH_ZOOM;
import static com.makernote.core.descriptor.impl.olympus.OlympusFocusInfoMakernoteTags.TAG_FOCUS_DISTANCE;
import static com.makernote.core.descriptor.impl.olympus.OlympusFocusInfoMakernoteTags.TAG_IMAGE_STABILIZATION;
import static com.makernote.core.descriptor.impl.olympus.OlympusFocusInfoMakernoteTags.TAG_MACRO_LED;
import static com.makernote.core.descriptor.impl.olympus.OlympusFocusInfoMakernoteTags.TAG_MANUAL_FLASH;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OlympusFocusInfoMakernoteDescriptor}.
 */
class OlympusFocusInfoMakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new OlympusFocusInfoMakernoteDescriptor();
    }

    @Test
    void describe_focusDistance_millimetresToMetres() {
        assertThat(describe(TAG_FOCUS_DISTANCE, new Rational(1500, 1))).contains("1.5 m");
    }

    @Test
    void describe_focusDistanceSentinels_areInfinity() {
        assertThat(describe(TAG_FOCUS_DISTANCE, new Rational(0, 1))).contains("inf");
        assertThat(describe(TAG_FOCUS_DISTANCE, new Rational(0xFFFFFFFFL, 1))).contains("inf");
        assertThat(describeAbsent(TAG_FOCUS_DISTANCE)).isEmpty();
    }

    @Test
    void describe_afPoint_isSigned() {
        assertThat(describe(TAG_AF_POINT, 0xFFFE)).contains("-2");
    }

    @Test
    void describe_externalFlash_matchesPairs() {
        assertThat(describe(TAG_EXTERNAL_FLASH, new int[]{1, 0})).contains("On");
        assertThat(describe(TAG_EXTERNAL_FLASH, new int[]{2, 2})).contains("Unknown (2 2)");
        assertThat(describe(TAG_EXTERNAL_FLASH, new int[]{1})).isEmpty();
    }

    @Test
    void describe_externalFlashZoom_acceptsSingleValue() {
        assertThat(describe(TAG_EXTERNAL_FLASH_ZOOM, 1)).contains("On");
        assertThat(describe(TAG_EXTERNAL_FLASH_ZOOM, new int[]{0, 0})).contains("Off");
    }

    @Test
    void describe_manualFlash_strengthFraction() {
        assertThat(describe(TAG_MANUAL_FLASH, new short[]{0, 0})).contains("Off");
        assertThat(describe(TAG_MANUAL_FLASH, new short[]{1, 1})).contains("Full");
        assertThat(describe(TAG_MANUAL_FLASH, new short[]{1, 4})).contains("On (1/4 strength)");
    }

    @Test
    void describe_imageStabilization_modeBitAtOffset43() {
        byte[] off = new byte[44];
        byte[] modeOne = new byte[44];
        modeOne[0] = 1;
        modeOne[43] = 1;
        byte[] modeTwo = new byte[44];
        modeTwo[2] = 1;

        assertThat(describe(TAG_IMAGE_STABILIZATION, off)).contains("Off");
        assertThat(describe(TAG_IMAGE_STABILIZATION, modeOne)).contains("On, Mode 1");
        assertThat(describe(TAG_IMAGE_STABILIZATION, modeTwo)).contains("On, Mode 2");
        assertThat(describe(TAG_IMAGE_STABILIZATION, new byte[43])).isEmpty();
    }

    @Test
    void describe_macroLed_offOn() {
        assertThat(describe(TAG_MACRO_LED, 1)).contains("On");
    }
}
