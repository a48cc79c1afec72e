package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags.TAG_BODY_FIRMWARE_VERSION;
import static com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags.TAG_CAMERA_TYPE_2;
import static com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags.TAG_EQUIPMENT_VERSION;
import static com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags.TAG_EXTENDER;
import static com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags.TAG_FLASH_TYPE;
import static com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags.TAG_FOCAL_PLANE_DIAGONAL;
import static com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags.TAG_LENS_PROPERTIES;
import static com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags.TAG_LENS_TYPE;
import static com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags.TAG_MAX_APERTURE;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OlympusEquipmentMakernoteDescriptor}.
 */
class OlympusEquipmentMakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new OlympusEquipmentMakernoteDescriptor();
    }

    @Test
    void describe_version_asciiDigitsWithoutLeadingZero() {
        assertThat(describe(TAG_EQUIPMENT_VERSION, new byte[]{'0', '1', '0', '0'})).contains("100");
    }

    @Test
    void describe_cameraType_resolvesModelOrKeepsCode() {
        assertThat(describe(TAG_CAMERA_TYPE_2, "S0003")).contains("E-330");
        assertThat(describe(TAG_CAMERA_TYPE_2, "ZZ999")).contains("ZZ999");
    }

    @Test
    void describe_lensType_looksUpMakeAndModelBytes() {
        // Given: make 0, model 1, sub-model 0x10
        int[] lens = {0, 0, 1, 0x10, 0, 0};

        // When / Then
        assertThat(describe(TAG_LENS_TYPE, lens)).contains("Olympus M.Zuiko Digital ED 14-42mm F3.5-5.6");
    }

    @Test
    void describe_lensTypeUnlistedOrShort_returnsEmpty() {
        assertThat(describe(TAG_LENS_TYPE, new int[]{9, 0, 9, 9, 0, 0})).isEmpty();
        assertThat(describe(TAG_LENS_TYPE, new int[]{0, 0, 1})).isEmpty();
    }

    @Test
    void describe_extender_looksUpMakeAndModel() {
        assertThat(describe(TAG_EXTENDER, new int[]{0, 0, 4, 0, 0, 0}))
            .contains("Olympus Zuiko Digital EC-14 1.4x Teleconverter");
    }

    @Test
    void describe_firmwareVersion_splitsHexWord() {
        assertThat(describe(TAG_BODY_FIRMWARE_VERSION, 0x1234)).contains("1.234");
        assertThat(describe(TAG_BODY_FIRMWARE_VERSION, 0x0100)).contains("0.100");
    }

    @Test
    void describe_maxAperture_isPowerOfRootTwo() {
        assertThat(describe(TAG_MAX_APERTURE, 256)).contains("1.4");
        assertThat(describe(TAG_MAX_APERTURE, 768)).contains("2.8");
    }

    @Test
    void describe_miscFormats() {
        assertThat(describe(TAG_FOCAL_PLANE_DIAGONAL, "21.6")).contains("21.6 mm");
        assertThat(describe(TAG_LENS_PROPERTIES, 0x4a1)).contains("0x04A1");
        assertThat(describe(TAG_FLASH_TYPE, 1)).contains("Unknown (1)");
        assertThat(describe(TAG_FLASH_TYPE, 3)).contains("E-System");
    }
}
