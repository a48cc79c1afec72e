package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.olympus.OlympusRawDevelopmentMakernoteTags.TAG_RAW_DEV_COLOR_SPACE;
import static com.makernote.core.descriptor.impl.olympus.OlympusRawDevelopmentMakernoteTags.TAG_RAW_DEV_EDIT_STATUS;
import static com.makernote.core.descriptor.impl.olympus.OlympusRawDevelopmentMakernoteTags.TAG_RAW_DEV_ENGINE;
import static com.makernote.core.descriptor.impl.olympus.OlympusRawDevelopmentMakernoteTags.TAG_RAW_DEV_SETTINGS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OlympusRawDevelopmentMakernoteDescriptor}.
 */
class OlympusRawDevelopmentMakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new OlympusRawDevelopmentMakernoteDescriptor();
    }

    @Test
    void describe_tables_mapCodes() {
        assertThat(describe(TAG_RAW_DEV_COLOR_SPACE, 1)).contains("Adobe RGB");
        assertThat(describe(TAG_RAW_DEV_ENGINE, 3)).contains("Advanced High Function");
        assertThat(describe(TAG_RAW_DEV_ENGINE, 4)).contains("Unknown (4)");
    }

    @Test
    void describe_editStatus_sharedPortraitCodes() {
        assertThat(describe(TAG_RAW_DEV_EDIT_STATUS, 0)).contains("Original");
        assertThat(describe(TAG_RAW_DEV_EDIT_STATUS, 6)).contains("Edited (Portrait)");
        assertThat(describe(TAG_RAW_DEV_EDIT_STATUS, 8)).contains("Edited (Portrait)");
        assertThat(describe(TAG_RAW_DEV_EDIT_STATUS, 7)).contains("Unknown (7)");
    }

    @Test
    void describe_settings_listsFlags() {
        assertThat(describe(TAG_RAW_DEV_SETTINGS, 0)).contains("(none)");
        assertThat(describe(TAG_RAW_DEV_SETTINGS, 0x81)).contains("WB Color Temp, Noise Reduction");
    }
}
