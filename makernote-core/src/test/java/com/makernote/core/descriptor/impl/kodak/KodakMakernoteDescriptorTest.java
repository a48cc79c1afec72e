package com.makernote.core.descriptor.impl.kodak;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.TAG_COLOR_MODE;
import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.TAG_FLASH_MODE;
import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.TAG_FOCUS_MODE;
import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.TAG_KODAK_MODEL;
import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.TAG_QUALITY;
import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.TAG_SHUTTER_MODE;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link KodakMakernoteDescriptor}.
 */
class KodakMakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new KodakMakernoteDescriptor();
    }

    @Test
    void describe_flashMode_acceptsBothEncodings() {
        assertThat(describe(TAG_FLASH_MODE, 0x10)).contains("Fill Flash");
        assertThat(describe(TAG_FLASH_MODE, 0x01)).contains("Fill Flash");
        assertThat(describe(TAG_FLASH_MODE, 0x40)).contains("Red Eye");
        assertThat(describe(TAG_FLASH_MODE, 0x99)).contains("Unknown (153)");
    }

    @Test
    void describe_colorMode_mapsBitCodes() {
        assertThat(describe(TAG_COLOR_MODE, 0x2000)).contains("B&W");
        assertThat(describe(TAG_COLOR_MODE, 0x0200)).contains("Neutral Color");
    }

    @Test
    void describe_focusMode_gapInTableIsUnknown() {
        assertThat(describe(TAG_FOCUS_MODE, 0)).contains("Normal");
        assertThat(describe(TAG_FOCUS_MODE, 1)).contains("Unknown (1)");
        assertThat(describe(TAG_FOCUS_MODE, 2)).contains("Macro");
    }

    @Test
    void describe_qualityAndShutter_mapTables() {
        assertThat(describe(TAG_QUALITY, 1)).contains("Fine");
        assertThat(describe(TAG_SHUTTER_MODE, 32)).contains("Manual");
    }

    @Test
    void describe_model_passesThrough() {
        assertThat(describe(TAG_KODAK_MODEL, "DC4800")).contains("DC4800");
    }
}
