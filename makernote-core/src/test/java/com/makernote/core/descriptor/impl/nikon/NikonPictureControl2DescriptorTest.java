package com.makernote.core.descriptor.impl.nikon;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.nikon.NikonPictureControl2Tags.TAG_FILTER_EFFECT;
import static com.makernote.core.descriptor.impl.nikon.NikonPictureControl2Tags.TAG_PICTURE_CONTROL_ADJUST;
import static com.makernote.core.descriptor.impl.nikon.NikonPictureControl2Tags.TAG_PICTURE_CONTROL_NAME;
import static com.makernote.core.descriptor.impl.nikon.NikonPictureControl2Tags.TAG_SHARPNESS;
import static com.makernote.core.descriptor.impl.nikon.NikonPictureControl2Tags.TAG_TONING_EFFECT;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NikonPictureControl2Descriptor}.
 */
class NikonPictureControl2DescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new NikonPictureControl2Descriptor();
    }

    @Test
    void describe_adjustment_offsetFromNeutral() {
        assertThat(describe(TAG_SHARPNESS, 0x80)).contains("Normal");
        assertThat(describe(TAG_SHARPNESS, 0x83)).contains("+3");
        assertThat(describe(TAG_SHARPNESS, 0x7e)).contains("-2");
        assertThat(describe(TAG_SHARPNESS, 0xff)).contains("n/a");
    }

    @Test
    void describe_effects_mapTables() {
        assertThat(describe(TAG_FILTER_EFFECT, 0x83)).contains("Red");
        assertThat(describe(TAG_FILTER_EFFECT, 0x90)).contains("Unknown (144)");
        assertThat(describe(TAG_TONING_EFFECT, 0x82)).contains("Cyanotype");
    }

    @Test
    void describe_name_trimsPadding() {
        assertThat(describe(TAG_PICTURE_CONTROL_NAME, "STANDARD   ")).contains("STANDARD");
        assertThat(describe(TAG_PICTURE_CONTROL_NAME, "")).isEmpty();
        assertThat(describe(TAG_PICTURE_CONTROL_ADJUST, 1)).contains("Quick Adjust");
    }
}
