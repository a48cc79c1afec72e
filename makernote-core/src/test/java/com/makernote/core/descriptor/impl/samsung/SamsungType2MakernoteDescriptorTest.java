package com.makernote.core.descriptor.impl.samsung;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.samsung.SamsungType2MakernoteTags.TAG_CAMERA_TEMPERATURE;
import static com.makernote.core.descriptor.impl.samsung.SamsungType2MakernoteTags.TAG_DEVICE_TYPE;
import static com.makernote.core.descriptor.impl.samsung.SamsungType2MakernoteTags.TAG_FACE_DETECT;
import static com.makernote.core.descriptor.impl.samsung.SamsungType2MakernoteTags.TAG_MAKER_NOTE_VERSION;
import static com.makernote.core.descriptor.impl.samsung.SamsungType2MakernoteTags.TAG_SAMSUNG_MODEL_ID;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SamsungType2MakernoteDescriptor}.
 */
class SamsungType2MakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new SamsungType2MakernoteDescriptor();
    }

    @Test
    void describe_version_twoMajorDigits() {
        assertThat(describe(TAG_MAKER_NOTE_VERSION, "0100")).contains("1.00");
    }

    @Test
    void describe_deviceType_namesFamilies() {
        assertThat(describe(TAG_DEVICE_TYPE, 0x2000)).contains("High-end NX Camera");
        assertThat(describe(TAG_DEVICE_TYPE, 0x12000)).contains("Cell Phone");
        assertThat(describe(TAG_DEVICE_TYPE, 0x9999)).contains("Unknown (39321)");
    }

    @Test
    void describe_modelId_looksUpModel() {
        assertThat(describe(TAG_SAMSUNG_MODEL_ID, 0x100101c)).contains("NX10");
        assertThat(describe(TAG_SAMSUNG_MODEL_ID, 7)).contains("Unknown (7)");
    }

    @Test
    void describe_temperatureAndFaceDetect() {
        assertThat(describe(TAG_CAMERA_TEMPERATURE, 35)).contains("35 C");
        assertThat(describe(TAG_FACE_DETECT, 1)).contains("On");
    }
}
