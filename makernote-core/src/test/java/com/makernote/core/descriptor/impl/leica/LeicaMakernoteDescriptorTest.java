package com.makernote.core.descriptor.impl.leica;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import com.makernote.core.lang.Rational;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.leica.LeicaMakernoteTags.TAG_APPROXIMATE_F_NUMBER;
import static com.makernote.core.descriptor.impl.leica.LeicaMakernoteTags.TAG_CAMERA_TEMPERATURE;
import static com.makernote.core.descriptor.impl.leica.LeicaMakernoteTags.TAG_QUALITY;
import static com.makernote.core.descriptor.impl.leica.LeicaMakernoteTags.TAG_USER_PROFILE;
import static com.makernote.core.descriptor.impl.leica.LeicaMakernoteTags.TAG_WHITE_BALANCE;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LeicaMakernoteDescriptor}.
 */
class LeicaMakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new LeicaMakernoteDescriptor();
    }

    @Test
    void describe_tables_mapCodes() {
        assertThat(describe(TAG_QUALITY, 2)).contains("Basic");
        assertThat(describe(TAG_USER_PROFILE, 4)).contains("User Profile 0 (Dynamic)");
        assertThat(describe(TAG_WHITE_BALANCE, 6)).contains("Shadow");
        assertThat(describe(TAG_WHITE_BALANCE, 7)).contains("Unknown (7)");
    }

    @Test
    void describe_rationals_renderSimply() {
        assertThat(describe(TAG_APPROXIMATE_F_NUMBER, new Rational(56, 10))).contains("5.6");
    }

    @Test
    void describe_temperature_appendsCelsius() {
        assertThat(describe(TAG_CAMERA_TEMPERATURE, 31)).contains("31 C");
    }
}
