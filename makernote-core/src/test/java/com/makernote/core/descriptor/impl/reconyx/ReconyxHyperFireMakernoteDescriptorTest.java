package com.makernote.core.descriptor.impl.reconyx;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFireMakernoteTags.TAG_AMBIENT_TEMPERATURE;
import static com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFireMakernoteTags.TAG_BATTERY_VOLTAGE;
import static com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFireMakernoteTags.TAG_DATE_TIME_ORIGINAL;
import static com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFireMakernoteTags.TAG_EVENT_NUMBER;
import static com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFireMakernoteTags.TAG_MAKERNOTE_VERSION;
import static com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFireMakernoteTags.TAG_MOON_PHASE;
import static com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFireMakernoteTags.TAG_SEQUENCE;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReconyxHyperFireMakernoteDescriptor}.
 */
class ReconyxHyperFireMakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new ReconyxHyperFireMakernoteDescriptor();
    }

    @Test
    void describe_sequence_indexOverCount() {
        assertThat(describe(TAG_SEQUENCE, new int[]{1, 3})).contains("1/3");
    }

    @Test
    void describe_shortSequence_rendersRawValues() {
        assertThat(describe(TAG_SEQUENCE, new int[]{1})).contains("1");
        assertThat(describeAbsent(TAG_SEQUENCE)).isEmpty();
    }

    @Test
    void describe_unsignedValues_maskSignExtension() {
        assertThat(describe(TAG_MAKERNOTE_VERSION, -1)).contains("65535");
        assertThat(describe(TAG_EVENT_NUMBER, -1)).contains("4294967295");
    }

    @Test
    void describe_voltageAndTemperature() {
        assertThat(describe(TAG_BATTERY_VOLTAGE, 8.5)).contains("8.500");
        assertThat(describe(TAG_AMBIENT_TEMPERATURE, 0xFFFB)).contains("-5");
    }

    @Test
    void describe_moonPhaseAndDate() {
        assertThat(describe(TAG_MOON_PHASE, 4)).contains("Full");
        assertThat(describe(TAG_DATE_TIME_ORIGINAL, LocalDateTime.of(2021, 6, 1, 22, 15, 0)))
            .contains("2021:06:01 22:15:00");
    }
}
