package com.makernote.core.descriptor.impl.pentax;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PentaxType2MakernoteDescriptor}, which only names tags.
 */
class PentaxType2MakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new PentaxType2MakernoteDescriptor();
    }

    @Test
    void describe_anyTag_rendersRawValue() {
        assertThat(describe(PentaxType2MakernoteTags.TAG_ISO, 200)).contains("200");
        assertThat(describe(PentaxType2MakernoteTags.TAG_ISO_2, new int[]{1, 2})).contains("1 2");
    }

    @Test
    void describe_longArray_summarisesLength() {
        assertThat(describe(0x0200, new int[40])).contains("[40 values]");
    }

    @Test
    void catalog_duplicateIsoNameKeepsDistinctIds() {
        assertThat(PentaxType2MakernoteTags.TAG_ISO).isNotEqualTo(PentaxType2MakernoteTags.TAG_ISO_2);
        assertThat(PentaxType2MakernoteTags.CATALOG.tagName(PentaxType2MakernoteTags.TAG_ISO_2)).isEqualTo("ISO");
    }
}
