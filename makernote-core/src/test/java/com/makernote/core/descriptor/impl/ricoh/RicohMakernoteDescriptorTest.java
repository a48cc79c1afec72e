package com.makernote.core.descriptor.impl.ricoh;

import com.makernote.core.descriptor.DescriptorTestBase;
import com.makernote.core.descriptor.TagDescriptor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RicohMakernoteDescriptor}.
 */
class RicohMakernoteDescriptorTest extends DescriptorTestBase {

    @Override
    protected TagDescriptor descriptor() {
        return new RicohMakernoteDescriptor();
    }

    @Test
    void describe_anyTag_rendersRawValue() {
        assertThat(describe(RicohMakernoteTags.TAG_VERSION, "0100")).contains("0100");
        assertThat(describeAbsent(RicohMakernoteTags.TAG_VERSION)).isEmpty();
    }

    @Test
    void catalog_namesKnownTags() {
        assertThat(RicohMakernoteTags.CATALOG.nameOf(RicohMakernoteTags.TAG_VERSION)).isPresent();
        assertThat(RicohMakernoteTags.CATALOG.tagName(0x1234)).isEqualTo("Unknown tag (0x1234)");
    }
}
