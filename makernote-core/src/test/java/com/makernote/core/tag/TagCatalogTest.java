package com.makernote.core.tag;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TagCatalog}.
 */
class TagCatalogTest {

    private final TagCatalog catalog = TagCatalog.builder("Test Makernote")
        .tag(0x0010, "Image Width")
        .tag(0x0002, "Quality")
        .build();

    @Test
    void nameOf_knownTag_returnsName() {
        assertThat(catalog.nameOf(0x0010)).contains("Image Width");
        assertThat(catalog.tagName(0x0002)).isEqualTo("Quality");
    }

    @Test
    void tagName_unknownTag_rendersHexPlaceholder() {
        assertThat(catalog.nameOf(0x00ab)).isEmpty();
        assertThat(catalog.tagName(0x00ab)).isEqualTo("Unknown tag (0x00ab)");
    }

    @Test
    void tagIds_returnsAscendingOrder() {
        assertThat(catalog.tagIds()).containsExactly(0x0002, 0x0010);
        assertThat(catalog.size()).isEqualTo(2);
        assertThat(catalog.contains(0x0010)).isTrue();
        assertThat(catalog.contains(0x0011)).isFalse();
    }

    @Test
    void asMap_isUnmodifiable() {
        assertThatThrownBy(() -> catalog.asMap().put(1, "x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void builder_duplicateId_throwsIllegalState() {
        TagCatalog.Builder builder = TagCatalog.builder("Broken").tag(1, "First");

        assertThatThrownBy(() -> builder.tag(1, "Second"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("0x0001")
            .hasMessageContaining("Broken");
    }

    @Test
    void builder_blankName_throwsIllegalArgument() {
        assertThatThrownBy(() -> TagCatalog.builder("Broken").tag(1, " "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void vendorName_returnsDirectoryName() {
        assertThat(catalog.vendorName()).isEqualTo("Test Makernote");
        assertThat(catalog).hasToString("Test Makernote (2 tags)");
    }
}
