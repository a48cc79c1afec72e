package com.makernote.core.descriptor;

import com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags;
import com.makernote.core.tag.MapTagValues;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MakernoteType}.
 */
class MakernoteTypeTest {

    @Test
    void values_coverAllSupportedLayouts() {
        assertThat(MakernoteType.values()).hasSize(26);
    }

    @Test
    void ids_areUniqueKebabCase() {
        Set<String> ids = Arrays.stream(MakernoteType.values())
            .map(MakernoteType::getId)
            .collect(Collectors.toSet());

        assertThat(ids).hasSize(MakernoteType.values().length);
        assertThat(ids).allMatch(id -> id.matches("[a-z0-9]+(-[a-z0-9]+)*"));
    }

    @ParameterizedTest
    @EnumSource(MakernoteType.class)
    void findById_ownId_returnsType(MakernoteType type) {
        assertThat(MakernoteType.findById(type.getId())).contains(type);
    }

    @Test
    void findById_ignoresCaseAndWhitespace() {
        assertThat(MakernoteType.findById("  Olympus-Equipment ")).contains(MakernoteType.OLYMPUS_EQUIPMENT);
        assertThat(MakernoteType.findById(null)).isEmpty();
        assertThat(MakernoteType.findById("minolta")).isEmpty();
    }

    @Test
    void fromId_unknownId_listsKnownTypes() {
        assertThatThrownBy(() -> MakernoteType.fromId("minolta"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown makernote type 'minolta'")
            .hasMessageContaining("kodak")
            .hasMessageContaining("sony-type6");
    }

    @ParameterizedTest
    @EnumSource(MakernoteType.class)
    void catalog_hasVendorNameAndTags(MakernoteType type) {
        assertThat(type.getVendorName()).isNotBlank();
        assertThat(type.getCatalog().size()).isPositive();
    }

    @Test
    void nameOfAndDescribe_delegateToCatalogAndDescriptor() {
        MakernoteType type = MakernoteType.KODAK;

        assertThat(type.nameOf(KodakMakernoteTags.TAG_FLASH_MODE)).contains("Flash Mode");
        assertThat(type.nameOf(0xFFFF)).isEmpty();
        assertThat(type.describe(KodakMakernoteTags.TAG_FLASH_MODE,
            MapTagValues.of(KodakMakernoteTags.TAG_FLASH_MODE, 0x10))).contains("Fill Flash");
    }

    @ParameterizedTest
    @EnumSource(MakernoteType.class)
    void describe_unknownTag_fallsBackToRawValue(MakernoteType type) {
        int tagId = 0x7FFF_0001;

        assertThat(type.describe(tagId, MapTagValues.of(tagId, "raw"))).contains("raw");
        assertThat(type.describe(tagId, MapTagValues.empty())).isEmpty();
    }
}
