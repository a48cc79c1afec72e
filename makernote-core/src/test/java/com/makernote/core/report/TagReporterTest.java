package com.makernote.core.report;

import com.makernote.core.config.CatalogConfig;
import com.makernote.core.config.CatalogConfig.OutputConfig;
import com.makernote.core.config.CatalogConfig.OutputFormat;
import com.makernote.core.config.CatalogConfig.VendorsConfig;
import com.makernote.core.descriptor.MakernoteType;
import com.makernote.core.model.TagEntry;
import com.makernote.core.model.TagReport;
import com.makernote.core.tag.MapTagValues;
import org.junit.jupiter.api.Test;

import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.TAG_FLASH_MODE;
import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.TAG_IMAGE_WIDTH;
import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.TAG_KODAK_MODEL;
import static com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags.TAG_QUALITY;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TagReporter}.
 */
class TagReporterTest {

    private static final int UNKNOWN_TAG = 0x0FFF;

    private final MapTagValues values = MapTagValues.builder()
        .put(TAG_FLASH_MODE, 0x10)
        .put(TAG_KODAK_MODEL, "DC4800")
        .put(UNKNOWN_TAG, 7)
        .put(TAG_QUALITY, 2)
        .build();

    @Test
    void report_describesEveryTagInIdOrder() {
        TagReport report = new TagReporter(CatalogConfig.defaults()).report(MakernoteType.KODAK, values);

        assertThat(report.vendor()).isEqualTo("kodak");
        assertThat(report.vendorName()).isEqualTo(MakernoteType.KODAK.getVendorName());
        assertThat(report.entries()).extracting(TagEntry::tagId)
            .containsExactly(TAG_KODAK_MODEL, TAG_QUALITY, TAG_FLASH_MODE, UNKNOWN_TAG);
        assertThat(report.entries()).extracting(TagEntry::description)
            .containsExactly("DC4800", "Normal", "Fill Flash", "7");
    }

    @Test
    void report_unknownTag_isNamedByHexId() {
        TagReport report = new TagReporter(CatalogConfig.defaults()).report(MakernoteType.KODAK, values);

        assertThat(report.entries().get(3).name()).isEqualTo("Unknown tag (0x0fff)");
    }

    @Test
    void report_unknownTagsExcluded_dropsThem() {
        CatalogConfig config = new CatalogConfig(VendorsConfig.all(),
            new OutputConfig(OutputFormat.TEXT, false, false));

        TagReport report = new TagReporter(config).report(MakernoteType.KODAK, values);

        assertThat(report.entries()).extracting(TagEntry::tagId)
            .containsExactly(TAG_KODAK_MODEL, TAG_QUALITY, TAG_FLASH_MODE);
    }

    @Test
    void report_emptyDirectory_returnsEmptyReport() {
        TagReport report = new TagReporter(CatalogConfig.defaults())
            .report(MakernoteType.SIGMA, MapTagValues.empty());

        assertThat(report.entries()).isEmpty();
    }

    @Test
    void catalog_listsEveryKnownTagWithoutDescriptions() {
        TagReport report = new TagReporter(CatalogConfig.defaults()).catalog(MakernoteType.KODAK);

        assertThat(report.size()).isEqualTo(MakernoteType.KODAK.getCatalog().size());
        assertThat(report.entries()).noneMatch(TagEntry::hasDescription);
        assertThat(report.entries()).extracting(TagEntry::tagId).isSorted();
        assertThat(report.entries()).extracting(TagEntry::name).contains("Kodak Model", "Image Width");
        assertThat(report.entries()).extracting(TagEntry::tagId).contains(TAG_IMAGE_WIDTH);
    }
}
