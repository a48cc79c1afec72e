package com.makernote.core.config;

import com.makernote.core.config.CatalogConfig.OutputConfig;
import com.makernote.core.config.CatalogConfig.OutputFormat;
import com.makernote.core.config.CatalogConfig.VendorsConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CatalogConfig}.
 */
class CatalogConfigTest {

    @Test
    void constructor_nullSections_useDefaults() {
        CatalogConfig config = new CatalogConfig(null, null);

        assertThat(config).isEqualTo(CatalogConfig.defaults());
        assertThat(config.output().format()).isEqualTo(OutputFormat.TEXT);
        assertThat(config.output().includeUnknownTags()).isTrue();
        assertThat(config.output().hexTagIds()).isFalse();
    }

    @Test
    void isEnabled_emptyList_enablesEveryVendor() {
        VendorsConfig vendors = VendorsConfig.all();

        assertThat(vendors.isEnabled("kodak")).isTrue();
        assertThat(vendors.isEnabled("sigma")).isTrue();
    }

    @Test
    void isEnabled_explicitList_enablesOnlyListedVendors() {
        VendorsConfig vendors = new VendorsConfig(List.of("kodak"));

        assertThat(vendors.isEnabled("kodak")).isTrue();
        assertThat(vendors.isEnabled("sigma")).isFalse();
    }

    @Test
    void vendorsConfig_copiesEnabledList() {
        List<String> enabled = new ArrayList<>(List.of("kodak"));
        VendorsConfig vendors = new VendorsConfig(enabled);
        enabled.add("sigma");

        assertThat(vendors.enabled()).containsExactly("kodak");
        assertThatThrownBy(() -> vendors.enabled().add("dji"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void outputConfig_nullFields_useDefaults() {
        OutputConfig output = new OutputConfig(null, null, null);

        assertThat(output).isEqualTo(OutputConfig.defaults());
    }
}
