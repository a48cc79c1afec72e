package com.makernote.core.config;

import com.makernote.core.config.CatalogConfig.OutputFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            vendors:
              enabled:
                - kodak
                - olympus-equipment

            output:
              format: json
              includeUnknownTags: false
              hexTagIds: true
            """);

        CatalogConfig config = ConfigLoader.load(configFile);

        assertThat(config.vendors().enabled()).containsExactly("kodak", "olympus-equipment");
        assertThat(config.output().format()).isEqualTo(OutputFormat.JSON);
        assertThat(config.output().includeUnknownTags()).isFalse();
        assertThat(config.output().hexTagIds()).isTrue();
    }

    @Test
    void load_partialYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            output:
              format: yaml
            """);

        CatalogConfig config = ConfigLoader.load(configFile);

        assertThat(config.vendors().enabled()).isEmpty();
        assertThat(config.output().format()).isEqualTo(OutputFormat.YAML);
        assertThat(config.output().includeUnknownTags()).isTrue();
        assertThat(config.output().hexTagIds()).isFalse();
    }

    @Test
    void load_unknownProperties_areIgnored() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            project:
              name: "Photos"
            vendors:
              enabled: [sony-type6]
              preferred: sony-type6
            """);

        CatalogConfig config = ConfigLoader.load(configFile);

        assertThat(config.vendors().enabled()).containsExactly("sony-type6");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        CatalogConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(CatalogConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        CatalogConfig config = ConfigLoader.load(tempDir);

        assertThat(config).isEqualTo(CatalogConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(CatalogConfig.defaults());
    }

    @Test
    void load_malformedYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            vendors:
              enabled: [kodak
            output: {
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(CatalogConfig.defaults());
    }

    @Test
    void load_unsupportedFormat_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            output:
              format: xml
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(CatalogConfig.defaults());
    }
}
