package com.makernote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the {@code makernote} command line.
 */
class MakernoteCliTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = MakernoteCli.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Paths.get(MakernoteCliTest.class.getResource("/dumps/" + name).toURI());
    }

    private Path config(String yaml) throws IOException {
        Path file = tempDir.resolve("makernote.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    // ==================== list ====================

    @Test
    @DisplayName("list prints every vendor with its tag count")
    void list_defaults_printsAllVendors() {
        int exitCode = run("list");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).hasSize(26);
        assertThat(out.toString())
            .contains("kodak")
            .contains("Kodak Makernote")
            .contains("olympus-raw-development2")
            .contains(" tags");
    }

    @Test
    void list_configuredVendors_printsOnlyThose() throws IOException {
        Path config = config("""
            vendors:
              enabled: [kodak, sigma]
            """);

        int exitCode = run("-c", config.toString(), "list");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).hasSize(2);
        assertThat(out.toString()).contains("kodak").contains("sigma").doesNotContain("olympus");
    }

    // ==================== tags ====================

    @Test
    void tags_kodak_printsCatalog() {
        int exitCode = run("tags", "kodak");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines().findFirst()).contains("Kodak Makernote (kodak)");
        assertThat(out.toString()).contains("Kodak Model").contains("Flash Mode");
    }

    @Test
    void tags_hexAndCaseInsensitiveFormat_overridesConfig() {
        int exitCode = run("tags", "KODAK", "--hex", "--format", "json");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"vendor\" : \"kodak\"").contains("\"0x005c\"");
    }

    @Test
    void tags_unknownVendor_isUsageError() {
        int exitCode = run("tags", "minolta");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Unknown makernote type 'minolta'");
    }

    @Test
    void tags_disabledVendor_fails() throws IOException {
        Path config = config("""
            vendors:
              enabled: [sigma]
            """);

        int exitCode = run("--config", config.toString(), "tags", "kodak");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Vendor is disabled by configuration: kodak");
    }

    // ==================== describe ====================

    @Test
    @DisplayName("describe renders a YAML dump as a text table")
    void describe_yamlDump_printsDescriptions() throws Exception {
        int exitCode = run("describe", "kodak", fixture("kodak.yaml").toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
            "Kodak Makernote (kodak)",
            "  0     Kodak Model           DC4800",
            "  9     Quality               Normal",
            "  12    Image Width           2160",
            "  92    Flash Mode            Fill Flash",
            "  4095  Unknown tag (0x0fff)  7"
        );
    }

    @Test
    void describe_configExcludesUnknownTags_dropsThem() throws Exception {
        Path config = config("""
            output:
              includeUnknownTags: false
            """);

        int exitCode = run("-c", config.toString(), "describe", "kodak", fixture("kodak.yaml").toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).doesNotContain("Unknown tag");
    }

    @Test
    void describe_jsonDump_printsJsonReport() throws Exception {
        int exitCode = run("describe", "olympus-equipment",
            fixture("olympus-equipment.json").toString(), "-f", "json");

        assertThat(exitCode).isZero();
        JsonNode report = new ObjectMapper().readTree(out.toString());
        assertThat(report.get("vendor").asText()).isEqualTo("olympus-equipment");
        assertThat(report.get("tags")).hasSize(5);
        assertThat(report.get("tags").get(1).get("name").asText()).isEqualTo("Camera Type 2");
    }

    @Test
    void describe_missingDump_fails() {
        Path missing = tempDir.resolve("missing.yaml");

        int exitCode = run("describe", "kodak", missing.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Failed to read tag dump").contains("missing.yaml");
    }

    @Test
    void describe_invalidTagId_fails() throws IOException {
        Path dump = tempDir.resolve("bad.yaml");
        Files.writeString(dump, "flash: 16\n");

        int exitCode = run("describe", "kodak", dump.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Invalid tag id 'flash'");
    }

    // ==================== global options ====================

    @Test
    void noSubcommand_printsUsage() {
        int exitCode = run();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: makernote").contains("describe");
    }

    @Test
    void version_printsVersion() {
        int exitCode = run("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("makernote 1.0.0-SNAPSHOT");
    }
}
