package com.makernote.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.makernote.core.config.CatalogConfig.OutputConfig;
import com.makernote.core.config.CatalogConfig.OutputFormat;
import com.makernote.core.model.TagEntry;
import com.makernote.core.model.TagReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link TagReport} as text, JSON or YAML.
 *
 * <p>Text output is an aligned table headed by the directory name:
 * <pre>
 * Kodak Makernote (kodak)
 *   0x0009  Kodak Model   DC4800
 *   0x0010  Image Width   2160
 * </pre>
 *
 * <p>JSON and YAML share one document shape: {@code vendor}, {@code vendorName} and a
 * {@code tags} list of {@code id}, {@code name}, {@code description}. Ids are numbers unless
 * {@code output.hexTagIds} is set, in which case they are {@code 0x%04x} strings.
 */
public final class ReportFormatter {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    private final OutputFormat format;
    private final boolean hexTagIds;

    public ReportFormatter(OutputConfig output) {
        Objects.requireNonNull(output, "output must not be null");
        this.format = output.format();
        this.hexTagIds = output.hexTagIds();
    }

    public OutputFormat format() {
        return format;
    }

    /**
     * Renders a report in the configured format.
     *
     * @param report report to render
     * @return rendered text ending with a line separator
     */
    public String format(TagReport report) {
        Objects.requireNonNull(report, "report must not be null");
        return switch (format) {
            case TEXT -> formatText(report);
            case JSON -> write(JSON_MAPPER, report) + System.lineSeparator();
            case YAML -> write(YAML_MAPPER, report);
        };
    }

    /**
     * Renders a tag id the configured way.
     *
     * @param tagId tag id
     * @return decimal or {@code 0x%04x} text
     */
    public String formatTagId(int tagId) {
        return hexTagIds ? String.format("0x%04x", tagId) : Integer.toString(tagId);
    }

    // ==================== Text ====================

    private String formatText(TagReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(report.vendorName()).append(" (").append(report.vendor()).append(')')
            .append(System.lineSeparator());

        if (report.entries().isEmpty()) {
            sb.append("  (no tags)").append(System.lineSeparator());
            return sb.toString();
        }

        int idWidth = 0;
        int nameWidth = 0;
        for (TagEntry entry : report.entries()) {
            idWidth = Math.max(idWidth, formatTagId(entry.tagId()).length());
            nameWidth = Math.max(nameWidth, entry.name().length());
        }

        for (TagEntry entry : report.entries()) {
            String line = String.format("  %-" + idWidth + "s  %-" + nameWidth + "s  %s",
                formatTagId(entry.tagId()),
                entry.name(),
                entry.hasDescription() ? entry.description() : "");
            sb.append(line.stripTrailing()).append(System.lineSeparator());
        }
        return sb.toString();
    }

    // ==================== JSON / YAML ====================

    private String write(ObjectMapper mapper, TagReport report) {
        try {
            return mapper.writeValueAsString(toDocument(report));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report for " + report.vendor(), e);
        }
    }

    private Map<String, Object> toDocument(TagReport report) {
        List<Map<String, Object>> tags = new ArrayList<>();
        for (TagEntry entry : report.entries()) {
            Map<String, Object> tag = new LinkedHashMap<>();
            tag.put("id", hexTagIds ? formatTagId(entry.tagId()) : entry.tagId());
            tag.put("name", entry.name());
            tag.put("description", entry.description());
            tags.add(tag);
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("vendor", report.vendor());
        document.put("vendorName", report.vendorName());
        document.put("tags", tags);
        return document;
    }
}
