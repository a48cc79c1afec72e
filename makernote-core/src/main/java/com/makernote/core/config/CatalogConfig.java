package com.makernote.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration of the makernote tools.
 *
 * <p>Loaded from {@code makernote.yaml}. Selects the vendors to expose and how reports are
 * printed. Missing sections take their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * vendors:
 *   enabled:
 *     - kodak
 *     - olympus-equipment
 *
 * output:
 *   format: json
 *   includeUnknownTags: false
 *   hexTagIds: true
 * }</pre>
 *
 * @param vendors vendor selection
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogConfig(
    @JsonProperty("vendors") VendorsConfig vendors,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling absent sections with defaults.
     */
    public CatalogConfig {
        if (vendors == null) {
            vendors = VendorsConfig.all();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration: every vendor enabled, text output, unknown tags
     * included, decimal tag ids.
     *
     * @return default configuration
     */
    public static CatalogConfig defaults() {
        return new CatalogConfig(VendorsConfig.all(), OutputConfig.defaults());
    }

    /**
     * Vendor selection.
     *
     * @param enabled vendor ids to expose; empty means all
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VendorsConfig(
        @JsonProperty("enabled") List<String> enabled
    ) {
        public VendorsConfig {
            enabled = enabled == null ? List.of() : List.copyOf(enabled);
        }

        public static VendorsConfig all() {
            return new VendorsConfig(List.of());
        }

        /**
         * Checks if a vendor is enabled.
         *
         * @param vendorId vendor id to check
         * @return true if the list is empty or names the vendor
         */
        public boolean isEnabled(String vendorId) {
            return enabled.isEmpty() || enabled.contains(vendorId);
        }
    }

    /**
     * Report output format.
     */
    public enum OutputFormat {
        /** Aligned plain text table */
        @JsonProperty("text")
        TEXT,

        /** JSON document */
        @JsonProperty("json")
        JSON,

        /** YAML document */
        @JsonProperty("yaml")
        YAML
    }

    /**
     * Output configuration.
     *
     * @param format report format
     * @param includeUnknownTags whether tags absent from the vendor catalog are reported
     * @param hexTagIds whether tag ids print as {@code 0x%04x}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") OutputFormat format,
        @JsonProperty("includeUnknownTags") Boolean includeUnknownTags,
        @JsonProperty("hexTagIds") Boolean hexTagIds
    ) {
        public OutputConfig {
            if (format == null) {
                format = OutputFormat.TEXT;
            }
            if (includeUnknownTags == null) {
                includeUnknownTags = Boolean.TRUE;
            }
            if (hexTagIds == null) {
                hexTagIds = Boolean.FALSE;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(OutputFormat.TEXT, true, false);
        }
    }
}
