package com.makernote.cli;

import com.makernote.core.config.CatalogConfig.OutputConfig;
import com.makernote.core.config.CatalogConfig.OutputFormat;
import picocli.CommandLine.Option;

/**
 * Output options shared by the commands that print reports. Options given on the command
 * line override the {@code output} section of the configuration file.
 */
public class OutputOptions {

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES} (overrides config)")
    private OutputFormat format;

    @Option(names = "--hex", description = "Print tag ids as hexadecimal (overrides config)")
    private Boolean hexTagIds;

    /**
     * Merges these options over a configured output section.
     *
     * @param configured output section from the configuration file
     * @return effective output settings
     */
    public OutputConfig applyTo(OutputConfig configured) {
        return new OutputConfig(
            format != null ? format : configured.format(),
            configured.includeUnknownTags(),
            hexTagIds != null ? hexTagIds : configured.hexTagIds()
        );
    }
}
