package com.makernote.cli;

import com.makernote.MakernoteCli;
import com.makernote.core.config.CatalogConfig;
import com.makernote.core.descriptor.MakernoteType;
import com.makernote.core.model.TagReport;
import com.makernote.core.report.ReportFormatter;
import com.makernote.core.report.TagReporter;
import com.makernote.core.tag.MapTagValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to describe a decoded tag dump.
 *
 * <p>The dump is a JSON or YAML map of tag id to value, see {@link TagDumpLoader}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * makernote describe kodak kodak-dump.yaml
 * makernote describe olympus-focus-info focus.json --format json --hex
 * }</pre>
 */
@Command(
    name = "describe",
    description = "Describe the tags of a decoded makernote dump (JSON or YAML)",
    mixinStandardHelpOptions = true
)
public class DescribeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DescribeCommand.class);

    @ParentCommand
    private MakernoteCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Vendor id, see 'makernote list'")
    private MakernoteType type;

    @Parameters(index = "1", description = "Tag dump file (.json, .yaml or .yml)")
    private Path dumpFile;

    @Mixin
    private OutputOptions outputOptions;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        CatalogConfig config = parent.loadConfig();
        if (!config.vendors().isEnabled(type.getId())) {
            err.println("✗ Vendor is disabled by configuration: " + type.getId());
            return 1;
        }

        MapTagValues values;
        try {
            values = new TagDumpLoader().load(dumpFile);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to read tag dump: {}", dumpFile, e);
            err.println("✗ Failed to read tag dump " + dumpFile + ": " + e.getMessage());
            return 1;
        }
        log.info("Loaded {} tag values from {}", values.size(), dumpFile);

        TagReport report = new TagReporter(config).report(type, values);
        ReportFormatter formatter = new ReportFormatter(outputOptions.applyTo(config.output()));

        PrintWriter out = spec.commandLine().getOut();
        out.print(formatter.format(report));
        out.flush();
        return 0;
    }
}
