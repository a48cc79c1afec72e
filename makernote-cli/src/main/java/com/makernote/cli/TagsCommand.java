package com.makernote.cli;

import com.makernote.MakernoteCli;
import com.makernote.core.config.CatalogConfig;
import com.makernote.core.descriptor.MakernoteType;
import com.makernote.core.report.ReportFormatter;
import com.makernote.core.report.TagReporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Command to print the tag catalog of one vendor.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * makernote tags kodak
 * makernote tags olympus-equipment --hex --format yaml
 * }</pre>
 */
@Command(
    name = "tags",
    description = "Print the tag catalog of a vendor",
    mixinStandardHelpOptions = true
)
public class TagsCommand implements Callable<Integer> {

    @ParentCommand
    private MakernoteCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Vendor id, see 'makernote list'")
    private MakernoteType type;

    @Mixin
    private OutputOptions outputOptions;

    @Override
    public Integer call() {
        CatalogConfig config = parent.loadConfig();
        if (!config.vendors().isEnabled(type.getId())) {
            spec.commandLine().getErr().println("✗ Vendor is disabled by configuration: " + type.getId());
            return 1;
        }

        ReportFormatter formatter = new ReportFormatter(outputOptions.applyTo(config.output()));
        spec.commandLine().getOut().print(formatter.format(new TagReporter(config).catalog(type)));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
