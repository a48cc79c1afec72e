package com.makernote.cli;

import com.makernote.MakernoteCli;
import com.makernote.core.config.CatalogConfig;
import com.makernote.core.descriptor.MakernoteType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the enabled makernote vendors.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * makernote list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List enabled makernote vendors with their tag counts",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @ParentCommand
    private MakernoteCli parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        CatalogConfig config = parent.loadConfig();
        PrintWriter out = spec.commandLine().getOut();

        List<MakernoteType> enabled = Arrays.stream(MakernoteType.values())
            .filter(type -> config.vendors().isEnabled(type.getId()))
            .toList();
        log.debug("{} of {} vendors enabled", enabled.size(), MakernoteType.values().length);

        if (enabled.isEmpty()) {
            out.println("No vendors enabled.");
            out.flush();
            return 0;
        }

        int idWidth = enabled.stream().mapToInt(type -> type.getId().length()).max().orElse(0);
        int nameWidth = enabled.stream().mapToInt(type -> type.getVendorName().length()).max().orElse(0);

        for (MakernoteType type : enabled) {
            out.printf("  %-" + idWidth + "s  %-" + nameWidth + "s  %3d tags%n",
                type.getId(), type.getVendorName(), type.getCatalog().size());
        }
        out.flush();
        return 0;
    }
}
