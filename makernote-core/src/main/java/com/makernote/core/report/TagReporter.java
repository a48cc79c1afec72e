package com.makernote.core.report;

import com.makernote.core.config.CatalogConfig;
import com.makernote.core.descriptor.MakernoteType;
import com.makernote.core.model.TagEntry;
import com.makernote.core.model.TagReport;
import com.makernote.core.tag.MapTagValues;
import com.makernote.core.tag.TagCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds {@link TagReport}s for a makernote directory.
 *
 * <p>Each populated tag is named through the vendor catalog and described through the
 * vendor resolver. Tags the catalog does not list are kept or dropped according to
 * {@code output.includeUnknownTags}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TagReporter reporter = new TagReporter(config);
 * TagReport report = reporter.report(MakernoteType.KODAK, values);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TagReporter {

    private static final Logger log = LoggerFactory.getLogger(TagReporter.class);

    private final boolean includeUnknownTags;

    public TagReporter(CatalogConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.includeUnknownTags = config.output().includeUnknownTags();
    }

    /**
     * Names and describes every populated tag of a directory.
     *
     * @param type vendor layout the values belong to
     * @param values decoded tag values
     * @return report with one entry per reported tag, ascending by id
     */
    public TagReport report(MakernoteType type, MapTagValues values) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(values, "values must not be null");

        TagCatalog catalog = type.getCatalog();
        List<TagEntry> entries = new ArrayList<>();
        int skipped = 0;

        for (int tagId : values.tagIds()) {
            if (!includeUnknownTags && !catalog.contains(tagId)) {
                skipped++;
                continue;
            }
            String description = type.describe(tagId, values).orElse(null);
            entries.add(new TagEntry(tagId, catalog.tagName(tagId), description));
        }

        log.debug("Described {} tags for {} ({} unknown skipped)", entries.size(), type.getId(), skipped);
        return new TagReport(type.getId(), type.getVendorName(), entries);
    }

    /**
     * Lists the tags a vendor catalog knows, without descriptions.
     *
     * @param type vendor layout
     * @return report with one entry per catalog tag, ascending by id
     */
    public TagReport catalog(MakernoteType type) {
        Objects.requireNonNull(type, "type must not be null");

        TagCatalog catalog = type.getCatalog();
        List<TagEntry> entries = catalog.tagIds().stream()
            .map(tagId -> new TagEntry(tagId, catalog.tagName(tagId), null))
            .toList();
        return new TagReport(type.getId(), type.getVendorName(), entries);
    }
}
