package com.makernote.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Described tags of one makernote directory, in ascending tag id order.
 *
 * @param vendor vendor id, for example {@code "kodak"}
 * @param vendorName directory display name, for example {@code "Kodak Makernote"}
 * @param entries described tags
 */
public record TagReport(
    String vendor,
    String vendorName,
    List<TagEntry> entries
) {
    /**
     * Compact constructor with validation.
     */
    public TagReport {
        Objects.requireNonNull(vendor, "vendor must not be null");
        Objects.requireNonNull(vendorName, "vendorName must not be null");
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
