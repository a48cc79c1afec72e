package com.makernote.core.model;

import java.util.Objects;

/**
 * One described tag of a makernote directory.
 *
 * @param tagId tag identifier
 * @param name display name, or the {@code Unknown tag (0x....)} rendering
 * @param description human-readable value; {@code null} when no value is available
 */
public record TagEntry(
    int tagId,
    String name,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public TagEntry {
        Objects.requireNonNull(name, "name must not be null");
    }

    public boolean hasDescription() {
        return description != null;
    }
}
