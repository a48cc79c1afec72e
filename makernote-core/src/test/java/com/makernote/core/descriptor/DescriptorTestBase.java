package com.makernote.core.descriptor;

import com.makernote.core.tag.MapTagValues;

import java.util.Optional;

/**
 * Base class for vendor resolver tests.
 *
 * <p>Provides helpers that build single-tag directories and describe them, so subclasses
 * focus on the vendor's tables and formats.
 *
 * @since 1.0.0
 */
public abstract class DescriptorTestBase {

    /**
     * Returns the resolver under test.
     *
     * @return resolver
     */
    protected abstract TagDescriptor descriptor();

    /**
     * Describes a tag of a directory holding only that tag.
     *
     * @param tagId tag id
     * @param value decoded value
     * @return description, empty when the resolver produces none
     */
    protected Optional<String> describe(int tagId, Object value) {
        return descriptor().describe(tagId, MapTagValues.of(tagId, value));
    }

    /**
     * Describes a tag of an empty directory.
     *
     * @param tagId tag id
     * @return description, expected to be empty
     */
    protected Optional<String> describeAbsent(int tagId) {
        return descriptor().describe(tagId, MapTagValues.empty());
    }
}
