package com.makernote.core.descriptor;

import com.makernote.core.tag.TagValues;

import java.util.Optional;

/**
 * Converts decoded makernote values into human-readable descriptions.
 *
 * <p>Implementations are stateless and thread-safe. They never throw for a missing value, a
 * value of an unexpected type or an unknown enumerated code: those cases yield an empty
 * result or an {@code Unknown (N)} text, depending on the vendor's convention for the tag.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TagValues values = MapTagValues.of(KodakMakernoteTags.TAG_FLASH_MODE, 0x10);
 * Optional<String> text = new KodakMakernoteDescriptor()
 *     .describe(KodakMakernoteTags.TAG_FLASH_MODE, values);  // "Fill Flash"
 * }</pre>
 *
 * @see com.makernote.core.descriptor.base.AbstractTagDescriptor
 * @since 1.0.0
 */
public interface TagDescriptor {

    /**
     * Describes the value currently held for a tag.
     *
     * @param tagId tag identifier; ids unknown to the vendor fall back to the generic rendering
     * @param values decoded values of the directory
     * @return description, or empty when no value is available
     */
    Optional<String> describe(int tagId, TagValues values);
}
