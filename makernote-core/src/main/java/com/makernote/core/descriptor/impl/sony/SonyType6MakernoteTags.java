package com.makernote.core.descriptor.impl.sony;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Sony Type 6 makernote.
 */
public final class SonyType6MakernoteTags {

    public static final int TAG_MAKERNOTE_THUMB_OFFSET = 0x0513;
    public static final int TAG_MAKERNOTE_THUMB_LENGTH = 0x0514;
    public static final int TAG_UNKNOWN_1 = 0x0515;
    public static final int TAG_MAKERNOTE_THUMB_VERSION = 0x2000;

    public static final TagCatalog CATALOG = TagCatalog.builder("Sony Makernote")
        .tag(TAG_MAKERNOTE_THUMB_OFFSET, "Makernote Thumb Offset")
        .tag(TAG_MAKERNOTE_THUMB_LENGTH, "Makernote Thumb Length")
        .tag(TAG_UNKNOWN_1, "Sony-6-0x0203")
        .tag(TAG_MAKERNOTE_THUMB_VERSION, "Makernote Thumb Version")
        .build();

    private SonyType6MakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
