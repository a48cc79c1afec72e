package com.makernote.core.descriptor.impl.ricoh;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Ricoh makernote.
 */
public final class RicohMakernoteTags {

    public static final int TAG_MAKERNOTE_DATA_TYPE = 0x0001;
    public static final int TAG_VERSION = 0x0002;
    public static final int TAG_PRINT_IMAGE_MATCHING_INFO = 0x0E00;
    public static final int TAG_RICOH_CAMERA_INFO_MAKERNOTE_SUB_IFD_POINTER = 0x2001;

    public static final TagCatalog CATALOG = TagCatalog.builder("Ricoh Makernote")
        .tag(TAG_MAKERNOTE_DATA_TYPE, "Makernote Data Type")
        .tag(TAG_VERSION, "Version")
        .tag(TAG_PRINT_IMAGE_MATCHING_INFO, "Print Image Matching (PIM) Info")
        .tag(TAG_RICOH_CAMERA_INFO_MAKERNOTE_SUB_IFD_POINTER, "Ricoh Camera Info Makernote Sub-IFD")
        .build();

    private RicohMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
