package com.makernote.core.descriptor.impl.nikon;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the first Nikon makernote layout, used by the E-series Coolpix cameras
 * (E700, E800, E900, E900S, E910, E950).
 */
public final class NikonType1MakernoteTags {

    public static final int TAG_UNKNOWN_1 = 0x0002;
    public static final int TAG_QUALITY = 0x0003;
    public static final int TAG_COLOR_MODE = 0x0004;
    public static final int TAG_IMAGE_ADJUSTMENT = 0x0005;
    public static final int TAG_CCD_SENSITIVITY = 0x0006;
    public static final int TAG_WHITE_BALANCE = 0x0007;
    public static final int TAG_FOCUS = 0x0008;
    public static final int TAG_UNKNOWN_2 = 0x0009;
    public static final int TAG_DIGITAL_ZOOM = 0x000A;
    public static final int TAG_CONVERTER = 0x000B;
    public static final int TAG_UNKNOWN_3 = 0x0F00;

    public static final TagCatalog CATALOG = TagCatalog.builder("Nikon Makernote")
        .tag(TAG_UNKNOWN_1, "Makernote Unknown 1")
        .tag(TAG_QUALITY, "Quality")
        .tag(TAG_COLOR_MODE, "Color Mode")
        .tag(TAG_IMAGE_ADJUSTMENT, "Image Adjustment")
        .tag(TAG_CCD_SENSITIVITY, "CCD Sensitivity")
        .tag(TAG_WHITE_BALANCE, "White Balance")
        .tag(TAG_FOCUS, "Focus")
        .tag(TAG_UNKNOWN_2, "Makernote Unknown 2")
        .tag(TAG_DIGITAL_ZOOM, "Digital Zoom")
        .tag(TAG_CONVERTER, "Fisheye Converter")
        .tag(TAG_UNKNOWN_3, "Makernote Unknown 3")
        .build();

    private NikonType1MakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
