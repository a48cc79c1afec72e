package com.makernote.core.descriptor.impl.casio;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the first Casio makernote layout, used by QV-series cameras.
 */
public final class CasioType1MakernoteTags {

    public static final int TAG_RECORDING_MODE = 0x0001;
    public static final int TAG_QUALITY = 0x0002;
    public static final int TAG_FOCUSING_MODE = 0x0003;
    public static final int TAG_FLASH_MODE = 0x0004;
    public static final int TAG_FLASH_INTENSITY = 0x0005;
    public static final int TAG_OBJECT_DISTANCE = 0x0006;
    public static final int TAG_WHITE_BALANCE = 0x0007;
    public static final int TAG_UNKNOWN_1 = 0x0008;
    public static final int TAG_UNKNOWN_2 = 0x0009;
    public static final int TAG_DIGITAL_ZOOM = 0x000A;
    public static final int TAG_SHARPNESS = 0x000B;
    public static final int TAG_CONTRAST = 0x000C;
    public static final int TAG_SATURATION = 0x000D;
    public static final int TAG_UNKNOWN_3 = 0x000E;
    public static final int TAG_UNKNOWN_4 = 0x000F;
    public static final int TAG_UNKNOWN_5 = 0x0010;
    public static final int TAG_UNKNOWN_6 = 0x0011;
    public static final int TAG_UNKNOWN_7 = 0x0012;
    public static final int TAG_UNKNOWN_8 = 0x0013;
    public static final int TAG_CCD_SENSITIVITY = 0x0014;

    public static final TagCatalog CATALOG = TagCatalog.builder("Casio Makernote")
        .tag(TAG_RECORDING_MODE, "Recording Mode")
        .tag(TAG_QUALITY, "Quality")
        .tag(TAG_FOCUSING_MODE, "Focusing Mode")
        .tag(TAG_FLASH_MODE, "Flash Mode")
        .tag(TAG_FLASH_INTENSITY, "Flash Intensity")
        .tag(TAG_OBJECT_DISTANCE, "Object Distance")
        .tag(TAG_WHITE_BALANCE, "White Balance")
        .tag(TAG_UNKNOWN_1, "Makernote Unknown 1")
        .tag(TAG_UNKNOWN_2, "Makernote Unknown 2")
        .tag(TAG_DIGITAL_ZOOM, "Digital Zoom")
        .tag(TAG_SHARPNESS, "Sharpness")
        .tag(TAG_CONTRAST, "Contrast")
        .tag(TAG_SATURATION, "Saturation")
        .tag(TAG_UNKNOWN_3, "Makernote Unknown 3")
        .tag(TAG_UNKNOWN_4, "Makernote Unknown 4")
        .tag(TAG_UNKNOWN_5, "Makernote Unknown 5")
        .tag(TAG_UNKNOWN_6, "Makernote Unknown 6")
        .tag(TAG_UNKNOWN_7, "Makernote Unknown 7")
        .tag(TAG_UNKNOWN_8, "Makernote Unknown 8")
        .tag(TAG_CCD_SENSITIVITY, "CCD Sensitivity")
        .build();

    private CasioType1MakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
