package com.makernote.core.descriptor.impl.pentax;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Pentax makernote used by early Optio and EI models.
 */
public final class PentaxMakernoteTags {

    public static final int TAG_CAPTURE_MODE = 0x0001;
    public static final int TAG_QUALITY_LEVEL = 0x0002;
    public static final int TAG_FOCUS_MODE = 0x0003;
    public static final int TAG_FLASH_MODE = 0x0004;
    public static final int TAG_WHITE_BALANCE = 0x0007;
    public static final int TAG_DIGITAL_ZOOM = 0x000A;
    public static final int TAG_SHARPNESS = 0x000B;
    public static final int TAG_CONTRAST = 0x000C;
    public static final int TAG_SATURATION = 0x000D;
    public static final int TAG_ISO_SPEED = 0x0014;
    public static final int TAG_COLOUR = 0x0017;
    public static final int TAG_PRINT_IMAGE_MATCHING_INFO = 0x0E00;
    public static final int TAG_TIME_ZONE = 0x1000;
    public static final int TAG_DAYLIGHT_SAVINGS = 0x1001;

    public static final TagCatalog CATALOG = TagCatalog.builder("Pentax Makernote")
        .tag(TAG_CAPTURE_MODE, "Capture Mode")
        .tag(TAG_QUALITY_LEVEL, "Quality Level")
        .tag(TAG_FOCUS_MODE, "Focus Mode")
        .tag(TAG_FLASH_MODE, "Flash Mode")
        .tag(TAG_WHITE_BALANCE, "White Balance")
        .tag(TAG_DIGITAL_ZOOM, "Digital Zoom")
        .tag(TAG_SHARPNESS, "Sharpness")
        .tag(TAG_CONTRAST, "Contrast")
        .tag(TAG_SATURATION, "Saturation")
        .tag(TAG_ISO_SPEED, "ISO Speed")
        .tag(TAG_COLOUR, "Colour")
        .tag(TAG_PRINT_IMAGE_MATCHING_INFO, "Print Image Matching (PIM) Info")
        .tag(TAG_TIME_ZONE, "Time Zone")
        .tag(TAG_DAYLIGHT_SAVINGS, "Daylight Savings")
        .build();

    private PentaxMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
