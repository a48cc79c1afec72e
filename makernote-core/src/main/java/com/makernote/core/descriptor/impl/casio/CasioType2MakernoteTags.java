package com.makernote.core.descriptor.impl.casio;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the second Casio makernote layout, introduced with the Exilim range.
 */
public final class CasioType2MakernoteTags {

    public static final int TAG_THUMBNAIL_DIMENSIONS = 0x0002;
    public static final int TAG_THUMBNAIL_SIZE = 0x0003;
    public static final int TAG_THUMBNAIL_OFFSET = 0x0004;
    public static final int TAG_QUALITY_MODE = 0x0008;
    public static final int TAG_IMAGE_SIZE = 0x0009;
    public static final int TAG_FOCUS_MODE_1 = 0x000D;
    public static final int TAG_ISO_SENSITIVITY = 0x0014;
    public static final int TAG_WHITE_BALANCE_1 = 0x0019;
    public static final int TAG_FOCAL_LENGTH = 0x001D;
    public static final int TAG_SATURATION = 0x001F;
    public static final int TAG_CONTRAST = 0x0020;
    public static final int TAG_SHARPNESS = 0x0021;
    public static final int TAG_PRINT_IMAGE_MATCHING_INFO = 0x0E00;
    public static final int TAG_PREVIEW_THUMBNAIL = 0x2000;
    public static final int TAG_WHITE_BALANCE_BIAS = 0x2011;
    public static final int TAG_WHITE_BALANCE_2 = 0x2012;
    public static final int TAG_OBJECT_DISTANCE = 0x2022;
    public static final int TAG_FLASH_DISTANCE = 0x2034;
    public static final int TAG_RECORD_MODE = 0x3000;
    public static final int TAG_SELF_TIMER = 0x3001;
    public static final int TAG_QUALITY = 0x3002;
    public static final int TAG_FOCUS_MODE_2 = 0x3003;
    public static final int TAG_TIME_ZONE = 0x3006;
    public static final int TAG_BESTSHOT_MODE = 0x3007;
    public static final int TAG_CCD_ISO_SENSITIVITY = 0x3014;
    public static final int TAG_COLOUR_MODE = 0x3015;
    public static final int TAG_ENHANCEMENT = 0x3016;
    public static final int TAG_FILTER = 0x3017;

    public static final TagCatalog CATALOG = TagCatalog.builder("Casio Makernote")
        .tag(TAG_THUMBNAIL_DIMENSIONS, "Thumbnail Dimensions")
        .tag(TAG_THUMBNAIL_SIZE, "Thumbnail Size")
        .tag(TAG_THUMBNAIL_OFFSET, "Thumbnail Offset")
        .tag(TAG_QUALITY_MODE, "Quality Mode")
        .tag(TAG_IMAGE_SIZE, "Image Size")
        .tag(TAG_FOCUS_MODE_1, "Focus Mode")
        .tag(TAG_ISO_SENSITIVITY, "ISO Sensitivity")
        .tag(TAG_WHITE_BALANCE_1, "White Balance")
        .tag(TAG_FOCAL_LENGTH, "Focal Length")
        .tag(TAG_SATURATION, "Saturation")
        .tag(TAG_CONTRAST, "Contrast")
        .tag(TAG_SHARPNESS, "Sharpness")
        .tag(TAG_PRINT_IMAGE_MATCHING_INFO, "Print Image Matching (PIM) Info")
        .tag(TAG_PREVIEW_THUMBNAIL, "Casio Preview Thumbnail")
        .tag(TAG_WHITE_BALANCE_BIAS, "White Balance Bias")
        .tag(TAG_WHITE_BALANCE_2, "White Balance")
        .tag(TAG_OBJECT_DISTANCE, "Object Distance")
        .tag(TAG_FLASH_DISTANCE, "Flash Distance")
        .tag(TAG_RECORD_MODE, "Record Mode")
        .tag(TAG_SELF_TIMER, "Self Timer")
        .tag(TAG_QUALITY, "Quality")
        .tag(TAG_FOCUS_MODE_2, "Focus Mode")
        .tag(TAG_TIME_ZONE, "Time Zone")
        .tag(TAG_BESTSHOT_MODE, "BestShot Mode")
        .tag(TAG_CCD_ISO_SENSITIVITY, "CCD ISO Sensitivity")
        .tag(TAG_COLOUR_MODE, "Colour Mode")
        .tag(TAG_ENHANCEMENT, "Enhancement")
        .tag(TAG_FILTER, "Filter")
        .build();

    private CasioType2MakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
