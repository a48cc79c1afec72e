package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Olympus Raw Development sub-IFD (makernote tag {@code 0x2030}).
 */
public final class OlympusRawDevelopmentMakernoteTags {

    public static final int TAG_RAW_DEV_VERSION = 0x0000;
    public static final int TAG_RAW_DEV_EXPOSURE_BIAS_VALUE = 0x0100;
    public static final int TAG_RAW_DEV_WHITE_BALANCE_VALUE = 0x0101;
    public static final int TAG_RAW_DEV_WB_FINE_ADJUSTMENT = 0x0102;
    public static final int TAG_RAW_DEV_GRAY_POINT = 0x0103;
    public static final int TAG_RAW_DEV_SATURATION_EMPHASIS = 0x0104;
    public static final int TAG_RAW_DEV_MEMORY_COLOR_EMPHASIS = 0x0105;
    public static final int TAG_RAW_DEV_CONTRAST_VALUE = 0x0106;
    public static final int TAG_RAW_DEV_SHARPNESS_VALUE = 0x0107;
    public static final int TAG_RAW_DEV_COLOR_SPACE = 0x0108;
    public static final int TAG_RAW_DEV_ENGINE = 0x0109;
    public static final int TAG_RAW_DEV_NOISE_REDUCTION = 0x010A;
    public static final int TAG_RAW_DEV_EDIT_STATUS = 0x010B;
    public static final int TAG_RAW_DEV_SETTINGS = 0x010C;

    public static final TagCatalog CATALOG = TagCatalog.builder("Olympus Raw Development")
        .tag(TAG_RAW_DEV_VERSION, "Raw Dev Version")
        .tag(TAG_RAW_DEV_EXPOSURE_BIAS_VALUE, "Raw Dev Exposure Bias Value")
        .tag(TAG_RAW_DEV_WHITE_BALANCE_VALUE, "Raw Dev White Balance Value")
        .tag(TAG_RAW_DEV_WB_FINE_ADJUSTMENT, "Raw Dev WB Fine Adjustment")
        .tag(TAG_RAW_DEV_GRAY_POINT, "Raw Dev Gray Point")
        .tag(TAG_RAW_DEV_SATURATION_EMPHASIS, "Raw Dev Saturation Emphasis")
        .tag(TAG_RAW_DEV_MEMORY_COLOR_EMPHASIS, "Raw Dev Memory Color Emphasis")
        .tag(TAG_RAW_DEV_CONTRAST_VALUE, "Raw Dev Contrast Value")
        .tag(TAG_RAW_DEV_SHARPNESS_VALUE, "Raw Dev Sharpness Value")
        .tag(TAG_RAW_DEV_COLOR_SPACE, "Raw Dev Color Space")
        .tag(TAG_RAW_DEV_ENGINE, "Raw Dev Engine")
        .tag(TAG_RAW_DEV_NOISE_REDUCTION, "Raw Dev Noise Reduction")
        .tag(TAG_RAW_DEV_EDIT_STATUS, "Raw Dev Edit Status")
        .tag(TAG_RAW_DEV_SETTINGS, "Raw Dev Settings")
        .build();

    private OlympusRawDevelopmentMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
