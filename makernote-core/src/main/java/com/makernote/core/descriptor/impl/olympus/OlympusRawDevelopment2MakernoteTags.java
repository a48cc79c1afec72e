package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Olympus Raw Development 2 sub-IFD (makernote tag {@code 0x2031}).
 */
public final class OlympusRawDevelopment2MakernoteTags {

    public static final int TAG_RAW_DEV_VERSION = 0x0000;
    public static final int TAG_RAW_DEV_EXPOSURE_BIAS_VALUE = 0x0100;
    public static final int TAG_RAW_DEV_WHITE_BALANCE = 0x0101;
    public static final int TAG_RAW_DEV_WHITE_BALANCE_VALUE = 0x0102;
    public static final int TAG_RAW_DEV_WB_FINE_ADJUSTMENT = 0x0103;
    public static final int TAG_RAW_DEV_GRAY_POINT = 0x0104;
    public static final int TAG_RAW_DEV_CONTRAST_VALUE = 0x0105;
    public static final int TAG_RAW_DEV_SHARPNESS_VALUE = 0x0106;
    public static final int TAG_RAW_DEV_SATURATION_EMPHASIS = 0x0107;
    public static final int TAG_RAW_DEV_MEMORY_COLOR_EMPHASIS = 0x0108;
    public static final int TAG_RAW_DEV_COLOR_SPACE = 0x0109;
    public static final int TAG_RAW_DEV_NOISE_REDUCTION = 0x010A;
    public static final int TAG_RAW_DEV_ENGINE = 0x010B;
    public static final int TAG_RAW_DEV_PICTURE_MODE = 0x010C;
    public static final int TAG_RAW_DEV_PM_SATURATION = 0x010D;
    public static final int TAG_RAW_DEV_PM_CONTRAST = 0x010E;
    public static final int TAG_RAW_DEV_PM_SHARPNESS = 0x010F;
    public static final int TAG_RAW_DEV_PM_BW_FILTER = 0x0110;
    public static final int TAG_RAW_DEV_PM_PICTURE_TONE = 0x0111;
    public static final int TAG_RAW_DEV_GRADATION = 0x0112;
    public static final int TAG_RAW_DEV_SATURATION_3 = 0x0113;
    public static final int TAG_RAW_DEV_AUTO_GRADATION = 0x0119;
    public static final int TAG_RAW_DEV_PM_NOISE_FILTER = 0x0120;
    public static final int TAG_RAW_DEV_ART_FILTER = 0x0121;

    public static final TagCatalog CATALOG = TagCatalog.builder("Olympus Raw Development 2")
        .tag(TAG_RAW_DEV_VERSION, "Raw Dev Version")
        .tag(TAG_RAW_DEV_EXPOSURE_BIAS_VALUE, "Raw Dev Exposure Bias Value")
        .tag(TAG_RAW_DEV_WHITE_BALANCE, "Raw Dev White Balance")
        .tag(TAG_RAW_DEV_WHITE_BALANCE_VALUE, "Raw Dev White Balance Value")
        .tag(TAG_RAW_DEV_WB_FINE_ADJUSTMENT, "Raw Dev WB Fine Adjustment")
        .tag(TAG_RAW_DEV_GRAY_POINT, "Raw Dev Gray Point")
        .tag(TAG_RAW_DEV_CONTRAST_VALUE, "Raw Dev Contrast Value")
        .tag(TAG_RAW_DEV_SHARPNESS_VALUE, "Raw Dev Sharpness Value")
        .tag(TAG_RAW_DEV_SATURATION_EMPHASIS, "Raw Dev Saturation Emphasis")
        .tag(TAG_RAW_DEV_MEMORY_COLOR_EMPHASIS, "Raw Dev Memory Color Emphasis")
        .tag(TAG_RAW_DEV_COLOR_SPACE, "Raw Dev Color Space")
        .tag(TAG_RAW_DEV_NOISE_REDUCTION, "Raw Dev Noise Reduction")
        .tag(TAG_RAW_DEV_ENGINE, "Raw Dev Engine")
        .tag(TAG_RAW_DEV_PICTURE_MODE, "Raw Dev Picture Mode")
        .tag(TAG_RAW_DEV_PM_SATURATION, "Raw Dev PM Saturation")
        .tag(TAG_RAW_DEV_PM_CONTRAST, "Raw Dev PM Contrast")
        .tag(TAG_RAW_DEV_PM_SHARPNESS, "Raw Dev PM Sharpness")
        .tag(TAG_RAW_DEV_PM_BW_FILTER, "Raw Dev PM BW Filter")
        .tag(TAG_RAW_DEV_PM_PICTURE_TONE, "Raw Dev PM Picture Tone")
        .tag(TAG_RAW_DEV_GRADATION, "Raw Dev Gradation")
        .tag(TAG_RAW_DEV_SATURATION_3, "Raw Dev Saturation 3")
        .tag(TAG_RAW_DEV_AUTO_GRADATION, "Raw Dev Auto Gradation")
        .tag(TAG_RAW_DEV_PM_NOISE_FILTER, "Raw Dev PM Noise Filter")
        .tag(TAG_RAW_DEV_ART_FILTER, "Raw Dev Art Filter")
        .build();

    private OlympusRawDevelopment2MakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
