package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Olympus Raw Info sub-IFD (makernote tag {@code 0x3000}).
 */
public final class OlympusRawInfoMakernoteTags {

    public static final int TAG_RAW_INFO_VERSION = 0x0000;
    public static final int TAG_WB_RB_LEVELS_USED = 0x0100;
    public static final int TAG_WB_RB_LEVELS_AUTO = 0x0110;
    public static final int TAG_WB_RB_LEVELS_SHADE = 0x0120;
    public static final int TAG_WB_RB_LEVELS_CLOUDY = 0x0121;
    public static final int TAG_WB_RB_LEVELS_FINE_WEATHER = 0x0122;
    public static final int TAG_WB_RB_LEVELS_TUNGSTEN = 0x0123;
    public static final int TAG_WB_RB_LEVELS_EVENING_SUNLIGHT = 0x0124;
    public static final int TAG_WB_RB_LEVELS_DAYLIGHT_FLUOR = 0x0130;
    public static final int TAG_WB_RB_LEVELS_DAY_WHITE_FLUOR = 0x0131;
    public static final int TAG_WB_RB_LEVELS_COOL_WHITE_FLUOR = 0x0132;
    public static final int TAG_WB_RB_LEVELS_WHITE_FLUORESCENT = 0x0133;
    public static final int TAG_COLOR_MATRIX_2 = 0x0200;
    public static final int TAG_CORING_FILTER = 0x0310;
    public static final int TAG_CORING_VALUES = 0x0311;
    public static final int TAG_BLACK_LEVEL_2 = 0x0600;
    public static final int TAG_YCBCR_COEFFICIENTS = 0x0601;
    public static final int TAG_VALID_PIXEL_DEPTH = 0x0611;
    public static final int TAG_CROP_LEFT = 0x0612;
    public static final int TAG_CROP_TOP = 0x0613;
    public static final int TAG_CROP_WIDTH = 0x0614;
    public static final int TAG_CROP_HEIGHT = 0x0615;
    public static final int TAG_LIGHT_SOURCE = 0x1000;
    public static final int TAG_WHITE_BALANCE_COMP = 0x1001;
    public static final int TAG_SATURATION_SETTING = 0x1010;
    public static final int TAG_HUE_SETTING = 0x1011;
    public static final int TAG_CONTRAST_SETTING = 0x1012;
    public static final int TAG_SHARPNESS_SETTING = 0x1013;
    public static final int TAG_CM_EXPOSURE_COMPENSATION = 0x2000;
    public static final int TAG_CM_WHITE_BALANCE = 0x2001;
    public static final int TAG_CM_WHITE_BALANCE_COMP = 0x2002;
    public static final int TAG_CM_WHITE_BALANCE_GRAY_POINT = 0x2010;
    public static final int TAG_CM_SATURATION = 0x2020;
    public static final int TAG_CM_HUE = 0x2021;
    public static final int TAG_CM_CONTRAST = 0x2022;
    public static final int TAG_CM_SHARPNESS = 0x2023;

    public static final TagCatalog CATALOG = TagCatalog.builder("Olympus Raw Info")
        .tag(TAG_RAW_INFO_VERSION, "Raw Info Version")
        .tag(TAG_WB_RB_LEVELS_USED, "WB RB Levels Used")
        .tag(TAG_WB_RB_LEVELS_AUTO, "WB RB Levels Auto")
        .tag(TAG_WB_RB_LEVELS_SHADE, "WB RB Levels Shade")
        .tag(TAG_WB_RB_LEVELS_CLOUDY, "WB RB Levels Cloudy")
        .tag(TAG_WB_RB_LEVELS_FINE_WEATHER, "WB RB Levels Fine Weather")
        .tag(TAG_WB_RB_LEVELS_TUNGSTEN, "WB RB Levels Tungsten")
        .tag(TAG_WB_RB_LEVELS_EVENING_SUNLIGHT, "WB RB Levels Evening Sunlight")
        .tag(TAG_WB_RB_LEVELS_DAYLIGHT_FLUOR, "WB RB Levels Daylight Fluor")
        .tag(TAG_WB_RB_LEVELS_DAY_WHITE_FLUOR, "WB RB Levels Day White Fluor")
        .tag(TAG_WB_RB_LEVELS_COOL_WHITE_FLUOR, "WB RB Levels Cool White Fluor")
        .tag(TAG_WB_RB_LEVELS_WHITE_FLUORESCENT, "WB RB Levels White Fluorescent")
        .tag(TAG_COLOR_MATRIX_2, "Color Matrix 2")
        .tag(TAG_CORING_FILTER, "Coring Filter")
        .tag(TAG_CORING_VALUES, "Coring Values")
        .tag(TAG_BLACK_LEVEL_2, "Black Level 2")
        .tag(TAG_YCBCR_COEFFICIENTS, "YCbCrCoefficients")
        .tag(TAG_VALID_PIXEL_DEPTH, "Valid Pixel Depth")
        .tag(TAG_CROP_LEFT, "Crop Left")
        .tag(TAG_CROP_TOP, "Crop Top")
        .tag(TAG_CROP_WIDTH, "Crop Width")
        .tag(TAG_CROP_HEIGHT, "Crop Height")
        .tag(TAG_LIGHT_SOURCE, "Light Source")
        .tag(TAG_WHITE_BALANCE_COMP, "White Balance Comp")
        .tag(TAG_SATURATION_SETTING, "Saturation Setting")
        .tag(TAG_HUE_SETTING, "Hue Setting")
        .tag(TAG_CONTRAST_SETTING, "Contrast Setting")
        .tag(TAG_SHARPNESS_SETTING, "Sharpness Setting")
        .tag(TAG_CM_EXPOSURE_COMPENSATION, "CM Exposure Compensation")
        .tag(TAG_CM_WHITE_BALANCE, "CM White Balance")
        .tag(TAG_CM_WHITE_BALANCE_COMP, "CM White Balance Comp")
        .tag(TAG_CM_WHITE_BALANCE_GRAY_POINT, "CM White Balance Gray Point")
        .tag(TAG_CM_SATURATION, "CM Saturation")
        .tag(TAG_CM_HUE, "CM Hue")
        .tag(TAG_CM_CONTRAST, "CM Contrast")
        .tag(TAG_CM_SHARPNESS, "CM Sharpness")
        .build();

    private OlympusRawInfoMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
