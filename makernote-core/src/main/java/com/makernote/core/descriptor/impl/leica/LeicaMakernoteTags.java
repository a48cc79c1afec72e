package com.makernote.core.descriptor.impl.leica;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Leica makernote used by the Digilux and early M8-era bodies.
 */
public final class LeicaMakernoteTags {

    public static final int TAG_QUALITY = 0x0300;
    public static final int TAG_USER_PROFILE = 0x0302;
    public static final int TAG_SERIAL_NUMBER = 0x0303;
    public static final int TAG_WHITE_BALANCE = 0x0304;
    public static final int TAG_LENS_TYPE = 0x0310;
    public static final int TAG_EXTERNAL_SENSOR_BRIGHTNESS_VALUE = 0x0311;
    public static final int TAG_MEASURED_LV = 0x0312;
    public static final int TAG_APPROXIMATE_F_NUMBER = 0x0313;
    public static final int TAG_CAMERA_TEMPERATURE = 0x0320;
    public static final int TAG_COLOR_TEMPERATURE = 0x0321;
    public static final int TAG_WB_RED_LEVEL = 0x0322;
    public static final int TAG_WB_GREEN_LEVEL = 0x0323;
    public static final int TAG_WB_BLUE_LEVEL = 0x0324;
    public static final int TAG_CCD_VERSION = 0x0330;
    public static final int TAG_CCD_BOARD_VERSION = 0x0331;
    public static final int TAG_CONTROLLER_BOARD_VERSION = 0x0332;
    public static final int TAG_M16_C_VERSION = 0x0333;
    public static final int TAG_IMAGE_ID_NUMBER = 0x0340;

    public static final TagCatalog CATALOG = TagCatalog.builder("Leica Makernote")
        .tag(TAG_QUALITY, "Quality")
        .tag(TAG_USER_PROFILE, "User Profile")
        .tag(TAG_SERIAL_NUMBER, "Serial Number")
        .tag(TAG_WHITE_BALANCE, "White Balance")
        .tag(TAG_LENS_TYPE, "Lens Type")
        .tag(TAG_EXTERNAL_SENSOR_BRIGHTNESS_VALUE, "External Sensor Brightness Value")
        .tag(TAG_MEASURED_LV, "Measured LV")
        .tag(TAG_APPROXIMATE_F_NUMBER, "Approximate F Number")
        .tag(TAG_CAMERA_TEMPERATURE, "Camera Temperature")
        .tag(TAG_COLOR_TEMPERATURE, "Color Temperature")
        .tag(TAG_WB_RED_LEVEL, "WB Red Level")
        .tag(TAG_WB_GREEN_LEVEL, "WB Green Level")
        .tag(TAG_WB_BLUE_LEVEL, "WB Blue Level")
        .tag(TAG_CCD_VERSION, "CCD Version")
        .tag(TAG_CCD_BOARD_VERSION, "CCD Board Version")
        .tag(TAG_CONTROLLER_BOARD_VERSION, "Controller Board Version")
        .tag(TAG_M16_C_VERSION, "M16 C Version")
        .tag(TAG_IMAGE_ID_NUMBER, "Image ID Number")
        .build();

    private LeicaMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
