package com.makernote.core.descriptor.impl.sigma;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Sigma and Foveon makernote.
 */
public final class SigmaMakernoteTags {

    public static final int TAG_SERIAL_NUMBER = 0x0002;
    public static final int TAG_DRIVE_MODE = 0x0003;
    public static final int TAG_RESOLUTION_MODE = 0x0004;
    public static final int TAG_AUTO_FOCUS_MODE = 0x0005;
    public static final int TAG_FOCUS_SETTING = 0x0006;
    public static final int TAG_WHITE_BALANCE = 0x0007;
    public static final int TAG_EXPOSURE_MODE = 0x0008;
    public static final int TAG_METERING_MODE = 0x0009;
    public static final int TAG_LENS_RANGE = 0x000A;
    public static final int TAG_COLOR_SPACE = 0x000B;
    public static final int TAG_EXPOSURE = 0x000C;
    public static final int TAG_CONTRAST = 0x000D;
    public static final int TAG_SHADOW = 0x000E;
    public static final int TAG_HIGHLIGHT = 0x000F;
    public static final int TAG_SATURATION = 0x0010;
    public static final int TAG_SHARPNESS = 0x0011;
    public static final int TAG_FILL_LIGHT = 0x0012;
    public static final int TAG_COLOR_ADJUSTMENT = 0x0014;
    public static final int TAG_ADJUSTMENT_MODE = 0x0015;
    public static final int TAG_QUALITY = 0x0016;
    public static final int TAG_FIRMWARE = 0x0017;
    public static final int TAG_SOFTWARE = 0x0018;
    public static final int TAG_AUTO_BRACKET = 0x0019;

    public static final TagCatalog CATALOG = TagCatalog.builder("Sigma Makernote")
        .tag(TAG_SERIAL_NUMBER, "Serial Number")
        .tag(TAG_DRIVE_MODE, "Drive Mode")
        .tag(TAG_RESOLUTION_MODE, "Resolution Mode")
        .tag(TAG_AUTO_FOCUS_MODE, "Auto Focus Mode")
        .tag(TAG_FOCUS_SETTING, "Focus Setting")
        .tag(TAG_WHITE_BALANCE, "White Balance")
        .tag(TAG_EXPOSURE_MODE, "Exposure Mode")
        .tag(TAG_METERING_MODE, "Metering Mode")
        .tag(TAG_LENS_RANGE, "Lens Range")
        .tag(TAG_COLOR_SPACE, "Color Space")
        .tag(TAG_EXPOSURE, "Exposure")
        .tag(TAG_CONTRAST, "Contrast")
        .tag(TAG_SHADOW, "Shadow")
        .tag(TAG_HIGHLIGHT, "Highlight")
        .tag(TAG_SATURATION, "Saturation")
        .tag(TAG_SHARPNESS, "Sharpness")
        .tag(TAG_FILL_LIGHT, "Fill Light")
        .tag(TAG_COLOR_ADJUSTMENT, "Color Adjustment")
        .tag(TAG_ADJUSTMENT_MODE, "Adjustment Mode")
        .tag(TAG_QUALITY, "Quality")
        .tag(TAG_FIRMWARE, "Firmware")
        .tag(TAG_SOFTWARE, "Software")
        .tag(TAG_AUTO_BRACKET, "Auto Bracket")
        .build();

    private SigmaMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
