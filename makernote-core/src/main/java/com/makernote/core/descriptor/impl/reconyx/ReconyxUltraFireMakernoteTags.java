package com.makernote.core.descriptor.impl.reconyx;

import com.makernote.core.tag.TagCatalog;

/**
 * Field offsets of the Reconyx UltraFire makernote.
 */
public final class ReconyxUltraFireMakernoteTags {

    public static final int TAG_LABEL = 0;
    public static final int TAG_MAKERNOTE_ID = 10;
    public static final int TAG_MAKERNOTE_SIZE = 14;
    public static final int TAG_MAKERNOTE_PUBLIC_ID = 18;
    public static final int TAG_MAKERNOTE_PUBLIC_SIZE = 22;
    public static final int TAG_CAMERA_VERSION = 24;
    public static final int TAG_UIB_VERSION = 31;
    public static final int TAG_BTL_VERSION = 38;
    public static final int TAG_PEX_VERSION = 45;
    public static final int TAG_EVENT_TYPE = 52;
    public static final int TAG_SEQUENCE = 53;
    public static final int TAG_EVENT_NUMBER = 55;
    public static final int TAG_DATE_TIME_ORIGINAL = 59;
    public static final int TAG_DAY_OF_WEEK = 66;
    public static final int TAG_MOON_PHASE = 67;
    public static final int TAG_AMBIENT_TEMPERATURE_FAHRENHEIT = 68;
    public static final int TAG_AMBIENT_TEMPERATURE = 70;
    public static final int TAG_FLASH = 72;
    public static final int TAG_BATTERY_VOLTAGE = 73;
    public static final int TAG_SERIAL_NUMBER = 75;
    public static final int TAG_USER_LABEL = 90;

    public static final TagCatalog CATALOG = TagCatalog.builder("Reconyx UltraFire Makernote")
        .tag(TAG_LABEL, "Makernote Label")
        .tag(TAG_MAKERNOTE_ID, "Makernote ID")
        .tag(TAG_MAKERNOTE_SIZE, "Makernote Size")
        .tag(TAG_MAKERNOTE_PUBLIC_ID, "Makernote Public ID")
        .tag(TAG_MAKERNOTE_PUBLIC_SIZE, "Makernote Public Size")
        .tag(TAG_CAMERA_VERSION, "Camera Version")
        .tag(TAG_UIB_VERSION, "Uib Version")
        .tag(TAG_BTL_VERSION, "Btl Version")
        .tag(TAG_PEX_VERSION, "Pex Version")
        .tag(TAG_EVENT_TYPE, "Event Type")
        .tag(TAG_SEQUENCE, "Sequence")
        .tag(TAG_EVENT_NUMBER, "Event Number")
        .tag(TAG_DATE_TIME_ORIGINAL, "Date/Time Original")
        .tag(TAG_DAY_OF_WEEK, "Day of Week")
        .tag(TAG_MOON_PHASE, "Moon Phase")
        .tag(TAG_AMBIENT_TEMPERATURE_FAHRENHEIT, "Ambient Temperature Fahrenheit")
        .tag(TAG_AMBIENT_TEMPERATURE, "Ambient Temperature")
        .tag(TAG_FLASH, "Flash")
        .tag(TAG_BATTERY_VOLTAGE, "Battery Voltage")
        .tag(TAG_SERIAL_NUMBER, "Serial Number")
        .tag(TAG_USER_LABEL, "User Label")
        .build();

    private ReconyxUltraFireMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
