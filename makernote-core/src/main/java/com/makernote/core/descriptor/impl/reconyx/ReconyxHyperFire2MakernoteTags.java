package com.makernote.core.descriptor.impl.reconyx;

import com.makernote.core.tag.TagCatalog;

/**
 * Field offsets of the Reconyx HyperFire 2 makernote.
 */
public final class ReconyxHyperFire2MakernoteTags {

    public static final int TAG_FILE_NUMBER = 0x10;
    public static final int TAG_DIRECTORY_NUMBER = 0x12;
    public static final int TAG_FIRMWARE_VERSION = 0x2A;
    public static final int TAG_FIRMWARE_DATE = 0x30;
    public static final int TAG_TRIGGER_MODE = 0x34;
    public static final int TAG_SEQUENCE = 0x36;
    public static final int TAG_EVENT_NUMBER = 0x3A;
    public static final int TAG_DATE_TIME_ORIGINAL = 0x3E;
    public static final int TAG_DAY_OF_WEEK = 0x4A;
    public static final int TAG_MOON_PHASE = 0x4C;
    public static final int TAG_AMBIENT_TEMPERATURE_FAHRENHEIT = 0x4E;
    public static final int TAG_AMBIENT_TEMPERATURE = 0x50;
    public static final int TAG_CONTRAST = 0x52;
    public static final int TAG_BRIGHTNESS = 0x54;
    public static final int TAG_SHARPNESS = 0x56;
    public static final int TAG_SATURATION = 0x58;
    public static final int TAG_FLASH = 0x5A;
    public static final int TAG_AMBIENT_INFRARED = 0x5C;
    public static final int TAG_AMBIENT_LIGHT = 0x5E;
    public static final int TAG_MOTION_SENSITIVITY = 0x60;
    public static final int TAG_BATTERY_VOLTAGE = 0x62;
    public static final int TAG_BATTERY_VOLTAGE_AVG = 0x64;
    public static final int TAG_BATTERY_TYPE = 0x66;
    public static final int TAG_USER_LABEL = 0x68;
    public static final int TAG_SERIAL_NUMBER = 0x7E;

    public static final TagCatalog CATALOG = TagCatalog.builder("Reconyx HyperFire 2 Makernote")
        .tag(TAG_FILE_NUMBER, "File Number")
        .tag(TAG_DIRECTORY_NUMBER, "Directory Number")
        .tag(TAG_FIRMWARE_VERSION, "Firmware Version")
        .tag(TAG_FIRMWARE_DATE, "Firmware Date")
        .tag(TAG_TRIGGER_MODE, "Trigger Mode")
        .tag(TAG_SEQUENCE, "Sequence")
        .tag(TAG_EVENT_NUMBER, "Event Number")
        .tag(TAG_DATE_TIME_ORIGINAL, "Date/Time Original")
        .tag(TAG_DAY_OF_WEEK, "Day of Week")
        .tag(TAG_MOON_PHASE, "Moon Phase")
        .tag(TAG_AMBIENT_TEMPERATURE_FAHRENHEIT, "Ambient Temperature Fahrenheit")
        .tag(TAG_AMBIENT_TEMPERATURE, "Ambient Temperature")
        .tag(TAG_CONTRAST, "Contrast")
        .tag(TAG_BRIGHTNESS, "Brightness")
        .tag(TAG_SHARPNESS, "Sharpness")
        .tag(TAG_SATURATION, "Saturation")
        .tag(TAG_FLASH, "Flash")
        .tag(TAG_AMBIENT_INFRARED, "Ambient Infrared")
        .tag(TAG_AMBIENT_LIGHT, "Ambient Light")
        .tag(TAG_MOTION_SENSITIVITY, "Motion Sensitivity")
        .tag(TAG_BATTERY_VOLTAGE, "Battery Voltage")
        .tag(TAG_BATTERY_VOLTAGE_AVG, "Battery Voltage Avg")
        .tag(TAG_BATTERY_TYPE, "Battery Type")
        .tag(TAG_USER_LABEL, "User Label")
        .tag(TAG_SERIAL_NUMBER, "Serial Number")
        .build();

    private ReconyxHyperFire2MakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
