package com.makernote.core.descriptor.impl.reconyx;

import com.makernote.core.tag.TagCatalog;

/**
 * Field offsets of the Reconyx HyperFire makernote.
 */
public final class ReconyxHyperFireMakernoteTags {

    public static final int TAG_MAKERNOTE_VERSION = 0;
    public static final int TAG_FIRMWARE_VERSION = 2;
    public static final int TAG_TRIGGER_MODE = 12;
    public static final int TAG_SEQUENCE = 14;
    public static final int TAG_EVENT_NUMBER = 18;
    public static final int TAG_DATE_TIME_ORIGINAL = 22;
    public static final int TAG_MOON_PHASE = 36;
    public static final int TAG_AMBIENT_TEMPERATURE_FAHRENHEIT = 38;
    public static final int TAG_AMBIENT_TEMPERATURE = 40;
    public static final int TAG_SERIAL_NUMBER = 42;
    public static final int TAG_CONTRAST = 72;
    public static final int TAG_BRIGHTNESS = 74;
    public static final int TAG_SHARPNESS = 76;
    public static final int TAG_SATURATION = 78;
    public static final int TAG_INFRARED_ILLUMINATOR = 80;
    public static final int TAG_MOTION_SENSITIVITY = 82;
    public static final int TAG_BATTERY_VOLTAGE = 84;
    public static final int TAG_USER_LABEL = 86;

    public static final TagCatalog CATALOG = TagCatalog.builder("Reconyx HyperFire Makernote")
        .tag(TAG_MAKERNOTE_VERSION, "Makernote Version")
        .tag(TAG_FIRMWARE_VERSION, "Firmware Version")
        .tag(TAG_TRIGGER_MODE, "Trigger Mode")
        .tag(TAG_SEQUENCE, "Sequence")
        .tag(TAG_EVENT_NUMBER, "Event Number")
        .tag(TAG_DATE_TIME_ORIGINAL, "Date/Time Original")
        .tag(TAG_MOON_PHASE, "Moon Phase")
        .tag(TAG_AMBIENT_TEMPERATURE_FAHRENHEIT, "Ambient Temperature Fahrenheit")
        .tag(TAG_AMBIENT_TEMPERATURE, "Ambient Temperature")
        .tag(TAG_SERIAL_NUMBER, "Serial Number")
        .tag(TAG_CONTRAST, "Contrast")
        .tag(TAG_BRIGHTNESS, "Brightness")
        .tag(TAG_SHARPNESS, "Sharpness")
        .tag(TAG_SATURATION, "Saturation")
        .tag(TAG_INFRARED_ILLUMINATOR, "Infrared Illuminator")
        .tag(TAG_MOTION_SENSITIVITY, "Motion Sensitivity")
        .tag(TAG_BATTERY_VOLTAGE, "Battery Voltage")
        .tag(TAG_USER_LABEL, "User Label")
        .build();

    private ReconyxHyperFireMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
