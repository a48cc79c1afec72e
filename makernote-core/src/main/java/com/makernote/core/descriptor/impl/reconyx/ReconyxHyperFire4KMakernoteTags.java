package com.makernote.core.descriptor.impl.reconyx;

import com.makernote.core.tag.TagCatalog;

/**
 * Field offsets of the Reconyx HyperFire 4K makernote, a fixed binary structure.
 */
public final class ReconyxHyperFire4KMakernoteTags {

    public static final int TAG_MAKERNOTE_IDENTIFIER = 0;         // char[12]
    public static final int TAG_AGGREGATE_MAKERNOTE_VERSION = 12; // uint32
    public static final int TAG_AGGREGATE_MAKERNOTE_SIZE = 16;    // uint32
    public static final int TAG_MAKERNOTE_INFO_VERSION = 20;      // uint32
    public static final int TAG_MAKERNOTE_INFO_SIZE = 24;         // uint16
    public static final int TAG_CAMERA_FIRMWARE_MAJOR = 26;       // uint8
    public static final int TAG_CAMERA_FIRMWARE_MINOR = 27;       // uint8
    public static final int TAG_CAMERA_FIRMWARE_BUILD_YEAR = 28;  // uint16
    public static final int TAG_CAMERA_FIRMWARE_BUILD_MONTH = 30; // uint8
    public static final int TAG_CAMERA_FIRMWARE_BUILD_DAY = 31;   // uint8
    public static final int TAG_CAMERA_FIRMWARE_REVISION = 32;    // char
    public static final int TAG_UIB_FIRMWARE_MAJOR = 33;          // uint8
    public static final int TAG_UIB_FIRMWARE_MINOR = 34;          // uint8
    public static final int TAG_UIB_FIRMWARE_BUILD_YEAR = 35;     // uint16
    public static final int TAG_UIB_FIRMWARE_BUILD_MONTH = 37;    // uint8
    public static final int TAG_UIB_FIRMWARE_BUILD_DAY = 38;      // uint8
    public static final int TAG_UIB_FIRMWARE_REVISION = 39;       // char
    public static final int TAG_EVENT_TYPE = 40;                  // char
    public static final int TAG_EVENT_SEQUENCE_NUMBER = 41;       // uint8
    public static final int TAG_MAX_EVENT_SEQUENCE_NUMBER = 42;   // uint8
    public static final int TAG_EVENT_NUMBER = 43;                // uint32
    public static final int TAG_TIME_SECONDS = 47;                // uint8
    public static final int TAG_TIME_MINUTES = 48;                // uint8
    public static final int TAG_TIME_HOURS = 49;                  // uint8
    public static final int TAG_DATE_DAY = 50;                    // uint8
    public static final int TAG_DATE_MONTH = 51;                  // uint8
    public static final int TAG_DATE_YEAR = 52;                   // uint16
    public static final int TAG_DATE_DAY_OF_WEEK = 54;            // uint8
    public static final int TAG_MOON_PHASE = 55;                  // uint8
    public static final int TAG_TEMPERATURE_FAHRENHEIT = 56;      // int16
    public static final int TAG_TEMPERATURE_CELSIUS = 58;         // int16
    public static final int TAG_CONTRAST = 60;                    // uint16
    public static final int TAG_BRIGHTNESS = 62;                  // uint16
    public static final int TAG_SHARPNESS = 64;                   // uint16
    public static final int TAG_SATURATION = 66;                  // uint16
    public static final int TAG_FLASH = 68;                       // uint8
    public static final int TAG_AMBIENT_LIGHT_READING = 69;       // uint32
    public static final int TAG_MOTION_SENSOR_SENSITIVITY = 73;   // uint16
    public static final int TAG_BATTERY_VOLTAGE_INSTANTANEOUS = 75;// uint16
    public static final int TAG_BATTERY_VOLTAGE_AVERAGE = 77;     // uint16
    public static final int TAG_BATTERY_TYPE = 79;                // uint16
    public static final int TAG_USER_LABEL = 81;                  // char[51]
    public static final int TAG_CAMERA_SERIAL_NUMBER = 132;       // char[15]
    public static final int TAG_RECNX_DIRECTORY_NUMBER = 147;     // uint16
    public static final int TAG_FILE_NUMBER = 149;                // uint16
    public static final int TAG_RESERVED = 151;                   // uint8[36]

    public static final TagCatalog CATALOG = TagCatalog.builder("Reconyx HyperFire 4K Makernote")
        .tag(TAG_MAKERNOTE_IDENTIFIER, "Makernote Identifier")
        .tag(TAG_AGGREGATE_MAKERNOTE_VERSION, "Aggregate Makernote Version")
        .tag(TAG_AGGREGATE_MAKERNOTE_SIZE, "Aggregate Makernote Size")
        .tag(TAG_MAKERNOTE_INFO_VERSION, "Makernote Info Version")
        .tag(TAG_MAKERNOTE_INFO_SIZE, "Makernote Info Size")
        .tag(TAG_CAMERA_FIRMWARE_MAJOR, "Camera Firmware Major")
        .tag(TAG_CAMERA_FIRMWARE_MINOR, "Camera Firmware Minor")
        .tag(TAG_CAMERA_FIRMWARE_BUILD_YEAR, "Camera Firmware Build Year")
        .tag(TAG_CAMERA_FIRMWARE_BUILD_MONTH, "Camera Firmware Build Month")
        .tag(TAG_CAMERA_FIRMWARE_BUILD_DAY, "Camera Firmware Build Day")
        .tag(TAG_CAMERA_FIRMWARE_REVISION, "Camera Firmware Revision")
        .tag(TAG_UIB_FIRMWARE_MAJOR, "UIB Firmware Major")
        .tag(TAG_UIB_FIRMWARE_MINOR, "UIB Firmware Minor")
        .tag(TAG_UIB_FIRMWARE_BUILD_YEAR, "UIB Firmware Build Year")
        .tag(TAG_UIB_FIRMWARE_BUILD_MONTH, "UIB Firmware Build Month")
        .tag(TAG_UIB_FIRMWARE_BUILD_DAY, "UIB Firmware Build Day")
        .tag(TAG_UIB_FIRMWARE_REVISION, "UIB Firmware Revision")
        .tag(TAG_EVENT_TYPE, "Event Type")
        .tag(TAG_EVENT_SEQUENCE_NUMBER, "Event Sequence Number")
        .tag(TAG_MAX_EVENT_SEQUENCE_NUMBER, "Max Event Sequence Number")
        .tag(TAG_EVENT_NUMBER, "Event Number")
        .tag(TAG_TIME_SECONDS, "Time Seconds")
        .tag(TAG_TIME_MINUTES, "Time Minutes")
        .tag(TAG_TIME_HOURS, "Time Hours")
        .tag(TAG_DATE_DAY, "Date Day")
        .tag(TAG_DATE_MONTH, "Date Month")
        .tag(TAG_DATE_YEAR, "Date Year")
        .tag(TAG_DATE_DAY_OF_WEEK, "Date Day of Week")
        .tag(TAG_MOON_PHASE, "Moon Phase")
        .tag(TAG_TEMPERATURE_FAHRENHEIT, "Temperature Fahrenheit")
        .tag(TAG_TEMPERATURE_CELSIUS, "Temperature Celsius")
        .tag(TAG_CONTRAST, "Contrast")
        .tag(TAG_BRIGHTNESS, "Brightness")
        .tag(TAG_SHARPNESS, "Sharpness")
        .tag(TAG_SATURATION, "Saturation")
        .tag(TAG_FLASH, "Flash")
        .tag(TAG_AMBIENT_LIGHT_READING, "Ambient Light Reading")
        .tag(TAG_MOTION_SENSOR_SENSITIVITY, "Motion Sensor Sensitivity")
        .tag(TAG_BATTERY_VOLTAGE_INSTANTANEOUS, "Battery Voltage Instantaneous")
        .tag(TAG_BATTERY_VOLTAGE_AVERAGE, "Battery Voltage Average")
        .tag(TAG_BATTERY_TYPE, "Battery Type")
        .tag(TAG_USER_LABEL, "User Label")
        .tag(TAG_CAMERA_SERIAL_NUMBER, "Camera Serial Number")
        .tag(TAG_RECNX_DIRECTORY_NUMBER, "RECNX Directory Number")
        .tag(TAG_FILE_NUMBER, "File Number")
        .tag(TAG_RESERVED, "Reserved")
        .build();

    private ReconyxHyperFire4KMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
