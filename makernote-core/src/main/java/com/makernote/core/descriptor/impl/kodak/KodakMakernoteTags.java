package com.makernote.core.descriptor.impl.kodak;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Kodak makernote. The Kodak block is a fixed binary record, so each id is
 * the byte offset of the field within it.
 */
public final class KodakMakernoteTags {

    public static final int TAG_KODAK_MODEL = 0;
    public static final int TAG_QUALITY = 9;
    public static final int TAG_BURST_MODE = 10;
    public static final int TAG_IMAGE_WIDTH = 12;
    public static final int TAG_IMAGE_HEIGHT = 14;
    public static final int TAG_YEAR_CREATED = 16;
    public static final int TAG_MONTH_DAY_CREATED = 18;
    public static final int TAG_TIME_CREATED = 20;
    public static final int TAG_BURST_MODE_2 = 24;
    public static final int TAG_SHUTTER_MODE = 27;
    public static final int TAG_METERING_MODE = 28;
    public static final int TAG_SEQUENCE_NUMBER = 29;
    public static final int TAG_F_NUMBER = 30;
    public static final int TAG_EXPOSURE_TIME = 32;
    public static final int TAG_EXPOSURE_COMPENSATION = 36;
    public static final int TAG_FOCUS_MODE = 56;
    public static final int TAG_WHITE_BALANCE = 64;
    public static final int TAG_FLASH_MODE = 92;
    public static final int TAG_FLASH_FIRED = 93;
    public static final int TAG_ISO_SETTING = 94;
    public static final int TAG_ISO = 96;
    public static final int TAG_TOTAL_ZOOM = 98;
    public static final int TAG_DATE_TIME_STAMP = 100;
    public static final int TAG_COLOR_MODE = 102;
    public static final int TAG_DIGITAL_ZOOM = 104;
    public static final int TAG_SHARPNESS = 107;

    public static final TagCatalog CATALOG = TagCatalog.builder("Kodak Makernote")
        .tag(TAG_KODAK_MODEL, "Kodak Model")
        .tag(TAG_QUALITY, "Quality")
        .tag(TAG_BURST_MODE, "Burst Mode")
        .tag(TAG_IMAGE_WIDTH, "Image Width")
        .tag(TAG_IMAGE_HEIGHT, "Image Height")
        .tag(TAG_YEAR_CREATED, "Year Created")
        .tag(TAG_MONTH_DAY_CREATED, "Month/Day Created")
        .tag(TAG_TIME_CREATED, "Time Created")
        .tag(TAG_BURST_MODE_2, "Burst Mode 2")
        .tag(TAG_SHUTTER_MODE, "Shutter Speed")
        .tag(TAG_METERING_MODE, "Metering Mode")
        .tag(TAG_SEQUENCE_NUMBER, "Sequence Number")
        .tag(TAG_F_NUMBER, "F Number")
        .tag(TAG_EXPOSURE_TIME, "Exposure Time")
        .tag(TAG_EXPOSURE_COMPENSATION, "Exposure Compensation")
        .tag(TAG_FOCUS_MODE, "Focus Mode")
        .tag(TAG_WHITE_BALANCE, "White Balance")
        .tag(TAG_FLASH_MODE, "Flash Mode")
        .tag(TAG_FLASH_FIRED, "Flash Fired")
        .tag(TAG_ISO_SETTING, "ISO Setting")
        .tag(TAG_ISO, "ISO")
        .tag(TAG_TOTAL_ZOOM, "Total Zoom")
        .tag(TAG_DATE_TIME_STAMP, "Date/Time Stamp")
        .tag(TAG_COLOR_MODE, "Color Mode")
        .tag(TAG_DIGITAL_ZOOM, "Digital Zoom")
        .tag(TAG_SHARPNESS, "Sharpness")
        .build();

    private KodakMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
