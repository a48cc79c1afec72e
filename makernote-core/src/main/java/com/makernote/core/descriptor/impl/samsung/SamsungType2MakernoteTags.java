package com.makernote.core.descriptor.impl.samsung;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Samsung Type 2 makernote, an IFD written by NX bodies, compacts and phones.
 */
public final class SamsungType2MakernoteTags {

    public static final int TAG_MAKER_NOTE_VERSION = 0x0001;
    public static final int TAG_DEVICE_TYPE = 0x0002;
    public static final int TAG_SAMSUNG_MODEL_ID = 0x0003;
    public static final int TAG_ORIENTATION_INFO = 0x0011;
    public static final int TAG_SMART_ALBUM_COLOR = 0x0020;
    public static final int TAG_PICTURE_WIZARD = 0x0021;
    public static final int TAG_LOCAL_LOCATION_NAME = 0x0030;
    public static final int TAG_LOCATION_NAME = 0x0031;
    public static final int TAG_PREVIEW_IFD = 0x0035;
    public static final int TAG_RAW_DATA_BYTE_ORDER = 0x0040;
    public static final int TAG_WHITE_BALANCE_SETUP = 0x0041;
    public static final int TAG_CAMERA_TEMPERATURE = 0x0043;
    public static final int TAG_RAW_DATA_CFA_PATTERN = 0x0050;
    public static final int TAG_FACE_DETECT = 0x0100;
    public static final int TAG_FACE_RECOGNITION = 0x0120;
    public static final int TAG_FACE_NAME = 0x0123;

    // 0xa0xx are written by NX bodies only
    public static final int TAG_FIRMWARE_NAME = 0xA001;
    public static final int TAG_SERIAL_NUMBER = 0xA002;
    public static final int TAG_LENS_TYPE = 0xA003;
    public static final int TAG_LENS_FIRMWARE = 0xA004;
    public static final int TAG_SENSOR_AREAS = 0xA010;
    public static final int TAG_COLOR_SPACE = 0xA011;
    public static final int TAG_SMART_RANGE = 0xA012;
    public static final int TAG_EXPOSURE_COMPENSATION = 0xA013;
    public static final int TAG_ISO = 0xA014;
    public static final int TAG_EXPOSURE_TIME = 0xA018;
    public static final int TAG_F_NUMBER = 0xA019;
    public static final int TAG_FOCAL_LENGTH_IN_35MM_FORMAT = 0xA01A;
    public static final int TAG_ENCRYPTION_KEY = 0xA020;
    public static final int TAG_WB_RGGB_LEVELS_UNCORRECTED = 0xA021;
    public static final int TAG_WB_RGGB_LEVELS_AUTO = 0xA022;
    public static final int TAG_COLOR_MATRIX = 0xA030;
    public static final int TAG_TONE_CURVE_SRGB_DEFAULT = 0xA040;

    public static final TagCatalog CATALOG = TagCatalog.builder("Samsung Makernote")
        .tag(TAG_MAKER_NOTE_VERSION, "Maker Note Version")
        .tag(TAG_DEVICE_TYPE, "Device Type")
        .tag(TAG_SAMSUNG_MODEL_ID, "Model Id")
        .tag(TAG_ORIENTATION_INFO, "Orientation Info")
        .tag(TAG_SMART_ALBUM_COLOR, "Smart Album Color")
        .tag(TAG_PICTURE_WIZARD, "Picture Wizard")
        .tag(TAG_LOCAL_LOCATION_NAME, "Local Location Name")
        .tag(TAG_LOCATION_NAME, "Location Name")
        .tag(TAG_PREVIEW_IFD, "Preview IFD")
        .tag(TAG_RAW_DATA_BYTE_ORDER, "Raw Data Byte Order")
        .tag(TAG_WHITE_BALANCE_SETUP, "White Balance Setup")
        .tag(TAG_CAMERA_TEMPERATURE, "Camera Temperature")
        .tag(TAG_RAW_DATA_CFA_PATTERN, "Raw Data CFA Pattern")
        .tag(TAG_FACE_DETECT, "Face Detect")
        .tag(TAG_FACE_RECOGNITION, "Face Recognition")
        .tag(TAG_FACE_NAME, "Face Name")
        .tag(TAG_FIRMWARE_NAME, "Firmware Name")
        .tag(TAG_SERIAL_NUMBER, "Serial Number")
        .tag(TAG_LENS_TYPE, "Lens Type")
        .tag(TAG_LENS_FIRMWARE, "Lens Firmware")
        .tag(TAG_SENSOR_AREAS, "Sensor Areas")
        .tag(TAG_COLOR_SPACE, "Color Space")
        .tag(TAG_SMART_RANGE, "Smart Range")
        .tag(TAG_EXPOSURE_COMPENSATION, "Exposure Compensation")
        .tag(TAG_ISO, "ISO")
        .tag(TAG_EXPOSURE_TIME, "Exposure Time")
        .tag(TAG_F_NUMBER, "F-Number")
        .tag(TAG_FOCAL_LENGTH_IN_35MM_FORMAT, "Focal Length in 35mm Format")
        .tag(TAG_ENCRYPTION_KEY, "Encryption Key")
        .tag(TAG_WB_RGGB_LEVELS_UNCORRECTED, "WB RGGB Levels Uncorrected")
        .tag(TAG_WB_RGGB_LEVELS_AUTO, "WB RGGB Levels Auto")
        .tag(TAG_COLOR_MATRIX, "Color Matrix")
        .tag(TAG_TONE_CURVE_SRGB_DEFAULT, "Tone Curve sRGB Default")
        .build();

    private SamsungType2MakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
