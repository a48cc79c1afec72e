package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Olympus Image Processing sub-IFD (makernote tag {@code 0x2040}).
 */
public final class OlympusImageProcessingMakernoteTags {

    public static final int TAG_IMAGE_PROCESSING_VERSION = 0x0000;
    public static final int TAG_WB_RB_LEVELS = 0x0100;
    public static final int TAG_WB_RB_LEVELS_3000K = 0x0102;
    public static final int TAG_WB_RB_LEVELS_3300K = 0x0103;
    public static final int TAG_WB_RB_LEVELS_3600K = 0x0104;
    public static final int TAG_WB_RB_LEVELS_3900K = 0x0105;
    public static final int TAG_WB_RB_LEVELS_4000K = 0x0106;
    public static final int TAG_WB_RB_LEVELS_4300K = 0x0107;
    public static final int TAG_WB_RB_LEVELS_4500K = 0x0108;
    public static final int TAG_WB_RB_LEVELS_4800K = 0x0109;
    public static final int TAG_WB_RB_LEVELS_5300K = 0x010A;
    public static final int TAG_WB_RB_LEVELS_6000K = 0x010B;
    public static final int TAG_WB_RB_LEVELS_6600K = 0x010C;
    public static final int TAG_WB_RB_LEVELS_7500K = 0x010D;
    public static final int TAG_WB_RB_LEVELS_CWB1 = 0x010E;
    public static final int TAG_WB_RB_LEVELS_CWB2 = 0x010F;
    public static final int TAG_WB_RB_LEVELS_CWB3 = 0x0110;
    public static final int TAG_WB_RB_LEVELS_CWB4 = 0x0111;
    public static final int TAG_WB_G_LEVEL_3000K = 0x0113;
    public static final int TAG_WB_G_LEVEL_3300K = 0x0114;
    public static final int TAG_WB_G_LEVEL_3600K = 0x0115;
    public static final int TAG_WB_G_LEVEL_3900K = 0x0116;
    public static final int TAG_WB_G_LEVEL_4000K = 0x0117;
    public static final int TAG_WB_G_LEVEL_4300K = 0x0118;
    public static final int TAG_WB_G_LEVEL_4500K = 0x0119;
    public static final int TAG_WB_G_LEVEL_4800K = 0x011A;
    public static final int TAG_WB_G_LEVEL_5300K = 0x011B;
    public static final int TAG_WB_G_LEVEL_6000K = 0x011C;
    public static final int TAG_WB_G_LEVEL_6600K = 0x011D;
    public static final int TAG_WB_G_LEVEL_7500K = 0x011E;
    public static final int TAG_WB_G_LEVEL = 0x011F;
    public static final int TAG_COLOR_MATRIX = 0x0200;
    // 0x0201-0x0258 hold sRGB, Adobe RGB and ProPhoto RGB color matrices
    public static final int TAG_ENHANCER = 0x0300;
    public static final int TAG_ENHANCER_VALUES = 0x0301;
    public static final int TAG_CORING_FILTER = 0x0310;
    public static final int TAG_CORING_VALUES = 0x0311;
    public static final int TAG_BLACK_LEVEL_2 = 0x0600;
    public static final int TAG_GAIN_BASE = 0x0610;
    public static final int TAG_VALID_BITS = 0x0611;
    public static final int TAG_CROP_LEFT = 0x0612;
    public static final int TAG_CROP_TOP = 0x0613;
    public static final int TAG_CROP_WIDTH = 0x0614;
    public static final int TAG_CROP_HEIGHT = 0x0615;
    public static final int TAG_UNKNOWN_BLOCK_1 = 0x0635;
    public static final int TAG_UNKNOWN_BLOCK_2 = 0x0636;
    public static final int TAG_SENSOR_CALIBRATION = 0x0805;
    public static final int TAG_NOISE_REDUCTION_2 = 0x1010;
    public static final int TAG_DISTORTION_CORRECTION_2 = 0x1011;
    public static final int TAG_SHADING_COMPENSATION_2 = 0x1012;
    public static final int TAG_MULTIPLE_EXPOSURE_MODE = 0x101C;
    public static final int TAG_UNKNOWN_BLOCK_3 = 0x1103;
    public static final int TAG_UNKNOWN_BLOCK_4 = 0x1104;
    public static final int TAG_ASPECT_RATIO = 0x1112;
    public static final int TAG_ASPECT_FRAME = 0x1113;
    public static final int TAG_FACES_DETECTED = 0x1200;
    public static final int TAG_FACE_DETECT_AREA = 0x1201;
    public static final int TAG_MAX_FACES = 0x1202;
    public static final int TAG_FACE_DETECT_FRAME_SIZE = 0x1203;
    public static final int TAG_FACE_DETECT_FRAME_CROP = 0x1207;
    public static final int TAG_CAMERA_TEMPERATURE = 0x1306;
    public static final int TAG_KEYSTONE_COMPENSATION = 0x1900;
    public static final int TAG_KEYSTONE_DIRECTION = 0x1901;
    public static final int TAG_KEYSTONE_VALUE = 0x1906;

    public static final TagCatalog CATALOG = TagCatalog.builder("Olympus Image Processing")
        .tag(TAG_IMAGE_PROCESSING_VERSION, "Image Processing Version")
        .tag(TAG_WB_RB_LEVELS, "WB RB Levels")
        .tag(TAG_WB_RB_LEVELS_3000K, "WB RB Levels 3000K")
        .tag(TAG_WB_RB_LEVELS_3300K, "WB RB Levels 3300K")
        .tag(TAG_WB_RB_LEVELS_3600K, "WB RB Levels 3600K")
        .tag(TAG_WB_RB_LEVELS_3900K, "WB RB Levels 3900K")
        .tag(TAG_WB_RB_LEVELS_4000K, "WB RB Levels 4000K")
        .tag(TAG_WB_RB_LEVELS_4300K, "WB RB Levels 4300K")
        .tag(TAG_WB_RB_LEVELS_4500K, "WB RB Levels 4500K")
        .tag(TAG_WB_RB_LEVELS_4800K, "WB RB Levels 4800K")
        .tag(TAG_WB_RB_LEVELS_5300K, "WB RB Levels 5300K")
        .tag(TAG_WB_RB_LEVELS_6000K, "WB RB Levels 6000K")
        .tag(TAG_WB_RB_LEVELS_6600K, "WB RB Levels 6600K")
        .tag(TAG_WB_RB_LEVELS_7500K, "WB RB Levels 7500K")
        .tag(TAG_WB_RB_LEVELS_CWB1, "WB RB Levels CWB1")
        .tag(TAG_WB_RB_LEVELS_CWB2, "WB RB Levels CWB2")
        .tag(TAG_WB_RB_LEVELS_CWB3, "WB RB Levels CWB3")
        .tag(TAG_WB_RB_LEVELS_CWB4, "WB RB Levels CWB4")
        .tag(TAG_WB_G_LEVEL_3000K, "WB G Level 3000K")
        .tag(TAG_WB_G_LEVEL_3300K, "WB G Level 3300K")
        .tag(TAG_WB_G_LEVEL_3600K, "WB G Level 3600K")
        .tag(TAG_WB_G_LEVEL_3900K, "WB G Level 3900K")
        .tag(TAG_WB_G_LEVEL_4000K, "WB G Level 4000K")
        .tag(TAG_WB_G_LEVEL_4300K, "WB G Level 4300K")
        .tag(TAG_WB_G_LEVEL_4500K, "WB G Level 4500K")
        .tag(TAG_WB_G_LEVEL_4800K, "WB G Level 4800K")
        .tag(TAG_WB_G_LEVEL_5300K, "WB G Level 5300K")
        .tag(TAG_WB_G_LEVEL_6000K, "WB G Level 6000K")
        .tag(TAG_WB_G_LEVEL_6600K, "WB G Level 6600K")
        .tag(TAG_WB_G_LEVEL_7500K, "WB G Level 7500K")
        .tag(TAG_WB_G_LEVEL, "WB G Level")
        .tag(TAG_COLOR_MATRIX, "Color Matrix")
        .tag(TAG_ENHANCER, "Enhancer")
        .tag(TAG_ENHANCER_VALUES, "Enhancer Values")
        .tag(TAG_CORING_FILTER, "Coring Filter")
        .tag(TAG_CORING_VALUES, "Coring Values")
        .tag(TAG_BLACK_LEVEL_2, "Black Level 2")
        .tag(TAG_GAIN_BASE, "Gain Base")
        .tag(TAG_VALID_BITS, "Valid Bits")
        .tag(TAG_CROP_LEFT, "Crop Left")
        .tag(TAG_CROP_TOP, "Crop Top")
        .tag(TAG_CROP_WIDTH, "Crop Width")
        .tag(TAG_CROP_HEIGHT, "Crop Height")
        .tag(TAG_UNKNOWN_BLOCK_1, "Unknown Block 1")
        .tag(TAG_UNKNOWN_BLOCK_2, "Unknown Block 2")
        .tag(TAG_SENSOR_CALIBRATION, "Sensor Calibration")
        .tag(TAG_NOISE_REDUCTION_2, "Noise Reduction 2")
        .tag(TAG_DISTORTION_CORRECTION_2, "Distortion Correction 2")
        .tag(TAG_SHADING_COMPENSATION_2, "Shading Compensation 2")
        .tag(TAG_MULTIPLE_EXPOSURE_MODE, "Multiple Exposure Mode")
        .tag(TAG_UNKNOWN_BLOCK_3, "Unknown Block 3")
        .tag(TAG_UNKNOWN_BLOCK_4, "Unknown Block 4")
        .tag(TAG_ASPECT_RATIO, "Aspect Ratio")
        .tag(TAG_ASPECT_FRAME, "Aspect Frame")
        .tag(TAG_FACES_DETECTED, "Faces Detected")
        .tag(TAG_FACE_DETECT_AREA, "Face Detect Area")
        .tag(TAG_MAX_FACES, "Max Faces")
        .tag(TAG_FACE_DETECT_FRAME_SIZE, "Face Detect Frame Size")
        .tag(TAG_FACE_DETECT_FRAME_CROP, "Face Detect Frame Crop")
        .tag(TAG_CAMERA_TEMPERATURE, "Camera Temperature")
        .tag(TAG_KEYSTONE_COMPENSATION, "Keystone Compensation")
        .tag(TAG_KEYSTONE_DIRECTION, "Keystone Direction")
        .tag(TAG_KEYSTONE_VALUE, "Keystone Value")
        .build();

    private OlympusImageProcessingMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
