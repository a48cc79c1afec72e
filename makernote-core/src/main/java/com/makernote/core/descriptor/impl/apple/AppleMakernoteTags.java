package com.makernote.core.descriptor.impl.apple;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the makernote written by Apple iOS devices.
 *
 * <p>Layout documented by ExifTool's Apple table.
 */
public final class AppleMakernoteTags {

    public static final int TAG_MAKERNOTE_VERSION = 0x0001;
    public static final int TAG_AE_MATRIX = 0x0002;
    public static final int TAG_RUN_TIME = 0x0003;
    public static final int TAG_AE_STABLE = 0x0004;
    public static final int TAG_AE_TARGET = 0x0005;
    public static final int TAG_AE_AVERAGE = 0x0006;
    public static final int TAG_AF_STABLE = 0x0007;
    public static final int TAG_ACCELERATION_VECTOR = 0x0008;
    public static final int TAG_HDR_IMAGE_TYPE = 0x000a;
    public static final int TAG_BURST_UUID = 0x000b;
    public static final int TAG_FOCUS_DISTANCE_RANGE = 0x000c;
    public static final int TAG_OIS_MODE = 0x000f;
    public static final int TAG_CONTENT_IDENTIFIER = 0x0011;
    public static final int TAG_IMAGE_CAPTURE_TYPE = 0x0014;
    public static final int TAG_IMAGE_UNIQUE_ID = 0x0015;
    public static final int TAG_LIVE_PHOTO_ID = 0x0017;
    public static final int TAG_IMAGE_PROCESSING_FLAGS = 0x0019;
    public static final int TAG_QUALITY_HINT = 0x001a;
    public static final int TAG_LUMINANCE_NOISE_AMPLITUDE = 0x001d;
    public static final int TAG_IMAGE_CAPTURE_REQUEST_ID = 0x0020;
    public static final int TAG_HDR_HEADROOM = 0x0021;
    public static final int TAG_SCENE_FLAGS = 0x0025;
    public static final int TAG_SIGNAL_TO_NOISE_RATIO_TYPE = 0x0026;
    public static final int TAG_SIGNAL_TO_NOISE_RATIO = 0x0027;
    public static final int TAG_PHOTO_IDENTIFIER = 0x002b;
    public static final int TAG_FOCUS_POSITION = 0x002f;
    public static final int TAG_HDR_GAIN = 0x0030;
    public static final int TAG_AF_MEASURED_DEPTH = 0x0038;
    public static final int TAG_AF_CONFIDENCE = 0x003d;
    public static final int TAG_COLOR_CORRECTION_MATRIX = 0x003e;
    public static final int TAG_GREEN_GHOST_MITIGATION_STATUS = 0x003f;
    public static final int TAG_SEMANTIC_STYLE = 0x0040;
    public static final int TAG_SEMANTIC_STYLE_RENDERING_VER = 0x0041;
    public static final int TAG_SEMANTIC_STYLE_PRESET = 0x0042;
    public static final int TAG_FRONT_FACING_CAMERA = 0x0045;

    public static final TagCatalog CATALOG = TagCatalog.builder("Apple Makernote")
        .tag(TAG_MAKERNOTE_VERSION, "Makernote Version")
        .tag(TAG_AE_MATRIX, "AE Matrix")
        .tag(TAG_RUN_TIME, "Run Time")
        .tag(TAG_AE_STABLE, "AE Stable")
        .tag(TAG_AE_TARGET, "AE Target")
        .tag(TAG_AE_AVERAGE, "AE Average")
        .tag(TAG_AF_STABLE, "AF Stable")
        .tag(TAG_ACCELERATION_VECTOR, "Acceleration Vector")
        .tag(TAG_HDR_IMAGE_TYPE, "HDR Image Type")
        .tag(TAG_BURST_UUID, "Burst UUID")
        .tag(TAG_FOCUS_DISTANCE_RANGE, "Focus Distance Range")
        .tag(TAG_OIS_MODE, "OIS Mode")
        .tag(TAG_CONTENT_IDENTIFIER, "Content Identifier")
        .tag(TAG_IMAGE_CAPTURE_TYPE, "Image Capture Type")
        .tag(TAG_IMAGE_UNIQUE_ID, "Image Unique ID")
        .tag(TAG_LIVE_PHOTO_ID, "Live Photo ID")
        .tag(TAG_IMAGE_PROCESSING_FLAGS, "Image Processing Flags")
        .tag(TAG_QUALITY_HINT, "Quality Hint")
        .tag(TAG_LUMINANCE_NOISE_AMPLITUDE, "Luminance Noise Amplitude")
        .tag(TAG_IMAGE_CAPTURE_REQUEST_ID, "Image Capture Request ID")
        .tag(TAG_HDR_HEADROOM, "HDR Headroom")
        .tag(TAG_SCENE_FLAGS, "Scene Flags")
        .tag(TAG_SIGNAL_TO_NOISE_RATIO_TYPE, "Signal-to-Noise Ratio Type")
        .tag(TAG_SIGNAL_TO_NOISE_RATIO, "Signal-to-Noise Ratio")
        .tag(TAG_PHOTO_IDENTIFIER, "Photo Identifier")
        .tag(TAG_FOCUS_POSITION, "Focus Position")
        .tag(TAG_HDR_GAIN, "HDR Gain")
        .tag(TAG_AF_MEASURED_DEPTH, "AF Measured Depth")
        .tag(TAG_AF_CONFIDENCE, "AF Confidence")
        .tag(TAG_COLOR_CORRECTION_MATRIX, "Color Correction Matrix")
        .tag(TAG_GREEN_GHOST_MITIGATION_STATUS, "Green Ghost Mitigation Status")
        .tag(TAG_SEMANTIC_STYLE, "Semantic Style")
        .tag(TAG_SEMANTIC_STYLE_RENDERING_VER, "Semantic Style Rendering Ver")
        .tag(TAG_SEMANTIC_STYLE_PRESET, "Semantic Style Preset")
        .tag(TAG_FRONT_FACING_CAMERA, "Front Facing Camera")
        .build();

    private AppleMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
