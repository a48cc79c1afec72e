package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Olympus Focus Info sub-IFD (makernote tag {@code 0x2050}).
 */
public final class OlympusFocusInfoMakernoteTags {

    public static final int TAG_FOCUS_INFO_VERSION = 0x0000;
    public static final int TAG_AUTO_FOCUS = 0x0209;
    public static final int TAG_SCENE_DETECT = 0x0210;
    public static final int TAG_SCENE_AREA = 0x0211;
    public static final int TAG_SCENE_DETECT_DATA = 0x0212;
    public static final int TAG_ZOOM_STEP_COUNT = 0x0300;
    public static final int TAG_FOCUS_STEP_COUNT = 0x0301;
    public static final int TAG_FOCUS_STEP_INFINITY = 0x0303;
    public static final int TAG_FOCUS_STEP_NEAR = 0x0304;
    public static final int TAG_FOCUS_DISTANCE = 0x0305;
    public static final int TAG_AF_POINT = 0x0308;
    // 0x031a holds continuous AF parameters on some bodies
    public static final int TAG_AF_INFO = 0x0328;
    public static final int TAG_EXTERNAL_FLASH = 0x1201;
    public static final int TAG_EXTERNAL_FLASH_GUIDE_NUMBER = 0x1203;
    public static final int TAG_EXTERNAL_FLASH_BOUNCE = 0x1204;
    public static final int TAG_EXTERNAL_FLASH_ZOOM = 0x1205;
    public static final int TAG_INTERNAL_FLASH = 0x1208;
    public static final int TAG_MANUAL_FLASH = 0x1209;
    public static final int TAG_MACRO_LED = 0x120A;
    public static final int TAG_SENSOR_TEMPERATURE = 0x1500;
    public static final int TAG_IMAGE_STABILIZATION = 0x1600;

    public static final TagCatalog CATALOG = TagCatalog.builder("Olympus Focus Info")
        .tag(TAG_FOCUS_INFO_VERSION, "Focus Info Version")
        .tag(TAG_AUTO_FOCUS, "Auto Focus")
        .tag(TAG_SCENE_DETECT, "Scene Detect")
        .tag(TAG_SCENE_AREA, "Scene Area")
        .tag(TAG_SCENE_DETECT_DATA, "Scene Detect Data")
        .tag(TAG_ZOOM_STEP_COUNT, "Zoom Step Count")
        .tag(TAG_FOCUS_STEP_COUNT, "Focus Step Count")
        .tag(TAG_FOCUS_STEP_INFINITY, "Focus Step Infinity")
        .tag(TAG_FOCUS_STEP_NEAR, "Focus Step Near")
        .tag(TAG_FOCUS_DISTANCE, "Focus Distance")
        .tag(TAG_AF_POINT, "AF Point")
        .tag(TAG_AF_INFO, "AF Info")
        .tag(TAG_EXTERNAL_FLASH, "External Flash")
        .tag(TAG_EXTERNAL_FLASH_GUIDE_NUMBER, "External Flash Guide Number")
        .tag(TAG_EXTERNAL_FLASH_BOUNCE, "External Flash Bounce")
        .tag(TAG_EXTERNAL_FLASH_ZOOM, "External Flash Zoom")
        .tag(TAG_INTERNAL_FLASH, "Internal Flash")
        .tag(TAG_MANUAL_FLASH, "Manual Flash")
        .tag(TAG_MACRO_LED, "Macro LED")
        .tag(TAG_SENSOR_TEMPERATURE, "Sensor Temperature")
        .tag(TAG_IMAGE_STABILIZATION, "Image Stabilization")
        .build();

    private OlympusFocusInfoMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
