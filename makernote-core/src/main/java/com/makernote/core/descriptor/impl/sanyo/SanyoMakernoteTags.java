package com.makernote.core.descriptor.impl.sanyo;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Sanyo makernote.
 */
public final class SanyoMakernoteTags {

    public static final int TAG_MAKERNOTE_OFFSET = 0x00FF;
    public static final int TAG_SANYO_THUMBNAIL = 0x0100;
    public static final int TAG_SPECIAL_MODE = 0x0200;
    public static final int TAG_SANYO_QUALITY = 0x0201;
    public static final int TAG_MACRO = 0x0202;
    public static final int TAG_DIGITAL_ZOOM = 0x0204;
    public static final int TAG_SOFTWARE_VERSION = 0x0207;
    public static final int TAG_PICT_INFO = 0x0208;
    public static final int TAG_CAMERA_ID = 0x0209;
    public static final int TAG_SEQUENTIAL_SHOT = 0x020E;
    public static final int TAG_WIDE_RANGE = 0x020F;
    public static final int TAG_COLOR_ADJUSTMENT_MODE = 0x0210;
    public static final int TAG_QUICK_SHOT = 0x0213;
    public static final int TAG_SELF_TIMER = 0x0214;
    public static final int TAG_VOICE_MEMO = 0x0216;
    public static final int TAG_RECORD_SHUTTER_RELEASE = 0x0217;
    public static final int TAG_FLICKER_REDUCE = 0x0218;
    public static final int TAG_OPTICAL_ZOOM_ON = 0x0219;
    public static final int TAG_DIGITAL_ZOOM_ON = 0x021B;
    public static final int TAG_LIGHT_SOURCE_SPECIAL = 0x021D;
    public static final int TAG_RESAVED = 0x021E;
    public static final int TAG_SCENE_SELECT = 0x021F;
    public static final int TAG_MANUAL_FOCUS_DISTANCE_OR_FACE_INFO = 0x0223;
    public static final int TAG_SEQUENCE_SHOT_INTERVAL = 0x0224;
    public static final int TAG_FLASH_MODE = 0x0225;
    public static final int TAG_PRINT_IMAGE_MATCHING_INFO = 0x0E00;
    public static final int TAG_DATA_DUMP = 0x0F00;

    public static final TagCatalog CATALOG = TagCatalog.builder("Sanyo Makernote")
        .tag(TAG_MAKERNOTE_OFFSET, "Makernote Offset")
        .tag(TAG_SANYO_THUMBNAIL, "Sanyo Thumbnail")
        .tag(TAG_SPECIAL_MODE, "Special Mode")
        .tag(TAG_SANYO_QUALITY, "Sanyo Quality")
        .tag(TAG_MACRO, "Macro")
        .tag(TAG_DIGITAL_ZOOM, "Digital Zoom")
        .tag(TAG_SOFTWARE_VERSION, "Software Version")
        .tag(TAG_PICT_INFO, "Pict Info")
        .tag(TAG_CAMERA_ID, "Camera ID")
        .tag(TAG_SEQUENTIAL_SHOT, "Sequential Shot")
        .tag(TAG_WIDE_RANGE, "Wide Range")
        .tag(TAG_COLOR_ADJUSTMENT_MODE, "Color Adjustment Node")
        .tag(TAG_QUICK_SHOT, "Quick Shot")
        .tag(TAG_SELF_TIMER, "Self Timer")
        .tag(TAG_VOICE_MEMO, "Voice Memo")
        .tag(TAG_RECORD_SHUTTER_RELEASE, "Record Shutter Release")
        .tag(TAG_FLICKER_REDUCE, "Flicker Reduce")
        .tag(TAG_OPTICAL_ZOOM_ON, "Optical Zoom On")
        .tag(TAG_DIGITAL_ZOOM_ON, "Digital Zoom On")
        .tag(TAG_LIGHT_SOURCE_SPECIAL, "Light Source Special")
        .tag(TAG_RESAVED, "Resaved")
        .tag(TAG_SCENE_SELECT, "Scene Select")
        .tag(TAG_MANUAL_FOCUS_DISTANCE_OR_FACE_INFO, "Manual Focus Distance or Face Info")
        .tag(TAG_SEQUENCE_SHOT_INTERVAL, "Sequence Shot Interval")
        .tag(TAG_FLASH_MODE, "Flash Mode")
        .tag(TAG_PRINT_IMAGE_MATCHING_INFO, "Print Image Matching (PIM) Info")
        .tag(TAG_DATA_DUMP, "Data Dump")
        .build();

    private SanyoMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
