package com.makernote.core.descriptor.impl.nikon;

import com.makernote.core.tag.TagCatalog;

/**
 * Fields of the 68-byte Nikon PictureControl version 2 record. Each id is the byte offset of
 * the field within the record.
 */
public final class NikonPictureControl2Tags {

    public static final int TAG_PICTURE_CONTROL_VERSION = 0;
    public static final int TAG_PICTURE_CONTROL_NAME = 4;
    public static final int TAG_PICTURE_CONTROL_BASE = 24;
    public static final int TAG_PICTURE_CONTROL_ADJUST = 48;
    public static final int TAG_PICTURE_CONTROL_QUICK_ADJUST = 49;
    public static final int TAG_SHARPNESS = 51;
    public static final int TAG_CLARITY = 53;
    public static final int TAG_CONTRAST = 55;
    public static final int TAG_BRIGHTNESS = 57;
    public static final int TAG_SATURATION = 59;
    public static final int TAG_HUE = 61;
    public static final int TAG_FILTER_EFFECT = 63;
    public static final int TAG_TONING_EFFECT = 64;
    public static final int TAG_TONING_SATURATION = 65;

    public static final TagCatalog CATALOG = TagCatalog.builder("Nikon PictureControl 2")
        .tag(TAG_PICTURE_CONTROL_VERSION, "Picture Control Version")
        .tag(TAG_PICTURE_CONTROL_NAME, "Picture Control Name")
        .tag(TAG_PICTURE_CONTROL_BASE, "Picture Control Base")
        .tag(TAG_PICTURE_CONTROL_ADJUST, "Picture Control Adjust")
        .tag(TAG_PICTURE_CONTROL_QUICK_ADJUST, "Picture Control Quick Adjust")
        .tag(TAG_SHARPNESS, "Sharpness")
        .tag(TAG_CLARITY, "Clarity")
        .tag(TAG_CONTRAST, "Contrast")
        .tag(TAG_BRIGHTNESS, "Brightness")
        .tag(TAG_SATURATION, "Saturation")
        .tag(TAG_HUE, "Hue")
        .tag(TAG_FILTER_EFFECT, "Filter Effect")
        .tag(TAG_TONING_EFFECT, "Toning Effect")
        .tag(TAG_TONING_SATURATION, "Toning Saturation")
        .build();

    private NikonPictureControl2Tags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
