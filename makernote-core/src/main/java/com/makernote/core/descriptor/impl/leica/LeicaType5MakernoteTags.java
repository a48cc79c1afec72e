package com.makernote.core.descriptor.impl.leica;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Leica "Type 5" makernote written by the X, T and SL bodies.
 */
public final class LeicaType5MakernoteTags {

    public static final int TAG_LENS_MODEL = 0x0303;
    public static final int TAG_ORIGINAL_FILE_NAME = 0x0406;
    public static final int TAG_ORIGINAL_DIRECTORY = 0x0407;
    public static final int TAG_EXPOSURE_MODE = 0x040d;
    public static final int TAG_SHOT_INFO = 0x0410;
    public static final int TAG_FILM_MODE = 0x0412;
    public static final int TAG_WB_RGB_LEVELS = 0x0413;
    public static final int TAG_INTERNAL_SERIAL_NUMBER = 0x0500;

    public static final TagCatalog CATALOG = TagCatalog.builder("Leica Makernote")
        .tag(TAG_LENS_MODEL, "Lens Model")
        .tag(TAG_ORIGINAL_FILE_NAME, "Original File Name")
        .tag(TAG_ORIGINAL_DIRECTORY, "Original Directory")
        .tag(TAG_EXPOSURE_MODE, "Exposure Mode")
        .tag(TAG_SHOT_INFO, "Shot Info")
        .tag(TAG_FILM_MODE, "Film Mode")
        .tag(TAG_WB_RGB_LEVELS, "WB RGB Levels")
        .tag(TAG_INTERNAL_SERIAL_NUMBER, "Internal Serial Number")
        .build();

    private LeicaType5MakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
