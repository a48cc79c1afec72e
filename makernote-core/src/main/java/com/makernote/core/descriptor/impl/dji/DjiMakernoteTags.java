package com.makernote.core.descriptor.impl.dji;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the DJI drone makernote. Speeds are in metres per second, angles in degrees.
 */
public final class DjiMakernoteTags {

    public static final int TAG_MAKE = 0x0001;
    public static final int TAG_AIRCRAFT_SPEED_X = 0x0003;
    public static final int TAG_AIRCRAFT_SPEED_Y = 0x0004;
    public static final int TAG_AIRCRAFT_SPEED_Z = 0x0005;
    public static final int TAG_AIRCRAFT_PITCH = 0x0006;
    public static final int TAG_AIRCRAFT_YAW = 0x0007;
    public static final int TAG_AIRCRAFT_ROLL = 0x0008;
    public static final int TAG_CAMERA_PITCH = 0x0009;
    public static final int TAG_CAMERA_YAW = 0x000A;
    public static final int TAG_CAMERA_ROLL = 0x000B;

    public static final TagCatalog CATALOG = TagCatalog.builder("DJI Makernote")
        .tag(TAG_MAKE, "Make")
        .tag(TAG_AIRCRAFT_SPEED_X, "Aircraft X Speed")
        .tag(TAG_AIRCRAFT_SPEED_Y, "Aircraft Y Speed")
        .tag(TAG_AIRCRAFT_SPEED_Z, "Aircraft Z Speed")
        .tag(TAG_AIRCRAFT_PITCH, "Aircraft Pitch")
        .tag(TAG_AIRCRAFT_YAW, "Aircraft Yaw")
        .tag(TAG_AIRCRAFT_ROLL, "Aircraft Roll")
        .tag(TAG_CAMERA_PITCH, "Camera Pitch")
        .tag(TAG_CAMERA_YAW, "Camera Yaw")
        .tag(TAG_CAMERA_ROLL, "Camera Roll")
        .build();

    private DjiMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
