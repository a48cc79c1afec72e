package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Olympus Equipment sub-IFD (makernote tag {@code 0x2010}).
 */
public final class OlympusEquipmentMakernoteTags {

    public static final int TAG_EQUIPMENT_VERSION = 0x0000;
    public static final int TAG_CAMERA_TYPE_2 = 0x0100;
    public static final int TAG_SERIAL_NUMBER = 0x0101;
    public static final int TAG_INTERNAL_SERIAL_NUMBER = 0x0102;
    public static final int TAG_FOCAL_PLANE_DIAGONAL = 0x0103;
    public static final int TAG_BODY_FIRMWARE_VERSION = 0x0104;
    public static final int TAG_LENS_TYPE = 0x0201;
    public static final int TAG_LENS_SERIAL_NUMBER = 0x0202;
    public static final int TAG_LENS_MODEL = 0x0203;
    public static final int TAG_LENS_FIRMWARE_VERSION = 0x0204;
    public static final int TAG_MAX_APERTURE_AT_MIN_FOCAL = 0x0205;
    public static final int TAG_MAX_APERTURE_AT_MAX_FOCAL = 0x0206;
    public static final int TAG_MIN_FOCAL_LENGTH = 0x0207;
    public static final int TAG_MAX_FOCAL_LENGTH = 0x0208;
    public static final int TAG_MAX_APERTURE = 0x020A;
    public static final int TAG_LENS_PROPERTIES = 0x020B;
    public static final int TAG_EXTENDER = 0x0301;
    public static final int TAG_EXTENDER_SERIAL_NUMBER = 0x0302;
    public static final int TAG_EXTENDER_MODEL = 0x0303;
    public static final int TAG_EXTENDER_FIRMWARE_VERSION = 0x0304;
    public static final int TAG_CONVERSION_LENS = 0x0403;
    public static final int TAG_FLASH_TYPE = 0x1000;
    public static final int TAG_FLASH_MODEL = 0x1001;
    public static final int TAG_FLASH_FIRMWARE_VERSION = 0x1002;
    public static final int TAG_FLASH_SERIAL_NUMBER = 0x1003;

    public static final TagCatalog CATALOG = TagCatalog.builder("Olympus Equipment")
        .tag(TAG_EQUIPMENT_VERSION, "Equipment Version")
        .tag(TAG_CAMERA_TYPE_2, "Camera Type 2")
        .tag(TAG_SERIAL_NUMBER, "Serial Number")
        .tag(TAG_INTERNAL_SERIAL_NUMBER, "Internal Serial Number")
        .tag(TAG_FOCAL_PLANE_DIAGONAL, "Focal Plane Diagonal")
        .tag(TAG_BODY_FIRMWARE_VERSION, "Body Firmware Version")
        .tag(TAG_LENS_TYPE, "Lens Type")
        .tag(TAG_LENS_SERIAL_NUMBER, "Lens Serial Number")
        .tag(TAG_LENS_MODEL, "Lens Model")
        .tag(TAG_LENS_FIRMWARE_VERSION, "Lens Firmware Version")
        .tag(TAG_MAX_APERTURE_AT_MIN_FOCAL, "Max Aperture At Min Focal")
        .tag(TAG_MAX_APERTURE_AT_MAX_FOCAL, "Max Aperture At Max Focal")
        .tag(TAG_MIN_FOCAL_LENGTH, "Min Focal Length")
        .tag(TAG_MAX_FOCAL_LENGTH, "Max Focal Length")
        .tag(TAG_MAX_APERTURE, "Max Aperture")
        .tag(TAG_LENS_PROPERTIES, "Lens Properties")
        .tag(TAG_EXTENDER, "Extender")
        .tag(TAG_EXTENDER_SERIAL_NUMBER, "Extender Serial Number")
        .tag(TAG_EXTENDER_MODEL, "Extender Model")
        .tag(TAG_EXTENDER_FIRMWARE_VERSION, "Extender Firmware Version")
        .tag(TAG_CONVERSION_LENS, "Conversion Lens")
        .tag(TAG_FLASH_TYPE, "Flash Type")
        .tag(TAG_FLASH_MODEL, "Flash Model")
        .tag(TAG_FLASH_FIRMWARE_VERSION, "Flash Firmware Version")
        .tag(TAG_FLASH_SERIAL_NUMBER, "Flash Serial Number")
        .build();

    private OlympusEquipmentMakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
