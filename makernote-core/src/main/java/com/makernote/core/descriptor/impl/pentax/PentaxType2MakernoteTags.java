package com.makernote.core.descriptor.impl.pentax;

import com.makernote.core.tag.TagCatalog;

/**
 * Tag ids of the Pentax makernote written by later bodies, prefixed with {@code "AOC\0"}.
 */
public final class PentaxType2MakernoteTags {

    public static final int TAG_PENTAX_VERSION = 0x0000;
    public static final int TAG_PENTAX_MODEL_TYPE = 0x0001;
    public static final int TAG_PREVIEW_IMAGE_SIZE = 0x0002;
    public static final int TAG_PREVIEW_IMAGE_LENGTH = 0x0003;
    public static final int TAG_PREVIEW_IMAGE_START = 0x0004;
    public static final int TAG_PENTAX_MODEL_ID = 0x0005;
    public static final int TAG_DATE = 0x0006;
    public static final int TAG_TIME = 0x0007;
    public static final int TAG_QUALITY = 0x0008;
    public static final int TAG_PENTAX_IMAGE_SIZE = 0x0009;
    public static final int TAG_PICTURE_MODE = 0x000B;
    public static final int TAG_FLASH_MODE = 0x000C;
    public static final int TAG_FOCUS_MODE = 0x000D;
    public static final int TAG_AF_POINT_SELECTED = 0x000E;
    public static final int TAG_AF_POINTS_IN_FOCUS = 0x000F;
    public static final int TAG_FOCUS_POSITION = 0x0010;
    public static final int TAG_EXPOSURE_TIME = 0x0012;
    public static final int TAG_F_NUMBER = 0x0013;
    public static final int TAG_ISO = 0x0014;
    public static final int TAG_LIGHT_READING = 0x0015;
    public static final int TAG_EXPOSURE_COMPENSATION = 0x0016;
    public static final int TAG_METERING_MODE = 0x0017;
    public static final int TAG_AUTO_BRACKETING = 0x0018;
    public static final int TAG_WHITE_BALANCE = 0x0019;
    public static final int TAG_WHITE_BALANCE_MODE = 0x001A;
    public static final int TAG_BLUE_BALANCE = 0x001B;
    public static final int TAG_RED_BALANCE = 0x001C;
    public static final int TAG_FOCAL_LENGTH = 0x001D;
    public static final int TAG_DIGITAL_ZOOM = 0x001E;
    public static final int TAG_SATURATION = 0x001F;
    public static final int TAG_CONTRAST = 0x0020;
    public static final int TAG_SHARPNESS = 0x0021;
    public static final int TAG_WORLD_TIME_LOCATION = 0x0022;
    public static final int TAG_HOMETOWN_CITY = 0x0023;
    public static final int TAG_DESTINATION_CITY = 0x0024;
    public static final int TAG_HOMETOWN_DST = 0x0025;
    public static final int TAG_DESTINATION_DST = 0x0026;
    public static final int TAG_DSP_FIRMWARE_VERSION = 0x0027;
    public static final int TAG_CPU_FIRMWARE_VERSION = 0x0028;
    public static final int TAG_FRAME_NUMBER = 0x0029;
    public static final int TAG_EFFECTIVE_LV = 0x002D;
    public static final int TAG_IMAGE_EDITING = 0x0032;
    public static final int TAG_PICTURE_MODE_2 = 0x0033;
    public static final int TAG_DRIVE_MODE = 0x0034;
    public static final int TAG_SENSOR_SIZE = 0x0035;
    public static final int TAG_COLOR_SPACE = 0x0037;
    public static final int TAG_IMAGE_AREA_OFFSET = 0x0038;
    public static final int TAG_RAW_IMAGE_SIZE = 0x0039;
    public static final int TAG_AF_POINTS_IN_FOCUS_2 = 0x003C;
    public static final int TAG_DATA_SCALING = 0x003D;
    public static final int TAG_PREVIEW_IMAGE_BORDERS = 0x003E;
    public static final int TAG_LENS_REC = 0x003F;
    public static final int TAG_SENSITIVITY_ADJUST = 0x0040;
    public static final int TAG_IMAGE_EDIT_COUNT = 0x0041;
    public static final int TAG_CAMERA_TEMPERATURE = 0x0047;
    public static final int TAG_AE_LOCK = 0x0048;
    public static final int TAG_NOISE_REDUCTION = 0x0049;
    public static final int TAG_FLASH_EXPOSURE_COMP = 0x004D;
    public static final int TAG_IMAGE_TONE = 0x004F;
    public static final int TAG_COLOR_TEMPERATURE = 0x0050;
    public static final int TAG_COLOR_TEMP_DAYLIGHT = 0x0053;
    public static final int TAG_COLOR_TEMP_SHADE = 0x0054;
    public static final int TAG_COLOR_TEMP_CLOUDY = 0x0055;
    public static final int TAG_COLOR_TEMP_TUNGSTEN = 0x0056;
    public static final int TAG_COLOR_TEMP_FLUORESCENT_D = 0x0057;
    public static final int TAG_COLOR_TEMP_FLUORESCENT_N = 0x0058;
    public static final int TAG_COLOR_TEMP_FLUORESCENT_W = 0x0059;
    public static final int TAG_COLOR_TEMP_FLASH = 0x005A;
    public static final int TAG_SHAKE_REDUCTION_INFO = 0x005C;
    public static final int TAG_SHUTTER_COUNT = 0x005D;
    public static final int TAG_FACE_INFO = 0x0060;
    public static final int TAG_RAW_DEVELOPMENT_PROCESS = 0x0062;
    public static final int TAG_HUE = 0x0067;
    public static final int TAG_AWB_INFO = 0x0068;
    public static final int TAG_DYNAMIC_RANGE_EXPANSION = 0x0069;
    public static final int TAG_TIME_INFO = 0x006B;
    public static final int TAG_HIGH_LOW_KEY_ADJ = 0x006C;
    public static final int TAG_CONTRAST_HIGHLIGHT = 0x006D;
    public static final int TAG_CONTRAST_SHADOW = 0x006E;
    public static final int TAG_CONTRAST_HIGHLIGHT_SHADOW_ADJ = 0x006F;
    public static final int TAG_FINE_SHARPNESS = 0x0070;
    public static final int TAG_HIGH_ISO_NOISE_REDUCTION = 0x0071;
    public static final int TAG_AF_ADJUSTMENT = 0x0072;
    public static final int TAG_MONOCHROME_FILTER_EFFECT = 0x0073;
    public static final int TAG_MONOCHROME_TONING = 0x0074;
    public static final int TAG_FACE_DETECT = 0x0076;
    public static final int TAG_FACE_DETECT_FRAME_SIZE = 0x0077;
    public static final int TAG_SHADOW_CORRECTION = 0x0079;
    public static final int TAG_ISO_AUTO_PARAMETERS = 0x007A;
    public static final int TAG_CROSS_PROCESS = 0x007B;
    public static final int TAG_LENS_CORR = 0x007D;
    public static final int TAG_WHITE_LEVEL = 0x007E;
    public static final int TAG_BLEACH_BYPASS_TONING = 0x007F;
    public static final int TAG_ASPECT_RATIO = 0x0080;
    public static final int TAG_BLUR_CONTROL = 0x0082;
    public static final int TAG_HDR = 0x0085;
    public static final int TAG_SHUTTER_TYPE = 0x0087;
    public static final int TAG_NEUTRAL_DENSITY_FILTER = 0x0088;
    public static final int TAG_ISO_2 = 0x008B;
    public static final int TAG_INTERVAL_SHOOTING = 0x0092;
    public static final int TAG_SKIN_TONE_CORRECTION = 0x0095;
    public static final int TAG_CLARITY_CONTROL = 0x0096;
    public static final int TAG_BLACK_POINT = 0x0200;
    public static final int TAG_WHITE_POINT = 0x0201;
    public static final int TAG_COLOR_MATRIX_A = 0x0203;
    public static final int TAG_COLOR_MATRIX_B = 0x0204;
    public static final int TAG_CAMERA_SETTINGS = 0x0205;
    public static final int TAG_AE_INFO = 0x0206;
    public static final int TAG_LENS_INFO = 0x0207;
    public static final int TAG_FLASH_INFO = 0x0208;
    public static final int TAG_AE_METERING_SEGMENTS = 0x0209;
    public static final int TAG_FLASH_METERING_SEGMENTS = 0x020A;
    public static final int TAG_SLAVE_FLASH_METERING_SEGMENTS = 0x020B;
    public static final int TAG_WB_RGGB_LEVELS_DAYLIGHT = 0x020D;
    public static final int TAG_WB_RGGB_LEVELS_SHADE = 0x020E;
    public static final int TAG_WB_RGGB_LEVELS_CLOUDY = 0x020F;
    public static final int TAG_WB_RGGB_LEVELS_TUNGSTEN = 0x0210;
    public static final int TAG_WB_RGGB_LEVELS_FLUORESCENT_D = 0x0211;
    public static final int TAG_WB_RGGB_LEVELS_FLUORESCENT_N = 0x0212;
    public static final int TAG_WB_RGGB_LEVELS_FLUORESCENT_W = 0x0213;
    public static final int TAG_WB_RGGB_LEVELS_FLASH = 0x0214;
    public static final int TAG_CAMERA_INFO = 0x0215;
    public static final int TAG_BATTERY_INFO = 0x0216;
    public static final int TAG_SATURATION_INFO = 0x021B;
    public static final int TAG_COLOR_MATRIX_A2 = 0x021C;
    public static final int TAG_COLOR_MATRIX_B2 = 0x021D;
    public static final int TAG_AF_INFO = 0x021F;
    public static final int TAG_HUFFMAN_TABLE = 0x0220;
    public static final int TAG_KELVIN_WB = 0x0221;
    public static final int TAG_COLOR_INFO = 0x0222;
    public static final int TAG_EV_STEP_INFO = 0x0224;
    public static final int TAG_SHOT_INFO = 0x0226;
    public static final int TAG_FACE_POS = 0x0227;
    public static final int TAG_FACE_SIZE = 0x0228;
    public static final int TAG_SERIAL_NUMBER = 0x0229;
    public static final int TAG_FILTER_INFO = 0x022A;
    public static final int TAG_LEVEL_INFO = 0x022B;
    public static final int TAG_WB_LEVELS = 0x022D;
    public static final int TAG_ARTIST = 0x022E;
    public static final int TAG_COPYRIGHT = 0x022F;
    public static final int TAG_FIRMWARE_VERSION = 0x0230;
    public static final int TAG_CONTRAST_DETECT_AF_AREA = 0x0231;
    public static final int TAG_CROSS_PROCESS_PARAMS = 0x0235;
    public static final int TAG_LENS_INFO_Q = 0x0239;
    public static final int TAG_MODEL = 0x023F;
    public static final int TAG_PIXEL_SHIFT_INFO = 0x0243;
    public static final int TAG_AF_POINT_INFO = 0x0245;
    public static final int TAG_DATA_DUMP = 0x02FE;
    public static final int TAG_TEMP_INFO = 0x03FF;
    public static final int TAG_TONE_CURVE = 0x0402;
    public static final int TAG_TONE_CURVES = 0x0403;
    public static final int TAG_UNKNOWN_BLOCK = 0x0405;
    public static final int TAG_PRINT_IM = 0x0E00;

    public static final TagCatalog CATALOG = TagCatalog.builder("Pentax Makernote")
        .tag(TAG_PENTAX_VERSION, "PentaxVersion")
        .tag(TAG_PENTAX_MODEL_TYPE, "PentaxModelType")
        .tag(TAG_PREVIEW_IMAGE_SIZE, "PreviewImageSize")
        .tag(TAG_PREVIEW_IMAGE_LENGTH, "PreviewImageLength")
        .tag(TAG_PREVIEW_IMAGE_START, "PreviewImageStart")
        .tag(TAG_PENTAX_MODEL_ID, "PentaxModelId")
        .tag(TAG_DATE, "Date")
        .tag(TAG_TIME, "Time")
        .tag(TAG_QUALITY, "Quality")
        .tag(TAG_PENTAX_IMAGE_SIZE, "PentaxImageSize")
        .tag(TAG_PICTURE_MODE, "PictureMode")
        .tag(TAG_FLASH_MODE, "FlashMode")
        .tag(TAG_FOCUS_MODE, "FocusMode")
        .tag(TAG_AF_POINT_SELECTED, "AFPointSelected")
        .tag(TAG_AF_POINTS_IN_FOCUS, "AFPointsInFocus")
        .tag(TAG_FOCUS_POSITION, "FocusPosition")
        .tag(TAG_EXPOSURE_TIME, "ExposureTime")
        .tag(TAG_F_NUMBER, "FNumber")
        .tag(TAG_ISO, "Iso")
        .tag(TAG_LIGHT_READING, "LightReading")
        .tag(TAG_EXPOSURE_COMPENSATION, "ExposureCompensation")
        .tag(TAG_METERING_MODE, "MeteringMode")
        .tag(TAG_AUTO_BRACKETING, "AutoBracketing")
        .tag(TAG_WHITE_BALANCE, "WhiteBalance")
        .tag(TAG_WHITE_BALANCE_MODE, "WhiteBalanceMode")
        .tag(TAG_BLUE_BALANCE, "BlueBalance")
        .tag(TAG_RED_BALANCE, "RedBalance")
        .tag(TAG_FOCAL_LENGTH, "FocalLength")
        .tag(TAG_DIGITAL_ZOOM, "DigitalZoom")
        .tag(TAG_SATURATION, "Saturation")
        .tag(TAG_CONTRAST, "Contrast")
        .tag(TAG_SHARPNESS, "Sharpness")
        .tag(TAG_WORLD_TIME_LOCATION, "WorldTimeLocation")
        .tag(TAG_HOMETOWN_CITY, "HometownCity")
        .tag(TAG_DESTINATION_CITY, "DestinationCity")
        .tag(TAG_HOMETOWN_DST, "HometownDST")
        .tag(TAG_DESTINATION_DST, "DestinationDST")
        .tag(TAG_DSP_FIRMWARE_VERSION, "DSPFirmwareVersion")
        .tag(TAG_CPU_FIRMWARE_VERSION, "CPUFirmwareVersion")
        .tag(TAG_FRAME_NUMBER, "FrameNumber")
        .tag(TAG_EFFECTIVE_LV, "EffectiveLV")
        .tag(TAG_IMAGE_EDITING, "ImageEditing")
        .tag(TAG_PICTURE_MODE_2, "PictureMode2")
        .tag(TAG_DRIVE_MODE, "DriveMode")
        .tag(TAG_SENSOR_SIZE, "SensorSize")
        .tag(TAG_COLOR_SPACE, "ColorSpace")
        .tag(TAG_IMAGE_AREA_OFFSET, "ImageAreaOffset")
        .tag(TAG_RAW_IMAGE_SIZE, "RawImageSize")
        .tag(TAG_AF_POINTS_IN_FOCUS_2, "AFPointsInFocus2")
        .tag(TAG_DATA_SCALING, "DataScaling")
        .tag(TAG_PREVIEW_IMAGE_BORDERS, "PreviewImageBorders")
        .tag(TAG_LENS_REC, "LensRec")
        .tag(TAG_SENSITIVITY_ADJUST, "SensitivityAdjust")
        .tag(TAG_IMAGE_EDIT_COUNT, "ImageEditCount")
        .tag(TAG_CAMERA_TEMPERATURE, "CameraTemperature")
        .tag(TAG_AE_LOCK, "AELock")
        .tag(TAG_NOISE_REDUCTION, "NoiseReduction")
        .tag(TAG_FLASH_EXPOSURE_COMP, "FlashExposureComp")
        .tag(TAG_IMAGE_TONE, "ImageTone")
        .tag(TAG_COLOR_TEMPERATURE, "ColorTemperature")
        .tag(TAG_COLOR_TEMP_DAYLIGHT, "ColorTempDaylight")
        .tag(TAG_COLOR_TEMP_SHADE, "ColorTempShade")
        .tag(TAG_COLOR_TEMP_CLOUDY, "ColorTempCloudy")
        .tag(TAG_COLOR_TEMP_TUNGSTEN, "ColorTempTungsten")
        .tag(TAG_COLOR_TEMP_FLUORESCENT_D, "ColorTempFluorescentD")
        .tag(TAG_COLOR_TEMP_FLUORESCENT_N, "ColorTempFluorescentN")
        .tag(TAG_COLOR_TEMP_FLUORESCENT_W, "ColorTempFluorescentW")
        .tag(TAG_COLOR_TEMP_FLASH, "ColorTempFlash")
        .tag(TAG_SHAKE_REDUCTION_INFO, "ShakeReductionInfo")
        .tag(TAG_SHUTTER_COUNT, "ShutterCount")
        .tag(TAG_FACE_INFO, "FaceInfo")
        .tag(TAG_RAW_DEVELOPMENT_PROCESS, "RawDevelopmentProcess")
        .tag(TAG_HUE, "Hue")
        .tag(TAG_AWB_INFO, "AWBInfo")
        .tag(TAG_DYNAMIC_RANGE_EXPANSION, "DynamicRangeExpansion")
        .tag(TAG_TIME_INFO, "TimeInfo")
        .tag(TAG_HIGH_LOW_KEY_ADJ, "HighLowKeyAdj")
        .tag(TAG_CONTRAST_HIGHLIGHT, "ContrastHighlight")
        .tag(TAG_CONTRAST_SHADOW, "ContrastShadow")
        .tag(TAG_CONTRAST_HIGHLIGHT_SHADOW_ADJ, "ContrastHighlightShadowAdj")
        .tag(TAG_FINE_SHARPNESS, "FineSharpness")
        .tag(TAG_HIGH_ISO_NOISE_REDUCTION, "HighISONoiseReduction")
        .tag(TAG_AF_ADJUSTMENT, "AFAdjustment")
        .tag(TAG_MONOCHROME_FILTER_EFFECT, "MonochromeFilterEffect")
        .tag(TAG_MONOCHROME_TONING, "MonochromeToning")
        .tag(TAG_FACE_DETECT, "FaceDetect")
        .tag(TAG_FACE_DETECT_FRAME_SIZE, "FaceDetectFrameSize")
        .tag(TAG_SHADOW_CORRECTION, "ShadowCorrection")
        .tag(TAG_ISO_AUTO_PARAMETERS, "ISOAutoParameters")
        .tag(TAG_CROSS_PROCESS, "CrossProcess")
        .tag(TAG_LENS_CORR, "LensCorr")
        .tag(TAG_WHITE_LEVEL, "WhiteLevel")
        .tag(TAG_BLEACH_BYPASS_TONING, "BleachBypassToning")
        .tag(TAG_ASPECT_RATIO, "AspectRatio")
        .tag(TAG_BLUR_CONTROL, "BlurControl")
        .tag(TAG_HDR, "HDR")
        .tag(TAG_SHUTTER_TYPE, "ShutterType")
        .tag(TAG_NEUTRAL_DENSITY_FILTER, "NeutralDensityFilter")
        .tag(TAG_ISO_2, "ISO")
        .tag(TAG_INTERVAL_SHOOTING, "IntervalShooting")
        .tag(TAG_SKIN_TONE_CORRECTION, "SkinToneCorrection")
        .tag(TAG_CLARITY_CONTROL, "ClarityControl")
        .tag(TAG_BLACK_POINT, "BlackPoint")
        .tag(TAG_WHITE_POINT, "WhitePoint")
        .tag(TAG_COLOR_MATRIX_A, "ColorMatrixA")
        .tag(TAG_COLOR_MATRIX_B, "ColorMatrixB")
        .tag(TAG_CAMERA_SETTINGS, "CameraSettings")
        .tag(TAG_AE_INFO, "AEInfo")
        .tag(TAG_LENS_INFO, "LensInfo")
        .tag(TAG_FLASH_INFO, "FlashInfo")
        .tag(TAG_AE_METERING_SEGMENTS, "AEMeteringSegments")
        .tag(TAG_FLASH_METERING_SEGMENTS, "FlashMeteringSegments")
        .tag(TAG_SLAVE_FLASH_METERING_SEGMENTS, "SlaveFlashMeteringSegments")
        .tag(TAG_WB_RGGB_LEVELS_DAYLIGHT, "WB_RGGBLevelsDaylight")
        .tag(TAG_WB_RGGB_LEVELS_SHADE, "WB_RGGBLevelsShade")
        .tag(TAG_WB_RGGB_LEVELS_CLOUDY, "WB_RGGBLevelsCloudy")
        .tag(TAG_WB_RGGB_LEVELS_TUNGSTEN, "WB_RGGBLevelsTungsten")
        .tag(TAG_WB_RGGB_LEVELS_FLUORESCENT_D, "WB_RGGBLevelsFluorescentD")
        .tag(TAG_WB_RGGB_LEVELS_FLUORESCENT_N, "WB_RGGBLevelsFluorescentN")
        .tag(TAG_WB_RGGB_LEVELS_FLUORESCENT_W, "WB_RGGBLevelsFluorescentW")
        .tag(TAG_WB_RGGB_LEVELS_FLASH, "WB_RGGBLevelsFlash")
        .tag(TAG_CAMERA_INFO, "CameraInfo")
        .tag(TAG_BATTERY_INFO, "BatteryInfo")
        .tag(TAG_SATURATION_INFO, "SaturationInfo")
        .tag(TAG_COLOR_MATRIX_A2, "ColorMatrixA2")
        .tag(TAG_COLOR_MATRIX_B2, "ColorMatrixB2")
        .tag(TAG_AF_INFO, "AFInfo")
        .tag(TAG_HUFFMAN_TABLE, "HuffmanTable")
        .tag(TAG_KELVIN_WB, "KelvinWB")
        .tag(TAG_COLOR_INFO, "ColorInfo")
        .tag(TAG_EV_STEP_INFO, "EVStepInfo")
        .tag(TAG_SHOT_INFO, "ShotInfo")
        .tag(TAG_FACE_POS, "FacePos")
        .tag(TAG_FACE_SIZE, "FaceSize")
        .tag(TAG_SERIAL_NUMBER, "SerialNumber")
        .tag(TAG_FILTER_INFO, "FilterInfo")
        .tag(TAG_LEVEL_INFO, "LevelInfo")
        .tag(TAG_WB_LEVELS, "WBLevels")
        .tag(TAG_ARTIST, "Artist")
        .tag(TAG_COPYRIGHT, "Copyright")
        .tag(TAG_FIRMWARE_VERSION, "FirmwareVersion")
        .tag(TAG_CONTRAST_DETECT_AF_AREA, "ContrastDetectAFArea")
        .tag(TAG_CROSS_PROCESS_PARAMS, "CrossProcessParams")
        .tag(TAG_LENS_INFO_Q, "LensInfoQ")
        .tag(TAG_MODEL, "Model")
        .tag(TAG_PIXEL_SHIFT_INFO, "PixelShiftInfo")
        .tag(TAG_AF_POINT_INFO, "AFPointInfo")
        .tag(TAG_DATA_DUMP, "DataDump")
        .tag(TAG_TEMP_INFO, "TempInfo")
        .tag(TAG_TONE_CURVE, "ToneCurve")
        .tag(TAG_TONE_CURVES, "ToneCurves")
        .tag(TAG_UNKNOWN_BLOCK, "UnknownBlock")
        .tag(TAG_PRINT_IM, "PrintIM")
        .build();

    private PentaxType2MakernoteTags() {
        throw new AssertionError("Constants class should not be instantiated");
    }
}
