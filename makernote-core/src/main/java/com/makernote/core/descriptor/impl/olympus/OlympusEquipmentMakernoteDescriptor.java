package com.makernote.core.descriptor.impl.olympus;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags.*;

/**
 * Descriptions for the Olympus Equipment sub-IFD.
 *
 * <p>Lens and extender tags hold six space separated numbers: make, unknown, model,
 * sub-model and two unknowns. The lens is identified by make, model and sub-model, the
 * extender by make and model; both are looked up in hex form, e.g. {@code "0 01 10"}.
 */
public final class OlympusEquipmentMakernoteDescriptor extends AbstractTagDescriptor {

    private static final Map<String, String> LENS_TYPES = Map.ofEntries(
        Map.entry("0 00 00", "None"),
        // Olympus lenses (also Kenko Tokina)
        Map.entry("0 01 00", "Olympus Zuiko Digital ED 50mm F2.0 Macro"),
        Map.entry("0 01 01", "Olympus Zuiko Digital 40-150mm F3.5-4.5"),
        Map.entry("0 01 10", "Olympus M.Zuiko Digital ED 14-42mm F3.5-5.6"),
        Map.entry("0 02 00", "Olympus Zuiko Digital ED 150mm F2.0"),
        Map.entry("0 02 10", "Olympus M.Zuiko Digital 17mm F2.8 Pancake"),
        Map.entry("0 03 00", "Olympus Zuiko Digital ED 300mm F2.8"),
        Map.entry("0 03 10", "Olympus M.Zuiko Digital ED 14-150mm F4.0-5.6 [II]"),
        Map.entry("0 04 10", "Olympus M.Zuiko Digital ED 9-18mm F4.0-5.6"),
        Map.entry("0 05 00", "Olympus Zuiko Digital 14-54mm F2.8-3.5"),
        Map.entry("0 05 01", "Olympus Zuiko Digital Pro ED 90-250mm F2.8"),
        Map.entry("0 05 10", "Olympus M.Zuiko Digital ED 14-42mm F3.5-5.6 L"),
        Map.entry("0 06 00", "Olympus Zuiko Digital ED 50-200mm F2.8-3.5"),
        Map.entry("0 06 01", "Olympus Zuiko Digital ED 8mm F3.5 Fisheye"),
        Map.entry("0 06 10", "Olympus M.Zuiko Digital ED 40-150mm F4.0-5.6"),
        Map.entry("0 07 00", "Olympus Zuiko Digital 11-22mm F2.8-3.5"),
        Map.entry("0 07 01", "Olympus Zuiko Digital 18-180mm F3.5-6.3"),
        Map.entry("0 07 10", "Olympus M.Zuiko Digital ED 12mm F2.0"),
        Map.entry("0 08 01", "Olympus Zuiko Digital 70-300mm F4.0-5.6"),
        Map.entry("0 08 10", "Olympus M.Zuiko Digital ED 75-300mm F4.8-6.7"),
        Map.entry("0 09 10", "Olympus M.Zuiko Digital 14-42mm F3.5-5.6 II"),
        Map.entry("0 10 01", "Kenko Tokina Reflex 300mm F6.3 MF Macro"),
        Map.entry("0 10 10", "Olympus M.Zuiko Digital ED 12-50mm F3.5-6.3 EZ"),
        Map.entry("0 11 10", "Olympus M.Zuiko Digital 45mm F1.8"),
        Map.entry("0 12 10", "Olympus M.Zuiko Digital ED 60mm F2.8 Macro"),
        Map.entry("0 13 10", "Olympus M.Zuiko Digital 14-42mm F3.5-5.6 II R"),
        Map.entry("0 14 10", "Olympus M.Zuiko Digital ED 40-150mm F4.0-5.6 R"),
        Map.entry("0 15 00", "Olympus Zuiko Digital ED 7-14mm F4.0"),
        Map.entry("0 15 10", "Olympus M.Zuiko Digital ED 75mm F1.8"),
        Map.entry("0 16 10", "Olympus M.Zuiko Digital 17mm F1.8"),
        Map.entry("0 17 00", "Olympus Zuiko Digital Pro ED 35-100mm F2.0"),
        Map.entry("0 18 00", "Olympus Zuiko Digital 14-45mm F3.5-5.6"),
        Map.entry("0 18 10", "Olympus M.Zuiko Digital ED 75-300mm F4.8-6.7 II"),
        Map.entry("0 19 10", "Olympus M.Zuiko Digital ED 12-40mm F2.8 Pro"),
        Map.entry("0 20 00", "Olympus Zuiko Digital 35mm F3.5 Macro"),
        Map.entry("0 20 10", "Olympus M.Zuiko Digital ED 40-150mm F2.8 Pro"),
        Map.entry("0 21 10", "Olympus M.Zuiko Digital ED 14-42mm F3.5-5.6 EZ"),
        Map.entry("0 22 00", "Olympus Zuiko Digital 17.5-45mm F3.5-5.6"),
        Map.entry("0 22 10", "Olympus M.Zuiko Digital 25mm F1.8"),
        Map.entry("0 23 00", "Olympus Zuiko Digital ED 14-42mm F3.5-5.6"),
        Map.entry("0 23 10", "Olympus M.Zuiko Digital ED 7-14mm F2.8 Pro"),
        Map.entry("0 24 00", "Olympus Zuiko Digital ED 40-150mm F4.0-5.6"),
        Map.entry("0 24 10", "Olympus M.Zuiko Digital ED 300mm F4.0 IS Pro"),
        Map.entry("0 25 10", "Olympus M.Zuiko Digital ED 8mm F1.8 Fisheye Pro"),
        Map.entry("0 30 00", "Olympus Zuiko Digital ED 50-200mm F2.8-3.5 SWD"),
        Map.entry("0 31 00", "Olympus Zuiko Digital ED 12-60mm F2.8-4.0 SWD"),
        Map.entry("0 32 00", "Olympus Zuiko Digital ED 14-35mm F2.0 SWD"),
        Map.entry("0 33 00", "Olympus Zuiko Digital 25mm F2.8"),
        Map.entry("0 34 00", "Olympus Zuiko Digital ED 9-18mm F4.0-5.6"),
        Map.entry("0 35 00", "Olympus Zuiko Digital 14-54mm F2.8-3.5 II"),
        // Sigma lenses
        Map.entry("1 01 00", "Sigma 18-50mm F3.5-5.6 DC"),
        Map.entry("1 01 10", "Sigma 30mm F2.8 EX DN"),
        Map.entry("1 02 00", "Sigma 55-200mm F4.0-5.6 DC"),
        Map.entry("1 02 10", "Sigma 19mm F2.8 EX DN"),
        Map.entry("1 03 00", "Sigma 18-125mm F3.5-5.6 DC"),
        Map.entry("1 03 10", "Sigma 30mm F2.8 DN | A"),
        Map.entry("1 04 00", "Sigma 18-125mm F3.5-5.6 DC"),
        Map.entry("1 04 10", "Sigma 19mm F2.8 DN | A"),
        Map.entry("1 05 00", "Sigma 30mm F1.4 EX DC HSM"),
        Map.entry("1 05 10", "Sigma 60mm F2.8 DN | A"),
        Map.entry("1 06 00", "Sigma APO 50-500mm F4.0-6.3 EX DG HSM"),
        Map.entry("1 07 00", "Sigma Macro 105mm F2.8 EX DG"),
        Map.entry("1 08 00", "Sigma APO Macro 150mm F2.8 EX DG HSM"),
        Map.entry("1 09 00", "Sigma 18-50mm F2.8 EX DC Macro"),
        Map.entry("1 10 00", "Sigma 24mm F1.8 EX DG Aspherical Macro"),
        Map.entry("1 11 00", "Sigma APO 135-400mm F4.5-5.6 DG"),
        Map.entry("1 12 00", "Sigma APO 300-800mm F5.6 EX DG HSM"),
        Map.entry("1 13 00", "Sigma 30mm F1.4 EX DC HSM"),
        Map.entry("1 14 00", "Sigma APO 50-500mm F4.0-6.3 EX DG HSM"),
        Map.entry("1 15 00", "Sigma 10-20mm F4.0-5.6 EX DC HSM"),
        Map.entry("1 16 00", "Sigma APO 70-200mm F2.8 II EX DG Macro HSM"),
        Map.entry("1 17 00", "Sigma 50mm F1.4 EX DG HSM"),
        // Panasonic/Leica lenses
        Map.entry("2 01 00", "Leica D Vario Elmarit 14-50mm F2.8-3.5 Asph."),
        Map.entry("2 01 10", "Lumix G Vario 14-45mm F3.5-5.6 Asph. Mega OIS"),
        Map.entry("2 02 00", "Leica D Summilux 25mm F1.4 Asph."),
        Map.entry("2 02 10", "Lumix G Vario 45-200mm F4.0-5.6 Mega OIS"),
        Map.entry("2 03 00", "Leica D Vario Elmar 14-50mm F3.8-5.6 Asph. Mega OIS"),
        Map.entry("2 03 01", "Leica D Vario Elmar 14-50mm F3.8-5.6 Asph."),
        Map.entry("2 03 10", "Lumix G Vario HD 14-140mm F4.0-5.8 Asph. Mega OIS"),
        Map.entry("2 04 00", "Leica D Vario Elmar 14-150mm F3.5-5.6"),
        Map.entry("2 04 10", "Lumix G Vario 7-14mm F4.0 Asph."),
        Map.entry("2 05 10", "Lumix G 20mm F1.7 Asph."),
        Map.entry("2 06 10", "Leica DG Macro-Elmarit 45mm F2.8 Asph. Mega OIS"),
        Map.entry("2 07 10", "Lumix G Vario 14-42mm F3.5-5.6 Asph. Mega OIS"),
        Map.entry("2 08 10", "Lumix G Fisheye 8mm F3.5"),
        Map.entry("2 09 10", "Lumix G Vario 100-300mm F4.0-5.6 Mega OIS"),
        Map.entry("2 10 10", "Lumix G 14mm F2.5 Asph."),
        Map.entry("2 11 10", "Lumix G 12.5mm F12 3D"),
        Map.entry("2 12 10", "Leica DG Summilux 25mm F1.4 Asph."),
        Map.entry("2 13 10", "Lumix G X Vario PZ 45-175mm F4.0-5.6 Asph. Power OIS"),
        Map.entry("2 14 10", "Lumix G X Vario PZ 14-42mm F3.5-5.6 Asph. Power OIS"),
        Map.entry("2 15 10", "Lumix G X Vario 12-35mm F2.8 Asph. Power OIS"),
        Map.entry("2 16 10", "Lumix G Vario 45-150mm F4.0-5.6 Asph. Mega OIS"),
        Map.entry("2 17 10", "Lumix G X Vario 35-100mm F2.8 Power OIS"),
        Map.entry("2 18 10", "Lumix G Vario 14-42mm F3.5-5.6 II Asph. Mega OIS"),
        Map.entry("2 19 10", "Lumix G Vario 14-140mm F3.5-5.6 Asph. Power OIS"),
        Map.entry("2 20 10", "Lumix G Vario 12-32mm F3.5-5.6 Asph. Mega OIS"),
        Map.entry("2 21 10", "Leica DG Nocticron 42.5mm F1.2 Asph. Power OIS"),
        Map.entry("2 22 10", "Leica DG Summilux 15mm F1.7 Asph."),
        Map.entry("2 24 10", "Lumix G Macro 30mm F2.8 Asph. Mega OIS"),
        Map.entry("2 25 10", "Lumix G 42.5mm F1.7 Asph. Power OIS"),
        Map.entry("3 01 00", "Leica D Vario Elmarit 14-50mm F2.8-3.5 Asph."),
        Map.entry("3 02 00", "Leica D Summilux 25mm F1.4 Asph."),
        // Tamron lenses
        Map.entry("5 01 10", "Tamron 14-150mm F3.5-5.8 Di III")
    );

    private static final Map<String, String> EXTENDER_TYPES = Map.of(
        "0 00", "None",
        "0 04", "Olympus Zuiko Digital EC-14 1.4x Teleconverter",
        "0 08", "Olympus EX-25 Extension Tube",
        "0 10", "Olympus Zuiko Digital EC-20 2.0x Teleconverter"
    );

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_EQUIPMENT_VERSION -> versionBytes(values, tagId, 4);
            case TAG_CAMERA_TYPE_2 -> values.getString(tagId)
                .map(type -> OlympusCameraTypes.modelOf(type).orElse(type));
            case TAG_FOCAL_PLANE_DIAGONAL -> values.getString(tagId).map(text -> text + " mm");
            case TAG_BODY_FIRMWARE_VERSION, TAG_LENS_FIRMWARE_VERSION ->
                describeInt(values, tagId, OlympusEquipmentMakernoteDescriptor::firmwareVersion);
            case TAG_LENS_TYPE -> values.getString(tagId).flatMap(OlympusEquipmentMakernoteDescriptor::lensType);
            case TAG_MAX_APERTURE_AT_MIN_FOCAL, TAG_MAX_APERTURE_AT_MAX_FOCAL, TAG_MAX_APERTURE ->
                describeInt(values, tagId, value -> DescriptionRules.decimal(maxAperture(value), "0.#"));
            case TAG_LENS_PROPERTIES -> describeInt(values, tagId, value -> String.format(Locale.ROOT, "0x%04X", value));
            case TAG_EXTENDER -> values.getString(tagId).flatMap(OlympusEquipmentMakernoteDescriptor::extender);
            case TAG_FLASH_TYPE -> indexed(values, tagId, "None", null, "Simple E-System", "E-System");
            case TAG_FLASH_MODEL -> indexed(values, tagId,
                "None", "FL-20", "FL-50", "RF-11", "TF-22", "FL-36", "FL-50R", "FL-36R");
            default -> super.describe(tagId, values);
        };
    }

    /**
     * Renders a firmware word such as {@code 0x1234} as {@code "1.234"}.
     */
    static String firmwareVersion(int value) {
        String hex = String.format(Locale.ROOT, "%04X", value);
        return hex.substring(0, hex.length() - 3) + "." + hex.substring(hex.length() - 3);
    }

    static double maxAperture(int value) {
        return Math.pow(Math.sqrt(2.0), (value & 0xFFFF) / 256.0);
    }

    static Optional<String> lensType(String raw) {
        String[] parts = raw.trim().split(" ");
        if (parts.length < 6) {
            return Optional.empty();
        }
        try {
            String key = String.format(Locale.ROOT, "%X %02X %02X",
                Integer.parseInt(parts[0]), Integer.parseInt(parts[2]), Integer.parseInt(parts[3]));
            return Optional.ofNullable(LENS_TYPES.get(key));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static Optional<String> extender(String raw) {
        String[] parts = raw.trim().split(" ");
        if (parts.length < 6) {
            return Optional.empty();
        }
        try {
            String key = String.format(Locale.ROOT, "%X %02X",
                Integer.parseInt(parts[0]), Integer.parseInt(parts[2]));
            return Optional.ofNullable(EXTENDER_TYPES.get(key));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
