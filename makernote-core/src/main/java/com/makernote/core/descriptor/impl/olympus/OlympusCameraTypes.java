package com.makernote.core.descriptor.impl.olympus;

import java.util.Map;
import java.util.Optional;

/**
 * Olympus internal camera type codes and the model names they stand for.
 */
final class OlympusCameraTypes {

    private static final Map<String, String> MODELS = Map.ofEntries(
        Map.entry("D4028", "X-2,C-50Z"),
        Map.entry("D4029", "E-20,E-20N,E-20P"),
        Map.entry("D4034", "C720UZ"),
        Map.entry("D4040", "E-1"),
        Map.entry("D4041", "E-300"),
        Map.entry("S0003", "E-330"),
        Map.entry("S0004", "E-500"),
        Map.entry("S0009", "E-400"),
        Map.entry("S0010", "E-510"),
        Map.entry("S0011", "E-3"),
        Map.entry("S0013", "E-410"),
        Map.entry("S0016", "E-420"),
        Map.entry("S0017", "E-30"),
        Map.entry("S0018", "E-520"),
        Map.entry("S0019", "E-P1"),
        Map.entry("S0023", "E-620"),
        Map.entry("S0026", "E-P2"),
        Map.entry("S0027", "E-PL1"),
        Map.entry("S0029", "E-450"),
        Map.entry("S0030", "E-600"),
        Map.entry("S0032", "E-P3"),
        Map.entry("S0033", "E-5"),
        Map.entry("S0034", "E-PL2"),
        Map.entry("S0036", "E-M5"),
        Map.entry("S0038", "E-PL3"),
        Map.entry("S0039", "E-PM1"),
        Map.entry("S0040", "E-PL1s"),
        Map.entry("S0042", "E-PL5"),
        Map.entry("S0043", "E-PM2"),
        Map.entry("S0044", "E-P5"),
        Map.entry("S0045", "E-PL6"),
        Map.entry("S0046", "E-PL7"),
        Map.entry("S0047", "E-M1"),
        Map.entry("S0051", "E-M10"),
        Map.entry("S0052", "E-M5MarkII"),
        Map.entry("S0059", "E-M10MarkII"),
        Map.entry("S0061", "PEN-F"),
        Map.entry("S0065", "E-PL8"),
        Map.entry("S0067", "E-M1MarkII"),
        Map.entry("S0068", "E-M10MarkIII"),
        Map.entry("S0076", "E-PL9")
    );

    private OlympusCameraTypes() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static Optional<String> modelOf(String cameraType) {
        return Optional.ofNullable(MODELS.get(cameraType.trim()));
    }
}
