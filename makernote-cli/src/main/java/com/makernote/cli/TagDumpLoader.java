package com.makernote.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.makernote.core.lang.Rational;
import com.makernote.core.tag.MapTagValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Reads a decoded makernote directory from a JSON or YAML file.
 *
 * <p>The document is a map of tag id to value. Ids are decimal or {@code 0x} hexadecimal.
 * Values map onto the types {@link com.makernote.core.tag.TagValues} understands:
 * <ul>
 *   <li>integral numbers become {@code Integer} (or {@code Long} when out of range)</li>
 *   <li>other numbers become {@code Double}</li>
 *   <li>strings stay strings</li>
 *   <li>{@code {numerator: n, denominator: d}} becomes a {@link Rational}</li>
 *   <li>arrays become {@code int[]}, {@code long[]}, {@code double[]}, {@code String[]}
 *       or {@code Rational[]} by element type</li>
 * </ul>
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * 0x0009: DC4800
 * 0x0010: 2160
 * 0x0305: { numerator: 1, denominator: 0 }
 * 0x1600: [0, 0, 0, 0]
 * }</pre>
 */
public class TagDumpLoader {

    private static final Logger log = LoggerFactory.getLogger(TagDumpLoader.class);

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads a dump file, choosing YAML for {@code .yaml}/{@code .yml} and JSON otherwise.
     *
     * @param file dump file
     * @return decoded tag values
     * @throws IOException if the file cannot be read or parsed
     * @throws IllegalArgumentException if an id or value has an unsupported shape
     */
    public MapTagValues load(Path file) throws IOException {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new IOException("File not found or not readable");
        }

        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? yamlMapper : jsonMapper;
        log.debug("Parsing tag dump {} as {}", file, mapper == yamlMapper ? "YAML" : "JSON");

        return toValues(mapper.readTree(file.toFile()));
    }

    /**
     * Converts an already parsed dump document.
     *
     * @param root document root, must be an object
     * @return decoded tag values
     */
    public MapTagValues toValues(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return MapTagValues.empty();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Tag dump must be a map of tag id to value");
        }

        MapTagValues.Builder builder = MapTagValues.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            int tagId = parseTagId(field.getKey());
            builder.put(tagId, toValue(field.getKey(), field.getValue()));
        }
        return builder.build();
    }

    // ==================== Conversion ====================

    static int parseTagId(String key) {
        String text = key.trim();
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return Integer.parseInt(text.substring(2), 16);
            }
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid tag id '" + key + "'", e);
        }
    }

    private static Object toValue(String key, JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : (Object) node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isObject()) {
            return toRational(key, node);
        }
        if (node.isArray()) {
            return toArray(key, node);
        }
        throw new IllegalArgumentException("Unsupported value for tag " + key + ": " + node);
    }

    private static Rational toRational(String key, JsonNode node) {
        JsonNode numerator = node.get("numerator");
        JsonNode denominator = node.get("denominator");
        if (numerator == null || denominator == null
                || !numerator.isIntegralNumber() || !denominator.isIntegralNumber()) {
            throw new IllegalArgumentException(
                "Object value for tag " + key + " must be {numerator, denominator}: " + node);
        }
        return new Rational(numerator.longValue(), denominator.longValue());
    }

    private static Object toArray(String key, JsonNode node) {
        int size = node.size();
        if (allMatch(node, JsonNode::isIntegralNumber)) {
            if (allMatch(node, JsonNode::canConvertToInt)) {
                int[] ints = new int[size];
                for (int i = 0; i < size; i++) {
                    ints[i] = node.get(i).intValue();
                }
                return ints;
            }
            long[] longs = new long[size];
            for (int i = 0; i < size; i++) {
                longs[i] = node.get(i).longValue();
            }
            return longs;
        }
        if (allMatch(node, JsonNode::isNumber)) {
            double[] doubles = new double[size];
            for (int i = 0; i < size; i++) {
                doubles[i] = node.get(i).doubleValue();
            }
            return doubles;
        }
        if (allMatch(node, JsonNode::isTextual)) {
            String[] strings = new String[size];
            for (int i = 0; i < size; i++) {
                strings[i] = node.get(i).textValue();
            }
            return strings;
        }
        if (allMatch(node, JsonNode::isObject)) {
            Rational[] rationals = new Rational[size];
            for (int i = 0; i < size; i++) {
                rationals[i] = toRational(key, node.get(i));
            }
            return rationals;
        }
        throw new IllegalArgumentException("Array value for tag " + key + " mixes element types: " + node);
    }

    private static boolean allMatch(JsonNode array, Predicate<JsonNode> predicate) {
        for (JsonNode element : array) {
            if (!predicate.test(element)) {
                return false;
            }
        }
        return true;
    }
}
