package com.makernote.core.tag;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory {@link TagValues} backed by a map of tag id to decoded value.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TagValues values = MapTagValues.builder()
 *     .put(CasioType1MakernoteTags.TAG_CCD_SENSITIVITY, 64)
 *     .build();
 * }</pre>
 */
public final class MapTagValues implements TagValues {

    private static final MapTagValues EMPTY = new MapTagValues(Map.of());

    private final Map<Integer, Object> values;

    private MapTagValues(Map<Integer, Object> values) {
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public static MapTagValues empty() {
        return EMPTY;
    }

    public static MapTagValues of(int tagId, Object value) {
        return builder().put(tagId, value).build();
    }

    public static MapTagValues copyOf(Map<Integer, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Object getObject(int tagId) {
        return values.get(tagId);
    }

    /**
     * Returns the tag ids that carry a value, in ascending order.
     *
     * @return populated tag ids
     */
    public Set<Integer> tagIds() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "MapTagValues" + values.keySet();
    }

    /**
     * Builder for {@link MapTagValues}. A later {@code put} for the same id replaces the
     * earlier value; {@code null} values are ignored.
     */
    public static final class Builder {

        private final Map<Integer, Object> values = new TreeMap<>();

        private Builder() {
        }

        public Builder put(int tagId, Object value) {
            if (value != null) {
                values.put(tagId, value);
            }
            return this;
        }

        public MapTagValues build() {
            return values.isEmpty() ? EMPTY : new MapTagValues(values);
        }
    }
}
