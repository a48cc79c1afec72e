package com.makernote.core.tag;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable mapping from a vendor's makernote tag ids to their display names.
 *
 * <p>One catalog exists per vendor layout and is held in a {@code static final} field of the
 * vendor's tags class. Catalogs never change after class initialization, so concurrent reads
 * need no coordination.
 *
 * <p><b>Construction:</b>
 * <pre>{@code
 * public static final TagCatalog CATALOG = TagCatalog.builder("Kodak Makernote")
 *     .tag(TAG_KODAK_MODEL, "Kodak Model")
 *     .tag(TAG_QUALITY, "Quality")
 *     .build();
 * }</pre>
 *
 * <p>Registering the same id twice fails with {@link IllegalStateException}, which surfaces as
 * an {@link ExceptionInInitializerError} the first time the vendor class is touched.
 *
 * @since 1.0.0
 */
public final class TagCatalog {

    private final String vendorName;
    private final Map<Integer, String> names;

    private TagCatalog(String vendorName, Map<Integer, String> names) {
        this.vendorName = vendorName;
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
    }

    public static Builder builder(String vendorName) {
        return new Builder(vendorName);
    }

    /**
     * Display name of the directory, for example {@code "Olympus Equipment"}.
     *
     * @return vendor directory name
     */
    public String vendorName() {
        return vendorName;
    }

    /**
     * Looks up the display name of a tag.
     *
     * @param tagId tag identifier, not necessarily known to this vendor
     * @return name, or empty when the id is not in the catalog
     */
    public Optional<String> nameOf(int tagId) {
        return Optional.ofNullable(names.get(tagId));
    }

    /**
     * Returns the display name or the generic {@code Unknown tag (0x....)} rendering.
     *
     * @param tagId tag identifier
     * @return name, never {@code null}
     */
    public String tagName(int tagId) {
        return nameOf(tagId).orElseGet(() -> String.format("Unknown tag (0x%04x)", tagId));
    }

    public boolean contains(int tagId) {
        return names.containsKey(tagId);
    }

    /**
     * Returns all registered tag ids in ascending order.
     *
     * @return sorted ids
     */
    public SortedSet<Integer> tagIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(names.keySet()));
    }

    public Map<Integer, String> asMap() {
        return names;
    }

    public int size() {
        return names.size();
    }

    @Override
    public String toString() {
        return vendorName + " (" + names.size() + " tags)";
    }

    /**
     * Builder collecting {@code (tagId, name)} pairs in declaration order.
     */
    public static final class Builder {

        private final String vendorName;
        private final Map<Integer, String> names = new LinkedHashMap<>();

        private Builder(String vendorName) {
            this.vendorName = Objects.requireNonNull(vendorName, "vendorName must not be null");
        }

        /**
         * Registers a tag.
         *
         * @param tagId tag identifier
         * @param name display name
         * @return this builder
         * @throws IllegalStateException if the id is already registered
         */
        public Builder tag(int tagId, String name) {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Tag name must not be blank for id " + tagId);
            }
            String previous = names.putIfAbsent(tagId, name);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                    "Duplicate tag id 0x%04x in %s: '%s' and '%s'", tagId, vendorName, previous, name));
            }
            return this;
        }

        public TagCatalog build() {
            return new TagCatalog(vendorName, names);
        }
    }
}
