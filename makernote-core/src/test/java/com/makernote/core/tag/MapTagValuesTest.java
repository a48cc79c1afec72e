package com.makernote.core.tag;

import com.makernote.core.lang.Rational;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MapTagValues} and the conversions of {@link TagValues}.
 */
class MapTagValuesTest {

    @Test
    void builder_nullValue_isIgnored() {
        MapTagValues values = MapTagValues.builder().put(1, null).put(2, 5).build();

        assertThat(values.tagIds()).containsExactly(2);
        assertThat(values.containsTag(1)).isFalse();
    }

    @Test
    void tagIds_sortedAscending() {
        MapTagValues values = MapTagValues.copyOf(Map.of(9, "a", 3, "b", 5, "c"));

        assertThat(values.tagIds()).containsExactly(3, 5, 9);
        assertThat(values.size()).isEqualTo(3);
    }

    @Test
    void empty_hasNoValues() {
        assertThat(MapTagValues.empty().size()).isZero();
        assertThat(MapTagValues.builder().build()).isSameAs(MapTagValues.empty());
    }

    @Test
    void getInt_convertsNumbersStringsAndSingletons() {
        MapTagValues values = MapTagValues.builder()
            .put(1, 42L)
            .put(2, " 17 ")
            .put(3, new int[]{8})
            .put(4, new byte[]{(byte) 0xFF})
            .put(5, "abc")
            .put(6, new int[]{1, 2})
            .build();

        assertThat(values.getInt(1)).hasValue(42);
        assertThat(values.getInt(2)).hasValue(17);
        assertThat(values.getInt(3)).hasValue(8);
        assertThat(values.getInt(4)).hasValue(255);
        assertThat(values.getInt(5)).isEmpty();
        assertThat(values.getInt(6)).isEmpty();
        assertThat(values.getInt(99)).isEmpty();
    }

    @Test
    void getRational_acceptsIntegersAndText() {
        MapTagValues values = MapTagValues.builder()
            .put(1, new Rational(3, 4))
            .put(2, 7)
            .put(3, "10/4")
            .put(4, 1.5)
            .build();

        assertThat(values.getRational(1)).contains(new Rational(3, 4));
        assertThat(values.getRational(2)).contains(new Rational(7, 1));
        assertThat(values.getRational(3).map(Rational::getDenominator)).contains(4L);
        assertThat(values.getRational(4)).isEmpty();
    }

    @Test
    void getDateTime_parsesExifAndIsoText() {
        MapTagValues values = MapTagValues.builder()
            .put(1, "2020:01:02 03:04:05")
            .put(2, "2020-01-02T03:04:05")
            .put(3, "yesterday")
            .build();

        LocalDateTime expected = LocalDateTime.of(2020, 1, 2, 3, 4, 5);
        assertThat(values.getDateTime(1)).contains(expected);
        assertThat(values.getDateTime(2)).contains(expected);
        assertThat(values.getDateTime(3)).isEmpty();
    }

    @Test
    void getString_arraysAreSpaceJoined() {
        MapTagValues values = MapTagValues.builder()
            .put(1, new int[]{1, 2, 3})
            .put(2, new byte[]{(byte) 200, 1})
            .put(3, new Rational(1, 2))
            .build();

        assertThat(values.getString(1)).contains("1 2 3");
        assertThat(values.getString(2)).contains("200 1");
        assertThat(values.getString(3)).contains("0.5");
    }

    @Test
    void getIntArray_convertsBytesUnsignedAndTextToCodePoints() {
        MapTagValues values = MapTagValues.builder()
            .put(1, new byte[]{(byte) 0x80, 2})
            .put(2, "AB")
            .put(3, new long[]{5L, 6L})
            .build();

        assertThat(values.getIntArray(1)).hasValueSatisfying(a -> assertThat(a).containsExactly(128, 2));
        assertThat(values.getIntArray(2)).hasValueSatisfying(a -> assertThat(a).containsExactly(65, 66));
        assertThat(values.getIntArray(3)).hasValueSatisfying(a -> assertThat(a).containsExactly(5, 6));
    }

    @Test
    void getShortAndByteArray_narrowNumericArrays() {
        MapTagValues values = MapTagValues.of(1, new int[]{1, 65535});

        assertThat(values.getShortArray(1)).hasValueSatisfying(a -> assertThat(a).containsExactly((short) 1, (short) -1));
        assertThat(values.getByteArray(1)).hasValueSatisfying(a -> assertThat(a).containsExactly((byte) 1, (byte) -1));
    }

    @Test
    void getStringArray_wrapsSingleString() {
        MapTagValues values = MapTagValues.builder()
            .put(1, "solo")
            .put(2, new String[]{"a", "b"})
            .build();

        assertThat(values.getStringArray(1)).hasValueSatisfying(a -> assertThat(a).containsExactly("solo"));
        assertThat(values.getStringArray(2)).hasValueSatisfying(a -> assertThat(a).containsExactly("a", "b"));
    }
}
