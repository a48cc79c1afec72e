package com.makernote.core.lang;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Rational}.
 */
class RationalTest {

    @Test
    void doubleValue_zeroNumerator_returnsZeroEvenWithZeroDenominator() {
        assertThat(new Rational(0, 0).doubleValue()).isZero();
        assertThat(new Rational(0, 5).doubleValue()).isZero();
    }

    @Test
    void doubleValue_regularFraction_divides() {
        assertThat(new Rational(1, 4).doubleValue()).isEqualTo(0.25);
        assertThat(new Rational(-3, 2).doubleValue()).isEqualTo(-1.5);
    }

    @Test
    void toSimpleString_integerValue_printsInteger() {
        assertThat(new Rational(10, 2).toSimpleString(true)).isEqualTo("5");
        assertThat(new Rational(7, 1).toSimpleString(false)).isEqualTo("7");
    }

    @Test
    void toSimpleString_unitFraction_reducesToOneOverN() {
        assertThat(new Rational(2, 8).toSimpleString(false)).isEqualTo("1/4");
    }

    @Test
    void toSimpleString_shortDecimalAllowed_printsDecimal() {
        assertThat(new Rational(3, 2).toSimpleString(true)).isEqualTo("1.5");
        assertThat(new Rational(3, 2).toSimpleString(false)).isEqualTo("3/2");
    }

    @Test
    void toSimpleString_zeroDenominator_printsRawFraction() {
        assertThat(new Rational(1, 0).toSimpleString(true)).isEqualTo("1/0");
    }

    @Test
    void isPositive_signsAndZero_evaluatesCorrectly() {
        assertThat(new Rational(1, 2).isPositive()).isTrue();
        assertThat(new Rational(-1, -2).isPositive()).isTrue();
        assertThat(new Rational(-1, 2).isPositive()).isFalse();
        assertThat(new Rational(0, 2).isPositive()).isFalse();
        assertThat(new Rational(1, 0).isPositive()).isFalse();
    }

    @Test
    void getSimplifiedInstance_commonFactor_dividesOnce() {
        Rational simplified = new Rational(6, 9).getSimplifiedInstance();

        assertThat(simplified.getNumerator()).isEqualTo(2);
        assertThat(simplified.getDenominator()).isEqualTo(3);
    }

    @Test
    void parse_fractionAndInteger_parsesBoth() {
        Rational fraction = Rational.parse(" 10 / 4 ");
        Rational integer = Rational.parse("12");

        assertThat(fraction.getNumerator()).isEqualTo(10);
        assertThat(fraction.getDenominator()).isEqualTo(4);
        assertThat(integer.getDenominator()).isEqualTo(1);
    }

    @Test
    void parse_garbage_throwsNumberFormatException() {
        assertThatThrownBy(() -> Rational.parse("ten/4"))
            .isInstanceOf(NumberFormatException.class);
    }

    @Test
    void equals_sameValueDifferentTerms_isEqual() {
        assertThat(new Rational(1, 2)).isEqualTo(new Rational(2, 4));
        assertThat(new Rational(1, 2)).hasSameHashCodeAs(new Rational(2, 4));
        assertThat(new Rational(1, 2)).isNotEqualTo(new Rational(1, 3));
    }
}
