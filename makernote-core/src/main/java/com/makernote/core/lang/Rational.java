package com.makernote.core.lang;

import java.util.Objects;

/**
 * Immutable rational number as stored in EXIF and makernote directories.
 *
 * <p>Both parts are kept as {@code long} so that unsigned 32-bit TIFF rationals fit without
 * overflow. Equality compares the numeric value, so {@code 1/2} equals {@code 2/4}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Rational zoom = new Rational(5, 2);
 * zoom.toSimpleString(true);   // "2.5"
 * new Rational(1, 3).toSimpleString(true); // "1/3"
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Rational extends Number implements Comparable<Rational> {

    private static final long serialVersionUID = 1L;

    private static final int MAX_SIMPLIFICATION_CALCULATIONS = 1000;

    private final long numerator;
    private final long denominator;

    public Rational(long numerator, long denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
     * Parses {@code "n/d"} or a plain integer.
     *
     * @param text text to parse
     * @return parsed rational
     * @throws NumberFormatException if the text is neither form
     */
    public static Rational parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String trimmed = text.trim();
        int slash = trimmed.indexOf('/');
        if (slash < 0) {
            return new Rational(Long.parseLong(trimmed), 1);
        }
        return new Rational(
            Long.parseLong(trimmed.substring(0, slash).trim()),
            Long.parseLong(trimmed.substring(slash + 1).trim()));
    }

    public long getNumerator() {
        return numerator;
    }

    public long getDenominator() {
        return denominator;
    }

    @Override
    public double doubleValue() {
        return numerator == 0 ? 0.0 : (double) numerator / (double) denominator;
    }

    @Override
    public float floatValue() {
        return numerator == 0 ? 0.0f : (float) numerator / (float) denominator;
    }

    @Override
    public int intValue() {
        return (int) doubleValue();
    }

    @Override
    public long longValue() {
        return (long) doubleValue();
    }

    public Rational getReciprocal() {
        return new Rational(denominator, numerator);
    }

    public Rational getAbsolute() {
        return new Rational(Math.abs(numerator), Math.abs(denominator));
    }

    public boolean isInteger() {
        return denominator == 1
            || (denominator != 0 && numerator % denominator == 0)
            || (denominator == 0 && numerator == 0);
    }

    public boolean isZero() {
        return numerator == 0 || denominator == 0;
    }

    public boolean isPositive() {
        return !isZero() && Long.signum(numerator) == Long.signum(denominator);
    }

    /**
     * Renders the simplest readable form of this value.
     *
     * <ul>
     *   <li>{@code n/0} with a non-zero numerator stays {@code n/0}</li>
     *   <li>integral values render as integers</li>
     *   <li>{@code 2/10} renders as {@code 1/5}</li>
     *   <li>otherwise the simplified fraction, or its decimal form when {@code allowDecimal}
     *       and that form is shorter than five characters</li>
     * </ul>
     *
     * @param allowDecimal whether short decimal forms may be used
     * @return simplified text
     */
    public String toSimpleString(boolean allowDecimal) {
        if (denominator == 0 && numerator != 0) {
            return toString();
        }
        if (isInteger()) {
            return Integer.toString(intValue());
        }
        if (numerator != 1 && numerator != 0 && denominator % numerator == 0) {
            return new Rational(1, denominator / numerator).toSimpleString(allowDecimal);
        }
        Rational simplified = getSimplifiedInstance();
        if (allowDecimal) {
            String decimal = Double.toString(simplified.doubleValue());
            if (decimal.length() < 5) {
                return decimal;
            }
        }
        return simplified.toString();
    }

    /**
     * Divides numerator and denominator by their first common factor.
     *
     * @return simplified instance, or {@code this} when no factor is found or the search
     *         would be too long
     */
    public Rational getSimplifiedInstance() {
        if (tooComplexForSimplification()) {
            return this;
        }
        long limit = Math.min(denominator, numerator);
        for (long factor = 2; factor <= limit; factor++) {
            if ((factor % 2 == 0 && factor > 2) || (factor % 5 == 0 && factor > 5)) {
                continue;
            }
            if (denominator % factor == 0 && numerator % factor == 0) {
                return new Rational(numerator / factor, denominator / factor);
            }
        }
        return this;
    }

    private boolean tooComplexForSimplification() {
        double maxPossibleCalculations = ((Math.min(denominator, numerator) - 1) / 5d) + 2;
        return maxPossibleCalculations > MAX_SIMPLIFICATION_CALCULATIONS;
    }

    @Override
    public int compareTo(Rational other) {
        return Double.compare(doubleValue(), other.doubleValue());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Rational other)) {
            return false;
        }
        return Double.compare(doubleValue(), other.doubleValue()) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(doubleValue());
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
