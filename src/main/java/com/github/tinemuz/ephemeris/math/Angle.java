/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.ephemeris.math;

import java.util.Objects;

/**
 * Immutable angle tagged with its unit.
 *
 * <p>Arithmetic keeps the unit of the left operand; the right operand is
 * converted first. {@link #normalize()} maps the value into the half-open
 * range {@code [0, fullTurn)} of the unit.</p>
 */
public final class Angle implements Comparable<Angle> {

    private static final double ARCSECONDS_PER_DEGREE = 3600.0;

    public static final Angle ZERO_DEGREES = new Angle(0.0, AngleUnit.DEGREE);

    private final double value;
    private final AngleUnit unit;

    private Angle(double value, AngleUnit unit) {
        this.value = value;
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    public static Angle of(double value, AngleUnit unit) {
        return new Angle(value, unit);
    }

    public static Angle ofDegrees(double degrees) {
        return new Angle(degrees, AngleUnit.DEGREE);
    }

    public static Angle ofRadians(double radians) {
        return new Angle(radians, AngleUnit.RADIAN);
    }

    /** Arcseconds are stored as degrees. */
    public static Angle ofArcseconds(double arcseconds) {
        return new Angle(arcseconds / ARCSECONDS_PER_DEGREE, AngleUnit.DEGREE);
    }

    /**
     * Map {@code degrees} into {@code [0, 360)}.
     *
     * <p>{@link Math#IEEEremainder} keeps the reduction exact for large
     * arguments such as polynomial mean longitudes far from J2000.</p>
     */
    public static double normalizeDegrees(double degrees) {
        return normalize(degrees, 360.0);
    }

    /** Map {@code radians} into {@code [0, 2π)}. */
    public static double normalizeRadians(double radians) {
        return normalize(radians, 2.0 * Math.PI);
    }

    private static double normalize(double v, double period) {
        double r = Math.IEEEremainder(v, period);
        if (r < 0.0) {
            r += period;
            // a tiny negative remainder rounds up to the full period
            if (r >= period) r = 0.0;
        }
        // -0.0 from negative multiples of the period
        return r == 0.0 ? 0.0 : r;
    }

    public double value() {
        return value;
    }

    public AngleUnit unit() {
        return unit;
    }

    public double degrees() {
        return unit.convert(value, AngleUnit.DEGREE);
    }

    public double radians() {
        return unit.convert(value, AngleUnit.RADIAN);
    }

    public double arcseconds() {
        return degrees() * ARCSECONDS_PER_DEGREE;
    }

    public Angle to(AngleUnit target) {
        return target == unit ? this : new Angle(unit.convert(value, target), target);
    }

    public Angle plus(Angle other) {
        return new Angle(value + other.unit.convert(other.value, unit), unit);
    }

    public Angle plusDegrees(double degrees) {
        return plus(ofDegrees(degrees));
    }

    public Angle minus(Angle other) {
        return new Angle(value - other.unit.convert(other.value, unit), unit);
    }

    public Angle negate() {
        return new Angle(-value, unit);
    }

    public Angle times(double factor) {
        return new Angle(value * factor, unit);
    }

    /**
     * @throws ArithmeticException if {@code divisor} is zero
     */
    public Angle dividedBy(double divisor) {
        if (divisor == 0.0) {
            throw new ArithmeticException("Angle division by zero");
        }
        return new Angle(value / divisor, unit);
    }

    public Angle normalize() {
        return new Angle(normalize(value, unit.fullTurn()), unit);
    }

    public double sin() {
        return Math.sin(radians());
    }

    public double cos() {
        return Math.cos(radians());
    }

    public double tan() {
        return Math.tan(radians());
    }

    @Override
    public int compareTo(Angle other) {
        return Double.compare(value, other.unit.convert(other.value, unit));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Angle)) return false;
        Angle other = (Angle) o;
        return unit == other.unit && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override
    public String toString() {
        return unit == AngleUnit.DEGREE ? value + " deg" : value + " rad";
    }
}
