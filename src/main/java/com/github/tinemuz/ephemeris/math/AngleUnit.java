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

/** Units an {@link Angle} can be expressed in. */
public enum AngleUnit {
    DEGREE(360.0),
    RADIAN(2.0 * Math.PI);

    private final double fullTurn;

    AngleUnit(double fullTurn) {
        this.fullTurn = fullTurn;
    }

    /** Size of one full revolution in this unit. */
    public double fullTurn() {
        return fullTurn;
    }

    /** Convert {@code value}, expressed in this unit, into {@code target}. */
    public double convert(double value, AngleUnit target) {
        if (this == target) return value;
        return this == DEGREE ? Math.toRadians(value) : Math.toDegrees(value);
    }
}
