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
package com.github.tinemuz.ephemeris.correction;

import com.github.tinemuz.ephemeris.math.Angle;

/**
 * Delaunay arguments used by the nutation series (Meeus, ch. 22), in degrees
 * normalized to [0°, 360°).
 */
public record FundamentalArguments(double d, double m, double mp, double f, double omega) {

    public static FundamentalArguments at(double jc) {
        double jc2 = jc * jc;
        double jc3 = jc2 * jc;
        return new FundamentalArguments(
                Angle.normalizeDegrees(297.85036 + 445267.111480 * jc - 0.0019142 * jc2 + jc3 / 189474.0),
                Angle.normalizeDegrees(357.52772 + 35999.050340 * jc - 0.0001603 * jc2 - jc3 / 300000.0),
                Angle.normalizeDegrees(134.96298 + 477198.867398 * jc + 0.0086972 * jc2 + jc3 / 56250.0),
                Angle.normalizeDegrees(93.27191 + 483202.017538 * jc - 0.0036825 * jc2 + jc3 / 327270.0),
                Angle.normalizeDegrees(125.04452 - 1934.136261 * jc + 0.0020708 * jc2 + jc3 / 450000.0));
    }

    /** Argument θ of {@code term} in radians. */
    public double argumentOf(NutationTerm term) {
        return Math.toRadians(term.d() * d + term.m() * m + term.mp() * mp + term.f() * f + term.omega() * omega);
    }
}
