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
package com.github.tinemuz.ephemeris.body;

import com.github.tinemuz.ephemeris.math.Angle;

/**
 * Fundamental arguments of the ELP2000-82B lunar theory (Meeus, ch. 47),
 * all in degrees and normalized to [0°, 360°).
 *
 * @param julianCenturies    time argument the arguments were evaluated at
 * @param meanLongitude      L', mean longitude of the Moon
 * @param meanElongation     D, mean elongation of the Moon
 * @param sunAnomaly         M, mean anomaly of the Sun
 * @param moonAnomaly        M', mean anomaly of the Moon
 * @param argumentOfLatitude F, mean distance of the Moon from its ascending node
 * @param a1                 Venus term argument
 * @param a2                 Jupiter term argument
 * @param a3                 additive latitude term argument
 * @param eccentricity       E, correction for the decreasing eccentricity of the Earth's orbit
 */
public record LunarArguments(
        double julianCenturies,
        double meanLongitude,
        double meanElongation,
        double sunAnomaly,
        double moonAnomaly,
        double argumentOfLatitude,
        double a1,
        double a2,
        double a3,
        double eccentricity) {

    /** Evaluate the argument polynomials at {@code jc} Julian centuries since J2000.0. */
    public static LunarArguments at(double jc) {
        double jc2 = jc * jc;
        double jc3 = jc2 * jc;
        double jc4 = jc3 * jc;
        return new LunarArguments(
                jc,
                Angle.normalizeDegrees(218.3164477 + 481267.88123421 * jc - 0.0015786 * jc2
                        + jc3 / 538841.0 - jc4 / 65194000.0),
                Angle.normalizeDegrees(297.8501921 + 445267.1114034 * jc - 0.0018819 * jc2
                        + jc3 / 545868.0 - jc4 / 113065000.0),
                Angle.normalizeDegrees(357.5291092 + 35999.0502909 * jc - 0.0001536 * jc2
                        - jc3 / 24490000.0),
                Angle.normalizeDegrees(134.9633964 + 477198.8675055 * jc + 0.0087414 * jc2
                        + jc3 / 69699.0 - jc4 / 147120000.0),
                Angle.normalizeDegrees(93.2720950 + 483202.0175233 * jc - 0.0036539 * jc2
                        - jc3 / 3526000.0 + jc4 / 863310000.0),
                Angle.normalizeDegrees(119.75 + 131.849 * jc),
                Angle.normalizeDegrees(53.09 + 479264.290 * jc),
                Angle.normalizeDegrees(313.45 + 481266.484 * jc),
                1.0 - 0.002516 * jc - 0.0000074 * jc2);
    }

    /** Multiple-angle combination {@code d*D + m*M + mp*M' + f*F} in degrees. */
    public double combine(int d, int m, int mp, int f) {
        return d * meanElongation + m * sunAnomaly + mp * moonAnomaly + f * argumentOfLatitude;
    }

    /** Eccentricity weight for a term whose M multiplier is {@code m}: E^|m|. */
    public double eccentricityWeight(int m) {
        switch (Math.abs(m)) {
            case 0:
                return 1.0;
            case 1:
                return eccentricity;
            case 2:
                return eccentricity * eccentricity;
            default:
                return Math.pow(eccentricity, Math.abs(m));
        }
    }
}
