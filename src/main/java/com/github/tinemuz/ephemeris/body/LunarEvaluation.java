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
import com.github.tinemuz.ephemeris.math.SphericalPosition;

/**
 * Raw ELP2000-82B sums for one instant, before nutation.
 *
 * <p>Longitude and latitude sums are in 10^-6 degree, the radius sum in
 * 10^-3 km.</p>
 *
 * @param arguments             fundamental arguments used for the sums
 * @param sumLongitude          Σl
 * @param sumLatitude           Σb
 * @param sumRadius             Σr
 * @param perturbationLongitude additive longitude terms from Venus, Jupiter and the Earth's flattening
 * @param perturbationLatitude  additive latitude terms
 */
public record LunarEvaluation(
        LunarArguments arguments,
        double sumLongitude,
        double sumLatitude,
        double sumRadius,
        double perturbationLongitude,
        double perturbationLatitude) {

    /** Mean distance between the centers of the Earth and Moon, km. */
    public static final double MEAN_DISTANCE_KM = 385000.56;

    private static final double ANGLE_SCALE = 1.0e6;
    private static final double RADIUS_SCALE = 1.0e3;

    /** Geometric longitude, normalized to [0°, 360°). */
    public Angle longitude() {
        return Angle.ofDegrees(Angle.normalizeDegrees(
                arguments.meanLongitude() + (sumLongitude + perturbationLongitude) / ANGLE_SCALE));
    }

    public Angle latitude() {
        return Angle.ofDegrees((sumLatitude + perturbationLatitude) / ANGLE_SCALE);
    }

    public double distanceKm() {
        return MEAN_DISTANCE_KM + sumRadius / RADIUS_SCALE;
    }

    /** Geocentric position with perturbations applied, without nutation. */
    public SphericalPosition basePosition() {
        return new SphericalPosition(longitude(), latitude(), distanceKm());
    }
}
