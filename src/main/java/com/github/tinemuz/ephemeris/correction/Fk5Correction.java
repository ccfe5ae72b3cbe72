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
import com.github.tinemuz.ephemeris.math.SphericalPosition;

/**
 * Conversion of a VSOP87 position to the FK5 frame (Meeus, eq. 32.3).
 *
 * @param longitude Δλ to add to the longitude
 * @param latitude  Δβ to add to the latitude
 */
public record Fk5Correction(Angle longitude, Angle latitude) {

    public static Fk5Correction of(double julianCenturies, SphericalPosition raw) {
        double lambdaPrime = raw.longitudeDegrees() - (1.397 + 0.00031 * julianCenturies) * julianCenturies;
        double cosL = Math.cos(Math.toRadians(lambdaPrime));
        double sinL = Math.sin(Math.toRadians(lambdaPrime));
        double dLambda = -0.09033 + 0.03916 * (cosL + sinL) * raw.latitude().tan();
        double dBeta = 0.03916 * (cosL - sinL);
        return new Fk5Correction(Angle.ofArcseconds(dLambda), Angle.ofArcseconds(dBeta));
    }

    public SphericalPosition applyTo(SphericalPosition raw) {
        return new SphericalPosition(raw.longitude().plus(longitude), raw.latitude().plus(latitude), raw.radius());
    }
}
