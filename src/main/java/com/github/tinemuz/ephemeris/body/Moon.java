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

import com.github.tinemuz.ephemeris.correction.Nutation;
import com.github.tinemuz.ephemeris.correction.NutationModel;
import com.github.tinemuz.ephemeris.math.Angle;
import com.github.tinemuz.ephemeris.math.SphericalPosition;
import com.github.tinemuz.ephemeris.time.JulianDay;

/**
 * Apparent geocentric position of the Moon (Meeus, ch. 47).
 *
 * <p>Nutation is applied to the longitude only. Distances are in
 * kilometers.</p>
 */
public final class Moon {

    /** Equatorial radius of the Earth used by the ELP2000 parallax, km. */
    public static final double EARTH_EQUATORIAL_RADIUS_KM = 6378.14;

    private Moon() {}

    /** Geometric position with the additive perturbations, no nutation. */
    public static SphericalPosition geocentric(double jde) {
        return MoonGeocentricModel.evaluateAt(jde).basePosition();
    }

    public static SphericalPosition apparent(double jde, NutationModel model) {
        double jc = JulianDay.toJulianCenturies(jde);
        SphericalPosition base = MoonGeocentricModel.evaluate(jc).basePosition();
        Angle longitude = base.longitude().plus(Nutation.compute(jc, model).longitude()).normalize();
        return new SphericalPosition(longitude, base.latitude(), base.radius());
    }

    public static SphericalPosition apparent(double jde) {
        return apparent(jde, NutationModel.DEFAULT);
    }

    public static double apparentLongitude(double jde, NutationModel model) {
        return apparent(jde, model).longitudeDegrees();
    }

    public static double apparentLongitude(double jde) {
        return apparentLongitude(jde, NutationModel.DEFAULT);
    }

    /** Equatorial horizontal parallax for a Moon at {@code distanceKm}. */
    public static Angle equatorialHorizontalParallax(double distanceKm) {
        return Angle.ofRadians(Math.asin(EARTH_EQUATORIAL_RADIUS_KM / distanceKm));
    }

    /** Load every coefficient table the Moon needs. */
    public static void preload() {
        MoonGeocentricModel.preload();
        NutationModel.DEFAULT.terms();
    }
}
