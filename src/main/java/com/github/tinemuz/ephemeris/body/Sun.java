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

import com.github.tinemuz.ephemeris.EphemerisDomainException;
import com.github.tinemuz.ephemeris.correction.Aberration;
import com.github.tinemuz.ephemeris.correction.Fk5Correction;
import com.github.tinemuz.ephemeris.correction.Nutation;
import com.github.tinemuz.ephemeris.correction.NutationModel;
import com.github.tinemuz.ephemeris.math.Angle;
import com.github.tinemuz.ephemeris.math.SphericalPosition;
import com.github.tinemuz.ephemeris.time.JulianDay;

/**
 * Apparent geocentric position of the Sun.
 *
 * <p>The geometric position is the antipode of the VSOP87D Earth. The
 * apparent position adds the FK5 frame correction and nutation in
 * longitude, then removes annual aberration (Meeus, ch. 25, higher accuracy
 * method).</p>
 */
public final class Sun {

    private Sun() {}

    /** Geometric geocentric position, in the dynamical frame of date. */
    public static SphericalPosition geocentric(double jde) {
        return EarthHeliocentricModel.geocentricSun(jde);
    }

    /**
     * Apparent position referred to the true equinox of date.
     *
     * @param jde   Julian Ephemeris Day
     * @param model nutation coefficient set
     * @return longitude in [0°, 360°), latitude in degrees, distance in AU
     * @throws EphemerisDomainException if the latitude leaves [-90°, 90°],
     *         which only corrupted coefficients can cause
     */
    public static SphericalPosition apparent(double jde, NutationModel model) {
        double jc = JulianDay.toJulianCenturies(jde);
        SphericalPosition geometric = geocentric(jde);
        SphericalPosition fk5 = Fk5Correction.of(jc, geometric).applyTo(geometric);
        Angle nutation = Nutation.compute(jc, model).longitude();
        Angle aberration = Aberration.annual(geometric.radius());

        Angle longitude = fk5.longitude().plus(nutation).minus(aberration).normalize();
        double latitude = fk5.latitudeDegrees();
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new EphemerisDomainException("Solar latitude out of range: " + latitude + " deg at JDE " + jde);
        }
        return new SphericalPosition(longitude, fk5.latitude(), geometric.radius());
    }

    public static SphericalPosition apparent(double jde) {
        return apparent(jde, NutationModel.DEFAULT);
    }

    /** Apparent longitude in degrees, [0°, 360°). */
    public static double apparentLongitude(double jde, NutationModel model) {
        return apparent(jde, model).longitudeDegrees();
    }

    public static double apparentLongitude(double jde) {
        return apparentLongitude(jde, NutationModel.DEFAULT);
    }

    /** Load every coefficient table the Sun needs. */
    public static void preload() {
        EarthHeliocentricModel.preload();
        NutationModel.DEFAULT.terms();
    }
}
