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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.ephemeris.math.SphericalPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NutationTest {

    private static final double ARCSEC_TOLERANCE = 0.001; // arcseconds

    // Meeus example 22.a: 1987 April 10, 0h TD
    private static final double JDE_1987_04_10 = 2446895.5;

    @Nested
    @DisplayName("Nutation series")
    class SeriesTests {

        @Test
        @DisplayName("Meeus example 22.a with the 63-term table")
        void meeusExample() {
            Nutation.Result r = Nutation.compute((JDE_1987_04_10 - 2451545.0) / 36525.0, NutationModel.MEEUS);
            assertEquals(-3.788, r.longitude().arcseconds(), ARCSEC_TOLERANCE);
            assertEquals(9.443, r.obliquity().arcseconds(), ARCSEC_TOLERANCE);
        }

        @Test
        @DisplayName("Full IAU 1980 table is the default and agrees within a milliarcsecond")
        void fullTable() {
            assertSame(NutationModel.IAU_1980, NutationModel.DEFAULT);
            assertEquals(-3.788, Nutation.longitude(JDE_1987_04_10).arcseconds(), ARCSEC_TOLERANCE);
            assertEquals(9.443, Nutation.obliquity(JDE_1987_04_10).arcseconds(), ARCSEC_TOLERANCE);
        }

        @Test
        @DisplayName("Table sizes")
        void tableSizes() {
            assertEquals(63, NutationModel.MEEUS.terms().size());
            assertEquals(106, NutationModel.IAU_1980.terms().size());
        }

        @Test
        @DisplayName("Amplitudes stay within the 18.6-year envelope")
        void envelope() {
            for (double jc = -2.0; jc <= 2.0; jc += 0.013) {
                Nutation.Result r = Nutation.compute(jc);
                assertTrue(Math.abs(r.longitude().arcseconds()) < 20.0);
                assertTrue(Math.abs(r.obliquity().arcseconds()) < 11.0);
            }
        }
    }

    @Nested
    @DisplayName("Aberration and FK5")
    class SmallCorrectionTests {

        @Test
        @DisplayName("Aberration is 20.49552 arcseconds over the distance")
        void aberration() {
            assertEquals(20.49552, Aberration.annual(1.0).arcseconds(), 1e-9);
            assertEquals(20.49552 / 0.99760775, Aberration.annual(0.99760775).arcseconds(), 1e-9);
        }

        @Test
        @DisplayName("Meeus example 25.b FK5 correction")
        void fk5() {
            double jc = -0.072183436;
            SphericalPosition raw = SphericalPosition.ofDegrees(199.907372, 0.000179, 0.99760775);
            Fk5Correction c = Fk5Correction.of(jc, raw);
            assertEquals(-0.09033, c.longitude().arcseconds(), 0.001);
            assertEquals(-0.02340, c.latitude().arcseconds(), 1e-4);

            SphericalPosition corrected = c.applyTo(raw);
            assertEquals(199.907347, corrected.longitudeDegrees(), 1e-6);
            assertEquals(0.000179 + c.latitude().degrees(), corrected.latitudeDegrees(), 1e-15);
        }
    }
}
