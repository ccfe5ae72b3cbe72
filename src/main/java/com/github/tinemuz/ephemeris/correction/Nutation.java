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
import com.github.tinemuz.ephemeris.time.JulianDay;

/**
 * Nutation in longitude (Δψ) and in obliquity (Δε).
 *
 * <p>Both are sums over the selected {@link NutationModel}:
 * {@code Δψ = Σ (a + bT) sin θ}, {@code Δε = Σ (a + bT) cos θ}, with the
 * coefficients in 0.0001″.</p>
 */
public final class Nutation {

    private static final double UNIT_ARCSECONDS = 0.0001;

    private Nutation() {}

    /**
     * @param longitude Δψ in degrees
     * @param obliquity Δε in degrees
     */
    public record Result(Angle longitude, Angle obliquity) {}

    public static Result compute(double julianCenturies, NutationModel model) {
        FundamentalArguments args = FundamentalArguments.at(julianCenturies);
        double psi = 0.0;
        double eps = 0.0;
        for (NutationTerm term : model.terms()) {
            double theta = args.argumentOf(term);
            psi += (term.psiA() + term.psiB() * julianCenturies) * Math.sin(theta);
            eps += (term.epsA() + term.epsB() * julianCenturies) * Math.cos(theta);
        }
        return new Result(
                Angle.ofArcseconds(psi * UNIT_ARCSECONDS),
                Angle.ofArcseconds(eps * UNIT_ARCSECONDS));
    }

    public static Result compute(double julianCenturies) {
        return compute(julianCenturies, NutationModel.DEFAULT);
    }

    /** Δψ at a Julian Ephemeris Day. */
    public static Angle longitude(double jde, NutationModel model) {
        return compute(JulianDay.toJulianCenturies(jde), model).longitude();
    }

    public static Angle longitude(double jde) {
        return longitude(jde, NutationModel.DEFAULT);
    }

    /** Δε at a Julian Ephemeris Day. */
    public static Angle obliquity(double jde, NutationModel model) {
        return compute(JulianDay.toJulianCenturies(jde), model).obliquity();
    }

    public static Angle obliquity(double jde) {
        return obliquity(jde, NutationModel.DEFAULT);
    }
}
