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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.ephemeris.series.CoefficientResource;
import com.github.tinemuz.ephemeris.time.JulianDay;

/**
 * Geocentric Moon from the truncated ELP2000-82B theory (Meeus, tables 47.A
 * and 47.B), read from the classpath resource <code>elp2000-82b.txt</code>.
 */
public final class MoonGeocentricModel {
    private static final Logger log = LoggerFactory.getLogger(MoonGeocentricModel.class);
    private static final String RESOURCE = "elp2000-82b.txt";

    private static volatile boolean loaded = false;
    private static List<LunarTerm> longitudeRadiusTerms;
    private static List<LunarTerm> latitudeTerms;

    private MoonGeocentricModel() {}

    /**
     * Multipliers of D, M, M', F with a sine amplitude (longitude or
     * latitude) and a cosine amplitude (radius, zero for latitude rows).
     */
    private record LunarTerm(boolean latitude, int d, int m, int mp, int f, double sine, double cosine) {}

    /**
     * Evaluate the periodic sums and perturbations.
     *
     * @param julianCenturies Julian centuries of TT since J2000.0
     * @throws IllegalStateException if coefficient data cannot be loaded
     */
    public static LunarEvaluation evaluate(double julianCenturies) {
        ensureLoaded();
        LunarArguments args = LunarArguments.at(julianCenturies);

        double sumL = 0.0;
        double sumR = 0.0;
        for (LunarTerm term : longitudeRadiusTerms) {
            double theta = Math.toRadians(args.combine(term.d(), term.m(), term.mp(), term.f()));
            double e = args.eccentricityWeight(term.m());
            sumL += term.sine() * Math.sin(theta) * e;
            sumR += term.cosine() * Math.cos(theta) * e;
        }
        double sumB = 0.0;
        for (LunarTerm term : latitudeTerms) {
            double theta = Math.toRadians(args.combine(term.d(), term.m(), term.mp(), term.f()));
            sumB += term.sine() * Math.sin(theta) * args.eccentricityWeight(term.m());
        }

        double lp = args.meanLongitude();
        double f = args.argumentOfLatitude();
        double mp = args.moonAnomaly();
        double perturbationL = 3958.0 * sinDeg(args.a1())
                + 1962.0 * sinDeg(lp - f)
                + 318.0 * sinDeg(args.a2());
        double perturbationB = -2235.0 * sinDeg(lp)
                + 382.0 * sinDeg(args.a3())
                + 175.0 * sinDeg(args.a1() - f)
                + 175.0 * sinDeg(args.a1() + f)
                + 127.0 * sinDeg(lp - mp)
                - 115.0 * sinDeg(lp + mp);

        return new LunarEvaluation(args, sumL, sumB, sumR, perturbationL, perturbationB);
    }

    public static LunarEvaluation evaluateAt(double jde) {
        return evaluate(JulianDay.toJulianCenturies(jde));
    }

    /** Load the coefficient tables now instead of on first evaluation. */
    public static void preload() {
        ensureLoaded();
    }

    private static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        List<LunarTerm> lr = new ArrayList<>();
        List<LunarTerm> b = new ArrayList<>();
        for (LunarTerm term : CoefficientResource.readRows(RESOURCE, MoonGeocentricModel::parseRow)) {
            (term.latitude() ? b : lr).add(term);
        }
        if (lr.isEmpty() || b.isEmpty()) {
            log.error("ELP2000-82B file '{}' lacks LR or B rows", RESOURCE);
            throw new IllegalStateException("ELP2000-82B file '" + RESOURCE + "' lacks LR or B rows");
        }
        longitudeRadiusTerms = List.copyOf(lr);
        latitudeTerms = List.copyOf(b);
        log.debug("ELP2000-82B loaded: {} longitude/radius terms, {} latitude terms", lr.size(), b.size());
        loaded = true;
    }

    private static LunarTerm parseRow(String[] fields) {
        switch (fields[0]) {
            case "LR":
                CoefficientResource.requireFields(fields, 7);
                return new LunarTerm(false,
                        Integer.parseInt(fields[1]), Integer.parseInt(fields[2]),
                        Integer.parseInt(fields[3]), Integer.parseInt(fields[4]),
                        Double.parseDouble(fields[5]), Double.parseDouble(fields[6]));
            case "B":
                CoefficientResource.requireFields(fields, 6);
                return new LunarTerm(true,
                        Integer.parseInt(fields[1]), Integer.parseInt(fields[2]),
                        Integer.parseInt(fields[3]), Integer.parseInt(fields[4]),
                        Double.parseDouble(fields[5]), 0.0);
            default:
                throw new IllegalArgumentException("Unknown row kind '" + fields[0] + "'");
        }
    }
}
