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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.ephemeris.math.Angle;
import com.github.tinemuz.ephemeris.math.AngleUnit;
import com.github.tinemuz.ephemeris.math.SphericalPosition;
import com.github.tinemuz.ephemeris.series.CoefficientResource;
import com.github.tinemuz.ephemeris.series.PeriodicSeriesEvaluator;
import com.github.tinemuz.ephemeris.series.SeriesModel;
import com.github.tinemuz.ephemeris.series.SeriesTable;
import com.github.tinemuz.ephemeris.series.SeriesTerm;
import com.github.tinemuz.ephemeris.time.JulianDay;

/**
 * Heliocentric ecliptic position of the Earth from the VSOP87D series.
 *
 * <p>Coefficients are the abridged tables of Meeus, Appendix III, loaded from
 * the classpath resource <code>vsop87d-earth.txt</code> on first use. The
 * time argument is Julian millennia of TT since J2000.0.</p>
 */
public final class EarthHeliocentricModel {
    private static final Logger log = LoggerFactory.getLogger(EarthHeliocentricModel.class);
    private static final String RESOURCE = "vsop87d-earth.txt";

    private static volatile boolean loaded = false;
    private static SeriesModel longitudeSeries;
    private static SeriesModel latitudeSeries;
    private static SeriesModel radiusSeries;

    private EarthHeliocentricModel() {}

    private enum Coordinate { L, B, R }

    /** One parsed data row: coordinate, power of t and the term itself. */
    private record Row(Coordinate coordinate, int power, SeriesTerm term) {}

    /**
     * Evaluate the Earth's heliocentric position.
     *
     * @param julianMillennia Julian millennia of TT since J2000.0
     * @return longitude in [0°, 360°), latitude in degrees, radius vector in AU
     * @throws IllegalStateException if coefficient data cannot be loaded
     */
    public static SphericalPosition evaluate(double julianMillennia) {
        ensureLoaded();
        double l = PeriodicSeriesEvaluator.evaluateModel(longitudeSeries, julianMillennia);
        double b = PeriodicSeriesEvaluator.evaluateModel(latitudeSeries, julianMillennia);
        double r = PeriodicSeriesEvaluator.evaluateModel(radiusSeries, julianMillennia);
        return new SphericalPosition(
                Angle.ofRadians(Angle.normalizeRadians(l)).to(AngleUnit.DEGREE),
                Angle.ofRadians(b).to(AngleUnit.DEGREE),
                r);
    }

    /** Evaluate at a Julian Ephemeris Day. */
    public static SphericalPosition evaluateAt(double jde) {
        return evaluate(JulianDay.toJulianMillennia(jde));
    }

    /**
     * Geocentric position of the Sun before any apparent-place correction:
     * the antipode of the heliocentric Earth.
     */
    public static SphericalPosition geocentricSun(double jde) {
        SphericalPosition earth = evaluateAt(jde);
        return new SphericalPosition(
                earth.longitude().plusDegrees(180.0).normalize(),
                earth.latitude().negate(),
                earth.radius());
    }

    /** Load the coefficient tables now instead of on first evaluation. */
    public static void preload() {
        ensureLoaded();
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        Map<Coordinate, List<List<SeriesTerm>>> byCoordinate = new EnumMap<>(Coordinate.class);
        for (Row row : CoefficientResource.readRows(RESOURCE, EarthHeliocentricModel::parseRow)) {
            List<List<SeriesTerm>> powers = byCoordinate.computeIfAbsent(row.coordinate(), c -> new ArrayList<>());
            while (powers.size() <= row.power()) powers.add(new ArrayList<>());
            powers.get(row.power()).add(row.term());
        }
        if (byCoordinate.size() != Coordinate.values().length) {
            log.error("VSOP87D file '{}' lacks one of the L, B, R series", RESOURCE);
            throw new IllegalStateException("VSOP87D file '" + RESOURCE + "' lacks one of the L, B, R series");
        }
        longitudeSeries = toModel(byCoordinate.get(Coordinate.L));
        latitudeSeries = toModel(byCoordinate.get(Coordinate.B));
        radiusSeries = toModel(byCoordinate.get(Coordinate.R));
        log.debug(
                "VSOP87D Earth loaded: L {} terms, B {} terms, R {} terms",
                longitudeSeries.termCount(),
                latitudeSeries.termCount(),
                radiusSeries.termCount());
        loaded = true;
    }

    private static Row parseRow(String[] fields) {
        CoefficientResource.requireFields(fields, 5);
        int power = Integer.parseInt(fields[1]);
        if (power < 0) {
            throw new IllegalArgumentException("Negative power " + power);
        }
        return new Row(
                Coordinate.valueOf(fields[0]),
                power,
                new SeriesTerm(
                        Double.parseDouble(fields[2]),
                        Double.parseDouble(fields[3]),
                        Double.parseDouble(fields[4])));
    }

    private static SeriesModel toModel(List<List<SeriesTerm>> powers) {
        List<SeriesTable> tables = new ArrayList<>(powers.size());
        for (List<SeriesTerm> terms : powers) tables.add(new SeriesTable(terms));
        return new SeriesModel(tables);
    }
}
