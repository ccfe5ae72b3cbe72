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
package com.github.tinemuz.ephemeris.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.github.tinemuz.ephemeris.body.Sun;
import com.github.tinemuz.ephemeris.correction.NutationModel;
import com.github.tinemuz.ephemeris.solver.ObjectiveFunction;
import com.github.tinemuz.ephemeris.solver.PeriodicNewtonSolver;
import com.github.tinemuz.ephemeris.time.CalendarDateTime;
import com.github.tinemuz.ephemeris.time.TimeScale;

/**
 * Finds the instants within a Gregorian year at which the apparent solar
 * longitude equals a target.
 *
 * <p>A year runs from January 1st 00:00 UT1 (inclusive) to the next January
 * 1st (exclusive). The Sun starts a year near 280°, wraps through 360° in
 * March and ends near 280° again, so a target has:</p>
 * <ul>
 *   <li>a root before the wrap iff {@code startLongitude <= target < 360},</li>
 *   <li>a root after the wrap iff {@code 0 <= target < endLongitude}.</li>
 * </ul>
 * <p>Both hold only for targets near 280°. A target equal to the longitude
 * at a year boundary therefore belongs to the year that starts there.</p>
 */
public final class SolarTermLocator {

    /**
     * Before April 1st, measured longitudes at or above this value belong
     * to the previous revolution and are folded down by 360°.
     */
    static final double FOLD_THRESHOLD = 250.0;

    private final TimeScale timeScale;
    private final NutationModel nutationModel;
    private final PeriodicNewtonSolver solver;

    public SolarTermLocator() {
        this(TimeScale.defaultScale(), NutationModel.DEFAULT, new PeriodicNewtonSolver());
    }

    public SolarTermLocator(TimeScale timeScale, NutationModel nutationModel, PeriodicNewtonSolver solver) {
        this.timeScale = Objects.requireNonNull(timeScale, "timeScale");
        this.nutationModel = Objects.requireNonNull(nutationModel, "nutationModel");
        this.solver = Objects.requireNonNull(solver, "solver");
    }

    public TimeScale timeScale() {
        return timeScale;
    }

    public NutationModel nutationModel() {
        return nutationModel;
    }

    /** JDE of January 1st 00:00 UT1. */
    public double startOfYear(int year) {
        return timeScale.startOfYear(year);
    }

    /** Apparent solar longitude in degrees. */
    public double solarLongitude(double jde) {
        return Sun.apparentLongitude(jde, nutationModel);
    }

    /**
     * Number of instants in {@code year} with apparent solar longitude
     * {@code targetLongitude}: 0, 1 or 2.
     *
     * @throws IllegalArgumentException if the target is outside [0, 360)
     */
    public int discriminant(int year, double targetLongitude) {
        requireLongitude(targetLongitude);
        YearBounds bounds = bounds(year);
        int count = 0;
        if (bounds.hasRootBeforeWrap(targetLongitude)) count++;
        if (bounds.hasRootAfterWrap(targetLongitude)) count++;
        return count;
    }

    /**
     * Instants in {@code year} with apparent solar longitude
     * {@code targetLongitude}, in ascending order.
     *
     * @return zero, one or two JDEs
     * @throws IllegalArgumentException if the target is outside [0, 360)
     */
    public List<Double> findRoots(int year, double targetLongitude) {
        requireLongitude(targetLongitude);
        YearBounds bounds = bounds(year);
        double aprilFirst = timeScale.ut1ToJde(CalendarDateTime.of(year, 4, 1, 0.0));

        List<Double> roots = new ArrayList<>(2);
        if (bounds.hasRootBeforeWrap(targetLongitude)) {
            roots.add(solver.findRoot(
                    foldedObjective(targetLongitude - 360.0, aprilFirst), bounds.startJde(), bounds.endJde()));
        }
        if (bounds.hasRootAfterWrap(targetLongitude)) {
            roots.add(solver.findRoot(
                    foldedObjective(targetLongitude, aprilFirst), bounds.startJde(), bounds.endJde()));
        }
        return List.copyOf(roots);
    }

    /**
     * Solar longitude minus {@code foldedTarget}, where longitudes of the
     * previous revolution are shifted by -360° so the function increases
     * through the whole year.
     */
    ObjectiveFunction foldedObjective(double foldedTarget, double aprilFirstJde) {
        return jde -> {
            double lon = solarLongitude(jde);
            if (jde < aprilFirstJde && lon >= FOLD_THRESHOLD) {
                lon -= 360.0;
            }
            return lon - foldedTarget;
        };
    }

    private YearBounds bounds(int year) {
        double start = startOfYear(year);
        double end = startOfYear(year + 1);
        return new YearBounds(start, end, solarLongitude(start), solarLongitude(end));
    }

    private static void requireLongitude(double longitude) {
        if (!(longitude >= 0.0 && longitude < 360.0)) {
            throw new IllegalArgumentException("Target longitude must be in [0, 360): " + longitude);
        }
    }

    private record YearBounds(double startJde, double endJde, double startLongitude, double endLongitude) {

        boolean hasRootBeforeWrap(double target) {
            return startLongitude <= target && target < 360.0;
        }

        boolean hasRootAfterWrap(double target) {
            return 0.0 <= target && target < endLongitude;
        }
    }
}
