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

import java.util.Iterator;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.ephemeris.EphemerisDomainException;
import com.github.tinemuz.ephemeris.body.Sun;
import com.github.tinemuz.ephemeris.correction.NutationModel;
import com.github.tinemuz.ephemeris.math.Angle;
import com.github.tinemuz.ephemeris.solver.ObjectiveFunction;
import com.github.tinemuz.ephemeris.solver.PeriodicNewtonSolver;

/**
 * Unbounded sequence of solar terms in calendar order, starting from any
 * instant.
 *
 * <p>The first event is the first term at or after the start instant; a
 * start within {@link #ON_TERM} of a term yields that term. Each later step
 * targets the next multiple of 15° past the Sun's longitude one day after
 * the last root. Roots solve the signed difference
 * {@code ((λ - target + 180) mod 360) - 180}, which stays continuous
 * across the 0° wrap. Like {@link ConjunctionSequenceGenerator} the only
 * state is the last root. Not thread-safe.</p>
 */
public final class SolarTermSequenceGenerator implements Iterator<SolarTermEvent> {
    private static final Logger log = LoggerFactory.getLogger(SolarTermSequenceGenerator.class);

    /** Lower bound of the Sun's apparent motion used to size brackets, degrees per day. */
    static final double MIN_SOLAR_RATE = 0.9;

    /** Offset past the last root before searching the next one, days. */
    static final double ADVANCE = 1.0;

    /** Longitudes within this distance of a multiple of 15° count as on it, degrees. */
    static final double ON_TERM = 1.0e-6;

    private final NutationModel nutationModel;
    private final PeriodicNewtonSolver solver;
    private double lastRoot;
    private boolean started;

    public SolarTermSequenceGenerator(double startJde) {
        this(startJde, NutationModel.DEFAULT, new PeriodicNewtonSolver());
    }

    public SolarTermSequenceGenerator(double startJde, NutationModel nutationModel, PeriodicNewtonSolver solver) {
        this.lastRoot = startJde;
        this.nutationModel = Objects.requireNonNull(nutationModel, "nutationModel");
        this.solver = Objects.requireNonNull(solver, "solver");
    }

    /** Always {@code true}: the sequence never ends. */
    @Override
    public boolean hasNext() {
        return true;
    }

    @Override
    public SolarTermEvent next() {
        double from = started ? lastRoot + ADVANCE : lastRoot;
        double longitude = Sun.apparentLongitude(from, nutationModel);
        SolarTerm term = SolarTerm.ofLongitude(nextMultiple(longitude));
        // negative only for a start within ON_TERM past the term
        double gap = Angle.normalizeDegrees(term.longitude() - longitude + 180.0) - 180.0;
        double lower = Math.min(from, from + gap / MIN_SOLAR_RATE);
        double upper = from + Math.max(gap, 0.0) / MIN_SOLAR_RATE + ADVANCE;

        ObjectiveFunction objective = signedDifference(term.longitude());
        if (objective.valueAt(upper) <= 0.0) {
            throw new EphemerisDomainException("Sun does not reach " + term + " before JDE " + upper);
        }
        double root = solver.findRoot(objective, lower, upper);
        lastRoot = root;
        started = true;
        log.trace("{} at JDE {}", term, root);
        return new SolarTermEvent(term, root);
    }

    /** Lazy infinite stream continuing this generator. */
    public Stream<SolarTermEvent> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public double lastRoot() {
        return lastRoot;
    }

    /**
     * Smallest multiple of 15° not below {@code longitude - ON_TERM}, wrapped
     * to [0, 360).
     */
    static double nextMultiple(double longitude) {
        double k = Math.ceil((longitude - ON_TERM) / SolarTerm.SPACING);
        return Angle.normalizeDegrees(k * SolarTerm.SPACING);
    }

    private ObjectiveFunction signedDifference(double target) {
        return jde -> Angle.normalizeDegrees(
                Sun.apparentLongitude(jde, nutationModel) - target + 180.0) - 180.0;
    }
}
