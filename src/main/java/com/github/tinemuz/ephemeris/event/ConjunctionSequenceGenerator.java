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
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.DoubleStream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.ephemeris.EphemerisDomainException;
import com.github.tinemuz.ephemeris.body.Moon;
import com.github.tinemuz.ephemeris.body.Sun;
import com.github.tinemuz.ephemeris.correction.NutationModel;
import com.github.tinemuz.ephemeris.math.Angle;
import com.github.tinemuz.ephemeris.solver.ObjectiveFunction;
import com.github.tinemuz.ephemeris.solver.PeriodicNewtonSolver;
import com.github.tinemuz.ephemeris.time.TimeScale;

/**
 * Unbounded, strictly increasing sequence of new moons: instants at which
 * the apparent longitudes of the Moon and the Sun coincide.
 *
 * <p>The only state is the last root returned, or the start JDE before the
 * first call. A fresh generator from any JDE restarts the sequence there.
 * Instances are not thread-safe.</p>
 */
public final class ConjunctionSequenceGenerator implements PrimitiveIterator.OfDouble {
    private static final Logger log = LoggerFactory.getLogger(ConjunctionSequenceGenerator.class);

    /** Mean synodic month, days. */
    public static final double SYNODIC_MONTH = 29.530588853;

    /** Mean rate of the Moon-Sun longitude difference, degrees per day. */
    static final double MEAN_DIFFERENCE_RATE = 360.0 / SYNODIC_MONTH;

    /** Offset past the last root before searching the next one, days. */
    static final double ADVANCE = 1.0;

    /** Differences within this distance of 0° count as an exact hit, degrees. */
    static final double EXACT_HIT = 1.0e-6;

    /** Half width of an exact-hit bracket and minimum width of the others, days. */
    static final double EXACT_HIT_HALF_WIDTH = 0.1;

    /** Bracket ends must lie within this distance of the wrap, degrees. */
    private static final double WRAP_WINDOW = 15.0;

    private final NutationModel nutationModel;
    private final PeriodicNewtonSolver solver;
    private double lastRoot;
    private boolean started;

    /** Bracket for the Newton refinement. */
    public record Bracket(double lower, double upper) {}

    public ConjunctionSequenceGenerator(double startJde) {
        this(startJde, NutationModel.DEFAULT);
    }

    public ConjunctionSequenceGenerator(double startJde, NutationModel nutationModel) {
        this(startJde, nutationModel, new PeriodicNewtonSolver(1.0e-15, 30));
    }

    public ConjunctionSequenceGenerator(double startJde, NutationModel nutationModel, PeriodicNewtonSolver solver) {
        this.lastRoot = startJde;
        this.nutationModel = Objects.requireNonNull(nutationModel, "nutationModel");
        this.solver = Objects.requireNonNull(solver, "solver");
    }

    /**
     * First new moon at or after {@code jde}. An instant within
     * {@link #EXACT_HIT} of a conjunction returns that conjunction.
     */
    public static double nextAfter(double jde) {
        return new ConjunctionSequenceGenerator(jde).nextDouble();
    }

    /**
     * New moons from 00:00 UT1 on January 1st of {@code year} up to, but
     * excluding, the same instant of the next year.
     */
    public static List<Double> moments(int year) {
        return moments(year, TimeScale.defaultScale(), NutationModel.DEFAULT);
    }

    public static List<Double> moments(int year, TimeScale timeScale, NutationModel nutationModel) {
        double start = timeScale.startOfYear(year);
        double end = timeScale.startOfYear(year + 1);
        ConjunctionSequenceGenerator generator = new ConjunctionSequenceGenerator(start, nutationModel);
        List<Double> roots = new ArrayList<>(13);
        while (true) {
            double root = generator.nextDouble();
            if (root >= end) break;
            if (root >= start) roots.add(root);
        }
        return List.copyOf(roots);
    }

    /** Always {@code true}: the sequence never ends. */
    @Override
    public boolean hasNext() {
        return true;
    }

    @Override
    public double nextDouble() {
        double from;
        if (started) {
            double diff = longitudeDifference(lastRoot);
            if (diff > 1.0 && diff < 359.0) {
                throw new EphemerisDomainException(
                        "JDE " + lastRoot + " is not a conjunction, longitude difference " + diff + " deg");
            }
            from = lastRoot + ADVANCE;
        } else {
            from = lastRoot;
        }
        Bracket bracket = firstRootRangeAfter(from);
        double root = refine(bracket);
        lastRoot = root;
        started = true;
        log.trace("New moon at JDE {}", root);
        return root;
    }

    /** Lazy infinite stream continuing this generator. */
    public DoubleStream stream() {
        return StreamSupport.doubleStream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /** Last root returned, or the start JDE if none has been returned yet. */
    public double lastRoot() {
        return lastRoot;
    }

    /** Moon minus Sun apparent longitude, degrees in [0, 360). */
    public double longitudeDifference(double jde) {
        return Angle.normalizeDegrees(
                Moon.apparentLongitude(jde, nutationModel) - Sun.apparentLongitude(jde, nutationModel));
    }

    /**
     * Bracket around the first conjunction at or after {@code jde}, estimated
     * from the mean synodic rate.
     *
     * @throws EphemerisDomainException if the estimate lands 30° or more
     *         from a conjunction
     */
    public Bracket firstRootRangeAfter(double jde) {
        double current = longitudeDifference(jde);
        double gap = isExactHit(current) ? 0.0 : 360.0 - current;
        double estimate = jde + gap / MEAN_DIFFERENCE_RATE;
        return bracketAround(jde, estimate, longitudeDifference(estimate));
    }

    /**
     * Bracket for an estimate whose longitude difference is {@code diff}:
     * centred on an exact hit, behind the estimate when the Moon is already
     * past the Sun, ahead of it when the Moon is still short of the Sun.
     */
    static Bracket bracketAround(double jde, double estimate, double diff) {
        if (isExactHit(diff)) {
            return new Bracket(estimate - EXACT_HIT_HALF_WIDTH, estimate + EXACT_HIT_HALF_WIDTH);
        }
        if (diff < 30.0) {
            double width = Math.max(diff * 2.0 / MEAN_DIFFERENCE_RATE, EXACT_HIT_HALF_WIDTH);
            return new Bracket(estimate - width, estimate);
        }
        if (diff > 330.0) {
            double width = Math.max((360.0 - diff) * 2.0 / MEAN_DIFFERENCE_RATE, EXACT_HIT_HALF_WIDTH);
            return new Bracket(estimate, estimate + width);
        }
        throw new EphemerisDomainException(
                "Conjunction estimate " + estimate + " is " + diff + " deg off, from JDE " + jde);
    }

    private static boolean isExactHit(double diff) {
        return diff < EXACT_HIT || diff > 360.0 - EXACT_HIT;
    }

    /**
     * Newton refinement inside {@code bracket}.
     *
     * @throws EphemerisDomainException unless the lower end lies just before
     *         the wrap and the upper end just after it
     */
    double refine(Bracket bracket) {
        double lowerDiff = longitudeDifference(bracket.lower());
        double upperDiff = longitudeDifference(bracket.upper());
        if (lowerDiff <= 360.0 - WRAP_WINDOW || upperDiff >= WRAP_WINDOW) {
            throw new EphemerisDomainException(String.format(
                    "No conjunction in [%f, %f]: differences %f deg and %f deg",
                    bracket.lower(), bracket.upper(), lowerDiff, upperDiff));
        }
        return solver.findRoot(foldedObjective(), bracket.lower(), bracket.upper());
    }

    /** Longitude difference with values just below 360° shifted to just below 0°. */
    private ObjectiveFunction foldedObjective() {
        return jde -> {
            double diff = longitudeDifference(jde);
            return diff > 360.0 - WRAP_WINDOW ? diff - 360.0 : diff;
        };
    }
}
