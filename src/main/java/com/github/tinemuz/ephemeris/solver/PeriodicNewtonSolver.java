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
package com.github.tinemuz.ephemeris.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Newton-Raphson root finder confined to a bracket.
 *
 * <p>The search starts at the bracket midpoint. The derivative is a central
 * difference with step {@value #DERIVATIVE_STEP}. Every step is clamped back
 * into {@code [lower, upper)}: below {@code lower} it snaps to {@code lower},
 * at or above {@code upper} to the largest double below {@code upper}.</p>
 *
 * <p>Running out of iterations is not an error. The last estimate is
 * returned and {@link RootResult#converged()} is {@code false}.</p>
 *
 * <p>The objective must already be folded across the 360° wrap. A raw
 * longitude difference jumps by 360° and sends the derivative estimate
 * far off.</p>
 */
public final class PeriodicNewtonSolver {
    private static final Logger log = LoggerFactory.getLogger(PeriodicNewtonSolver.class);

    /** Step of the central difference, in days. */
    public static final double DERIVATIVE_STEP = 1.0e-8;

    public static final double DEFAULT_TOLERANCE = 1.0e-10;
    public static final int DEFAULT_MAX_ITERATIONS = 20;

    private final double tolerance;
    private final int maxIterations;

    public PeriodicNewtonSolver() {
        this(DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * @param tolerance     stop once {@code |f(guess)|} is below this value
     * @param maxIterations iteration budget
     * @throws IllegalArgumentException if either parameter is not positive
     */
    public PeriodicNewtonSolver(double tolerance, int maxIterations) {
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    public double tolerance() {
        return tolerance;
    }

    public int maxIterations() {
        return maxIterations;
    }

    /** Root estimate of {@code f} in {@code [lower, upper)}. */
    public double findRoot(ObjectiveFunction f, double lower, double upper) {
        return solve(f, lower, upper).root();
    }

    /**
     * Run the iteration and report how it ended.
     *
     * @throws IllegalArgumentException if {@code lower >= upper}
     */
    public RootResult solve(ObjectiveFunction f, double lower, double upper) {
        if (!(lower < upper)) {
            throw new IllegalArgumentException("Empty bracket [" + lower + ", " + upper + ")");
        }
        double guess = lower + (upper - lower) / 2.0;
        double value = Double.NaN;
        for (int i = 0; i < maxIterations; i++) {
            value = f.valueAt(guess);
            if (Math.abs(value) < tolerance) {
                return new RootResult(guess, value, i, true);
            }
            double slope = (f.valueAt(guess + DERIVATIVE_STEP) - f.valueAt(guess - DERIVATIVE_STEP))
                    / (2.0 * DERIVATIVE_STEP);
            if (slope == 0.0 || !Double.isFinite(slope)) {
                log.debug("Flat or undefined slope at {} after {} iterations, keeping estimate", guess, i);
                return new RootResult(guess, value, i, false);
            }
            guess = clamp(guess - value / slope, lower, upper);
        }
        log.debug(
                "Iteration budget of {} spent in [{}, {}), residual {}",
                maxIterations, lower, upper, value);
        return new RootResult(guess, value, maxIterations, false);
    }

    static double clamp(double x, double lower, double upper) {
        if (x < lower) return lower;
        if (x >= upper) return Math.nextDown(upper);
        return x;
    }
}
