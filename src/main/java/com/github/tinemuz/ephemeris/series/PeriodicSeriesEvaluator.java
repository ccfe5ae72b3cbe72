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
package com.github.tinemuz.ephemeris.series;

/**
 * Evaluates truncated Poisson series of the VSOP87 kind.
 *
 * <p>Amplitudes are stored as integers scaled by 10^8; both methods return
 * the rescaled value (radians for angles, AU for the radius vector).</p>
 */
public final class PeriodicSeriesEvaluator {

    /** Divisor turning stored amplitudes into radians or AU. */
    public static final double SCALING_FACTOR = 1.0e8;

    private PeriodicSeriesEvaluator() {}

    /** Sum of {@code A cos(B + C t)} over the table, divided by {@link #SCALING_FACTOR}. */
    public static double evaluateTable(SeriesTable table, double t) {
        double sum = 0.0;
        for (SeriesTerm term : table.terms()) {
            sum += term.valueAt(t);
        }
        return sum / SCALING_FACTOR;
    }

    /**
     * Combine the tables of {@code model} with Horner's rule, highest power
     * first: {@code acc = acc * t + table_k(t)}.
     */
    public static double evaluateModel(SeriesModel model, double t) {
        double acc = 0.0;
        for (int k = model.degree(); k >= 0; k--) {
            acc = acc * t + evaluateTable(model.tables().get(k), t);
        }
        return acc;
    }
}
