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
package com.github.tinemuz.ephemeris.time;

import java.util.function.DoubleUnaryOperator;

/** Available ΔT approximations, each a function of the fractional year. */
public enum DeltaTModel {
    /** Segmented cubics from -4000 with extrapolation after 2005. */
    SEGMENTED_CUBIC(DeltaT::segmentedCubic),
    /** Espenak and Meeus (2006), all years. */
    ESPENAK_MEEUS(DeltaT::espenakMeeus),
    /** Espenak and Meeus with the 2014 revision, below 3000. */
    ESPENAK_MEEUS_2014(DeltaT::espenakMeeus2014),
    /** Bulletin A fit, below 2035. */
    OBSERVED_FIT(DeltaT::observedFit),
    /** Observed fit while available, Espenak-Meeus beyond. */
    DEFAULT(DeltaT::defaultModel);

    private final DoubleUnaryOperator formula;

    DeltaTModel(DoubleUnaryOperator formula) {
        this.formula = formula;
    }

    /**
     * ΔT in seconds for a fractional Gregorian year.
     *
     * @throws com.github.tinemuz.ephemeris.EphemerisDomainException if the
     *         year is outside the model's range
     */
    public double seconds(double year) {
        return formula.applyAsDouble(year);
    }
}
