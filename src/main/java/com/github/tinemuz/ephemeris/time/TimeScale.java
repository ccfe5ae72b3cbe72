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

import java.util.Objects;

/**
 * Conversion between Universal Time (UT1) calendar instants and Julian
 * Ephemeris Days (TT), through a ΔT model.
 *
 * <p>ΔT is evaluated at the fractional year of the instant being converted.
 * Over one conversion the difference between the UT1 and TT year is far
 * below the resolution of any ΔT model.</p>
 */
public final class TimeScale {

    private static final double SECONDS_PER_DAY = 86400.0;

    private static final TimeScale DEFAULT = new TimeScale(DeltaTModel.DEFAULT);

    private final DeltaTModel model;

    public TimeScale(DeltaTModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    public static TimeScale defaultScale() {
        return DEFAULT;
    }

    public DeltaTModel model() {
        return model;
    }

    /** ΔT in seconds at {@code dateTime}. */
    public double deltaT(CalendarDateTime dateTime) {
        return model.seconds(dateTime.fractionalYear());
    }

    public CalendarDateTime ut1ToTt(CalendarDateTime ut1) {
        return ut1.plusDays(deltaT(ut1) / SECONDS_PER_DAY);
    }

    public CalendarDateTime ttToUt1(CalendarDateTime tt) {
        return tt.plusDays(-deltaT(tt) / SECONDS_PER_DAY);
    }

    /** JDE of a UT1 instant. */
    public double ut1ToJde(CalendarDateTime ut1) {
        return JulianDay.fromDateTime(ut1ToTt(ut1));
    }

    /**
     * UT1 instant of a JDE.
     *
     * @throws com.github.tinemuz.ephemeris.EphemerisDomainException if the
     *         JDE is before year 401 or outside the ΔT model's range
     */
    public CalendarDateTime jdeToUt1(double jde) {
        return ttToUt1(JulianDay.toDateTime(jde));
    }

    /** JDE of 00:00 UT1 on January 1st of {@code year}. */
    public double startOfYear(int year) {
        return ut1ToJde(CalendarDateTime.startOfYear(year));
    }
}
