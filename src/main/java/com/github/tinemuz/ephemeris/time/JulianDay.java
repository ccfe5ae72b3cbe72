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

import java.time.LocalDate;

import com.github.tinemuz.ephemeris.EphemerisDomainException;

/**
 * Julian Day arithmetic for the Gregorian calendar (Meeus, ch. 7) and the
 * Julian time units used by the series.
 */
public final class JulianDay {

    /** JDE of the J2000.0 epoch, 2000 January 1.5 TT. */
    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_JULIAN_CENTURY = 36525.0;
    public static final double DAYS_PER_JULIAN_MILLENNIUM = 365250.0;

    /** JD of 0401-01-01 00:00, the earliest instant {@link #toDateTime} accepts. */
    public static final double MIN_CONVERTIBLE = 1867522.5;

    private JulianDay() {}

    /** Julian Day of a Gregorian date and day fraction. */
    public static double fromDateTime(CalendarDateTime dateTime) {
        LocalDate date = dateTime.date();
        long y = date.getYear();
        long m = date.getMonthValue();
        if (m <= 2) {
            y -= 1;
            m += 12;
        }
        long a = Math.floorDiv(y, 100);
        long b = Math.floorDiv(a, 4);
        long c = 2 - a + b;
        long e = (long) Math.floor(365.25 * (y + 4716));
        long f = (long) Math.floor(30.6001 * (m + 1));
        return c + date.getDayOfMonth() + e + f - 1524.5 + dateTime.fraction();
    }

    /**
     * Gregorian date and day fraction of a Julian Day.
     *
     * @throws EphemerisDomainException if {@code jd} is before {@link #MIN_CONVERTIBLE}
     */
    public static CalendarDateTime toDateTime(double jd) {
        if (!(jd >= MIN_CONVERTIBLE)) {
            throw new EphemerisDomainException("Julian Day " + jd + " is before year 401");
        }
        double q = jd + 0.5;
        long z = (long) Math.floor(q);
        long w = (long) Math.floor((z - 1867216.25) / 36524.25);
        long x = Math.floorDiv(w, 4);
        long a = z + 1 + w - x;
        long b = a + 1524;
        long c = (long) Math.floor((b - 122.1) / 365.25);
        long d = (long) Math.floor(365.25 * c);
        long e = (long) Math.floor((b - d) / 30.6001);
        long f = (long) Math.floor(30.6001 * e);
        int day = (int) (b - d - f);
        int month = (int) (e > 13 ? e - 13 : e - 1);
        int year = (int) (month <= 2 ? c - 4715 : c - 4716);
        return CalendarDateTime.of(year, month, day, q - z);
    }

    public static double toJulianCenturies(double jde) {
        return (jde - J2000) / DAYS_PER_JULIAN_CENTURY;
    }

    public static double fromJulianCenturies(double jc) {
        return jc * DAYS_PER_JULIAN_CENTURY + J2000;
    }

    public static double toJulianMillennia(double jde) {
        return (jde - J2000) / DAYS_PER_JULIAN_MILLENNIUM;
    }

    public static double fromJulianMillennia(double jm) {
        return jm * DAYS_PER_JULIAN_MILLENNIUM + J2000;
    }
}
