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
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * A proleptic Gregorian date plus the elapsed fraction of that day.
 *
 * <p>The time scale (UT1 or TT) is implied by the caller. Values order by
 * date, then by fraction.</p>
 *
 * @param date     calendar date
 * @param fraction elapsed part of the day, in [0, 1)
 */
public record CalendarDateTime(LocalDate date, double fraction) implements Comparable<CalendarDateTime> {

    private static final double SECONDS_PER_DAY = 86400.0;
    private static final long NANOS_PER_DAY = 86_400_000_000_000L;

    public CalendarDateTime {
        Objects.requireNonNull(date, "date");
        if (!(fraction >= 0.0 && fraction < 1.0)) {
            throw new IllegalArgumentException("Day fraction must be in [0, 1): " + fraction);
        }
    }

    public static CalendarDateTime of(int year, int month, int day, double fraction) {
        return new CalendarDateTime(LocalDate.of(year, month, day), fraction);
    }

    public static CalendarDateTime of(int year, int month, int day, int hour, int minute, double second) {
        return of(year, month, day, (hour * 3600.0 + minute * 60.0 + second) / SECONDS_PER_DAY);
    }

    public static CalendarDateTime startOfYear(int year) {
        return of(year, 1, 1, 0.0);
    }

    public static CalendarDateTime from(LocalDateTime dateTime) {
        return new CalendarDateTime(
                dateTime.toLocalDate(), dateTime.toLocalTime().toNanoOfDay() / (double) NANOS_PER_DAY);
    }

    /** Nearest {@link LocalDateTime}, rounded to the nanosecond. */
    public LocalDateTime toLocalDateTime() {
        long nanos = Math.round(fraction * NANOS_PER_DAY);
        if (nanos >= NANOS_PER_DAY) {
            return date.plusDays(1).atStartOfDay();
        }
        return LocalDateTime.of(date, LocalTime.ofNanoOfDay(nanos));
    }

    public int year() {
        return date.getYear();
    }

    /**
     * Shift by a possibly fractional number of days. The day rolls over on
     * the floor of the sum.
     */
    public CalendarDateTime plusDays(double days) {
        double total = fraction + days;
        double whole = Math.floor(total);
        double rest = total - whole;
        if (rest >= 1.0) {
            whole += 1.0;
            rest = 0.0;
        }
        return new CalendarDateTime(date.plusDays((long) whole), rest);
    }

    /** Year with the elapsed part of it as a fraction, e.g. 2015.5 around July 1st. */
    public double fractionalYear() {
        return date.getYear() + (date.getDayOfYear() - 1 + fraction) / date.lengthOfYear();
    }

    @Override
    public int compareTo(CalendarDateTime other) {
        int c = date.compareTo(other.date);
        return c != 0 ? c : Double.compare(fraction, other.fraction);
    }

    @Override
    public String toString() {
        return toLocalDateTime().toString();
    }
}
