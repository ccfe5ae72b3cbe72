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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.ephemeris.EphemerisDomainException;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JulianDayTest {

    @Nested
    @DisplayName("Calendar to Julian Day")
    class ForwardTests {

        @Test
        @DisplayName("Meeus examples 7.a and 7.b, plus J2000.0")
        void knownDays() {
            assertEquals(2451545.0, JulianDay.fromDateTime(CalendarDateTime.of(2000, 1, 1, 0.5)));
            assertEquals(2436116.31, JulianDay.fromDateTime(CalendarDateTime.of(1957, 10, 4, 0.81)), 1e-9);
            assertEquals(2446966.0, JulianDay.fromDateTime(CalendarDateTime.of(1987, 6, 19, 0.5)));
            assertEquals(2305447.5, JulianDay.fromDateTime(CalendarDateTime.of(1600, 1, 1, 0.0)));
            assertEquals(1867522.5, JulianDay.fromDateTime(CalendarDateTime.of(401, 1, 1, 0.0)));
        }

        @Test
        @DisplayName("Consecutive days differ by exactly one")
        void consecutiveDays() {
            LocalDate date = LocalDate.of(1899, 12, 25);
            double previous = JulianDay.fromDateTime(new CalendarDateTime(date, 0.0));
            for (int i = 1; i < 800; i++) {
                double jd = JulianDay.fromDateTime(new CalendarDateTime(date.plusDays(i), 0.0));
                assertEquals(previous + 1.0, jd);
                previous = jd;
            }
        }
    }

    @Nested
    @DisplayName("Julian Day to calendar")
    class InverseTests {

        @Test
        @DisplayName("Inverse of known days")
        void knownDays() {
            CalendarDateTime dt = JulianDay.toDateTime(2436116.31);
            assertEquals(LocalDate.of(1957, 10, 4), dt.date());
            assertEquals(0.81, dt.fraction(), 1e-8);
            assertEquals(CalendarDateTime.of(1600, 1, 1, 0.0), JulianDay.toDateTime(2305447.5));
            assertEquals(CalendarDateTime.of(2000, 1, 1, 0.5), JulianDay.toDateTime(2451545.0));
        }

        @Test
        @DisplayName("Dates round-trip over several centuries")
        void roundTrip() {
            for (double jd = 1867522.5; jd < 2524593.5; jd += 3659.25) {
                CalendarDateTime dt = JulianDay.toDateTime(jd);
                assertEquals(jd, JulianDay.fromDateTime(dt), 1e-8);
            }
        }

        @Test
        @DisplayName("Years before 401 are a domain error")
        void tooEarly() {
            assertThrows(EphemerisDomainException.class, () -> JulianDay.toDateTime(1867522.4));
            assertDoesNotThrow(() -> JulianDay.toDateTime(JulianDay.MIN_CONVERTIBLE));
        }
    }

    @Nested
    @DisplayName("Julian time units")
    class UnitTests {

        @Test
        @DisplayName("Centuries and millennia from J2000.0")
        void units() {
            assertEquals(0.0, JulianDay.toJulianCenturies(JulianDay.J2000));
            assertEquals(1.0, JulianDay.toJulianCenturies(JulianDay.J2000 + 36525.0));
            assertEquals(-0.1, JulianDay.toJulianMillennia(JulianDay.J2000 - 36525.0), 1e-15);
            assertEquals(2448908.5, JulianDay.fromJulianCenturies(JulianDay.toJulianCenturies(2448908.5)), 1e-8);
            assertEquals(2448908.5, JulianDay.fromJulianMillennia(JulianDay.toJulianMillennia(2448908.5)), 1e-8);
        }
    }
}
