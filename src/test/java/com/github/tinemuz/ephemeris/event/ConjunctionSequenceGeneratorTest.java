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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.ephemeris.EphemerisDomainException;
import com.github.tinemuz.ephemeris.event.ConjunctionSequenceGenerator.Bracket;
import com.github.tinemuz.ephemeris.time.CalendarDateTime;
import com.github.tinemuz.ephemeris.time.TimeScale;
import java.util.List;
import java.util.PrimitiveIterator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConjunctionSequenceGeneratorTest {

    private static final double ALMANAC_TOLERANCE = 0.0005; // days
    private static final double COINCIDENCE_TOLERANCE = 1e-5; // degrees
    private static final double MIN_GAP = 29.530588853 - 0.75;
    private static final double MAX_GAP = 29.530588853 + 0.75;
    private static final double SAME_ROOT_TOLERANCE = 1e-6; // days

    /** First new moon after J2000.0, JDE. */
    private static final double JANUARY_2000 = 2451550.2600937854;

    private static final TimeScale SCALE = TimeScale.defaultScale();

    /** 2024 new moons from the Hong Kong Observatory, local time UTC+8: month, day, hour, minute. */
    private static final int[][] HKO_2024 = {
        {1, 11, 19, 57}, {2, 10, 6, 59}, {3, 10, 17, 0}, {4, 9, 2, 21}, {5, 8, 11, 22},
        {6, 6, 20, 38}, {7, 6, 6, 57}, {8, 4, 19, 13}, {9, 3, 9, 56}, {10, 3, 2, 49},
        {11, 1, 20, 47}, {12, 1, 14, 21}, {12, 31, 6, 27},
    };

    /** Beijing time (UTC+8) new moons, 2011-11 to 2013-01: y, m, d, h, min, s. */
    private static final double[][] BEIJING_2011_2013 = {
        {2011, 11, 25, 14, 9, 41.25}, {2011, 12, 25, 2, 6, 27.25}, {2012, 1, 23, 15, 39, 24.16},
        {2012, 2, 22, 6, 34, 40.84}, {2012, 3, 22, 22, 37, 8.91}, {2012, 4, 21, 15, 18, 22.12},
        {2012, 5, 21, 7, 46, 59.97}, {2012, 6, 19, 23, 2, 6.39}, {2012, 7, 19, 12, 24, 2.83},
        {2012, 8, 17, 23, 54, 28.03}, {2012, 9, 16, 10, 10, 36.99}, {2012, 10, 15, 20, 2, 30.98},
        {2012, 11, 14, 6, 8, 5.9}, {2012, 12, 13, 16, 41, 37.6}, {2013, 1, 12, 3, 43, 31.34},
    };

    @Nested
    @DisplayName("Known new moons")
    class KnownValueTests {

        @Test
        @DisplayName("Thirteen new moons in 2024 match the almanac")
        void year2024() {
            List<Double> moments = ConjunctionSequenceGenerator.moments(2024);
            assertEquals(HKO_2024.length, moments.size());
            for (int i = 0; i < HKO_2024.length; i++) {
                int[] row = HKO_2024[i];
                double expected = fromUtc8(2024, row[0], row[1], row[2], row[3], 0.0);
                assertEquals(expected, moments.get(i), ALMANAC_TOLERANCE, "new moon " + (i + 1));
            }
        }

        @Test
        @DisplayName("Consecutive new moons 2011-2013")
        void consecutive() {
            double first = fromRow(BEIJING_2011_2013[0]);
            ConjunctionSequenceGenerator generator = new ConjunctionSequenceGenerator(first - 0.5);
            for (double[] row : BEIJING_2011_2013) {
                assertEquals(fromRow(row), generator.nextDouble(), 1e-4);
            }
        }

        @Test
        @DisplayName("nextAfter returns the first new moon at or after the instant")
        void nextAfter() {
            double jan2024 = SCALE.startOfYear(2024);
            double root = ConjunctionSequenceGenerator.nextAfter(jan2024);
            assertTrue(root >= jan2024);
            assertEquals(fromUtc8(2024, 1, 11, 19, 57, 0.0), root, ALMANAC_TOLERANCE);
        }
    }

    @Nested
    @DisplayName("Sequence invariants")
    class InvariantTests {

        @Test
        @DisplayName("500 consecutive roots are increasing, spaced by a synodic month and exact")
        void spacingAndCorrectness() {
            for (double start : new double[] {2451545.0, 2378496.5, 2488069.5}) {
                ConjunctionSequenceGenerator generator = new ConjunctionSequenceGenerator(start);
                double previous = generator.nextDouble();
                assertTrue(previous >= start);
                for (int i = 1; i < 500; i++) {
                    double root = generator.nextDouble();
                    double gap = root - previous;
                    assertTrue(gap >= MIN_GAP && gap <= MAX_GAP, "gap " + gap + " after " + previous);

                    double diff = generator.longitudeDifference(root);
                    assertTrue(diff < COINCIDENCE_TOLERANCE || diff > 360.0 - COINCIDENCE_TOLERANCE,
                            "difference " + diff + " at " + root);
                    previous = root;
                }
            }
        }

        @Test
        @DisplayName("A fresh generator from the same start restarts the same sequence")
        void restartable() {
            double start = 2459000.5;
            ConjunctionSequenceGenerator a = new ConjunctionSequenceGenerator(start);
            a.nextDouble();
            double second = a.nextDouble();
            assertEquals(second, a.lastRoot());

            PrimitiveIterator.OfDouble b = new ConjunctionSequenceGenerator(start);
            b.nextDouble();
            assertEquals(second, b.nextDouble());

            ConjunctionSequenceGenerator resumed = new ConjunctionSequenceGenerator(second + 1.0);
            assertEquals(a.nextDouble(), resumed.nextDouble(), 1e-9);
        }

        @Test
        @DisplayName("Stream view yields the same values lazily")
        void stream() {
            double start = 2460000.5;
            double[] viaStream = new ConjunctionSequenceGenerator(start).stream().limit(3).toArray();
            ConjunctionSequenceGenerator generator = new ConjunctionSequenceGenerator(start);
            assertTrue(generator.hasNext());
            for (double v : viaStream) {
                assertEquals(v, generator.nextDouble());
            }
        }

        @Test
        @DisplayName("Bracket from any instant straddles the next conjunction")
        void bracket() {
            ConjunctionSequenceGenerator generator = new ConjunctionSequenceGenerator(2460000.5);
            for (double jde = 2460000.5; jde < 2460060.5; jde += 2.5) {
                ConjunctionSequenceGenerator.Bracket b = generator.firstRootRangeAfter(jde);
                assertTrue(b.lower() < b.upper());
                assertTrue(b.upper() - b.lower() < 3.0, "width " + (b.upper() - b.lower()));
            }
        }
    }

    @Nested
    @DisplayName("Starting on a conjunction")
    class StartOnRootTests {

        @Test
        @DisplayName("nextAfter a root, or an instant just before it, returns that root")
        void hundredRoots() {
            ConjunctionSequenceGenerator generator = new ConjunctionSequenceGenerator(2451545.0);
            for (int i = 0; i < 100; i++) {
                double root = generator.nextDouble();
                assertEquals(root, ConjunctionSequenceGenerator.nextAfter(root), SAME_ROOT_TOLERANCE, "root " + i);
                assertEquals(root, new ConjunctionSequenceGenerator(root - 1e-9).nextDouble(), SAME_ROOT_TOLERANCE,
                        "root " + i);
            }
        }

        @Test
        @DisplayName("Bracket from a root is centred on it")
        void bracketFromRoot() {
            double root = ConjunctionSequenceGenerator.nextAfter(2451545.0);
            assertEquals(JANUARY_2000, root, SAME_ROOT_TOLERANCE);
            Bracket b = new ConjunctionSequenceGenerator(root).firstRootRangeAfter(root);
            assertTrue(b.lower() < root && root < b.upper(), b.toString());
        }
    }

    @Nested
    @DisplayName("Bracket selection")
    class BracketTests {

        private static final double ESTIMATE = 2460000.0;

        @Test
        @DisplayName("Exact hit is centred on the estimate")
        void exactHit() {
            Bracket zero = ConjunctionSequenceGenerator.bracketAround(0.0, ESTIMATE, 0.0);
            assertEquals(ESTIMATE - ConjunctionSequenceGenerator.EXACT_HIT_HALF_WIDTH, zero.lower());
            assertEquals(ESTIMATE + ConjunctionSequenceGenerator.EXACT_HIT_HALF_WIDTH, zero.upper());

            Bracket below = ConjunctionSequenceGenerator.bracketAround(0.0, ESTIMATE, 360.0 - 1e-8);
            assertEquals(zero, below);
        }

        @Test
        @DisplayName("Moon past the Sun puts the bracket behind the estimate")
        void behind() {
            Bracket b = ConjunctionSequenceGenerator.bracketAround(0.0, ESTIMATE, 12.0);
            assertEquals(ESTIMATE - 24.0 / ConjunctionSequenceGenerator.MEAN_DIFFERENCE_RATE, b.lower(), 1e-9);
            assertEquals(ESTIMATE, b.upper());
        }

        @Test
        @DisplayName("Moon short of the Sun puts the bracket ahead of the estimate")
        void ahead() {
            Bracket b = ConjunctionSequenceGenerator.bracketAround(0.0, ESTIMATE, 348.0);
            assertEquals(ESTIMATE, b.lower());
            assertEquals(ESTIMATE + 24.0 / ConjunctionSequenceGenerator.MEAN_DIFFERENCE_RATE, b.upper(), 1e-9);
        }

        @Test
        @DisplayName("Near-wrap brackets keep a minimum width")
        void minimumWidth() {
            double min = ConjunctionSequenceGenerator.EXACT_HIT_HALF_WIDTH;
            Bracket behind = ConjunctionSequenceGenerator.bracketAround(0.0, ESTIMATE, 1e-5);
            assertEquals(min, behind.upper() - behind.lower(), 1e-9);
            Bracket ahead = ConjunctionSequenceGenerator.bracketAround(0.0, ESTIMATE, 360.0 - 1e-5);
            assertEquals(min, ahead.upper() - ahead.lower(), 1e-9);
        }

        @Test
        @DisplayName("Estimate far from a conjunction is a domain error")
        void farEstimate() {
            EphemerisDomainException e = assertThrows(EphemerisDomainException.class,
                    () -> ConjunctionSequenceGenerator.bracketAround(0.0, ESTIMATE, 180.0));
            assertTrue(e.getMessage().contains("180.0 deg off"), e.getMessage());
            assertThrows(EphemerisDomainException.class,
                    () -> ConjunctionSequenceGenerator.bracketAround(0.0, ESTIMATE, 30.0));
            assertThrows(EphemerisDomainException.class,
                    () -> ConjunctionSequenceGenerator.bracketAround(0.0, ESTIMATE, 330.0));
        }

        @Test
        @DisplayName("Refinement rejects brackets that do not straddle the wrap")
        void refineRejects() {
            ConjunctionSequenceGenerator generator = new ConjunctionSequenceGenerator(2451545.0);
            // about 115 and 129 degrees past the January 2000 new moon
            assertThrows(EphemerisDomainException.class,
                    () -> generator.refine(new Bracket(2451560.0, 2451561.0)));
            // both ends still short of it
            assertThrows(EphemerisDomainException.class,
                    () -> generator.refine(new Bracket(JANUARY_2000 - 0.5, JANUARY_2000 - 0.2)));
            assertEquals(JANUARY_2000,
                    generator.refine(new Bracket(JANUARY_2000 - 0.5, JANUARY_2000 + 0.5)), SAME_ROOT_TOLERANCE);
        }
    }

    private static double fromUtc8(int year, int month, int day, int hour, int minute, double second) {
        return SCALE.ut1ToJde(CalendarDateTime.of(year, month, day, hour, minute, second)) - 8.0 / 24.0;
    }

    private static double fromRow(double[] row) {
        return fromUtc8((int) row[0], (int) row[1], (int) row[2], (int) row[3], (int) row[4], row[5]);
    }
}
