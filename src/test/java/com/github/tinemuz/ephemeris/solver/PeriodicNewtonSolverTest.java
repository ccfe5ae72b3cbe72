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

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PeriodicNewtonSolverTest {

    private static final double TOLERANCE = 1e-10;

    @Nested
    @DisplayName("Convergence")
    class ConvergenceTests {

        @Test
        @DisplayName("Finds the root of a smooth increasing function")
        void smoothRoot() {
            PeriodicNewtonSolver solver = new PeriodicNewtonSolver();
            RootResult r = solver.solve(x -> x * x * x + x - 10.0, 0.0, 5.0);
            assertTrue(r.converged());
            assertEquals(2.0, r.root(), 1e-9);
            assertTrue(Math.abs(r.residual()) < TOLERANCE);
        }

        @Test
        @DisplayName("Midpoint root converges without iterating")
        void midpointRoot() {
            RootResult r = new PeriodicNewtonSolver().solve(x -> x - 2.5, 0.0, 5.0);
            assertTrue(r.converged());
            assertEquals(0, r.iterations());
            assertEquals(2.5, r.root());
        }

        @Test
        @DisplayName("Folded sawtooth longitude converges across the wrap")
        void foldedSawtooth() {
            // longitude advancing 1°/day, wrapping through 360° at day 80
            ObjectiveFunction raw = jde -> ((jde + 280.0) % 360.0);
            double target = 5.0;
            ObjectiveFunction folded = jde -> {
                double lon = raw.valueAt(jde);
                if (jde < 90.0 && lon >= 250.0) lon -= 360.0;
                return lon - target;
            };
            double root = new PeriodicNewtonSolver().findRoot(folded, 0.0, 365.0);
            assertEquals(85.0, root, 1e-9);
        }
    }

    @Nested
    @DisplayName("Bracket clamping and budget")
    class ClampingTests {

        @Test
        @DisplayName("Steps below the bracket snap to the lower bound")
        void clampLower() {
            assertEquals(1.0, PeriodicNewtonSolver.clamp(0.5, 1.0, 2.0));
        }

        @Test
        @DisplayName("Steps at or above the upper bound stay inside the half-open bracket")
        void clampUpper() {
            double upper = 2460000.5;
            double clamped = PeriodicNewtonSolver.clamp(upper + 3.0, 2459000.5, upper);
            assertTrue(clamped < upper);
            assertEquals(Math.nextDown(upper), clamped);
            assertEquals(Math.nextDown(upper), PeriodicNewtonSolver.clamp(upper, 2459000.5, upper));
        }

        @Test
        @DisplayName("Root outside the bracket ends on the bracket edge")
        void rootOutside() {
            RootResult r = new PeriodicNewtonSolver().solve(x -> x - 10.0, 0.0, 5.0);
            assertFalse(r.converged());
            assertTrue(r.root() < 5.0 && r.root() > 4.999999);
        }

        @Test
        @DisplayName("Exhausted budget returns the best estimate, not an error")
        void exhausted() {
            AtomicInteger calls = new AtomicInteger();
            PeriodicNewtonSolver solver = new PeriodicNewtonSolver(1e-300, 5);
            RootResult r = solver.solve(x -> {
                calls.incrementAndGet();
                return Math.atan(x - 1.0);
            }, -3.0, 3.0);
            assertFalse(r.converged());
            assertEquals(5, r.iterations());
            assertEquals(1.0, r.root(), 1e-6);
            assertEquals(15, calls.get());
        }

        @Test
        @DisplayName("Flat objective stops without a NaN estimate")
        void flat() {
            RootResult r = new PeriodicNewtonSolver().solve(x -> 1.0, 0.0, 2.0);
            assertFalse(r.converged());
            assertEquals(1.0, r.root());
        }
    }

    @Nested
    @DisplayName("Argument validation")
    class ValidationTests {

        @Test
        @DisplayName("Rejects non-positive settings and empty brackets")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> new PeriodicNewtonSolver(0.0, 10));
            assertThrows(IllegalArgumentException.class, () -> new PeriodicNewtonSolver(1e-10, 0));
            assertThrows(IllegalArgumentException.class,
                    () -> new PeriodicNewtonSolver().findRoot(x -> x, 1.0, 1.0));
        }
    }
}
