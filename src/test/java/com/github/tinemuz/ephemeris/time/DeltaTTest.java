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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DeltaTTest {

    @Nested
    @DisplayName("Published approximations")
    class AlgorithmTests {

        @Test
        @DisplayName("Segmented cubic")
        void segmentedCubic() {
            assertEquals(5710.0, DeltaT.segmentedCubic(500.0), 5.0);
            assertEquals(29.0, DeltaT.segmentedCubic(1950.0), 0.1);
            assertEquals(66.0, DeltaT.segmentedCubic(2008.0), 0.1);
            // segment starts reproduce their constant term
            assertEquals(-2.3, DeltaT.segmentedCubic(1900.0), 1e-12);
            assertEquals(66.7, DeltaT.segmentedCubic(2010.0), 1e-12);
            EphemerisDomainException e =
                    assertThrows(EphemerisDomainException.class, () -> DeltaT.segmentedCubic(-4001.0));
            assertTrue(e.getMessage().chars().allMatch(c -> c < 128), e.getMessage());
            assertTrue(e.getMessage().contains("deltaT"), e.getMessage());
        }

        @Test
        @DisplayName("Espenak-Meeus 2006")
        void espenakMeeus() {
            assertEquals(5710.0, DeltaT.espenakMeeus(500.0), 1.0);
            assertEquals(29.07, DeltaT.espenakMeeus(1950.0), 1e-12);
            assertEquals(63.86, DeltaT.espenakMeeus(2000.0), 1e-12);
            assertEquals(66.0, DeltaT.espenakMeeus(2008.0), 0.15);
            assertTrue(Double.isFinite(DeltaT.espenakMeeus(-10000.0)));
        }

        @Test
        @DisplayName("Espenak-Meeus 2014 revision")
        void espenakMeeus2014() {
            assertEquals(DeltaT.espenakMeeus(1950.0), DeltaT.espenakMeeus2014(1950.0));
            assertEquals(66.0, DeltaT.espenakMeeus2014(2008.0), 0.5);
            assertEquals(67.62, DeltaT.espenakMeeus2014(2015.0), 1e-12);
            assertThrows(EphemerisDomainException.class, () -> DeltaT.espenakMeeus2014(3000.1));
        }

        @Test
        @DisplayName("Observed fit")
        void observedFit() {
            assertEquals(29.0, DeltaT.observedFit(1950.0), 0.1);
            assertEquals(66.0, DeltaT.observedFit(2008.0), 0.6);
            assertEquals(69.06, DeltaT.observedFit(2024.5), 0.01);
            assertThrows(EphemerisDomainException.class, () -> DeltaT.observedFit(2035.1));
        }
    }

    @Nested
    @DisplayName("Model selection")
    class ModelTests {

        @Test
        @DisplayName("Default follows the observed fit, then the 2014 revision")
        void defaultModel() {
            assertEquals(DeltaT.observedFit(2024.5), DeltaTModel.DEFAULT.seconds(2024.5));
            assertEquals(DeltaT.espenakMeeus2014(2100.0), DeltaTModel.DEFAULT.seconds(2100.0));
            assertEquals(DeltaT.espenakMeeus(3500.0), DeltaTModel.DEFAULT.seconds(3500.0));
            assertEquals(DeltaT.seconds(1984.0), DeltaT.seconds(1984.0, DeltaTModel.DEFAULT));
        }

        @Test
        @DisplayName("Each enum constant dispatches to its formula")
        void dispatch() {
            assertEquals(DeltaT.segmentedCubic(1850.0), DeltaTModel.SEGMENTED_CUBIC.seconds(1850.0));
            assertEquals(DeltaT.espenakMeeus(1850.0), DeltaTModel.ESPENAK_MEEUS.seconds(1850.0));
            assertEquals(DeltaT.espenakMeeus2014(2020.0), DeltaTModel.ESPENAK_MEEUS_2014.seconds(2020.0));
            assertEquals(DeltaT.observedFit(2020.0), DeltaTModel.OBSERVED_FIT.seconds(2020.0));
        }

        @Test
        @DisplayName("Modern values stay within a plausible band")
        void plausible() {
            for (DeltaTModel model : DeltaTModel.values()) {
                for (double y = 1950.0; y < 2015.0; y += 0.5) {
                    double dt = model.seconds(y);
                    assertTrue(dt > 25.0 && dt < 80.0, model + " at " + y + ": " + dt);
                }
            }
        }
    }
}
