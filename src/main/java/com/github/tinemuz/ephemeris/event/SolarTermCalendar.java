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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.github.tinemuz.ephemeris.cache.Memoizer;
import com.github.tinemuz.ephemeris.time.CalendarDateTime;

/**
 * Per-year solar term instants, cached.
 *
 * <p>Each (year, term) pair is solved once for the lifetime of the
 * calendar. Not thread-safe.</p>
 */
public final class SolarTermCalendar {

    private record YearTerm(int year, SolarTerm term) {}

    private final SolarTermLocator locator;
    private final Memoizer<YearTerm, Double> instants;

    public SolarTermCalendar() {
        this(new SolarTermLocator());
    }

    public SolarTermCalendar(SolarTermLocator locator) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.instants = Memoizer.of(key -> solve(key.year(), key.term()));
    }

    /**
     * JDE of {@code term} in {@code year}.
     *
     * @throws IllegalStateException if the year does not hold exactly one such instant
     */
    public double jde(int year, SolarTerm term) {
        return instants.apply(new YearTerm(year, term));
    }

    /** UT1 date and time of {@code term} in {@code year}. */
    public CalendarDateTime ut1(int year, SolarTerm term) {
        return locator.timeScale().jdeToUt1(jde(year, term));
    }

    /** All 24 terms of {@code year} in chronological order. */
    public List<SolarTermEvent> termsOf(int year) {
        List<SolarTermEvent> events = new ArrayList<>(SolarTerm.values().length);
        for (SolarTerm term : SolarTerm.inGregorianYearOrder()) {
            events.add(new SolarTermEvent(term, jde(year, term)));
        }
        events.sort(Comparator.comparingDouble(SolarTermEvent::jde));
        return List.copyOf(events);
    }

    /** Number of cached (year, term) instants. */
    public int cachedCount() {
        return instants.size();
    }

    private double solve(int year, SolarTerm term) {
        List<Double> roots = locator.findRoots(year, term.longitude());
        if (roots.size() != 1) {
            throw new IllegalStateException(
                    "Expected one " + term + " in " + year + " but found " + roots.size());
        }
        return roots.get(0);
    }
}
