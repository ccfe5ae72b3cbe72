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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.ephemeris.EphemerisDomainException;

/**
 * ΔT = TT - UT1 in seconds, as a function of the fractional Gregorian year.
 *
 * <p>Four published approximations are available. {@link DeltaTModel}
 * selects between them.</p>
 */
public final class DeltaT {
    private static final Logger log = LoggerFactory.getLogger(DeltaT.class);

    /** Upper bound of the range {@link #observedFit} was fitted over. */
    public static final double OBSERVED_FIT_LIMIT = 2035.0;
    /** Upper bound of the 2014 Espenak-Meeus update. */
    public static final double ESPENAK_MEEUS_2014_LIMIT = 3000.0;
    /** Lower bound of the segmented cubic table. */
    public static final double SEGMENTED_CUBIC_START = -4000.0;

    private static volatile boolean warnedBeyondObservedFit = false;

    /** Cubic segments: start year, a, b, c, d. The last row only closes the table. */
    private static final double[][] SEGMENTS = {
        {-4000, 108371.7, -13036.80, 392.000, 0.0},
        {-500, 17201.0, -627.82, 16.170, -0.3413},
        {-150, 12200.6, -346.41, 5.403, -0.1593},
        {150, 9113.8, -328.13, -1.647, 0.0377},
        {500, 5707.5, -391.41, 0.915, 0.3145},
        {900, 2203.4, -283.45, 13.034, -0.1778},
        {1300, 490.1, -57.35, 2.085, -0.0072},
        {1600, 120.0, -9.81, -1.532, 0.1403},
        {1700, 10.2, -0.91, 0.510, -0.0370},
        {1800, 13.4, -0.72, 0.202, -0.0193},
        {1830, 7.8, -1.81, 0.416, -0.0247},
        {1860, 8.3, -0.13, -0.406, 0.0292},
        {1880, -5.4, 0.32, -0.183, 0.0173},
        {1900, -2.3, 2.06, 0.169, -0.0135},
        {1920, 21.2, 1.69, -0.304, 0.0167},
        {1940, 24.2, 1.22, -0.064, 0.0031},
        {1960, 33.2, 0.51, 0.231, -0.0109},
        {1980, 51.0, 1.29, -0.026, 0.0032},
        {2000, 63.87, 0.1, 0.0, 0.0},
        {2005, 0.0, 0.0, 0.0, 0.0},
    };

    private DeltaT() {}

    /**
     * ΔT from {@code model}.
     *
     * @throws EphemerisDomainException if the year is outside the model's range
     */
    public static double seconds(double year, DeltaTModel model) {
        return model.seconds(year);
    }

    /** ΔT from {@link DeltaTModel#DEFAULT}. */
    public static double seconds(double year) {
        return defaultModel(year);
    }

    /**
     * Cubic segments tabulated from -4000, continued by a linear then
     * parabolic extrapolation after 2005.
     *
     * @throws EphemerisDomainException for years before -4000
     */
    public static double segmentedCubic(double year) {
        if (year < SEGMENTED_CUBIC_START) {
            throw new EphemerisDomainException("Year " + year + " is not supported by the segmented cubic deltaT");
        }
        double whole = Math.floor(year);
        for (int i = 0; i < SEGMENTS.length - 1; i++) {
            double[] start = SEGMENTS[i];
            double end = SEGMENTS[i + 1][0];
            if (whole >= start[0] && whole < end) {
                double t1 = (year - start[0]) / (end - start[0]) * 10.0;
                return start[1] + t1 * (start[2] + t1 * (start[3] + t1 * start[4]));
            }
        }
        if (year < 2015) {
            return linear2005(year);
        }
        if (year < 2115) {
            return parabola1820(year) + (year - 2114) * (parabola1820(2014) - linear2005(2014)) / 100.0;
        }
        return parabola1820(year);
    }

    private static double linear2005(double year) {
        return 64.7 + (year - 2005) * 0.4;
    }

    private static double parabola1820(double year) {
        double u = (year - 1820) / 100.0;
        return -20.0 + 31.0 * u * u;
    }

    /**
     * NASA polynomial expressions by Espenak and Meeus (2006). Defined for
     * every year.
     */
    public static double espenakMeeus(double y) {
        if (y < -500) {
            double u = (y - 1820) / 100.0;
            return -20 + 32 * u * u;
        }
        if (y < 500) {
            double u = y / 100.0;
            return poly(u, 10583.6, -1014.41, 33.78311, -5.952053, -0.1798452, 0.022174192, 0.0090316521);
        }
        if (y < 1600) {
            double u = (y - 1000) / 100.0;
            return poly(u, 1574.2, -556.01, 71.23472, 0.319781, -0.8503463, -0.005050998, 0.0083572073);
        }
        if (y < 1700) {
            double t = y - 1600;
            return poly(t, 120, -0.9808, -0.01532, 1.0 / 7129);
        }
        if (y < 1800) {
            double t = y - 1700;
            return poly(t, 8.83, 0.1603, -0.0059285, 0.00013336, -1.0 / 1174000);
        }
        if (y < 1860) {
            double t = y - 1800;
            return poly(t, 13.72, -0.332447, 0.0068612, 0.0041116, -0.00037436, 0.0000121272,
                    -0.0000001699, 0.000000000875);
        }
        if (y < 1900) {
            double t = y - 1860;
            return poly(t, 7.62, 0.5737, -0.251754, 0.01680668, -0.0004473624, 1.0 / 233174);
        }
        if (y < 1920) {
            double t = y - 1900;
            return poly(t, -2.79, 1.494119, -0.0598939, 0.0061966, -0.000197);
        }
        if (y < 1941) {
            double t = y - 1920;
            return poly(t, 21.20, 0.84493, -0.076100, 0.0020936);
        }
        if (y < 1961) {
            double t = y - 1950;
            return poly(t, 29.07, 0.407, -1.0 / 233, 1.0 / 2547);
        }
        if (y < 1986) {
            double t = y - 1975;
            return poly(t, 45.45, 1.067, -1.0 / 260, -1.0 / 718);
        }
        if (y < 2005) {
            double t = y - 2000;
            return poly(t, 63.86, 0.3345, -0.060374, 0.0017275, 0.000651814, 0.00002373599);
        }
        if (y < 2050) {
            double t = y - 2000;
            return poly(t, 62.92, 0.32217, 0.005589);
        }
        double u = (y - 1820) / 100.0;
        if (y < 2150) {
            return -20 + 32 * u * u - 0.5628 * (2150 - y);
        }
        return -20 + 32 * u * u;
    }

    /**
     * Espenak and Meeus with the 2014 revision after 2005.
     *
     * @throws EphemerisDomainException for years from 3000 on
     */
    public static double espenakMeeus2014(double y) {
        if (y >= ESPENAK_MEEUS_2014_LIMIT) {
            throw new EphemerisDomainException("Year " + y + " is not supported by the 2014 Espenak-Meeus deltaT");
        }
        if (y < 2005) {
            return espenakMeeus(y);
        }
        if (y < 2015) {
            return 64.69 + 0.2930 * (y - 2005);
        }
        double t = y - 2015;
        return 67.62 + 0.3645 * t + 0.0039755 * t * t;
    }

    /**
     * Polynomials fitted to IERS Bulletin A values from 2005 on. Earlier
     * years defer to {@link #espenakMeeus}.
     *
     * @throws EphemerisDomainException for years from 2035 on
     */
    public static double observedFit(double y) {
        if (y >= OBSERVED_FIT_LIMIT) {
            throw new EphemerisDomainException("Year " + y + " is not supported by the observed-fit deltaT");
        }
        if (y < 2005) {
            return espenakMeeus(y);
        }
        if (y < 2024) {
            double u = y - 1990;
            return 7305.087465383047 / u + poly(u, -1539.5103964825782, 116.17205714035308,
                    -1.1279910329686536, -0.2754809577876994, 0.01542796862306066,
                    -0.0003332548091334704, 2.6541070013360904e-06);
        }
        double u = y - 2020;
        return -4.199766017124573 / u + poly(u, 73.38076003516039, -1.3053623848472002,
                0.14136771053009262, -0.004086715638812636);
    }

    /**
     * {@link #observedFit} while it is defined, then {@link #espenakMeeus2014},
     * then {@link #espenakMeeus}.
     */
    static double defaultModel(double y) {
        if (y < OBSERVED_FIT_LIMIT) {
            return observedFit(y);
        }
        if (!warnedBeyondObservedFit) {
            synchronized (DeltaT.class) {
                if (!warnedBeyondObservedFit) {
                    warnedBeyondObservedFit = true;
                    log.warn(
                            "deltaT requested for {} beyond the observed fit ending {}; extrapolating with Espenak-Meeus",
                            String.format("%.2f", y), OBSERVED_FIT_LIMIT);
                }
            }
        }
        if (y < ESPENAK_MEEUS_2014_LIMIT) {
            return espenakMeeus2014(y);
        }
        return espenakMeeus(y);
    }

    /** c[0] + c[1] x + c[2] x^2 + ... by Horner's rule. */
    private static double poly(double x, double... c) {
        double acc = 0.0;
        for (int i = c.length - 1; i >= 0; i--) {
            acc = acc * x + c[i];
        }
        return acc;
    }
}
