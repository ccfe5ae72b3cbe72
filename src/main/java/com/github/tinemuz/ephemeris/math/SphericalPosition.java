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
package com.github.tinemuz.ephemeris.math;

import java.util.Objects;

/**
 * Ecliptic position of a body.
 *
 * @param longitude ecliptic longitude
 * @param latitude  ecliptic latitude
 * @param radius    distance: AU for the Sun and Earth, kilometers for the Moon
 */
public record SphericalPosition(Angle longitude, Angle latitude, double radius) {

    public SphericalPosition {
        Objects.requireNonNull(longitude, "longitude");
        Objects.requireNonNull(latitude, "latitude");
    }

    public static SphericalPosition ofDegrees(double longitudeDeg, double latitudeDeg, double radius) {
        return new SphericalPosition(Angle.ofDegrees(longitudeDeg), Angle.ofDegrees(latitudeDeg), radius);
    }

    public double longitudeDegrees() {
        return longitude.degrees();
    }

    public double latitudeDegrees() {
        return latitude.degrees();
    }
}
