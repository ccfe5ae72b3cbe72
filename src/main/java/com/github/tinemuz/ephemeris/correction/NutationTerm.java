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
package com.github.tinemuz.ephemeris.correction;

/**
 * One row of a nutation series. Coefficients are in units of 0.0001″, the
 * {@code b} parts per Julian century.
 *
 * @param d     multiplier of the mean elongation of the Moon
 * @param m     multiplier of the mean anomaly of the Sun
 * @param mp    multiplier of the mean anomaly of the Moon
 * @param f     multiplier of the Moon's argument of latitude
 * @param omega multiplier of the longitude of the Moon's ascending node
 * @param psiA  constant part of the longitude coefficient
 * @param psiB  secular part of the longitude coefficient
 * @param epsA  constant part of the obliquity coefficient
 * @param epsB  secular part of the obliquity coefficient
 */
public record NutationTerm(
        int d, int m, int mp, int f, int omega,
        double psiA, double psiB, double epsA, double epsB) {

    static NutationTerm parse(String[] fields) {
        return new NutationTerm(
                Integer.parseInt(fields[0]),
                Integer.parseInt(fields[1]),
                Integer.parseInt(fields[2]),
                Integer.parseInt(fields[3]),
                Integer.parseInt(fields[4]),
                Double.parseDouble(fields[5]),
                Double.parseDouble(fields[6]),
                Double.parseDouble(fields[7]),
                Double.parseDouble(fields[8]));
    }
}
