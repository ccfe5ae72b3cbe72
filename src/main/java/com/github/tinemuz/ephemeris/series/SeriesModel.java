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
package com.github.tinemuz.ephemeris.series;

import java.util.List;

/**
 * Series for one coordinate. {@code tables().get(k)} is multiplied by
 * {@code t^k}.
 *
 * @param tables tables in ascending power of the time argument
 */
public record SeriesModel(List<SeriesTable> tables) {

    public SeriesModel {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("SeriesModel needs at least one table");
        }
        tables = List.copyOf(tables);
    }

    /** Highest power of the time argument present in the model. */
    public int degree() {
        return tables.size() - 1;
    }

    public int termCount() {
        int n = 0;
        for (SeriesTable table : tables) n += table.size();
        return n;
    }
}
