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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.ephemeris.series.CoefficientResource;

/**
 * Selectable nutation coefficient sets. Each constant loads its table from
 * the classpath the first time it is used.
 */
public enum NutationModel {
    /** The 63 terms printed in Meeus, table 22.A. */
    MEEUS("nutation-meeus.txt"),
    /** The complete 106-term IAU 1980 series. */
    IAU_1980("nutation-iau1980.txt");

    public static final NutationModel DEFAULT = IAU_1980;

    private static final Logger log = LoggerFactory.getLogger(NutationModel.class);

    private final String resource;
    private volatile List<NutationTerm> terms;

    NutationModel(String resource) {
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }

    /**
     * Terms of this model.
     *
     * @throws IllegalStateException if the coefficient file cannot be loaded
     */
    public List<NutationTerm> terms() {
        List<NutationTerm> t = terms;
        if (t == null) {
            synchronized (this) {
                t = terms;
                if (t == null) {
                    t = List.copyOf(CoefficientResource.readRows(
                            resource, fields -> NutationTerm.parse(CoefficientResource.requireFields(fields, 9))));
                    log.debug("Nutation model {} loaded with {} terms", name(), t.size());
                    terms = t;
                }
            }
        }
        return t;
    }
}
