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
import java.util.List;

/**
 * The 24 solar terms (jieqi), in traditional order starting from the
 * beginning of spring.
 *
 * <p>Terms at even ordinals are <i>jie</i> (sectional terms), the others
 * <i>qi</i> (principal terms, which fix the lunar month numbers).</p>
 */
public enum SolarTerm {
    LICHUN(315, "立春"),
    YUSHUI(330, "雨水"),
    JINGZHE(345, "惊蛰"),
    CHUNFEN(0, "春分"),
    QINGMING(15, "清明"),
    GUYU(30, "谷雨"),
    LIXIA(45, "立夏"),
    XIAOMAN(60, "小满"),
    MANGZHONG(75, "芒种"),
    XIAZHI(90, "夏至"),
    XIAOSHU(105, "小暑"),
    DASHU(120, "大暑"),
    LIQIU(135, "立秋"),
    CHUSHU(150, "处暑"),
    BAILU(165, "白露"),
    QIUFEN(180, "秋分"),
    HANLU(195, "寒露"),
    SHUANGJIANG(210, "霜降"),
    LIDONG(225, "立冬"),
    XIAOXUE(240, "小雪"),
    DAXUE(255, "大雪"),
    DONGZHI(270, "冬至"),
    XIAOHAN(285, "小寒"),
    DAHAN(300, "大寒");

    /** Longitude step between consecutive terms, degrees. */
    public static final double SPACING = 15.0;

    private static final SolarTerm[] VALUES = values();
    private static final List<SolarTerm> GREGORIAN_ORDER = gregorianOrder();

    private final int longitude;
    private final String chineseName;

    SolarTerm(int longitude, String chineseName) {
        this.longitude = longitude;
        this.chineseName = chineseName;
    }

    /** Apparent solar longitude of the term, degrees in [0, 360). */
    public double longitude() {
        return longitude;
    }

    public String chineseName() {
        return chineseName;
    }

    /** Pinyin name, e.g. {@code "Lichun"}. */
    public String pinyin() {
        String n = name();
        return n.charAt(0) + n.substring(1).toLowerCase();
    }

    public boolean isJie() {
        return ordinal() % 2 == 0;
    }

    public boolean isQi() {
        return !isJie();
    }

    public SolarTerm next() {
        return VALUES[(ordinal() + 1) % VALUES.length];
    }

    public SolarTerm previous() {
        return VALUES[(ordinal() + VALUES.length - 1) % VALUES.length];
    }

    /**
     * Term at {@code longitude}.
     *
     * @throws IllegalArgumentException unless the longitude is a multiple of 15° in [0, 360)
     */
    public static SolarTerm ofLongitude(double longitude) {
        for (SolarTerm term : VALUES) {
            if (term.longitude == longitude) return term;
        }
        throw new IllegalArgumentException("No solar term at longitude " + longitude);
    }

    /** All terms in the order they occur within a Gregorian year, XIAOHAN first. */
    public static List<SolarTerm> inGregorianYearOrder() {
        return GREGORIAN_ORDER;
    }

    private static List<SolarTerm> gregorianOrder() {
        List<SolarTerm> order = new ArrayList<>(VALUES.length);
        SolarTerm term = XIAOHAN;
        for (int i = 0; i < VALUES.length; i++) {
            order.add(term);
            term = term.next();
        }
        return List.copyOf(order);
    }
}
