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
package com.github.tinemuz.ephemeris.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Caches the results of a pure function per distinct argument.
 *
 * <p>Entries live as long as the memoizer; there is no eviction. Keys are
 * compared with {@code equals}, so multi-argument functions take a record
 * as key. Instances are not thread-safe: share one across threads only
 * behind external synchronization.</p>
 *
 * @param <K> argument type
 * @param <V> result type
 */
public final class Memoizer<K, V> implements Function<K, V> {

    private final Function<? super K, ? extends V> function;
    private final Map<K, V> cache = new LinkedHashMap<>();

    private Memoizer(Function<? super K, ? extends V> function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    public static <K, V> Memoizer<K, V> of(Function<? super K, ? extends V> function) {
        return new Memoizer<>(function);
    }

    /**
     * Cached result for {@code key}, computing it on first request.
     * Exceptions from the function propagate and nothing is cached.
     */
    @Override
    public V apply(K key) {
        if (cache.containsKey(key)) {
            return cache.get(key);
        }
        // not computeIfAbsent: the function may itself call back into this memoizer
        V value = function.apply(key);
        cache.put(key, value);
        return value;
    }

    public boolean isCached(K key) {
        return cache.containsKey(key);
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }
}
