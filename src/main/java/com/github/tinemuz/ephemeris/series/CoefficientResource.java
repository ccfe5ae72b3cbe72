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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads whitespace separated coefficient tables from the classpath.
 *
 * <p>Blank lines and lines starting with {@code #} are skipped. Every other
 * line is split on whitespace and handed to a row parser. Any failure is
 * logged and rethrown as {@link IllegalStateException}, since the models
 * cannot run without their coefficients.</p>
 */
public final class CoefficientResource {
    private static final Logger log = LoggerFactory.getLogger(CoefficientResource.class);

    private CoefficientResource() {}

    /**
     * Parse every data row of {@code resource} with {@code rowParser}.
     *
     * @param resource  classpath resource name
     * @param rowParser maps the whitespace separated fields of one row to a value
     * @return parsed rows in file order
     * @throws IllegalStateException if the resource is missing, unreadable or malformed
     */
    public static <T> List<T> readRows(String resource, Function<String[], T> rowParser) {
        InputStream in = CoefficientResource.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Coefficient file '{}' not found on classpath", resource);
            throw new IllegalStateException("Coefficient file '" + resource + "' not found on classpath");
        }
        List<T> rows = new ArrayList<>();
        int lineNo = 0;
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                rows.add(rowParser.apply(line.split("\\s+")));
            }
        } catch (IOException e) {
            log.error("Failed to read coefficient file '{}'", resource, e);
            throw new IllegalStateException("Failed to read coefficient file '" + resource + "'", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse coefficient file '{}' at line {}", resource, lineNo, e);
            throw new IllegalStateException(
                    "Failed to parse coefficient file '" + resource + "' at line " + lineNo, e);
        }
        if (rows.isEmpty()) {
            log.error("Coefficient file '{}' holds no data rows", resource);
            throw new IllegalStateException("Coefficient file '" + resource + "' holds no data rows");
        }
        log.debug("Loaded {} rows from {}", rows.size(), resource);
        return rows;
    }

    /**
     * Check the field count of a row.
     *
     * @throws IllegalArgumentException if {@code fields} does not have {@code expected} entries
     */
    public static String[] requireFields(String[] fields, int expected) {
        if (fields.length != expected) {
            throw new IllegalArgumentException(
                    "Expected " + expected + " fields but found " + fields.length);
        }
        return fields;
    }
}
