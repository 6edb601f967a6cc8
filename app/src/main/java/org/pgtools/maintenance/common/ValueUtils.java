/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.pgtools.maintenance.common;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for values read from statistics views and from configuration.
 */
@UtilityClass
public final class ValueUtils {
    private static final Pattern SIZE_PATTERN = Pattern.compile("^(\\d+)\\s*([KMGT]?B?)$");
    private static final String[] SIZE_UNITS = {"bytes", "kB", "MB", "GB", "TB"};

    /**
     * Parse a human size such as {@code 10GB}, {@code 512MB} or {@code 2048}.
     * Units are binary multiples of 1024.
     *
     * @param size Size text
     * @return Size in bytes
     * @throws IllegalArgumentException If the text is not a valid size
     */
    public static long parseSize(String size) {
        if (size == null || size.isBlank()) {
            throw new IllegalArgumentException("Size must not be empty");
        }
        Matcher matcher = SIZE_PATTERN.matcher(size.trim().toUpperCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid size: " + size);
        }
        long number = Long.parseLong(matcher.group(1));
        int shift = switch (matcher.group(2)) {
            case "", "B" -> 0;
            case "K", "KB" -> 10;
            case "M", "MB" -> 20;
            case "G", "GB" -> 30;
            case "T", "TB" -> 40;
            default -> throw new IllegalArgumentException("Invalid size unit: " + size);
        };
        if (shift > 0 && number > (Long.MAX_VALUE >> shift)) {
            throw new IllegalArgumentException("Size out of range: " + size);
        }
        return number << shift;
    }

    /**
     * Format a byte count the way pg_size_pretty does.
     */
    public static String prettySize(long bytes) {
        double value = bytes;
        int unit = 0;
        while (Math.abs(value) >= 10 * 1024 && unit < SIZE_UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return Math.round(value) + " " + SIZE_UNITS[unit];
    }
}
