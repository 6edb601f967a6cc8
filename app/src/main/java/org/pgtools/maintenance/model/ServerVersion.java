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
package org.pgtools.maintenance.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Represents a PostgreSQL server version
 */
public record ServerVersion(int major, int minor, String rawVersion) {
    private static final int MINIMUM_SUPPORTED_MAJOR = 10;
    private static final Pattern PG_VERSION_REGEX = Pattern.compile(
            "^PostgreSQL\\s+(\\d+)(?:\\.(\\d+))?"
    );

    private static final int MAJOR_GROUP = 1;
    private static final int MINOR_GROUP = 2;

    /**
     * Parse version from SELECT version() output, for example
     * {@code PostgreSQL 15.4 on x86_64-pc-linux-gnu, compiled by gcc ...}
     *
     * @param versionString The version string from SELECT version()
     * @return Parsed version or null if parsing fails
     */
    public static ServerVersion parse(String versionString) {
        if (versionString == null || versionString.isBlank()) {
            return null;
        }
        final String input = versionString.trim();
        final Matcher matcher = PG_VERSION_REGEX.matcher(input);
        if (!matcher.find()) {
            return null;
        }
        final int major = Integer.parseInt(matcher.group(MAJOR_GROUP));
        final String minorText = matcher.group(MINOR_GROUP);
        final int minor = minorText == null ? 0 : Integer.parseInt(minorText);
        return new ServerVersion(major, minor, input);
    }

    public static String minimumVersion() {
        return String.valueOf(MINIMUM_SUPPORTED_MAJOR);
    }

    public String fullVersion() {
        return major + "." + minor;
    }

    public boolean isSupported() {
        return major >= MINIMUM_SUPPORTED_MAJOR;
    }
}
