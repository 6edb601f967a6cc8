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
package org.pgtools.maintenance.schedule;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A crontab line managed by pgmaint, recognised by its trailing marker comment.
 *
 * @param name Job name from the marker
 * @param line Full crontab line including the marker
 */
public record CrontabEntry(String name, String line) {
    static final String MARKER_PREFIX = "# pgmaint:";
    private static final Pattern MARKER = Pattern.compile("\\s#\\s*pgmaint:([A-Za-z0-9_.-]+)\\s*$");
    private static final Pattern JOB_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    public CrontabEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(line, "line");
    }

    /**
     * Build the line for a job.
     *
     * @param name    Job name
     * @param cron    Five field expression or an {@code @} shortcut
     * @param command Command line to run
     * @param logFile File receiving stdout and stderr
     * @throws IllegalArgumentException If the name or the expression is invalid
     */
    public static CrontabEntry of(String name, String cron, String command, String logFile) {
        if (name == null || !JOB_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid job name: " + name);
        }
        String expression = validateExpression(name, cron);
        if (command.contains("\n") || logFile.contains("\n")) {
            throw new IllegalArgumentException("Job " + name + " contains a line break");
        }
        String line = expression + " " + command + " >> " + logFile + " 2>&1 " + MARKER_PREFIX + name;
        return new CrontabEntry(name, line);
    }

    /**
     * @return The managed entry for a crontab line, empty for lines pgmaint does not own
     */
    public static Optional<CrontabEntry> parse(String line) {
        if (line == null || line.stripLeading().startsWith("#")) {
            return Optional.empty();
        }
        Matcher matcher = MARKER.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new CrontabEntry(matcher.group(1), line));
    }

    private static String validateExpression(String name, String cron) {
        String expression = cron == null ? "" : cron.trim().replaceAll("\\s+", " ");
        if (expression.startsWith("@")) {
            if (expression.contains(" ")) {
                throw new IllegalArgumentException("Invalid cron shortcut for job " + name + ": " + cron);
            }
            return expression;
        }
        if (expression.split(" ").length != 5) {
            throw new IllegalArgumentException("Cron expression for job " + name
                    + " must have five fields: " + cron);
        }
        return expression;
    }
}
