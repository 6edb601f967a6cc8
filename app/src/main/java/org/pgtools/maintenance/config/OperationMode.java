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
package org.pgtools.maintenance.config;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Operation mode selected for a run. Decides which evaluation rules apply.
 */
public enum OperationMode {
    ANALYZE("analyze"),
    VACUUM("vacuum"),
    AUTO("auto"),
    FULL_VACUUM("full-vacuum"),
    REINDEX("reindex");

    private final String label;

    OperationMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean includesAnalyze() {
        return this == ANALYZE || this == AUTO;
    }

    public boolean includesVacuum() {
        return this == VACUUM || this == AUTO || this == FULL_VACUUM;
    }

    public boolean includesReindex() {
        return this == REINDEX;
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(OperationMode::label).toList();
    }

    /**
     * Resolve a mode from its command line label.
     *
     * @throws IllegalArgumentException If the label is unknown
     */
    public static OperationMode fromLabel(String label) {
        String normalized = label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
        for (OperationMode mode : values()) {
            if (mode.label.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown operation mode: " + label
                + " (expected one of " + labels() + ")");
    }

    @Override
    public String toString() {
        return label;
    }
}
