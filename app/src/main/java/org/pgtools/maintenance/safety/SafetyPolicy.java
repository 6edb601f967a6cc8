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
package org.pgtools.maintenance.safety;

import org.pgtools.maintenance.common.ValueUtils;
import org.pgtools.maintenance.config.MaintenanceConfig;

/**
 * Operational safety rules applied to a ranked plan.
 *
 * @param skipLarge            Skip tables at or above the large table size
 * @param largeTableSizeBytes  Large table size in bytes
 * @param confirmDestructive   Run destructive operations without asking
 * @param dryRun               Run is a dry run, nobody is asked
 */
public record SafetyPolicy(boolean skipLarge,
                           long largeTableSizeBytes,
                           boolean confirmDestructive,
                           boolean dryRun) {

    public static final long DEFAULT_LARGE_TABLE_SIZE = 10L * 1024 * 1024 * 1024;

    public SafetyPolicy {
        if (largeTableSizeBytes < 0) {
            throw new IllegalArgumentException("Large table size cannot be negative");
        }
    }

    public static SafetyPolicy from(MaintenanceConfig config) {
        MaintenanceConfig.Safety safety = config.safety();
        return new SafetyPolicy(
                safety.skipLarge(),
                ValueUtils.parseSize(safety.largeTableSize()),
                safety.confirmDestructive(),
                config.dryRun());
    }
}
