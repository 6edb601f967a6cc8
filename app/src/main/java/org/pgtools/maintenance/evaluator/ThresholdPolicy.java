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
package org.pgtools.maintenance.evaluator;

import org.pgtools.maintenance.config.MaintenanceConfig;
import org.pgtools.maintenance.config.OperationMode;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds used to classify candidates. Ratios are fractions, not percentages.
 *
 * @param mode                     Operation mode of the run
 * @param deadTupleRatio           Dead to live ratio that triggers a vacuum
 * @param staleAfter               Age of statistics after which they are stale
 * @param modificationRatio        Modified to live ratio that triggers an analyze
 * @param neverAnalyzedMinLiveRows Live rows a never analyzed table needs
 * @param staleMinModifications    Modifications a stale table needs
 * @param verbose                  Add absolute counts to reason strings
 */
public record ThresholdPolicy(OperationMode mode,
                              double deadTupleRatio,
                              Duration staleAfter,
                              double modificationRatio,
                              long neverAnalyzedMinLiveRows,
                              long staleMinModifications,
                              boolean verbose) {

    public static final double DEFAULT_DEAD_TUPLE_RATIO = 0.20;
    public static final Duration DEFAULT_STALE_AFTER = Duration.ofDays(7);
    public static final double DEFAULT_MODIFICATION_RATIO = 0.10;
    public static final long DEFAULT_MIN_ROWS = 1000;

    public ThresholdPolicy {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(staleAfter, "staleAfter");
        if (!(deadTupleRatio > 0) || !(modificationRatio > 0)) {
            throw new IllegalArgumentException("Thresholds must be positive");
        }
    }

    public static ThresholdPolicy defaults(OperationMode mode) {
        return new ThresholdPolicy(mode, DEFAULT_DEAD_TUPLE_RATIO, DEFAULT_STALE_AFTER,
                DEFAULT_MODIFICATION_RATIO, DEFAULT_MIN_ROWS, DEFAULT_MIN_ROWS, false);
    }

    public static ThresholdPolicy from(MaintenanceConfig config) {
        MaintenanceConfig.Thresholds thresholds = config.thresholds();
        return new ThresholdPolicy(
                config.operation(),
                thresholds.deadTuplePercent() / 100.0,
                Duration.ofDays(thresholds.staleDays()),
                thresholds.modificationPercent() / 100.0,
                thresholds.neverAnalyzedMinLiveRows(),
                thresholds.staleMinModifications(),
                config.verbose());
    }
}
