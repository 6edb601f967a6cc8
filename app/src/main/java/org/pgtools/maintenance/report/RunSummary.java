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
package org.pgtools.maintenance.report;

import org.pgtools.maintenance.common.Constants;
import org.pgtools.maintenance.plan.OperationState;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one invocation, handed to the report writer.
 *
 * @param counts   Operations per final state, every state present
 * @param elapsed  Wall time from plan execution start to summary
 * @param outcomes Individual outcomes in plan order
 */
public record RunSummary(Map<OperationState, Integer> counts, Duration elapsed, List<OperationOutcome> outcomes) {

    public RunSummary {
        EnumMap<OperationState, Integer> complete = new EnumMap<>(OperationState.class);
        for (OperationState state : OperationState.values()) {
            complete.put(state, counts.getOrDefault(state, 0));
        }
        counts = Collections.unmodifiableMap(complete);
        outcomes = List.copyOf(outcomes);
    }

    public int count(OperationState state) {
        return counts.get(state);
    }

    public int total() {
        return outcomes.size();
    }

    public boolean hasFailures() {
        return count(OperationState.FAILED) > 0;
    }

    /**
     * @return 1 if any operation failed, 0 otherwise
     */
    public int exitCode() {
        return hasFailures() ? Constants.EXIT_OPERATION_FAILED : Constants.EXIT_OK;
    }
}
