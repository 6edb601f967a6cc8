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
package org.pgtools.maintenance.plan;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a maintenance operation.
 *
 * <pre>
 * PENDING -> SKIPPED | DRY_RUN_REPORTED | RUNNING
 * RUNNING -> SUCCEEDED | FAILED
 * </pre>
 */
public enum OperationState {
    PENDING,
    SKIPPED,
    DRY_RUN_REPORTED,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean canTransitionTo(OperationState next) {
        return allowedTransitions().contains(next);
    }

    private Set<OperationState> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(SKIPPED, DRY_RUN_REPORTED, RUNNING);
            case RUNNING -> EnumSet.of(SUCCEEDED, FAILED);
            default -> EnumSet.noneOf(OperationState.class);
        };
    }
}
