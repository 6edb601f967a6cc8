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

import org.pgtools.maintenance.plan.MaintenanceOperation;
import org.pgtools.maintenance.plan.OperationKind;
import org.pgtools.maintenance.plan.OperationState;

import java.time.Duration;

/**
 * Flat record of one operation, one row of the report.
 *
 * @param rank     Position in the plan
 * @param target   Schema-qualified table name
 * @param kind     Operation kind
 * @param reason   Trigger reason
 * @param state    Final state
 * @param duration Time spent running, zero if never run
 * @param error    Error text, empty if none
 * @param note     Skip note or annotation, empty if none
 */
public record OperationOutcome(int rank,
                               String target,
                               OperationKind kind,
                               String reason,
                               OperationState state,
                               Duration duration,
                               String error,
                               String note) {

    public static OperationOutcome of(MaintenanceOperation operation) {
        return new OperationOutcome(
                operation.rank(),
                operation.tableKey(),
                operation.kind(),
                operation.reason().toString(),
                operation.state(),
                operation.duration(),
                operation.error().orElse(""),
                operation.note().orElse(""));
    }
}
