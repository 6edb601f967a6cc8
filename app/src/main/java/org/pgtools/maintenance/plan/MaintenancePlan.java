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

import java.util.List;

/**
 * Operations of a run in priority order. The list is fixed, the operations
 * inside it change state as the run proceeds.
 */
public record MaintenancePlan(List<MaintenanceOperation> operations) {

    public MaintenancePlan {
        operations = List.copyOf(operations);
    }

    public static MaintenancePlan empty() {
        return new MaintenancePlan(List.of());
    }

    /**
     * @return Operations still waiting to be dispatched, in plan order
     */
    public List<MaintenanceOperation> pending() {
        return operations.stream()
                .filter(operation -> operation.state() == OperationState.PENDING)
                .toList();
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
