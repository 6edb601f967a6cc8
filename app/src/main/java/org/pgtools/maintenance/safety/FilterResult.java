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

import org.pgtools.maintenance.plan.MaintenanceOperation;
import org.pgtools.maintenance.plan.MaintenancePlan;

import java.util.List;

/**
 * Outcome of the safety filter.
 *
 * @param plan    Surviving operations, order unchanged
 * @param skipped Removed operations, already in state SKIPPED with a note
 */
public record FilterResult(MaintenancePlan plan, List<MaintenanceOperation> skipped) {

    public FilterResult {
        skipped = List.copyOf(skipped);
    }
}
