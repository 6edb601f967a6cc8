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

import jakarta.enterprise.context.ApplicationScoped;
import org.pgtools.maintenance.evaluator.ProposedOperation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks proposed operations into a plan.
 *
 * <p>Order: priority tier, then dead tuples, table size and staleness descending.
 * Never analyzed tables count as the most stale. Name and kind break remaining ties
 * so the same statistics always give the same plan.
 */
@ApplicationScoped
public class PlanBuilder {

    public MaintenancePlan build(List<ProposedOperation> proposals, Instant now) {
        Comparator<ProposedOperation> order = Comparator
                .comparingInt(ProposedOperation::tier)
                .thenComparing(proposal -> proposal.target().deadTuples(), Comparator.reverseOrder())
                .thenComparing(proposal -> proposal.target().totalBytes(), Comparator.reverseOrder())
                .thenComparing(proposal -> staleness(proposal, now), Comparator.reverseOrder())
                .thenComparing(proposal -> proposal.target().qualifiedName())
                .thenComparing(ProposedOperation::kind);

        List<ProposedOperation> sorted = new ArrayList<>(proposals);
        sorted.sort(order);

        List<MaintenanceOperation> operations = new ArrayList<>(sorted.size());
        int rank = 1;
        for (ProposedOperation proposal : sorted) {
            operations.add(new MaintenanceOperation(rank++, proposal.target(), proposal.kind(), proposal.reason()));
        }
        return new MaintenancePlan(operations);
    }

    private static Duration staleness(ProposedOperation proposal, Instant now) {
        return proposal.target().staleness(now).orElse(Duration.ofSeconds(Long.MAX_VALUE));
    }
}
