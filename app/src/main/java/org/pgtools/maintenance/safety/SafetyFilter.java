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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.pgtools.maintenance.common.ValueUtils;
import org.pgtools.maintenance.plan.MaintenanceOperation;
import org.pgtools.maintenance.plan.MaintenancePlan;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes operations that break the safety policy.
 *
 * <p>Large tables are checked first, so a large table never triggers a prompt.
 * Destructive operations need the override flag or a single interactive yes for
 * the whole run; a dry run never prompts. Removed operations become SKIPPED,
 * they are never replaced by a milder kind. Surviving order is unchanged.
 */
@Slf4j
@ApplicationScoped
public class SafetyFilter {
    static final String LARGE_TABLE_NOTE = "skipped: large table (%s)";
    static final String CONFIRMATION_NOTE = "skipped: requires confirmation";

    private final Confirmation confirmation;

    @Inject
    public SafetyFilter(Confirmation confirmation) {
        this.confirmation = confirmation;
    }

    public FilterResult apply(MaintenancePlan plan, SafetyPolicy policy) {
        List<MaintenanceOperation> kept = new ArrayList<>(plan.size());
        List<MaintenanceOperation> destructive = new ArrayList<>();
        List<MaintenanceOperation> skipped = new ArrayList<>();

        for (MaintenanceOperation operation : plan.operations()) {
            long size = operation.target().totalBytes();
            if (policy.skipLarge() && size >= policy.largeTableSizeBytes()) {
                log.warn("Skipping large table: {} ({}) for {}",
                        operation.tableKey(), ValueUtils.prettySize(size), operation.kind().displayName());
                operation.skip(LARGE_TABLE_NOTE.formatted(ValueUtils.prettySize(size)));
                skipped.add(operation);
                continue;
            }
            if (operation.kind().isDestructive()) {
                destructive.add(operation);
            }
            kept.add(operation);
        }

        if (!destructive.isEmpty() && !destructiveApproved(destructive, policy)) {
            for (MaintenanceOperation operation : destructive) {
                log.warn("Skipping {} on {}: not confirmed", operation.kind().displayName(), operation.tableKey());
                operation.skip(CONFIRMATION_NOTE);
                skipped.add(operation);
            }
            kept.removeAll(destructive);
        }

        skipped.sort((a, b) -> Integer.compare(a.rank(), b.rank()));
        return new FilterResult(new MaintenancePlan(kept), skipped);
    }

    private boolean destructiveApproved(List<MaintenanceOperation> destructive, SafetyPolicy policy) {
        if (policy.confirmDestructive()) {
            return true;
        }
        if (policy.dryRun()) {
            log.info("Dry run: {} operation(s) need an exclusive lock and would ask for confirmation",
                    destructive.size());
            return false;
        }
        log.warn("{} operation(s) hold an exclusive lock on their table for the whole run", destructive.size());
        return confirmation.confirm("Run %d exclusive-lock operation(s) (VACUUM FULL / REINDEX)?"
                .formatted(destructive.size()));
    }
}
