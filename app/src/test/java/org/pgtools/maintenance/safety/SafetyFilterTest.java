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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pgtools.maintenance.collector.TableCandidate;
import org.pgtools.maintenance.evaluator.TriggerReason;
import org.pgtools.maintenance.evaluator.TriggerRule;
import org.pgtools.maintenance.plan.MaintenanceOperation;
import org.pgtools.maintenance.plan.MaintenancePlan;
import org.pgtools.maintenance.plan.OperationKind;
import org.pgtools.maintenance.plan.OperationState;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SafetyFilterTest {

    private static final long GB = 1024L * 1024 * 1024;

    private SafetyFilter safetyFilter;

    @Mock
    private Confirmation confirmation;

    @BeforeEach
    void setUp() {
        safetyFilter = new SafetyFilter(confirmation);
    }

    private static MaintenanceOperation operation(int rank, String table, long bytes, OperationKind kind) {
        TableCandidate candidate = new TableCandidate("public", table, 100, 900, 0, 0, 0, 0, bytes,
                null, null, null, null, 0);
        return new MaintenanceOperation(rank, candidate, kind,
                new TriggerReason(TriggerRule.URGENT, "dead tuples at 900.0% of live rows", 900.0));
    }

    @Test
    void testApply_LargeTableSkipped_WithReason() {
        // Setup
        MaintenanceOperation large = operation(1, "events", 12 * GB, OperationKind.VACUUM);
        MaintenanceOperation small = operation(2, "orders", GB, OperationKind.VACUUM);
        SafetyPolicy policy = new SafetyPolicy(true, 10 * GB, false, false);

        // Execute
        FilterResult result = safetyFilter.apply(new MaintenancePlan(List.of(large, small)), policy);

        // Verify
        assertEquals(List.of(small), result.plan().operations());
        assertEquals(List.of(large), result.skipped());
        assertEquals(OperationState.SKIPPED, large.state());
        assertEquals(Optional.of("skipped: large table (12 GB)"), large.note());
        assertEquals(OperationState.PENDING, small.state());
    }

    @Test
    void testApply_SkipLargeDisabled_KeepsLargeTable() {
        // Setup
        MaintenanceOperation large = operation(1, "events", 12 * GB, OperationKind.VACUUM);

        // Execute
        FilterResult result = safetyFilter.apply(new MaintenancePlan(List.of(large)),
                new SafetyPolicy(false, 10 * GB, false, false));

        // Verify
        assertEquals(1, result.plan().size());
        assertTrue(result.skipped().isEmpty());
    }

    @Test
    void testApply_DestructiveWithoutConfirmation_IsSkipped() {
        // Setup
        MaintenanceOperation full = operation(1, "orders", GB, OperationKind.VACUUM_FULL);
        when(confirmation.confirm(anyString())).thenReturn(false);

        // Execute
        FilterResult result = safetyFilter.apply(new MaintenancePlan(List.of(full)),
                new SafetyPolicy(false, 10 * GB, false, false));

        // Verify
        assertTrue(result.plan().isEmpty());
        assertEquals(OperationState.SKIPPED, full.state());
        assertEquals(Optional.of(SafetyFilter.CONFIRMATION_NOTE), full.note());
        assertThrows(IllegalStateException.class, full::start, "Skipped operations never reach RUNNING");
    }

    @Test
    void testApply_DestructiveConfirmedInteractively_PromptsOnce() {
        // Setup
        MaintenanceOperation full = operation(1, "orders", GB, OperationKind.VACUUM_FULL);
        MaintenanceOperation reindex = operation(2, "items", GB, OperationKind.REINDEX);
        MaintenanceOperation vacuum = operation(3, "lines", GB, OperationKind.VACUUM);
        when(confirmation.confirm(anyString())).thenReturn(true);

        // Execute
        FilterResult result = safetyFilter.apply(new MaintenancePlan(List.of(full, reindex, vacuum)),
                new SafetyPolicy(false, 10 * GB, false, false));

        // Verify
        assertEquals(List.of(full, reindex, vacuum), result.plan().operations());
        verify(confirmation, times(1)).confirm(anyString());
    }

    @Test
    void testApply_ConfirmDestructiveFlag_NeverPrompts() {
        // Setup
        MaintenanceOperation full = operation(1, "orders", GB, OperationKind.VACUUM_FULL);

        // Execute
        FilterResult result = safetyFilter.apply(new MaintenancePlan(List.of(full)),
                new SafetyPolicy(false, 10 * GB, true, false));

        // Verify
        assertEquals(1, result.plan().size());
        verifyNoInteractions(confirmation);
    }

    @Test
    void testApply_DryRun_NeverPrompts() {
        // Setup
        MaintenanceOperation full = operation(1, "orders", GB, OperationKind.VACUUM_FULL);
        MaintenanceOperation vacuum = operation(2, "items", GB, OperationKind.VACUUM);

        // Execute
        FilterResult result = safetyFilter.apply(new MaintenancePlan(List.of(full, vacuum)),
                new SafetyPolicy(false, 10 * GB, false, true));

        // Verify
        assertEquals(List.of(vacuum), result.plan().operations());
        assertEquals(List.of(full), result.skipped());
        verifyNoInteractions(confirmation);
    }

    @Test
    void testApply_LargeDestructiveTable_SkippedWithoutPrompt() {
        // Setup
        MaintenanceOperation full = operation(1, "events", 12 * GB, OperationKind.VACUUM_FULL);

        // Execute
        FilterResult result = safetyFilter.apply(new MaintenancePlan(List.of(full)),
                new SafetyPolicy(true, 10 * GB, false, false));

        // Verify
        assertTrue(result.plan().isEmpty());
        assertTrue(full.note().orElseThrow().startsWith("skipped: large table"));
        verifyNoInteractions(confirmation);
    }

    @Test
    void testApply_SkippedListInRankOrder() {
        // Setup
        MaintenanceOperation full = operation(1, "orders", GB, OperationKind.VACUUM_FULL);
        MaintenanceOperation large = operation(2, "events", 20 * GB, OperationKind.VACUUM);
        when(confirmation.confirm(anyString())).thenReturn(false);

        // Execute
        FilterResult result = safetyFilter.apply(new MaintenancePlan(List.of(full, large)),
                new SafetyPolicy(true, 10 * GB, false, false));

        // Verify
        assertEquals(List.of(full, large), result.skipped());
    }
}
