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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pgtools.maintenance.collector.TableCandidate;
import org.pgtools.maintenance.evaluator.TriggerReason;
import org.pgtools.maintenance.evaluator.TriggerRule;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MaintenanceOperationTest {

    private MaintenanceOperation operation;

    @BeforeEach
    void setUp() {
        TableCandidate candidate = new TableCandidate("public", "orders", 1000, 400, 0, 0, 0, 0, 8192,
                null, null, null, null, 0);
        operation = new MaintenanceOperation(1, candidate, OperationKind.VACUUM,
                new TriggerReason(TriggerRule.URGENT, "dead tuples at 40.0% of live rows", 40.0));
    }

    @Test
    void testLifecycle_Success() {
        // Execute
        operation.start();
        operation.succeed(Duration.ofMillis(250));

        // Verify
        assertEquals(OperationState.SUCCEEDED, operation.state());
        assertEquals(Duration.ofMillis(250), operation.duration());
        assertTrue(operation.error().isEmpty());
    }

    @Test
    void testLifecycle_FailureKeepsError() {
        // Execute
        operation.start();
        operation.fail(Duration.ofSeconds(1), "could not obtain lock");

        // Verify
        assertEquals(OperationState.FAILED, operation.state());
        assertEquals(Optional.of("could not obtain lock"), operation.error());
    }

    @Test
    void testFail_BlankErrorBecomesUnknown() {
        operation.start();
        operation.fail(Duration.ZERO, " ");

        assertEquals(Optional.of("unknown error"), operation.error());
    }

    @Test
    void testSkip_RecordsNote() {
        operation.skip("skipped: requires confirmation");

        assertEquals(OperationState.SKIPPED, operation.state());
        assertEquals(Optional.of("skipped: requires confirmation"), operation.note());
    }

    @Test
    void testTerminalStates_CannotMoveAgain() {
        // Setup
        operation.skip("skipped");

        // Execute & Verify
        assertThrows(IllegalStateException.class, () -> operation.start());
        assertThrows(IllegalStateException.class, () -> operation.reportDryRun());
    }

    @Test
    void testSucceed_WithoutStart_Throws() {
        assertThrows(IllegalStateException.class, () -> operation.succeed(Duration.ZERO));
    }

    @Test
    void testConstructor_RejectsInvalidRank() {
        assertThrows(IllegalArgumentException.class, () -> new MaintenanceOperation(0, operation.target(),
                OperationKind.ANALYZE, operation.reason()));
    }

    @Test
    void testStateTransitions() {
        for (OperationState state : OperationState.values()) {
            boolean terminal = state.isTerminal();
            assertEquals(terminal, List.of(OperationState.SKIPPED, OperationState.DRY_RUN_REPORTED,
                    OperationState.SUCCEEDED, OperationState.FAILED).contains(state), state.name());
            if (terminal) {
                for (OperationState next : OperationState.values()) {
                    assertFalse(state.canTransitionTo(next), state + " -> " + next);
                }
            }
        }
        assertTrue(OperationState.PENDING.canTransitionTo(OperationState.RUNNING));
        assertFalse(OperationState.PENDING.canTransitionTo(OperationState.SUCCEEDED));
    }
}
