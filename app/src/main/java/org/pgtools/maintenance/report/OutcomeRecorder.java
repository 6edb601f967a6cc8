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

import lombok.extern.slf4j.Slf4j;
import org.pgtools.maintenance.metrics.MaintenanceMetrics;
import org.pgtools.maintenance.plan.MaintenanceOperation;
import org.pgtools.maintenance.plan.OperationState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects final states of a run from any worker thread.
 *
 * <p>Failures are data here: recording never throws on a failed operation.
 */
@Slf4j
public class OutcomeRecorder {
    private final Clock clock;
    private final MaintenanceMetrics metrics;
    private final Instant startedAt;
    private final List<OperationOutcome> outcomes = new ArrayList<>();

    public OutcomeRecorder(Clock clock, MaintenanceMetrics metrics) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.startedAt = clock.instant();
    }

    public void markRunning(MaintenanceOperation operation) {
        log.debug("Running {}", operation);
        metrics.operationStarted();
    }

    /**
     * Record an operation in a terminal state.
     *
     * @throws IllegalArgumentException If the operation is still pending or running
     */
    public void record(MaintenanceOperation operation) {
        OperationState state = operation.state();
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Operation is not finished: " + operation);
        }
        OperationOutcome outcome = OperationOutcome.of(operation);
        synchronized (outcomes) {
            outcomes.add(outcome);
        }
        if (state == OperationState.SUCCEEDED || state == OperationState.FAILED) {
            metrics.operationFinished();
        }
        try {
            metrics.recordOutcome(operation.kind(), state, operation.duration());
        } catch (RuntimeException e) {
            log.warn("Failed to record metrics for {}: {}", operation, e.getMessage());
        }
    }

    public RunSummary summarize() {
        List<OperationOutcome> snapshot;
        synchronized (outcomes) {
            snapshot = new ArrayList<>(outcomes);
        }
        snapshot.sort(Comparator.comparingInt(OperationOutcome::rank));
        Map<OperationState, Integer> counts = new EnumMap<>(OperationState.class);
        for (OperationOutcome outcome : snapshot) {
            counts.merge(outcome.state(), 1, Integer::sum);
        }
        Duration elapsed = Duration.between(startedAt, clock.instant());
        return new RunSummary(counts, elapsed, snapshot);
    }
}
