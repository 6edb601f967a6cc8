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

import org.pgtools.maintenance.collector.TableCandidate;
import org.pgtools.maintenance.evaluator.TriggerReason;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * One planned unit of work. Target, kind, reason and rank never change,
 * only the state moves forward.
 *
 * <p>State changes are synchronized; readers on other threads see the latest
 * state through the volatile field.
 */
public final class MaintenanceOperation {
    private final int rank;
    private final TableCandidate target;
    private final OperationKind kind;
    private final TriggerReason reason;

    private volatile OperationState state = OperationState.PENDING;
    private volatile Duration duration = Duration.ZERO;
    private volatile String error;
    private volatile String note;

    public MaintenanceOperation(int rank, TableCandidate target, OperationKind kind, TriggerReason reason) {
        if (rank < 1) {
            throw new IllegalArgumentException("Rank must be positive: " + rank);
        }
        this.rank = rank;
        this.target = Objects.requireNonNull(target, "target");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public int rank() {
        return rank;
    }

    public TableCandidate target() {
        return target;
    }

    public OperationKind kind() {
        return kind;
    }

    public TriggerReason reason() {
        return reason;
    }

    public OperationState state() {
        return state;
    }

    public Duration duration() {
        return duration;
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public Optional<String> note() {
        return Optional.ofNullable(note);
    }

    public String tableKey() {
        return target.qualifiedName();
    }

    /**
     * Attach a note without changing the state, for example a pending confirmation.
     */
    public synchronized void annotate(String text) {
        this.note = note == null ? text : note + "; " + text;
    }

    public synchronized void skip(String why) {
        transition(OperationState.SKIPPED);
        annotate(why);
    }

    public synchronized void reportDryRun() {
        transition(OperationState.DRY_RUN_REPORTED);
    }

    public synchronized void start() {
        transition(OperationState.RUNNING);
    }

    public synchronized void succeed(Duration elapsed) {
        this.duration = Objects.requireNonNull(elapsed, "elapsed");
        transition(OperationState.SUCCEEDED);
    }

    public synchronized void fail(Duration elapsed, String errorText) {
        this.duration = Objects.requireNonNull(elapsed, "elapsed");
        this.error = errorText == null || errorText.isBlank() ? "unknown error" : errorText;
        transition(OperationState.FAILED);
    }

    private void transition(OperationState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Operation #%d %s on %s cannot move from %s to %s"
                    .formatted(rank, kind, tableKey(), state, next));
        }
        state = next;
    }

    @Override
    public String toString() {
        return "#" + rank + " " + kind.displayName() + " " + tableKey() + " [" + state + "] (" + reason + ")";
    }
}
