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
package org.pgtools.maintenance.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.pgtools.maintenance.common.Constants;
import org.pgtools.maintenance.common.MetricNameBuilder;
import org.pgtools.maintenance.plan.OperationKind;
import org.pgtools.maintenance.plan.OperationState;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Metrics of a maintenance run
 */
@Slf4j
@ApplicationScoped
public class MaintenanceMetrics {

    static final String NAME_OPERATIONS = MetricNameBuilder.build(Constants.SUBSYSTEM_OPERATION, "total");
    static final String NAME_OPERATION_DURATION = MetricNameBuilder.build(Constants.SUBSYSTEM_OPERATION, "duration_seconds");
    static final String NAME_RUNNING = MetricNameBuilder.build(Constants.SUBSYSTEM_OPERATION, "running");
    static final String NAME_CANDIDATES = MetricNameBuilder.build(Constants.SUBSYSTEM_RUN, "candidates");
    static final String NAME_RUN_DURATION = MetricNameBuilder.build(Constants.SUBSYSTEM_RUN, "duration_seconds");
    static final String NAME_UP = MetricNameBuilder.build("up");

    private final AtomicReference<Double> databaseUpGaugeValue = new AtomicReference<>(0.0);
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger candidates = new AtomicInteger();

    private final MeterRegistry registry;

    private Timer runDurationTimer;

    @Inject
    public MaintenanceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        registerDatabaseUpGauge();
        registerRunningGauge();
        registerCandidatesGauge();
        registerRunDurationTimer();
        log.debug("Maintenance metrics initialized");
    }

    private void registerDatabaseUpGauge() {
        Gauge.builder(NAME_UP, databaseUpGaugeValue::get)
                .description("Whether the database was reachable (1=up, 0=down)")
                .register(registry);
    }

    private void registerRunningGauge() {
        Gauge.builder(NAME_RUNNING, running::get)
                .description("Maintenance operations currently running")
                .register(registry);
    }

    private void registerCandidatesGauge() {
        Gauge.builder(NAME_CANDIDATES, candidates::get)
                .description("Tables collected as maintenance candidates")
                .register(registry);
    }

    private void registerRunDurationTimer() {
        runDurationTimer = Timer.builder(NAME_RUN_DURATION)
                .description("Duration of the maintenance run")
                .register(registry);
    }

    /**
     * Count an operation in its final state and, if it ran, its duration.
     *
     * @param kind     Operation kind
     * @param state    Final state
     * @param duration Time spent running
     */
    public void recordOutcome(OperationKind kind, OperationState state, Duration duration) {
        String kindTag = kind.name().toLowerCase(Locale.ROOT);
        Counter.builder(NAME_OPERATIONS)
                .tag(Constants.TAG_KIND, kindTag)
                .tag(Constants.TAG_STATE, state.name().toLowerCase(Locale.ROOT))
                .description("Maintenance operations by kind and final state")
                .register(registry)
                .increment();
        if (state == OperationState.SUCCEEDED || state == OperationState.FAILED) {
            Timer.builder(NAME_OPERATION_DURATION)
                    .tag(Constants.TAG_KIND, kindTag)
                    .description("Duration of maintenance statements")
                    .register(registry)
                    .record(duration);
        }
    }

    public void operationStarted() {
        running.incrementAndGet();
    }

    public void operationFinished() {
        running.decrementAndGet();
    }

    public int runningOperations() {
        return running.get();
    }

    public void setCandidates(int count) {
        candidates.set(count);
    }

    public void recordRunDuration(Duration duration) {
        runDurationTimer.record(duration);
    }

    public void setDatabaseUp(boolean up) {
        databaseUpGaugeValue.set(up ? 1.0 : 0.0);
    }
}
