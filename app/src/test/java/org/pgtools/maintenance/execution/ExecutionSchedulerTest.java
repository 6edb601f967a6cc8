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
package org.pgtools.maintenance.execution;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pgtools.maintenance.collector.TableCandidate;
import org.pgtools.maintenance.evaluator.TriggerReason;
import org.pgtools.maintenance.evaluator.TriggerRule;
import org.pgtools.maintenance.metrics.MaintenanceMetrics;
import org.pgtools.maintenance.plan.MaintenanceOperation;
import org.pgtools.maintenance.plan.MaintenancePlan;
import org.pgtools.maintenance.plan.OperationKind;
import org.pgtools.maintenance.plan.OperationState;
import org.pgtools.maintenance.report.OperationOutcome;
import org.pgtools.maintenance.report.OutcomeRecorder;
import org.pgtools.maintenance.report.RunSummary;

import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class ExecutionSchedulerTest {

    private OutcomeRecorder recorder;
    private CancellationSignal cancellation;

    @BeforeEach
    void setUp() {
        MaintenanceMetrics metrics = new MaintenanceMetrics(new SimpleMeterRegistry());
        metrics.init();
        recorder = new OutcomeRecorder(Clock.systemUTC(), metrics);
        cancellation = new CancellationSignal();
    }

    private static MaintenancePlan plan(String... tables) {
        List<MaintenanceOperation> operations = new ArrayList<>();
        for (int i = 0; i < tables.length; i++) {
            TableCandidate candidate = new TableCandidate("public", tables[i], 1000, 400, 0, 0, 0, 0, 8192,
                    null, null, null, null, 0);
            operations.add(new MaintenanceOperation(i + 1, candidate, OperationKind.VACUUM,
                    new TriggerReason(TriggerRule.URGENT, "dead tuples", 40.0)));
        }
        return new MaintenancePlan(operations);
    }

    /**
     * Executor that sleeps, tracks overlap and lets a test hook in.
     */
    private static class RecordingExecutor implements MaintenanceExecutor {
        private final long sleepMillis;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();
        private final Map<String, AtomicInteger> perTable = new ConcurrentHashMap<>();
        private final AtomicInteger maxPerTable = new AtomicInteger();
        private final List<Integer> startedRanks = Collections.synchronizedList(new ArrayList<>());
        private final AtomicInteger cancelCalls = new AtomicInteger();

        RecordingExecutor(long sleepMillis) {
            this.sleepMillis = sleepMillis;
        }

        @Override
        public void execute(MaintenanceOperation operation) throws SQLException {
            startedRanks.add(operation.rank());
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            AtomicInteger sameTable = perTable.computeIfAbsent(operation.tableKey(), k -> new AtomicInteger());
            maxPerTable.accumulateAndGet(sameTable.incrementAndGet(), Math::max);
            try {
                beforeSleep(operation);
                Thread.sleep(sleepMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SQLException("interrupted");
            } finally {
                sameTable.decrementAndGet();
                inFlight.decrementAndGet();
            }
        }

        void beforeSleep(MaintenanceOperation operation) throws SQLException {
        }

        @Override
        public void cancelRunning() {
            cancelCalls.incrementAndGet();
        }
    }

    @Test
    void testReportDryRun_NeverExecutes() {
        // Setup
        MaintenancePlan plan = plan("a", "b", "c");
        ExecutionScheduler scheduler = new ExecutionScheduler(null, recorder, cancellation, 2, false);

        // Execute
        scheduler.reportDryRun(plan);

        // Verify
        RunSummary summary = recorder.summarize();
        assertEquals(3, summary.count(OperationState.DRY_RUN_REPORTED));
        assertEquals(0, summary.count(OperationState.SUCCEEDED));
        assertEquals(0, summary.exitCode());
    }

    @Test
    void testExecute_NeverExceedsConcurrency() {
        // Setup
        RecordingExecutor executor = new RecordingExecutor(30);
        MaintenancePlan plan = plan("t1", "t2", "t3", "t4", "t5", "t6", "t7", "t8", "t9", "t10");
        ExecutionScheduler scheduler = new ExecutionScheduler(executor, recorder, cancellation, 3, false);

        // Execute
        scheduler.execute(plan);

        // Verify
        assertTrue(executor.maxInFlight.get() <= 3, "At most 3 operations may run at once");
        assertEquals(10, recorder.summarize().count(OperationState.SUCCEEDED));
    }

    @Test
    void testExecute_SameTableNeverConcurrent() {
        // Setup
        Random random = new Random(7);
        String[] tables = new String[40];
        for (int i = 0; i < tables.length; i++) {
            tables[i] = "t" + random.nextInt(4);
        }
        RecordingExecutor executor = new RecordingExecutor(5);
        ExecutionScheduler scheduler = new ExecutionScheduler(executor, recorder, cancellation, 4, false);

        // Execute
        scheduler.execute(plan(tables));

        // Verify
        assertEquals(1, executor.maxPerTable.get(), "Operations on one table must not overlap");
        assertEquals(40, recorder.summarize().count(OperationState.SUCCEEDED));
    }

    @Test
    void testExecute_FailureDoesNotStopOthers() {
        // Setup
        RecordingExecutor executor = new RecordingExecutor(1) {
            @Override
            void beforeSleep(MaintenanceOperation operation) throws SQLException {
                if (operation.tableKey().equals("public.locked")) {
                    throw new SQLException("canceling statement due to lock timeout");
                }
            }
        };
        ExecutionScheduler scheduler = new ExecutionScheduler(executor, recorder, cancellation, 2, false);

        // Execute
        scheduler.execute(plan("a", "locked", "b", "c"));

        // Verify
        RunSummary summary = recorder.summarize();
        assertEquals(3, summary.count(OperationState.SUCCEEDED));
        assertEquals(1, summary.count(OperationState.FAILED));
        OperationOutcome failed = summary.outcomes().get(1);
        assertEquals("public.locked", failed.target());
        assertEquals("canceling statement due to lock timeout", failed.error());
        assertEquals(1, summary.exitCode());
    }

    @Test
    void testExecute_UnexpectedRuntimeException_RecordedAsFailure() {
        // Setup
        RecordingExecutor executor = new RecordingExecutor(1) {
            @Override
            void beforeSleep(MaintenanceOperation operation) {
                throw new IllegalStateException("driver bug");
            }
        };
        ExecutionScheduler scheduler = new ExecutionScheduler(executor, recorder, cancellation, 1, false);

        // Execute
        scheduler.execute(plan("a", "b"));

        // Verify
        assertEquals(2, recorder.summarize().count(OperationState.FAILED));
    }

    @Test
    void testExecute_SingleWorker_RunsInPlanOrderOneAtATime() {
        // Setup
        RecordingExecutor executor = new RecordingExecutor(40);
        ExecutionScheduler scheduler = new ExecutionScheduler(executor, recorder, cancellation, 1, false);

        // Execute
        scheduler.execute(plan("first", "second", "third"));

        // Verify
        RunSummary summary = recorder.summarize();
        assertEquals(List.of(1, 2, 3), executor.startedRanks);
        assertEquals(1, executor.maxInFlight.get());
        long sumOfDurations = summary.outcomes().stream().mapToLong(o -> o.duration().toMillis()).sum();
        assertTrue(sumOfDurations >= 120, "Each operation slept 40 ms");
        assertTrue(summary.elapsed().toMillis() >= sumOfDurations,
                "Sequential elapsed time covers every individual duration");
    }

    @Test
    void testExecute_Cancellation_SkipsUndispatched() {
        // Setup
        RecordingExecutor executor = new RecordingExecutor(1) {
            @Override
            void beforeSleep(MaintenanceOperation operation) {
                if (operation.rank() == 1) {
                    cancellation.cancel();
                }
            }
        };
        ExecutionScheduler scheduler = new ExecutionScheduler(executor, recorder, cancellation, 1, false);

        // Execute
        scheduler.execute(plan("a", "b", "c"));

        // Verify
        RunSummary summary = recorder.summarize();
        assertEquals(OperationState.SUCCEEDED, summary.outcomes().get(0).state());
        assertEquals(2, summary.count(OperationState.SKIPPED));
        assertEquals(ExecutionScheduler.CANCELLED_NOTE, summary.outcomes().get(2).note());
        assertEquals(List.of(1), executor.startedRanks);
        assertEquals(0, executor.cancelCalls.get(), "In-flight statements finish unless abort is requested");
    }

    @Test
    void testExecute_AbortInFlight_CancelsRunningStatements() throws Exception {
        // Setup
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch released = new CountDownLatch(1);
        MaintenanceExecutor executor = new MaintenanceExecutor() {
            @Override
            public void execute(MaintenanceOperation operation) throws SQLException {
                started.countDown();
                try {
                    if (!released.await(10, TimeUnit.SECONDS)) {
                        throw new SQLException("never cancelled");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new SQLException("canceling statement due to user request");
            }

            @Override
            public void cancelRunning() {
                released.countDown();
            }
        };
        ExecutionScheduler scheduler = new ExecutionScheduler(executor, recorder, cancellation, 1, true);
        Thread canceller = new Thread(() -> {
            try {
                started.await();
                cancellation.cancel();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();

        // Execute
        scheduler.execute(plan("big", "next"));
        canceller.join();

        // Verify
        RunSummary summary = recorder.summarize();
        assertEquals(OperationState.FAILED, summary.outcomes().get(0).state());
        assertEquals("canceling statement due to user request", summary.outcomes().get(0).error());
        assertEquals(OperationState.SKIPPED, summary.outcomes().get(1).state());
    }

    @Test
    void testExecute_EmptyPlan_DoesNothing() {
        RecordingExecutor executor = new RecordingExecutor(1);
        ExecutionScheduler scheduler = new ExecutionScheduler(executor, recorder, cancellation, 2, false);

        scheduler.execute(MaintenancePlan.empty());

        assertEquals(0, recorder.summarize().total());
        assertTrue(executor.startedRanks.isEmpty());
    }

    @Test
    void testConstructor_RejectsZeroConcurrency() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExecutionScheduler(new RecordingExecutor(0), recorder, cancellation, 0, false));
    }

    @Test
    void testWorkerThreadsAreNamed() throws Exception {
        // Setup
        List<String> names = Collections.synchronizedList(new ArrayList<>());
        RecordingExecutor executor = new RecordingExecutor(1) {
            @Override
            void beforeSleep(MaintenanceOperation operation) {
                names.add(Thread.currentThread().getName());
            }
        };

        // Execute
        new ExecutionScheduler(executor, recorder, cancellation, 2, false).execute(plan("a", "b"));

        // Verify
        assertTrue(names.stream().allMatch(name -> name.startsWith(ExecutionScheduler.WORKER_THREAD_PREFIX + "-")));
    }
}
