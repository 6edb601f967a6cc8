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

import lombok.extern.slf4j.Slf4j;
import org.pgtools.maintenance.plan.MaintenanceOperation;
import org.pgtools.maintenance.plan.MaintenancePlan;
import org.pgtools.maintenance.report.OutcomeRecorder;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a plan with a fixed pool of workers.
 *
 * <p>Workers take operations from one FIFO queue in plan order and take the next one
 * as soon as they are free, so at most {@code concurrency} operations run at any time.
 * A worker waits for the table token before starting, which serializes operations on
 * the same table. A failed operation is recorded and the worker moves on.
 *
 * <p>After cancellation no operation is started; operations not yet started are
 * skipped. Running statements finish, or are cancelled when {@code abortInFlight} is set.
 */
@Slf4j
public class ExecutionScheduler {
    static final String CANCELLED_NOTE = "cancelled before dispatch";
    static final String WORKER_THREAD_PREFIX = "maintenance-worker";

    private final MaintenanceExecutor executor;
    private final OutcomeRecorder recorder;
    private final CancellationSignal cancellation;
    private final int concurrency;
    private final boolean abortInFlight;
    private final TableLockRegistry tableLocks = new TableLockRegistry();

    public ExecutionScheduler(MaintenanceExecutor executor,
                              OutcomeRecorder recorder,
                              CancellationSignal cancellation,
                              int concurrency,
                              boolean abortInFlight) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        this.executor = executor;
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.concurrency = concurrency;
        this.abortInFlight = abortInFlight;
    }

    /**
     * Report every pending operation without touching the database.
     */
    public void reportDryRun(MaintenancePlan plan) {
        for (MaintenanceOperation operation : plan.pending()) {
            operation.reportDryRun();
            log.info("DRY RUN: Would execute {} on {} ({})",
                    operation.kind().displayName(), operation.tableKey(), operation.reason());
            recorder.record(operation);
        }
    }

    /**
     * Execute every pending operation and wait for all workers to finish.
     */
    public void execute(MaintenancePlan plan) {
        Objects.requireNonNull(executor, "executor");
        Queue<MaintenanceOperation> queue = new ConcurrentLinkedQueue<>(plan.pending());
        if (queue.isEmpty()) {
            log.info("No maintenance operations to execute");
            return;
        }
        if (abortInFlight) {
            cancellation.onCancel(executor::cancelRunning);
        }

        int workerCount = Math.min(concurrency, queue.size());
        log.info("Executing {} operations with {} worker(s)", queue.size(), workerCount);
        ExecutorService workers = Executors.newFixedThreadPool(workerCount, new NamedThreadFactory(WORKER_THREAD_PREFIX));
        try {
            List<Future<?>> futures = new ArrayList<>(workerCount);
            for (int i = 0; i < workerCount; i++) {
                futures.add(workers.submit(() -> work(queue)));
            }
            awaitWorkers(futures);
        } finally {
            workers.shutdown();
        }

        MaintenanceOperation remaining;
        while ((remaining = queue.poll()) != null) {
            remaining.skip(CANCELLED_NOTE);
            recorder.record(remaining);
        }
    }

    private void work(Queue<MaintenanceOperation> queue) {
        while (!cancellation.isCancelled()) {
            MaintenanceOperation operation = queue.poll();
            if (operation == null) {
                return;
            }
            try {
                runOne(operation);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                operation.skip(CANCELLED_NOTE);
                recorder.record(operation);
                return;
            }
        }
    }

    private void runOne(MaintenanceOperation operation) throws InterruptedException {
        String table = operation.tableKey();
        tableLocks.acquire(table);
        try {
            if (cancellation.isCancelled()) {
                operation.skip(CANCELLED_NOTE);
            } else {
                runStatement(operation);
            }
        } finally {
            tableLocks.release(table);
        }
        recorder.record(operation);
    }

    private void runStatement(MaintenanceOperation operation) {
        operation.start();
        recorder.markRunning(operation);
        log.info("Starting {} on {} ({})", operation.kind().displayName(), operation.tableKey(), operation.reason());
        long start = System.nanoTime();
        try {
            executor.execute(operation);
            operation.succeed(elapsedSince(start));
            log.info("Completed {} on {} in {} ms",
                    operation.kind().displayName(), operation.tableKey(), operation.duration().toMillis());
        } catch (SQLException e) {
            operation.fail(elapsedSince(start), e.getMessage());
            log.error("Failed {} on {}: {}", operation.kind().displayName(), operation.tableKey(), e.getMessage());
        } catch (RuntimeException e) {
            operation.fail(elapsedSince(start), e.toString());
            log.error("Unexpected error during {} on {}: {}",
                    operation.kind().displayName(), operation.tableKey(), e.getMessage(), e);
        }
    }

    private void awaitWorkers(List<Future<?>> futures) {
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancellation.cancel();
                } catch (ExecutionException e) {
                    log.error("Maintenance worker terminated unexpectedly: {}", e.getCause().getMessage(), e.getCause());
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
