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
package org.pgtools.maintenance.pipeline;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.exceptions.FaultToleranceException;
import org.pgtools.maintenance.collector.CandidateCollector;
import org.pgtools.maintenance.collector.CollectionRequest;
import org.pgtools.maintenance.collector.CollectionScope;
import org.pgtools.maintenance.collector.TableCandidate;
import org.pgtools.maintenance.common.ValueUtils;
import org.pgtools.maintenance.config.MaintenanceConfig;
import org.pgtools.maintenance.connection.DbDatasourceFactory;
import org.pgtools.maintenance.db.DatabaseService;
import org.pgtools.maintenance.evaluator.ProposedOperation;
import org.pgtools.maintenance.evaluator.ThresholdEvaluator;
import org.pgtools.maintenance.evaluator.ThresholdPolicy;
import org.pgtools.maintenance.execution.CancellationSignal;
import org.pgtools.maintenance.execution.ExecutionScheduler;
import org.pgtools.maintenance.execution.JdbcMaintenanceExecutor;
import org.pgtools.maintenance.metrics.MaintenanceMetrics;
import org.pgtools.maintenance.metrics.MetricsFileWriter;
import org.pgtools.maintenance.model.ServerVersion;
import org.pgtools.maintenance.plan.MaintenancePlan;
import org.pgtools.maintenance.plan.OperationState;
import org.pgtools.maintenance.plan.PlanBuilder;
import org.pgtools.maintenance.report.OperationOutcome;
import org.pgtools.maintenance.report.OutcomeRecorder;
import org.pgtools.maintenance.report.RunSummary;
import org.pgtools.maintenance.report.SummaryReportWriter;
import org.pgtools.maintenance.safety.FilterResult;
import org.pgtools.maintenance.safety.SafetyFilter;
import org.pgtools.maintenance.safety.SafetyPolicy;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One maintenance run: collect, evaluate, rank, filter, execute, record.
 *
 * <p>Errors before a plan exists are fatal and reported as {@link MaintenanceException}.
 * Once the plan exists, statement failures are recorded on their operation and the
 * summary is always produced.
 */
@Slf4j
@ApplicationScoped
public class MaintenancePipeline {

    private final DatabaseService databaseService;
    private final CandidateCollector collector;
    private final ThresholdEvaluator evaluator;
    private final PlanBuilder planBuilder;
    private final SafetyFilter safetyFilter;
    private final DbDatasourceFactory datasourceFactory;
    private final MaintenanceMetrics metrics;
    private final SummaryReportWriter reportWriter;
    private final MetricsFileWriter metricsFileWriter;
    private final CancellationSignal cancellation;
    private final Clock clock;

    @Inject
    public MaintenancePipeline(DatabaseService databaseService,
                               CandidateCollector collector,
                               ThresholdEvaluator evaluator,
                               PlanBuilder planBuilder,
                               SafetyFilter safetyFilter,
                               DbDatasourceFactory datasourceFactory,
                               MaintenanceMetrics metrics,
                               SummaryReportWriter reportWriter,
                               MetricsFileWriter metricsFileWriter,
                               CancellationSignal cancellation) {
        this(databaseService, collector, evaluator, planBuilder, safetyFilter, datasourceFactory,
                metrics, reportWriter, metricsFileWriter, cancellation, Clock.systemUTC());
    }

    MaintenancePipeline(DatabaseService databaseService,
                        CandidateCollector collector,
                        ThresholdEvaluator evaluator,
                        PlanBuilder planBuilder,
                        SafetyFilter safetyFilter,
                        DbDatasourceFactory datasourceFactory,
                        MaintenanceMetrics metrics,
                        SummaryReportWriter reportWriter,
                        MetricsFileWriter metricsFileWriter,
                        CancellationSignal cancellation,
                        Clock clock) {
        this.databaseService = databaseService;
        this.collector = collector;
        this.evaluator = evaluator;
        this.planBuilder = planBuilder;
        this.safetyFilter = safetyFilter;
        this.datasourceFactory = datasourceFactory;
        this.metrics = metrics;
        this.reportWriter = reportWriter;
        this.metricsFileWriter = metricsFileWriter;
        this.cancellation = cancellation;
        this.clock = clock;
    }

    /**
     * Run the whole pipeline once.
     *
     * @param config Resolved configuration of this invocation
     * @return Summary of all operations
     * @throws MaintenanceException If no plan could be built
     */
    public RunSummary run(MaintenanceConfig config) throws MaintenanceException {
        ServerVersion version = verifyDatabaseAndVersion(config);
        log.info("Connected to PostgreSQL {}", version.fullVersion());

        List<TableCandidate> candidates = collectCandidates(config);
        metrics.setCandidates(candidates.size());

        Instant now = clock.instant();
        List<ProposedOperation> proposals = evaluator.evaluateAll(candidates, ThresholdPolicy.from(config), now);
        MaintenancePlan ranked = planBuilder.build(proposals, now);
        FilterResult filtered = safetyFilter.apply(ranked, SafetyPolicy.from(config));
        log.info("Found {} candidates, {} planned operations, {} skipped by safety policy",
                candidates.size(), ranked.size(), filtered.skipped().size());

        OutcomeRecorder recorder = new OutcomeRecorder(clock, metrics);
        filtered.skipped().forEach(recorder::record);
        execute(config, filtered.plan(), recorder);

        RunSummary summary = recorder.summarize();
        metrics.recordRunDuration(summary.elapsed());
        logSummary(summary);
        writeOutputs(config, summary);
        return summary;
    }

    private ServerVersion verifyDatabaseAndVersion(MaintenanceConfig config) throws ConnectivityException {
        int maxAttempts = config.connection().retryAttempts();
        Duration retryDelay = config.connection().retryDelay();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (connectionAlive()) {
                if (attempt > 1) {
                    log.info("Database connection restored after {} attempts", attempt);
                }
                return detectSupportedVersion();
            }
            if (attempt < maxAttempts) {
                Duration wait = retryDelay.multipliedBy(attempt);
                log.warn("Database connection test failed (attempt {}/{}), retrying in {}",
                        attempt, maxAttempts, wait);
                sleep(wait);
            }
        }
        metrics.setDatabaseUp(false);
        log.error("Database connection test failed after {} attempts", maxAttempts);
        throw new ConnectivityException("Cannot connect to PostgreSQL database at "
                + databaseService.getUrl() + " after " + maxAttempts + " attempts");
    }

    private boolean connectionAlive() {
        try {
            return databaseService.testConnection();
        } catch (FaultToleranceException e) {
            log.warn("Database connection test aborted: {}", e.toString());
            return false;
        }
    }

    private ServerVersion detectSupportedVersion() throws ConnectivityException {
        ServerVersion version;
        try {
            version = databaseService.detectVersion();
        } catch (SQLException | FaultToleranceException e) {
            metrics.setDatabaseUp(false);
            throw new ConnectivityException("Failed to detect PostgreSQL version: " + e.getMessage(), e);
        }
        metrics.setDatabaseUp(true);
        if (!version.isSupported()) {
            throw new ConnectivityException("PostgreSQL " + version.fullVersion()
                    + " is not supported, minimum supported version is " + ServerVersion.minimumVersion());
        }
        return version;
    }

    private void sleep(Duration wait) throws ConnectivityException {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException("Connection retry interrupted", e);
        }
    }

    private List<TableCandidate> collectCandidates(MaintenanceConfig config) throws MaintenanceException {
        CollectionRequest request = new CollectionRequest(
                CollectionScope.from(config),
                config.operation().includesReindex(),
                ValueUtils.parseSize(config.thresholds().indexMinSize()),
                config.thresholds().indexReadFetchRatio(),
                config.collection().allowPartial());
        try (Connection connection = databaseService.getPooledConnection()) {
            return collector.collect(connection, request);
        } catch (SQLException e) {
            throw new ConnectivityException("Cannot open a session for statistics collection: " + e.getMessage(), e);
        }
    }

    private void execute(MaintenanceConfig config, MaintenancePlan plan, OutcomeRecorder recorder)
            throws ConnectivityException {
        int parallel = config.execution().parallel();
        if (config.dryRun()) {
            log.warn("DRY RUN MODE - No changes will be made");
            new ExecutionScheduler(null, recorder, cancellation, parallel, false).reportDryRun(plan);
            return;
        }
        if (plan.pending().isEmpty()) {
            log.info("No maintenance operations to execute");
            return;
        }
        try (AgroalDataSource workerPool = datasourceFactory.createWorkerPool(parallel)) {
            JdbcMaintenanceExecutor executor = new JdbcMaintenanceExecutor(workerPool, config.execution().lockTimeout());
            new ExecutionScheduler(executor, recorder, cancellation, parallel, config.execution().abortInFlight())
                    .execute(plan);
        } catch (SQLException e) {
            throw new ConnectivityException("Cannot create worker connection pool: " + e.getMessage(), e);
        }
    }

    private void logSummary(RunSummary summary) {
        log.info("Maintenance summary: {} operations in {} ms", summary.total(), summary.elapsed().toMillis());
        for (OperationState state : OperationState.values()) {
            if (summary.count(state) > 0) {
                log.info("  {}: {}", state, summary.count(state));
            }
        }
        for (OperationOutcome outcome : summary.outcomes()) {
            if (outcome.state() == OperationState.FAILED) {
                log.error("  Failed: {} {} - {}", outcome.kind().displayName(), outcome.target(), outcome.error());
            }
        }
    }

    private void writeOutputs(MaintenanceConfig config, RunSummary summary) {
        config.output().report().ifPresent(report -> {
            try {
                reportWriter.write(Path.of(report), summary, reportSettings(config), clock.instant());
            } catch (IOException e) {
                log.error("Failed to write report to {}: {}", report, e.getMessage(), e);
            }
        });
        config.output().metricsFile().ifPresent(file -> {
            try {
                metricsFileWriter.write(Path.of(file));
            } catch (IOException e) {
                log.error("Failed to write metrics to {}: {}", file, e.getMessage(), e);
            }
        });
    }

    static Map<String, String> reportSettings(MaintenanceConfig config) {
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put("Operation", config.operation().label());
        settings.put("Dry Run", String.valueOf(config.dryRun()));
        settings.put("Parallel Jobs", String.valueOf(config.execution().parallel()));
        settings.put("Schema", config.schema().orElse("all user schemas"));
        settings.put("Tables", config.tables().map(tables -> String.join(",", tables)).orElse("all"));
        settings.put("Dead Tuple Threshold", config.thresholds().deadTuplePercent() + "%");
        settings.put("Stale After", config.thresholds().staleDays() + " days");
        settings.put("Modification Threshold", config.thresholds().modificationPercent() + "%");
        settings.put("Skip Large Tables", String.valueOf(config.safety().skipLarge()));
        settings.put("Large Table Size", config.safety().largeTableSize());
        return settings;
    }
}
