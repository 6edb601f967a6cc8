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
package org.pgtools.maintenance.evaluator;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.pgtools.maintenance.collector.TableCandidate;
import org.pgtools.maintenance.config.OperationMode;
import org.pgtools.maintenance.plan.OperationKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Classifies candidates against a {@link ThresholdPolicy}.
 *
 * <p>Each candidate yields at most one vacuum family operation, one analyze and one
 * reindex, depending on the operation mode. Dead tuples are measured against live
 * rows, so a table with 1000 live and 400 dead rows is at 40%.
 */
@Slf4j
@ApplicationScoped
public class ThresholdEvaluator {

    /**
     * Evaluate every candidate.
     *
     * @param candidates Collected candidates
     * @param policy     Thresholds and mode
     * @param now        Reference time for staleness
     * @return Proposed operations in candidate order
     */
    public List<ProposedOperation> evaluateAll(List<TableCandidate> candidates, ThresholdPolicy policy, Instant now) {
        List<ProposedOperation> proposals = new ArrayList<>();
        for (TableCandidate candidate : candidates) {
            proposals.addAll(evaluate(candidate, policy, now));
        }
        log.debug("Evaluated {} candidates into {} proposed operations", candidates.size(), proposals.size());
        return proposals;
    }

    /**
     * Evaluate one candidate.
     *
     * @return Zero or more proposed operations
     */
    public List<ProposedOperation> evaluate(TableCandidate candidate, ThresholdPolicy policy, Instant now) {
        List<ProposedOperation> proposals = new ArrayList<>(2);
        OperationMode mode = policy.mode();
        if (mode.includesVacuum()) {
            OperationKind kind = mode == OperationMode.FULL_VACUUM ? OperationKind.VACUUM_FULL : OperationKind.VACUUM;
            vacuumReason(candidate, policy)
                    .ifPresent(reason -> proposals.add(new ProposedOperation(candidate, kind, reason)));
        }
        if (mode.includesAnalyze()) {
            analyzeReason(candidate, policy, now)
                    .ifPresent(reason -> proposals.add(new ProposedOperation(candidate, OperationKind.ANALYZE, reason)));
        }
        if (mode.includesReindex() && candidate.suspectIndexCount() > 0) {
            String description = candidate.suspectIndexCount() + " possibly bloated index(es)";
            proposals.add(new ProposedOperation(candidate, OperationKind.REINDEX,
                    new TriggerReason(TriggerRule.INDEX_BLOAT, description, candidate.suspectIndexCount())));
        }
        return proposals;
    }

    private Optional<TriggerReason> vacuumReason(TableCandidate candidate, ThresholdPolicy policy) {
        double ratio = candidate.deadToLiveRatio();
        TriggerRule rule;
        if (ratio >= 2 * policy.deadTupleRatio()) {
            rule = TriggerRule.URGENT;
        } else if (ratio >= policy.deadTupleRatio()) {
            rule = TriggerRule.HIGH;
        } else {
            return Optional.empty();
        }
        double percent = ratio * 100.0;
        String description = Double.isInfinite(ratio)
                ? "dead tuples without live rows"
                : "dead tuples at %s of live rows (threshold %s)".formatted(
                        formatPercent(percent), formatPercent(policy.deadTupleRatio() * 100.0));
        if (policy.verbose()) {
            description += ", %d dead / %d live".formatted(candidate.deadTuples(), candidate.liveTuples());
        }
        return Optional.of(new TriggerReason(rule, description, percent));
    }

    private Optional<TriggerReason> analyzeReason(TableCandidate candidate, ThresholdPolicy policy, Instant now) {
        long modifications = candidate.modificationsSinceAnalyze();
        if (candidate.neverAnalyzed()) {
            if (candidate.liveTuples() > policy.neverAnalyzedMinLiveRows()) {
                return Optional.of(new TriggerReason(TriggerRule.NEVER_ANALYZED,
                        "never analyzed, %d live rows".formatted(candidate.liveTuples()),
                        candidate.liveTuples()));
            }
        } else {
            Duration staleness = candidate.staleness(now).orElse(Duration.ZERO);
            if (staleness.compareTo(policy.staleAfter()) >= 0
                    && modifications > policy.staleMinModifications()) {
                String description = "last analyzed %d days ago".formatted(staleness.toDays());
                if (policy.verbose()) {
                    description += ", %d modifications since".formatted(modifications);
                }
                return Optional.of(new TriggerReason(TriggerRule.STALE, description, staleness.toDays()));
            }
        }
        if (modifications > 0 && modifications >= policy.modificationRatio() * candidate.liveTuples()) {
            double percent = candidate.modificationRatio() * 100.0;
            String description = Double.isInfinite(percent)
                    ? "%d modifications without live rows".formatted(modifications)
                    : "modifications at %s of live rows (threshold %s)".formatted(
                            formatPercent(percent), formatPercent(policy.modificationRatio() * 100.0));
            if (policy.verbose() && !Double.isInfinite(percent)) {
                description += ", %d modified / %d live".formatted(modifications, candidate.liveTuples());
            }
            return Optional.of(new TriggerReason(TriggerRule.HIGH_CHURN, description, percent));
        }
        return Optional.empty();
    }

    private static String formatPercent(double percent) {
        return String.format(Locale.ROOT, "%.1f%%", percent);
    }
}
