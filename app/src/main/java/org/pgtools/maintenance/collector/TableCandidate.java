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
package org.pgtools.maintenance.collector;

import org.pgtools.maintenance.connection.SqlIdentifiers;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Statistics snapshot of one table considered for maintenance.
 *
 * <p>Timestamps are null when the action was never performed.
 *
 * @param schemaName                Schema name
 * @param tableName                 Table name
 * @param liveTuples                Estimated live rows
 * @param deadTuples                Estimated dead rows
 * @param insertedTuples            Rows inserted since statistics reset
 * @param updatedTuples             Rows updated since statistics reset
 * @param deletedTuples             Rows deleted since statistics reset
 * @param modificationsSinceAnalyze Rows modified since the last analyze
 * @param totalBytes                Size including indexes and TOAST
 * @param lastVacuum                Last manual vacuum
 * @param lastAutovacuum            Last autovacuum
 * @param lastAnalyze               Last manual analyze
 * @param lastAutoanalyze           Last autoanalyze
 * @param suspectIndexCount         Indexes flagged as possibly bloated
 */
public record TableCandidate(String schemaName,
                             String tableName,
                             long liveTuples,
                             long deadTuples,
                             long insertedTuples,
                             long updatedTuples,
                             long deletedTuples,
                             long modificationsSinceAnalyze,
                             long totalBytes,
                             Instant lastVacuum,
                             Instant lastAutovacuum,
                             Instant lastAnalyze,
                             Instant lastAutoanalyze,
                             int suspectIndexCount) {

    public TableCandidate {
        Objects.requireNonNull(schemaName, "schemaName");
        Objects.requireNonNull(tableName, "tableName");
        if (liveTuples < 0 || deadTuples < 0 || insertedTuples < 0 || updatedTuples < 0
                || deletedTuples < 0 || modificationsSinceAnalyze < 0 || totalBytes < 0
                || suspectIndexCount < 0) {
            throw new IllegalArgumentException("Negative statistics for " + schemaName + "." + tableName);
        }
        if (liveTuples + deadTuples == 0) {
            throw new IllegalArgumentException("Table " + schemaName + "." + tableName + " has no tuples");
        }
    }

    /**
     * Identity of the candidate, unique within a run.
     */
    public String qualifiedName() {
        return schemaName + "." + tableName;
    }

    /**
     * @return Quoted name for use in SQL text
     */
    public String quotedName() {
        return SqlIdentifiers.qualifiedName(schemaName, tableName);
    }

    public long totalTuples() {
        return liveTuples + deadTuples;
    }

    /**
     * @return dead / (live + dead), always within [0, 1]
     */
    public double deadTupleRatio() {
        return (double) deadTuples / totalTuples();
    }

    /**
     * @return dead / live, positive infinity for a table with dead rows only
     */
    public double deadToLiveRatio() {
        if (liveTuples == 0) {
            return deadTuples == 0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return (double) deadTuples / liveTuples;
    }

    /**
     * @return modifications since last analyze / live, positive infinity without live rows
     */
    public double modificationRatio() {
        if (liveTuples == 0) {
            return modificationsSinceAnalyze == 0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return (double) modificationsSinceAnalyze / liveTuples;
    }

    public Optional<Instant> lastAnalyzed() {
        return Optional.ofNullable(latest(lastAnalyze, lastAutoanalyze));
    }

    public boolean neverAnalyzed() {
        return lastAnalyze == null && lastAutoanalyze == null;
    }

    /**
     * Time since the latest manual or automatic analyze.
     *
     * @param now Reference instant
     * @return Staleness, empty if the table was never analyzed
     */
    public Optional<Duration> staleness(Instant now) {
        return lastAnalyzed().map(analyzed -> Duration.between(analyzed, now));
    }

    public TableCandidate withSuspectIndexes(int count) {
        return new TableCandidate(schemaName, tableName, liveTuples, deadTuples, insertedTuples,
                updatedTuples, deletedTuples, modificationsSinceAnalyze, totalBytes,
                lastVacuum, lastAutovacuum, lastAnalyze, lastAutoanalyze, count);
    }

    private static Instant latest(Instant first, Instant second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.isAfter(second) ? first : second;
    }
}
