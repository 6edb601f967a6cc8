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

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads one snapshot of table statistics and turns it into maintenance candidates.
 *
 * <p>Filters are appended as constant SQL fragments with bound values, never as
 * interpolated text. Tables without any live or dead tuple are not candidates.
 */
@Slf4j
@ApplicationScoped
public class CandidateCollector {
    private static final String TABLE_SQL = """
            SELECT s.schemaname,
                   s.relname,
                   s.n_live_tup,
                   s.n_dead_tup,
                   s.n_tup_ins,
                   s.n_tup_upd,
                   s.n_tup_del,
                   s.n_mod_since_analyze,
                   s.last_vacuum,
                   s.last_autovacuum,
                   s.last_analyze,
                   s.last_autoanalyze,
                   pg_total_relation_size(s.relid) AS total_bytes
            FROM pg_stat_user_tables s
            WHERE s.schemaname NOT IN ('pg_catalog', 'information_schema', 'pg_toast')
              AND (s.n_live_tup + s.n_dead_tup) > 0""";

    private static final String INDEX_SQL = """
            SELECT s.schemaname,
                   s.relname,
                   count(*) AS suspect_indexes
            FROM pg_stat_user_indexes s
            WHERE s.schemaname NOT IN ('pg_catalog', 'information_schema', 'pg_toast')
              AND pg_relation_size(s.indexrelid) >= ?
              AND s.idx_scan > 0
              AND s.idx_tup_read > s.idx_tup_fetch * ?""";

    private static final String SCHEMA_FILTER = "\n  AND s.schemaname LIKE ?";
    private static final String TABLE_FILTER = "\n  AND s.relname LIKE ANY (?)";
    private static final String TABLE_ORDER = "\nORDER BY s.schemaname, s.relname";
    private static final String INDEX_GROUP = "\nGROUP BY s.schemaname, s.relname";

    /**
     * Collect candidates for one run.
     *
     * @param connection Read-only session on the statistics source
     * @param request    Scope and options
     * @return Candidates in schema and table order
     * @throws CollectionException If the table statistics cannot be read, or the index
     *                             statistics cannot be read and partial results are not allowed
     */
    public List<TableCandidate> collect(Connection connection, CollectionRequest request) throws CollectionException {
        log.debug("Collecting table statistics for {}", request.scope().describe());
        Map<String, TableCandidate> candidates;
        try {
            candidates = collectTables(connection, request.scope());
        } catch (SQLException e) {
            throw new CollectionException("Failed to query table statistics: " + e.getMessage(), e);
        }

        if (request.includeIndexStats()) {
            try {
                Map<String, Integer> suspects = collectSuspectIndexes(connection, request);
                suspects.forEach((key, count) -> candidates.computeIfPresent(key,
                        (k, candidate) -> candidate.withSuspectIndexes(count)));
                log.debug("Found possibly bloated indexes on {} tables", suspects.size());
            } catch (SQLException e) {
                if (!request.allowPartial()) {
                    throw new CollectionException("Failed to query index statistics: " + e.getMessage(), e);
                }
                log.warn("Index statistics unavailable, continuing with table statistics only: {}", e.getMessage());
            }
        }

        log.debug("Collected {} candidates", candidates.size());
        return new ArrayList<>(candidates.values());
    }

    private Map<String, TableCandidate> collectTables(Connection connection,
                                                      CollectionScope scope) throws SQLException {
        Map<String, TableCandidate> candidates = new LinkedHashMap<>();
        String sql = TABLE_SQL + scopeFilter(scope) + TABLE_ORDER;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            bindScope(connection, stmt, 1, scope);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    long live = rs.getLong("n_live_tup");
                    long dead = rs.getLong("n_dead_tup");
                    if (live + dead <= 0) {
                        continue;
                    }
                    TableCandidate candidate = new TableCandidate(
                            rs.getString("schemaname"),
                            rs.getString("relname"),
                            live,
                            dead,
                            rs.getLong("n_tup_ins"),
                            rs.getLong("n_tup_upd"),
                            rs.getLong("n_tup_del"),
                            rs.getLong("n_mod_since_analyze"),
                            rs.getLong("total_bytes"),
                            toInstant(rs.getTimestamp("last_vacuum")),
                            toInstant(rs.getTimestamp("last_autovacuum")),
                            toInstant(rs.getTimestamp("last_analyze")),
                            toInstant(rs.getTimestamp("last_autoanalyze")),
                            0
                    );
                    candidates.put(candidate.qualifiedName(), candidate);
                }
            }
        }
        return candidates;
    }

    private Map<String, Integer> collectSuspectIndexes(Connection connection,
                                                       CollectionRequest request) throws SQLException {
        Map<String, Integer> suspects = new HashMap<>();
        String sql = INDEX_SQL + scopeFilter(request.scope()) + INDEX_GROUP;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, request.indexMinBytes());
            stmt.setDouble(2, request.indexReadFetchRatio());
            bindScope(connection, stmt, 3, request.scope());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    suspects.put(rs.getString("schemaname") + "." + rs.getString("relname"),
                            rs.getInt("suspect_indexes"));
                }
            }
        }
        return suspects;
    }

    private String scopeFilter(CollectionScope scope) {
        StringBuilder filter = new StringBuilder();
        if (scope.schemaPattern().isPresent()) {
            filter.append(SCHEMA_FILTER);
        }
        if (!scope.tablePatterns().isEmpty()) {
            filter.append(TABLE_FILTER);
        }
        return filter.toString();
    }

    private void bindScope(Connection connection, PreparedStatement stmt,
                           int firstIndex, CollectionScope scope) throws SQLException {
        int index = firstIndex;
        Optional<String> schema = scope.schemaLikePattern();
        if (schema.isPresent()) {
            stmt.setString(index++, schema.get());
        }
        if (!scope.tablePatterns().isEmpty()) {
            Array patterns = connection.createArrayOf("text", scope.tableLikePatterns());
            stmt.setArray(index, patterns);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
