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

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs maintenance statements over JDBC, one session per statement.
 *
 * <p>VACUUM cannot run inside a transaction block, so sessions are switched to
 * autocommit before use. VERBOSE output arrives as warnings and is logged at debug.
 */
@Slf4j
public class JdbcMaintenanceExecutor implements MaintenanceExecutor {
    private final DataSource dataSource;
    private final Optional<Duration> lockTimeout;
    private final Set<Statement> runningStatements = ConcurrentHashMap.newKeySet();

    public JdbcMaintenanceExecutor(DataSource dataSource, Optional<Duration> lockTimeout) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
    }

    @Override
    public void execute(MaintenanceOperation operation) throws SQLException {
        String sql = MaintenanceStatements.statementFor(operation.kind(), operation.target());
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(true);
            applyLockTimeout(connection);
            try (Statement stmt = connection.createStatement()) {
                runningStatements.add(stmt);
                try {
                    log.debug("Executing: {}", sql);
                    stmt.execute(sql);
                    logServerNotices(operation, stmt.getWarnings());
                } finally {
                    runningStatements.remove(stmt);
                }
            }
        }
    }

    @Override
    public void cancelRunning() {
        for (Statement stmt : runningStatements) {
            try {
                stmt.cancel();
            } catch (SQLException e) {
                log.warn("Failed to cancel running statement: {}", e.getMessage());
            }
        }
    }

    int runningCount() {
        return runningStatements.size();
    }

    private void applyLockTimeout(Connection connection) throws SQLException {
        if (lockTimeout.isEmpty()) {
            return;
        }
        try (PreparedStatement stmt = connection.prepareStatement(MaintenanceStatements.SET_LOCK_TIMEOUT)) {
            stmt.setString(1, lockTimeout.get().toMillis() + "ms");
            stmt.execute();
        }
    }

    private void logServerNotices(MaintenanceOperation operation, SQLWarning warning) {
        SQLWarning current = warning;
        while (current != null) {
            log.debug("[{} {}] {}", operation.kind().displayName(), operation.tableKey(), current.getMessage());
            current = current.getNextWarning();
        }
    }
}
