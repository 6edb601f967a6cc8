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
package org.pgtools.maintenance.db;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.pgtools.maintenance.model.ServerVersion;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Access to the statistics source through the default datasource.
 */
@Slf4j
@ApplicationScoped
public class DatabaseService {
    private final AgroalDataSource dataSource;

    @Inject
    public DatabaseService(AgroalDataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * Get the JDBC URL for logging/debugging purposes.
     *
     * @return JDBC URL or "unavailable" if not accessible
     */
    public String getUrl() {
        try {
            return dataSource.getConfiguration().connectionPoolConfiguration()
                    .connectionFactoryConfiguration().jdbcUrl();
        } catch (Exception e) {
            log.debug("Could not retrieve JDBC URL", e);
            return "unavailable";
        }
    }

    /**
     * Get a connection from the default pool. Used for read-only collection.
     */
    public Connection getPooledConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Read the server version with {@code SELECT version()}.
     *
     * @throws SQLException If the query fails or the answer is not a PostgreSQL version
     */
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS)
    @Timeout(value = 5, unit = ChronoUnit.SECONDS)
    public ServerVersion detectVersion() throws SQLException {
        try (Connection conn = getPooledConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT version()")) {
            ServerVersion parsed = parseVersion(rs);
            if (parsed == null) {
                throw new SQLException("Unable to detect PostgreSQL version");
            }
            return parsed;
        } catch (SQLException e) {
            log.warn("Failed to detect server version (attempt may be retried): {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Test database connectivity
     */
    @Timeout(value = 5, unit = ChronoUnit.SECONDS)
    public boolean testConnection() {
        try (Connection conn = getPooledConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT 1")) {
            return rs.next() && rs.getInt(1) == 1;
        } catch (SQLException e) {
            log.debug("Connection test failed", e);
            return false;
        } catch (Exception e) {
            log.warn("Unexpected error during connection test", e);
            return false;
        }
    }

    private ServerVersion parseVersion(ResultSet rs) throws SQLException {
        if (!rs.next()) {
            return null;
        }
        String versionString = rs.getString(1);
        log.debug("Detected server version: {}", versionString);
        return ServerVersion.parse(versionString);
    }
}
