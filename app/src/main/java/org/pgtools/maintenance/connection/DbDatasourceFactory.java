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
package org.pgtools.maintenance.connection;

import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.supplier.AgroalPropertiesReader;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Factory for the connection pool used by maintenance workers.
 *
 * <p>Each worker runs its statement on an independent session, so the pool is
 * sized to the concurrency bound of the run:
 * <ul>
 *   <li>Exactly one connection per worker, opened lazily</li>
 *   <li>Same JDBC URL and credentials as the default datasource</li>
 *   <li>No max lifetime, maintenance statements may run for hours</li>
 * </ul>
 */
@Slf4j
@ApplicationScoped
public class DbDatasourceFactory {

    private static final String APPLICATION_NAME_PARAMETER = "ApplicationName";

    @ConfigProperty(name = "quarkus.datasource.jdbc.url")
    String jdbcUrl;

    @ConfigProperty(name = "quarkus.datasource.username")
    String username;

    @ConfigProperty(name = "quarkus.datasource.password")
    String password;

    /**
     * Create the worker pool.
     *
     * @param workers Number of concurrent workers
     * @return Configured AgroalDataSource holding at most {@code workers} connections
     * @throws SQLException If DataSource creation fails
     * @throws IllegalArgumentException If workers is less than one
     */
    public AgroalDataSource createWorkerPool(int workers) throws SQLException {
        if (workers < 1) {
            throw new IllegalArgumentException("Worker pool size must be at least 1, got " + workers);
        }

        Map<String, String> props = new HashMap<>();
        props.put(AgroalPropertiesReader.JDBC_URL, createWorkerJdbcUrl());
        props.put(AgroalPropertiesReader.PRINCIPAL, username);
        props.put(AgroalPropertiesReader.CREDENTIAL, password);
        props.put(AgroalPropertiesReader.MAX_SIZE, String.valueOf(workers));
        props.put(AgroalPropertiesReader.MIN_SIZE, "0");
        props.put(AgroalPropertiesReader.INITIAL_SIZE, "0");

        try {
            AgroalDataSource dataSource = AgroalDataSource.from(
                    new AgroalPropertiesReader().readProperties(props).get()
            );
            log.debug("Created worker pool with {} connections", workers);
            return dataSource;
        } catch (SQLException e) {
            log.error("Failed to create worker pool: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Tag worker sessions so they are recognisable in pg_stat_activity.
     *
     * @return JDBC URL of the default datasource with an application name
     */
    public String createWorkerJdbcUrl() {
        if (jdbcUrl.contains(APPLICATION_NAME_PARAMETER + "=")) {
            return jdbcUrl;
        }
        String separator = jdbcUrl.contains("?") ? "&" : "?";
        String workerUrl = jdbcUrl + separator + APPLICATION_NAME_PARAMETER + "=pgmaint-worker";
        log.trace("Created worker JDBC URL: {}", workerUrl);
        return workerUrl;
    }
}
