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
package org.pgtools.maintenance.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Settings of one maintenance run.
 *
 * <p>Values come from application.properties, an optional configuration file,
 * environment variables and command line flags. See {@link ConfigResolver}
 * for the precedence.
 */
@ConfigMapping(prefix = "app.maintenance")
public interface MaintenanceConfig {

    /**
     * @return Operation mode (default: analyze)
     */
    @WithDefault("analyze")
    OperationMode operation();

    /**
     * Report the plan without sending any maintenance statement.
     */
    @WithDefault("false")
    boolean dryRun();

    /**
     * Add absolute counts to trigger reasons and log pipeline details.
     */
    @WithDefault("false")
    boolean verbose();

    /**
     * Schema glob, all user schemas when absent.
     */
    Optional<String> schema();

    /**
     * Table name globs, all tables when absent.
     */
    Optional<List<String>> tables();

    Thresholds thresholds();

    Safety safety();

    Execution execution();

    Collection collection();

    Connection connection();

    Output output();

    interface Thresholds {
        /**
         * Dead tuples relative to live tuples, in percent, that makes a table
         * a vacuum candidate. Twice this value is urgent.
         *
         * @return Dead tuple threshold (default: 20)
         */
        @WithDefault("20")
        double deadTuplePercent();

        /**
         * @return Days since the last analyze before statistics are stale (default: 7)
         */
        @WithDefault("7")
        int staleDays();

        /**
         * @return Modifications since last analyze, in percent of live rows (default: 10)
         */
        @WithDefault("10")
        double modificationPercent();

        /**
         * @return Live rows a never analyzed table needs to be of interest (default: 1000)
         */
        @WithDefault("1000")
        long neverAnalyzedMinLiveRows();

        /**
         * @return Modifications a stale table needs to be re-analyzed (default: 1000)
         */
        @WithDefault("1000")
        long staleMinModifications();

        /**
         * @return Tuples read over tuples fetched above which an index is suspect (default: 10)
         */
        @WithDefault("10")
        double indexReadFetchRatio();

        /**
         * @return Smallest index considered for bloat detection (default: 10MB)
         */
        @WithDefault("10MB")
        String indexMinSize();
    }

    interface Safety {
        @WithDefault("false")
        boolean skipLarge();

        /**
         * @return Size at which a table counts as large (default: 10GB)
         */
        @WithDefault("10GB")
        String largeTableSize();

        /**
         * Allow VACUUM FULL and REINDEX without an interactive prompt.
         */
        @WithDefault("false")
        boolean confirmDestructive();
    }

    interface Execution {
        /**
         * @return Number of concurrent workers (default: 1)
         */
        @WithDefault("1")
        int parallel();

        /**
         * Cancel running statements when the run is interrupted instead of
         * letting them finish.
         */
        @WithDefault("false")
        boolean abortInFlight();

        /**
         * Session lock_timeout applied to each worker; the server setting is kept when absent.
         */
        Optional<Duration> lockTimeout();
    }

    interface Collection {
        /**
         * Continue with table statistics when the index statistics query fails.
         */
        @WithDefault("true")
        boolean allowPartial();
    }

    interface Connection {
        /**
         * @return Connectivity checks before giving up (default: 3)
         */
        @WithDefault("3")
        int retryAttempts();

        /**
         * Base delay between connectivity checks, multiplied by the attempt number.
         *
         * @return Base retry delay (default: 1 second)
         */
        @WithDefault("1s")
        Duration retryDelay();
    }

    interface Output {
        /**
         * Text report written after the run.
         */
        Optional<String> report();

        /**
         * Prometheus textfile written after the run.
         */
        Optional<String> metricsFile();
    }
}
