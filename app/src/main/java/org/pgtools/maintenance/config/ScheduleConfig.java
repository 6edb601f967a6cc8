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

import java.util.Map;
import java.util.Optional;

/**
 * Declarative crontab schedule managed by {@code pgmaint schedule}.
 */
@ConfigMapping(prefix = "app.schedule")
public interface ScheduleConfig {

    /**
     * @return Command scheduled jobs invoke (default: pgmaint)
     */
    @WithDefault("pgmaint")
    String command();

    /**
     * @return File scheduled jobs append their output to (default: /var/log/pgmaint.log)
     */
    @WithDefault("/var/log/pgmaint.log")
    String logFile();

    /**
     * Jobs keyed by name, for example {@code app.schedule.jobs.nightly-analyze.cron}.
     */
    Map<String, Job> jobs();

    interface Job {
        /**
         * Five field cron expression.
         */
        String cron();

        /**
         * Arguments passed to {@code pgmaint run}.
         */
        Optional<String> arguments();

        @WithDefault("true")
        boolean enabled();
    }
}
