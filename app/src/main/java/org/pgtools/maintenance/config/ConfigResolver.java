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

import io.quarkus.runtime.configuration.DurationConverter;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigSource;
import org.pgtools.maintenance.common.ValueUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the effective configuration of one invocation.
 *
 * <p>Precedence, highest first:
 * <ol>
 *   <li>Command line flags</li>
 *   <li>System properties and environment variables</li>
 *   <li>The file given with {@code --config}</li>
 *   <li>application.properties</li>
 *   <li>Mapping defaults</li>
 * </ol>
 * The result is an immutable mapping that is passed explicitly through the pipeline.
 */
@Slf4j
@ApplicationScoped
public class ConfigResolver {
    static final int COMMAND_LINE_ORDINAL = 500;
    static final int CONFIG_FILE_ORDINAL = 260;
    static final String COMMAND_LINE_SOURCE = "command-line";

    private final Config baseConfig;

    @Inject
    public ConfigResolver(Config baseConfig) {
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
    }

    /**
     * Resolve and validate the maintenance settings.
     *
     * @param flags      Properties set on the command line, keyed by property name
     * @param configFile Optional properties file, may be null
     * @return Effective maintenance configuration
     * @throws IllegalArgumentException If a value is missing, malformed or out of range
     */
    public MaintenanceConfig resolveMaintenance(Map<String, String> flags, Path configFile) {
        MaintenanceConfig config = build(flags, configFile).getConfigMapping(MaintenanceConfig.class);
        validate(config);
        return config;
    }

    /**
     * Resolve the crontab schedule.
     *
     * @param flags      Properties set on the command line, keyed by property name
     * @param configFile Optional properties file, may be null
     * @return Effective schedule configuration
     */
    public ScheduleConfig resolveSchedule(Map<String, String> flags, Path configFile) {
        return build(flags, configFile).getConfigMapping(ScheduleConfig.class);
    }

    private SmallRyeConfig build(Map<String, String> flags, Path configFile) {
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
                .addDefaultInterceptors()
                .withConverter(Duration.class, 200, new DurationConverter())
                .withMapping(MaintenanceConfig.class)
                .withMapping(ScheduleConfig.class)
                .withSources(new PropertiesConfigSource(Map.copyOf(flags), COMMAND_LINE_SOURCE, COMMAND_LINE_ORDINAL));

        if (configFile != null) {
            builder.withSources(loadFile(configFile));
        }
        for (ConfigSource source : baseConfig.getConfigSources()) {
            builder.withSources(source);
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private ConfigSource loadFile(Path configFile) {
        if (!Files.isReadable(configFile)) {
            throw new IllegalArgumentException("Configuration file is not readable: " + configFile);
        }
        try {
            log.debug("Loading configuration file {}", configFile);
            return new PropertiesConfigSource(configFile.toUri().toURL(), CONFIG_FILE_ORDINAL);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read configuration file " + configFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Check ranges the mapping itself cannot express.
     */
    static void validate(MaintenanceConfig config) {
        if (config.execution().parallel() < 1) {
            throw new IllegalArgumentException("Invalid parallel jobs value: " + config.execution().parallel());
        }
        MaintenanceConfig.Thresholds thresholds = config.thresholds();
        requirePositive("dead tuple threshold", thresholds.deadTuplePercent());
        requirePositive("modification threshold", thresholds.modificationPercent());
        requirePositive("index read/fetch ratio", thresholds.indexReadFetchRatio());
        if (thresholds.staleDays() < 0) {
            throw new IllegalArgumentException("Invalid stale days value: " + thresholds.staleDays());
        }
        if (config.connection().retryAttempts() < 1) {
            throw new IllegalArgumentException("Retry attempts must be at least 1");
        }
        ValueUtils.parseSize(thresholds.indexMinSize());
        ValueUtils.parseSize(config.safety().largeTableSize());
        config.execution().lockTimeout().ifPresent(timeout -> {
            if (timeout.isNegative()) {
                throw new IllegalArgumentException("Lock timeout cannot be negative: " + timeout);
            }
        });
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
    }
}
