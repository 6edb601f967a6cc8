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
package org.pgtools.maintenance.bootstrap;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import org.pgtools.maintenance.cli.CommandLineParser;
import org.pgtools.maintenance.cli.ParsedCommand;
import org.pgtools.maintenance.common.Constants;
import org.pgtools.maintenance.config.ConfigResolver;
import org.pgtools.maintenance.config.MaintenanceConfig;
import org.pgtools.maintenance.config.ScheduleConfig;
import org.pgtools.maintenance.db.DatabaseService;
import org.pgtools.maintenance.pipeline.MaintenanceException;
import org.pgtools.maintenance.pipeline.MaintenancePipeline;
import org.pgtools.maintenance.report.RunSummary;
import org.pgtools.maintenance.schedule.CrontabDiff;
import org.pgtools.maintenance.schedule.CrontabEntry;
import org.pgtools.maintenance.schedule.CrontabSync;

import java.io.IOException;

/**
 * Entry point of the pgmaint command.
 *
 * <p><b>Exit status:</b>
 * <ul>
 *   <li>0: every operation succeeded, was skipped on purpose or reported in a dry run</li>
 *   <li>1: at least one operation failed</li>
 *   <li>2: invalid arguments or configuration, or no plan could be built</li>
 * </ul>
 */
@Slf4j
@QuarkusMain
public class MaintenanceApp implements QuarkusApplication {
    private static final String BASE_PACKAGE = "org.pgtools.maintenance";

    private final CommandLineParser commandLineParser;
    private final ConfigResolver configResolver;
    private final MaintenancePipeline pipeline;
    private final CrontabSync crontabSync;
    private final DatabaseService databaseService;
    private final InterruptHandler interruptHandler;
    private final Banners banner;

    @Inject
    public MaintenanceApp(CommandLineParser commandLineParser,
                          ConfigResolver configResolver,
                          MaintenancePipeline pipeline,
                          CrontabSync crontabSync,
                          DatabaseService databaseService,
                          InterruptHandler interruptHandler,
                          Banners banner) {
        this.commandLineParser = commandLineParser;
        this.configResolver = configResolver;
        this.pipeline = pipeline;
        this.crontabSync = crontabSync;
        this.databaseService = databaseService;
        this.interruptHandler = interruptHandler;
        this.banner = banner;
    }

    @Override
    public int run(String... args) {
        ParsedCommand command;
        try {
            command = commandLineParser.parse(args);
        } catch (HelpScreenException e) {
            return Constants.EXIT_OK;
        } catch (ArgumentParserException e) {
            e.getParser().handleError(e);
            return Constants.EXIT_FATAL;
        }

        return switch (command.command()) {
            case RUN -> runMaintenance(command);
            case SCHEDULE -> manageSchedule(command);
        };
    }

    int runMaintenance(ParsedCommand command) {
        MaintenanceConfig config;
        try {
            config = configResolver.resolveMaintenance(command.overrides(), command.configFile());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return Constants.EXIT_FATAL;
        }
        if (config.verbose()) {
            LogLevels.enableDebug(BASE_PACKAGE);
        }

        banner.printHeader();
        logConfiguration(config);

        interruptHandler.arm();
        try {
            RunSummary summary = pipeline.run(config);
            banner.printFooter(summary);
            return summary.exitCode();
        } catch (MaintenanceException e) {
            log.error("Maintenance aborted: {}", e.getMessage());
            log.debug("Abort details:", e);
            return Constants.EXIT_FATAL;
        } catch (RuntimeException e) {
            log.error("Unexpected error during maintenance run: {}", e.getMessage(), e);
            return Constants.EXIT_FATAL;
        } finally {
            interruptHandler.disarm();
        }
    }

    int manageSchedule(ParsedCommand command) {
        ScheduleConfig config;
        try {
            config = configResolver.resolveSchedule(command.overrides(), command.configFile());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return Constants.EXIT_FATAL;
        }

        try {
            switch (command.scheduleAction()) {
                case SYNC -> logDiff("Applied", crontabSync.sync(config));
                case STATUS -> logDiff("Pending", crontabSync.status(config));
                case REMOVE -> crontabSync.remove();
            }
            return Constants.EXIT_OK;
        } catch (IllegalArgumentException e) {
            log.error("Invalid schedule: {}", e.getMessage());
            return Constants.EXIT_FATAL;
        } catch (IOException e) {
            log.error("Crontab update failed: {}", e.getMessage());
            log.debug("Crontab error details:", e);
            return Constants.EXIT_FATAL;
        }
    }

    private void logConfiguration(MaintenanceConfig config) {
        log.info("Configuration:");
        log.info("  Operation:              {}", config.operation().label());
        log.info("  Schema pattern:         {}", config.schema().orElse("all user schemas"));
        log.info("  Table patterns:         {}", config.tables().map(t -> String.join(",", t)).orElse("all"));
        log.info("  Dry run:                {}", config.dryRun());
        log.info("  Parallel jobs:          {}", config.execution().parallel());
        log.info("  Dead tuple threshold:   {}%", config.thresholds().deadTuplePercent());
        log.info("  Stale after:            {} days", config.thresholds().staleDays());
        log.info("  Skip large tables:      {} ({})", config.safety().skipLarge(), config.safety().largeTableSize());
        log.info("  Database URL:           {}", maskSensitiveInfo(databaseService.getUrl()));
    }

    private void logDiff(String verb, CrontabDiff diff) {
        for (CrontabEntry entry : diff.unchanged()) {
            log.info("  installed  {}", entry.line());
        }
        for (CrontabEntry entry : diff.toAdd()) {
            log.info("  {} add     {}", verb, entry.line());
        }
        for (CrontabEntry entry : diff.toRemove()) {
            log.info("  {} remove  {}", verb, entry.line());
        }
        if (diff.isEmpty()) {
            log.info("Crontab is up to date");
        }
    }

    /**
     * Mask sensitive information in connection strings for logging.
     *
     * @param url Database connection URL
     * @return Masked URL with password hidden
     */
    static String maskSensitiveInfo(String url) {
        if (url == null) {
            return "not configured";
        }
        return url.replaceAll("password=[^&\\s]+", "password=***")
                .replaceAll(":[^:/@]+@", ":***@");
    }
}
