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
package org.pgtools.maintenance.cli;

import jakarta.enterprise.context.ApplicationScoped;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import net.sourceforge.argparse4j.inf.Subparsers;
import org.pgtools.maintenance.common.Constants;
import org.pgtools.maintenance.config.OperationMode;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line surface of pgmaint.
 *
 * <p>Flags are stored under the configuration property they override, so a flag
 * that is not given leaves lower precedence sources in charge.
 */
@ApplicationScoped
public class CommandLineParser {
    static final String OPERATION = "app.maintenance.operation";
    static final String SCHEMA = "app.maintenance.schema";
    static final String TABLES = "app.maintenance.tables";
    static final String DRY_RUN = "app.maintenance.dry-run";
    static final String VERBOSE = "app.maintenance.verbose";
    static final String DEAD_THRESHOLD = "app.maintenance.thresholds.dead-tuple-percent";
    static final String STALE_DAYS = "app.maintenance.thresholds.stale-days";
    static final String MODIFICATION_THRESHOLD = "app.maintenance.thresholds.modification-percent";
    static final String SKIP_LARGE = "app.maintenance.safety.skip-large";
    static final String LARGE_SIZE = "app.maintenance.safety.large-table-size";
    static final String CONFIRM_DESTRUCTIVE = "app.maintenance.safety.confirm-destructive";
    static final String PARALLEL = "app.maintenance.execution.parallel";
    static final String ABORT_IN_FLIGHT = "app.maintenance.execution.abort-in-flight";
    static final String REPORT = "app.maintenance.output.report";
    static final String METRICS_FILE = "app.maintenance.output.metrics-file";

    private static final String PROPERTY_PREFIX = "app.";
    private static final String DEST_COMMAND = "command";
    private static final String DEST_ACTION = "action";
    private static final String DEST_CONFIG = "config";

    /**
     * Parse the arguments of one invocation.
     *
     * @param args Raw arguments
     * @return Parsed command
     * @throws ArgumentParserException On invalid arguments, or after help was printed
     */
    public ParsedCommand parse(String... args) throws ArgumentParserException {
        ArgumentParser parser = buildParser();
        Namespace namespace = parser.parseArgs(args);

        ParsedCommand.Command command = ParsedCommand.Command.valueOf(
                namespace.getString(DEST_COMMAND).toUpperCase(Locale.ROOT));
        ParsedCommand.ScheduleAction action = null;
        if (command == ParsedCommand.Command.SCHEDULE) {
            action = ParsedCommand.ScheduleAction.valueOf(
                    namespace.getString(DEST_ACTION).toUpperCase(Locale.ROOT));
        }

        String configFile = namespace.getString(DEST_CONFIG);
        return new ParsedCommand(command, action, overrides(namespace),
                configFile == null ? null : Path.of(configFile));
    }

    ArgumentParser buildParser() {
        ArgumentParser parser = ArgumentParsers.newFor(Constants.APPLICATION_NAME)
                .build()
                .defaultHelp(true)
                .description("Automated PostgreSQL maintenance: collects table statistics, "
                        + "plans ANALYZE/VACUUM/REINDEX work and runs it with bounded concurrency.");

        Subparsers commands = parser.addSubparsers()
                .dest(DEST_COMMAND)
                .title("commands");

        addRunCommand(commands.addParser("run")
                .help("Evaluate table statistics and run the resulting maintenance plan"));

        Subparser schedule = commands.addParser("schedule")
                .help("Manage the pgmaint crontab entries");
        Subparsers actions = schedule.addSubparsers()
                .dest(DEST_ACTION)
                .title("actions");
        addConfigArgument(actions.addParser("sync").help("Install or update the configured entries"));
        addConfigArgument(actions.addParser("status").help("Show installed entries and pending changes"));
        addConfigArgument(actions.addParser("remove").help("Remove all pgmaint entries"));
        return parser;
    }

    private void addRunCommand(Subparser run) {
        run.addArgument("-o", "--operation")
                .dest(OPERATION)
                .choices(OperationMode.labels())
                .help("Operation mode (default: analyze)");
        run.addArgument("-s", "--schema")
                .dest(SCHEMA)
                .metavar("PATTERN")
                .help("Schema glob, all user schemas when omitted");
        run.addArgument("-t", "--tables")
                .dest(TABLES)
                .metavar("PATTERNS")
                .help("Comma separated table name globs");
        run.addArgument("-j", "--parallel")
                .dest(PARALLEL)
                .type(Integer.class)
                .metavar("N")
                .help("Number of concurrent workers (default: 1)");
        run.addArgument("-n", "--dry-run")
                .dest(DRY_RUN)
                .action(Arguments.storeConst())
                .setConst(Boolean.TRUE)
                .help("Show what would be done without executing");
        run.addArgument("-v", "--verbose")
                .dest(VERBOSE)
                .action(Arguments.storeConst())
                .setConst(Boolean.TRUE)
                .help("Verbose reasons and logging");
        run.addArgument("--dead-threshold")
                .dest(DEAD_THRESHOLD)
                .type(Double.class)
                .metavar("PERCENT")
                .help("Dead tuple threshold in percent of live rows (default: 20)");
        run.addArgument("--stale-days")
                .dest(STALE_DAYS)
                .type(Integer.class)
                .metavar("DAYS")
                .help("Days after which statistics are stale (default: 7)");
        run.addArgument("--modification-threshold")
                .dest(MODIFICATION_THRESHOLD)
                .type(Double.class)
                .metavar("PERCENT")
                .help("Modifications since last analyze in percent of live rows (default: 10)");
        run.addArgument("--skip-large")
                .dest(SKIP_LARGE)
                .action(Arguments.storeConst())
                .setConst(Boolean.TRUE)
                .help("Skip tables larger than --large-size");
        run.addArgument("--large-size")
                .dest(LARGE_SIZE)
                .metavar("SIZE")
                .help("Large table threshold, e.g. 10GB (default: 10GB)");
        run.addArgument("--confirm-destructive")
                .dest(CONFIRM_DESTRUCTIVE)
                .action(Arguments.storeConst())
                .setConst(Boolean.TRUE)
                .help("Run VACUUM FULL and REINDEX without asking");
        run.addArgument("--abort-in-flight")
                .dest(ABORT_IN_FLIGHT)
                .action(Arguments.storeConst())
                .setConst(Boolean.TRUE)
                .help("Cancel running statements when interrupted");
        run.addArgument("--output")
                .dest(REPORT)
                .metavar("FILE")
                .help("Write a text report to FILE");
        run.addArgument("--metrics-file")
                .dest(METRICS_FILE)
                .metavar("FILE")
                .help("Write run metrics in Prometheus text format to FILE");
        addConfigArgument(run);
    }

    private void addConfigArgument(Subparser subparser) {
        subparser.addArgument("--config")
                .dest(DEST_CONFIG)
                .metavar("FILE")
                .help("Properties file with app.maintenance.* and app.schedule.* settings");
    }

    private Map<String, String> overrides(Namespace namespace) {
        Map<String, String> overrides = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : namespace.getAttrs().entrySet()) {
            if (entry.getKey().startsWith(PROPERTY_PREFIX) && entry.getValue() != null) {
                overrides.put(entry.getKey(), render(entry.getValue()));
            }
        }
        return overrides;
    }

    private String render(Object value) {
        if (value instanceof List<?> list) {
            return String.join(",", list.stream().map(String::valueOf).toList());
        }
        return String.valueOf(value);
    }
}
