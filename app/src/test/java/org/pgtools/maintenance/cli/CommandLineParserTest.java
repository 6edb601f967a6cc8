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

import net.sourceforge.argparse4j.inf.ArgumentParserException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineParserTest {

    private CommandLineParser parser;

    @BeforeEach
    void setUp() {
        parser = new CommandLineParser();
    }

    @Test
    void testParse_RunWithFlags() throws ArgumentParserException {
        // Execute
        ParsedCommand command = parser.parse("run", "-o", "full-vacuum", "-s", "sales", "-t", "orders,items",
                "-j", "4", "-n", "--confirm-destructive", "--output", "/tmp/report.txt",
                "--config", "/etc/pgmaint.properties");

        // Verify
        assertEquals(ParsedCommand.Command.RUN, command.command());
        assertNull(command.scheduleAction());
        assertEquals(Path.of("/etc/pgmaint.properties"), command.configFile());
        assertEquals("full-vacuum", command.overrides().get(CommandLineParser.OPERATION));
        assertEquals("sales", command.overrides().get(CommandLineParser.SCHEMA));
        assertEquals("orders,items", command.overrides().get(CommandLineParser.TABLES));
        assertEquals("4", command.overrides().get(CommandLineParser.PARALLEL));
        assertEquals("true", command.overrides().get(CommandLineParser.DRY_RUN));
        assertEquals("true", command.overrides().get(CommandLineParser.CONFIRM_DESTRUCTIVE));
        assertEquals("/tmp/report.txt", command.overrides().get(CommandLineParser.REPORT));
    }

    @Test
    void testParse_AbsentFlagsDoNotOverride() throws ArgumentParserException {
        // Execute
        ParsedCommand command = parser.parse("run");

        // Verify
        assertTrue(command.overrides().isEmpty(), "Unset flags must leave lower precedence sources in charge");
        assertNull(command.configFile());
    }

    @Test
    void testParse_LongThresholdFlags() throws ArgumentParserException {
        ParsedCommand command = parser.parse("run", "--dead-threshold", "35", "--stale-days", "3",
                "--modification-threshold", "12.5", "--large-size", "50GB", "--skip-large", "--abort-in-flight");

        assertEquals("35.0", command.overrides().get(CommandLineParser.DEAD_THRESHOLD));
        assertEquals("3", command.overrides().get(CommandLineParser.STALE_DAYS));
        assertEquals("12.5", command.overrides().get(CommandLineParser.MODIFICATION_THRESHOLD));
        assertEquals("50GB", command.overrides().get(CommandLineParser.LARGE_SIZE));
        assertEquals("true", command.overrides().get(CommandLineParser.SKIP_LARGE));
        assertEquals("true", command.overrides().get(CommandLineParser.ABORT_IN_FLIGHT));
    }

    @Test
    void testParse_UnknownOperation_Rejected() {
        assertThrows(ArgumentParserException.class, () -> parser.parse("run", "-o", "defrag"));
    }

    @Test
    void testParse_NonNumericParallel_Rejected() {
        assertThrows(ArgumentParserException.class, () -> parser.parse("run", "-j", "many"));
    }

    @Test
    void testParse_ScheduleActions() throws ArgumentParserException {
        assertEquals(ParsedCommand.ScheduleAction.SYNC, parser.parse("schedule", "sync").scheduleAction());
        assertEquals(ParsedCommand.ScheduleAction.STATUS, parser.parse("schedule", "status").scheduleAction());

        ParsedCommand remove = parser.parse("schedule", "remove", "--config", "jobs.properties");
        assertEquals(ParsedCommand.Command.SCHEDULE, remove.command());
        assertEquals(ParsedCommand.ScheduleAction.REMOVE, remove.scheduleAction());
        assertEquals(Path.of("jobs.properties"), remove.configFile());
        assertTrue(remove.overrides().isEmpty());
    }

    @Test
    void testParse_UnknownCommand_Rejected() {
        assertThrows(ArgumentParserException.class, () -> parser.parse("optimize"));
    }
}
