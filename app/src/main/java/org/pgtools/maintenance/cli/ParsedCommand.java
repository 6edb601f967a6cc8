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

import java.nio.file.Path;
import java.util.Map;

/**
 * Result of parsing the command line.
 *
 * @param command        Sub command to run
 * @param scheduleAction Crontab action, only set for {@link Command#SCHEDULE}
 * @param overrides      Configuration properties given as flags
 * @param configFile     File given with --config, or null
 */
public record ParsedCommand(Command command,
                            ScheduleAction scheduleAction,
                            Map<String, String> overrides,
                            Path configFile) {

    public ParsedCommand {
        overrides = Map.copyOf(overrides);
    }

    public enum Command {
        RUN, SCHEDULE
    }

    public enum ScheduleAction {
        SYNC, STATUS, REMOVE
    }
}
