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
package org.pgtools.maintenance.safety;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.io.Console;
import java.util.Locale;

/**
 * Prompts on the controlling terminal. Without a terminal, for example under
 * cron, the answer is always no.
 */
@Slf4j
@ApplicationScoped
public class ConsoleConfirmation implements Confirmation {

    @Override
    public boolean confirm(String prompt) {
        Console console = System.console();
        if (console == null) {
            log.warn("No interactive terminal, treating '{}' as declined", prompt);
            return false;
        }
        String answer = console.readLine("%s (yes/no): ", prompt);
        return answer != null && answer.trim().toLowerCase(Locale.ROOT).equals("yes");
    }
}
