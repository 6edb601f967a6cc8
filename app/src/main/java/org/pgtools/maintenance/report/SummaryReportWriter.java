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
package org.pgtools.maintenance.report;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.pgtools.maintenance.plan.OperationState;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Plain text report: a header with the run settings, one tab separated row
 * per operation and the totals.
 */
@Slf4j
@ApplicationScoped
public class SummaryReportWriter {
    static final String TITLE = "PostgreSQL Automated Maintenance Report";
    static final String COLUMNS = String.join("\t",
            "Rank", "Table", "Operation", "Reason", "State", "Duration (ms)", "Error", "Note");

    public void write(Path target, RunSummary summary, Map<String, String> settings, Instant generatedAt)
            throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(summary, settings, generatedAt), StandardCharsets.UTF_8);
        log.info("Report saved to: {}", target);
    }

    public String render(RunSummary summary, Map<String, String> settings, Instant generatedAt) {
        StringBuilder out = new StringBuilder();
        out.append(TITLE).append('\n');
        out.append("Generated: ").append(generatedAt).append('\n');
        out.append("=".repeat(TITLE.length())).append("\n\n");

        settings.forEach((name, value) -> out.append(name).append(": ").append(value).append('\n'));
        out.append('\n');

        out.append(COLUMNS).append('\n');
        for (OperationOutcome outcome : summary.outcomes()) {
            out.append(outcome.rank()).append('\t')
                    .append(clean(outcome.target())).append('\t')
                    .append(outcome.kind().displayName()).append('\t')
                    .append(clean(outcome.reason())).append('\t')
                    .append(outcome.state()).append('\t')
                    .append(outcome.duration().toMillis()).append('\t')
                    .append(clean(outcome.error())).append('\t')
                    .append(clean(outcome.note())).append('\n');
        }
        out.append('\n');

        out.append("Summary").append('\n');
        out.append("  Total operations: ").append(summary.total()).append('\n');
        for (OperationState state : OperationState.values()) {
            if (state.isTerminal()) {
                out.append("  ").append(label(state)).append(": ").append(summary.count(state)).append('\n');
            }
        }
        out.append("  Elapsed: ").append(summary.elapsed().toMillis()).append(" ms").append('\n');
        return out.toString();
    }

    private static String label(OperationState state) {
        String lower = state.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    private static String clean(String value) {
        return value.replace('\t', ' ').replace('\n', ' ').replace('\r', ' ');
    }
}
