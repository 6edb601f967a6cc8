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
package org.pgtools.maintenance.schedule;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.pgtools.maintenance.config.ScheduleConfig;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Declarative crontab management.
 *
 * <p>The desired entries are computed from configuration and compared with the
 * installed crontab. Only the difference is applied: unchanged entries and lines
 * pgmaint does not own keep their position, and nothing is written when the
 * crontab is already up to date.
 */
@Slf4j
@ApplicationScoped
public class CrontabSync {
    private final CrontabStore store;

    @Inject
    public CrontabSync(CrontabStore store) {
        this.store = store;
    }

    /**
     * Bring the crontab in line with the configured jobs.
     *
     * @return Applied difference, empty when nothing changed
     */
    public CrontabDiff sync(ScheduleConfig config) throws IOException {
        List<String> current = store.read();
        CrontabDiff diff = diff(desiredEntries(config), current);
        if (diff.isEmpty()) {
            log.info("Crontab already up to date ({} managed entries)", diff.unchanged().size());
            return diff;
        }
        store.write(apply(current, diff));
        log.info("Crontab updated: {} added, {} removed, {} unchanged",
                diff.toAdd().size(), diff.toRemove().size(), diff.unchanged().size());
        return diff;
    }

    /**
     * Compute the difference without changing anything.
     */
    public CrontabDiff status(ScheduleConfig config) throws IOException {
        return diff(desiredEntries(config), store.read());
    }

    /**
     * Remove every managed entry and keep all other lines.
     *
     * @return Number of removed entries
     */
    public int remove() throws IOException {
        List<String> current = store.read();
        List<String> kept = new ArrayList<>(current.size());
        int removed = 0;
        for (String line : current) {
            if (CrontabEntry.parse(line).isPresent()) {
                removed++;
            } else {
                kept.add(line);
            }
        }
        if (removed > 0) {
            store.write(kept);
            log.info("Removed {} pgmaint crontab entries", removed);
        } else {
            log.info("No pgmaint crontab entries installed");
        }
        return removed;
    }

    /**
     * @return Entries of enabled jobs, ordered by job name
     */
    public List<CrontabEntry> desiredEntries(ScheduleConfig config) {
        Map<String, ScheduleConfig.Job> jobs = new TreeMap<>(config.jobs());
        List<CrontabEntry> entries = new ArrayList<>(jobs.size());
        jobs.forEach((name, job) -> {
            if (job.enabled()) {
                String command = config.command() + " run"
                        + job.arguments().map(arguments -> " " + arguments.trim()).orElse("");
                entries.add(CrontabEntry.of(name, job.cron(), command, config.logFile()));
            }
        });
        return entries;
    }

    CrontabDiff diff(List<CrontabEntry> desired, List<String> current) {
        Map<String, CrontabEntry> installed = new HashMap<>();
        List<CrontabEntry> toRemove = new ArrayList<>();
        for (String line : current) {
            Optional<CrontabEntry> entry = CrontabEntry.parse(line);
            if (entry.isPresent() && installed.putIfAbsent(entry.get().name(), entry.get()) != null) {
                toRemove.add(entry.get());
            }
        }

        List<CrontabEntry> toAdd = new ArrayList<>();
        List<CrontabEntry> unchanged = new ArrayList<>();
        Set<String> wanted = new HashSet<>();
        for (CrontabEntry entry : desired) {
            wanted.add(entry.name());
            CrontabEntry existing = installed.get(entry.name());
            if (existing != null && existing.line().equals(entry.line())) {
                unchanged.add(existing);
            } else {
                if (existing != null) {
                    toRemove.add(existing);
                }
                toAdd.add(entry);
            }
        }
        installed.forEach((name, entry) -> {
            if (!wanted.contains(name)) {
                toRemove.add(entry);
            }
        });
        return new CrontabDiff(toAdd, toRemove, unchanged);
    }

    List<String> apply(List<String> current, CrontabDiff diff) {
        Map<String, Integer> keep = new HashMap<>();
        current.forEach(line -> keep.merge(line, 1, Integer::sum));
        diff.toRemove().forEach(entry -> keep.computeIfPresent(entry.line(), (line, count) -> count - 1));

        List<String> result = new ArrayList<>(current.size() + diff.toAdd().size());
        for (String line : current) {
            int left = keep.getOrDefault(line, 0);
            if (left > 0) {
                result.add(line);
                keep.put(line, left - 1);
            }
        }
        diff.toAdd().forEach(entry -> result.add(entry.line()));
        return result;
    }
}
