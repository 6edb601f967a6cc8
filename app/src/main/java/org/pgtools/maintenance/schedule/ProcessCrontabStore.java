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
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads and installs the crontab through the {@code crontab} binary.
 */
@Slf4j
@ApplicationScoped
public class ProcessCrontabStore implements CrontabStore {
    private static final long TIMEOUT_SECONDS = 30;

    private final String crontabBinary;

    @Inject
    public ProcessCrontabStore(@ConfigProperty(name = "app.crontab-binary", defaultValue = "crontab")
                               String crontabBinary) {
        this.crontabBinary = crontabBinary;
    }

    @Override
    public List<String> read() throws IOException {
        Path errorFile = Files.createTempFile("pgmaint-crontab", ".err");
        try {
            Process process = new ProcessBuilder(crontabBinary, "-l")
                    .redirectError(errorFile.toFile())
                    .start();
            String output;
            try (InputStream stdout = process.getInputStream()) {
                output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exit = waitFor(process);
            if (exit != 0) {
                String errors = Files.readString(errorFile, StandardCharsets.UTF_8);
                if (errors.contains("no crontab")) {
                    log.debug("No crontab installed for current user");
                    return List.of();
                }
                throw new IOException("crontab -l failed with exit code " + exit + ": " + errors.trim());
            }
            return output.lines().toList();
        } finally {
            Files.deleteIfExists(errorFile);
        }
    }

    @Override
    public void write(List<String> lines) throws IOException {
        Process process = new ProcessBuilder(crontabBinary, "-").redirectErrorStream(true).start();
        try (OutputStream stdin = process.getOutputStream()) {
            for (String line : lines) {
                stdin.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            }
        }
        String output;
        try (InputStream stdout = process.getInputStream()) {
            output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
        }
        int exit = waitFor(process);
        if (exit != 0) {
            throw new IOException("crontab install failed with exit code " + exit + ": " + output.trim());
        }
    }

    private int waitFor(Process process) throws IOException {
        try {
            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("crontab did not finish within " + TIMEOUT_SECONDS + " seconds");
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while waiting for crontab", e);
        }
    }
}
