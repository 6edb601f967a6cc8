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

import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pgtools.maintenance.cli.CommandLineParser;
import org.pgtools.maintenance.config.ConfigResolver;
import org.pgtools.maintenance.config.MaintenanceConfig;
import org.pgtools.maintenance.config.ScheduleConfig;
import org.pgtools.maintenance.db.DatabaseService;
import org.pgtools.maintenance.execution.CancellationSignal;
import org.pgtools.maintenance.pipeline.ConnectivityException;
import org.pgtools.maintenance.pipeline.MaintenancePipeline;
import org.pgtools.maintenance.plan.OperationKind;
import org.pgtools.maintenance.plan.OperationState;
import org.pgtools.maintenance.report.OperationOutcome;
import org.pgtools.maintenance.report.RunSummary;
import org.pgtools.maintenance.schedule.CrontabSync;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MaintenanceAppTest {

    @Mock
    private ConfigResolver configResolver;

    @Mock
    private MaintenancePipeline pipeline;

    @Mock
    private CrontabSync crontabSync;

    @Mock
    private DatabaseService databaseService;

    private CancellationSignal cancellation;
    private InterruptHandler interruptHandler;
    private MaintenanceApp app;

    @BeforeEach
    void setUp() {
        cancellation = new CancellationSignal();
        interruptHandler = new InterruptHandler(cancellation, Duration.ofSeconds(1));
        app = new MaintenanceApp(new CommandLineParser(), configResolver, pipeline, crontabSync,
                databaseService, interruptHandler, new Banners(60));
        lenient().when(databaseService.getUrl()).thenReturn("jdbc:postgresql://localhost:5432/postgres");
    }

    private static MaintenanceConfig realConfig() {
        return new ConfigResolver(new SmallRyeConfigBuilder().build()).resolveMaintenance(Map.of(), null);
    }

    private static RunSummary summaryWith(OperationState state) {
        OperationOutcome outcome = new OperationOutcome(1, "public.orders", OperationKind.VACUUM, "Urgent: test",
                state, Duration.ofMillis(10), state == OperationState.FAILED ? "boom" : "", "");
        return new RunSummary(Map.of(state, 1), Duration.ofMillis(20), List.of(outcome));
    }

    @Test
    void testRun_AllSucceeded_ExitZero() throws Exception {
        // Setup
        when(configResolver.resolveMaintenance(any(), any())).thenReturn(realConfig());
        when(pipeline.run(any())).thenReturn(summaryWith(OperationState.SUCCEEDED));

        // Execute
        int exit = app.run("run", "-o", "vacuum");

        // Verify
        assertEquals(0, exit);
        verify(configResolver).resolveMaintenance(Map.of("app.maintenance.operation", "vacuum"), null);
    }

    @Test
    void testRun_OperationFailed_ExitOne() throws Exception {
        // Setup
        when(configResolver.resolveMaintenance(any(), any())).thenReturn(realConfig());
        when(pipeline.run(any())).thenReturn(summaryWith(OperationState.FAILED));

        // Execute & Verify
        assertEquals(1, app.run("run"));
    }

    @Test
    void testRun_PipelineAborted_ExitTwo() throws Exception {
        // Setup
        when(configResolver.resolveMaintenance(any(), any())).thenReturn(realConfig());
        when(pipeline.run(any())).thenThrow(new ConnectivityException("Cannot connect"));

        // Execute & Verify
        assertEquals(2, app.run("run"));
    }

    @Test
    void testRun_UnexpectedError_ExitTwo() throws Exception {
        // Setup
        when(configResolver.resolveMaintenance(any(), any())).thenReturn(realConfig());
        when(pipeline.run(any())).thenThrow(new IllegalStateException("worker pool closed"));

        // Execute & Verify
        assertEquals(2, app.run("run"));
    }

    @Test
    void testRun_InvalidConfiguration_ExitTwo() {
        // Setup
        when(configResolver.resolveMaintenance(any(), any()))
                .thenThrow(new IllegalArgumentException("Invalid parallel jobs value: 0"));

        // Execute & Verify
        assertEquals(2, app.run("run", "-j", "0"));
        verifyNoInteractions(pipeline);
    }

    @Test
    void testRun_InvalidArguments_ExitTwo() {
        assertEquals(2, app.run("run", "--operation", "defrag"));
        verifyNoInteractions(configResolver, pipeline);
    }

    @Test
    void testRun_Help_ExitZero() {
        assertEquals(0, app.run("--help"));
        verifyNoInteractions(configResolver, pipeline);
    }

    @Test
    void testRun_InterruptAfterRunIsIgnored() throws Exception {
        // Setup
        when(configResolver.resolveMaintenance(any(), any())).thenReturn(realConfig());
        when(pipeline.run(any())).thenReturn(summaryWith(OperationState.SUCCEEDED));

        // Execute
        app.run("run");
        interruptHandler.onShutdown(null);

        // Verify
        assertFalse(cancellation.isCancelled());
    }

    @Test
    void testSchedule_SyncFails_ExitTwo() throws Exception {
        // Setup
        when(configResolver.resolveSchedule(any(), any())).thenReturn(mock(ScheduleConfig.class));
        when(crontabSync.sync(any())).thenThrow(new IOException("crontab: command not found"));

        // Execute & Verify
        assertEquals(2, app.run("schedule", "sync"));
    }

    @Test
    void testSchedule_Remove_ExitZero() throws Exception {
        // Setup
        when(configResolver.resolveSchedule(any(), any())).thenReturn(mock(ScheduleConfig.class));
        when(crontabSync.remove()).thenReturn(2);

        // Execute & Verify
        assertEquals(0, app.run("schedule", "remove"));
        verify(crontabSync).remove();
    }

    @Test
    void testMaskSensitiveInfo() {
        assertEquals("jdbc:postgresql://db:5432/app?user=maint&password=***",
                MaintenanceApp.maskSensitiveInfo("jdbc:postgresql://db:5432/app?user=maint&password=s3cret"));
        assertEquals("postgresql://maint:***@db:5432/app",
                MaintenanceApp.maskSensitiveInfo("postgresql://maint:s3cret@db:5432/app"));
        assertEquals("not configured", MaintenanceApp.maskSensitiveInfo(null));
    }
}
