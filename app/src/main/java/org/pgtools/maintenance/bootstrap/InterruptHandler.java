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

import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.pgtools.maintenance.execution.CancellationSignal;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns an operator interrupt during a run into a cancellation of that run.
 * The shutdown hook is held until the run has recorded its summary, at most
 * for the configured grace period. A shutdown after the run has finished is ignored.
 */
@Slf4j
@ApplicationScoped
public class InterruptHandler {
    private final CancellationSignal cancellation;
    private final Duration gracePeriod;
    private final AtomicBoolean armed = new AtomicBoolean();
    private volatile CountDownLatch runFinished = new CountDownLatch(0);

    @Inject
    public InterruptHandler(CancellationSignal cancellation,
                            @ConfigProperty(name = "app.shutdown.grace-period", defaultValue = "10m")
                            Duration gracePeriod) {
        this.cancellation = cancellation;
        this.gracePeriod = gracePeriod;
    }

    public void arm() {
        runFinished = new CountDownLatch(1);
        armed.set(true);
    }

    public void disarm() {
        armed.set(false);
        runFinished.countDown();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        if (!armed.get()) {
            return;
        }
        log.warn("Interrupted, stopping dispatch of maintenance operations");
        cancellation.cancel();
        try {
            if (!runFinished.await(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run did not finish within {}, shutting down anyway", gracePeriod);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the run to finish");
        }
    }
}
