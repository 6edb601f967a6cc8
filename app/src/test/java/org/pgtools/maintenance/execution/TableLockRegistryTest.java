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
package org.pgtools.maintenance.execution;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class TableLockRegistryTest {

    @Test
    void testAcquireRelease() throws InterruptedException {
        TableLockRegistry registry = new TableLockRegistry();

        registry.acquire("public.orders");
        assertTrue(registry.isHeld("public.orders"));
        assertFalse(registry.isHeld("public.items"));

        registry.release("public.orders");
        assertFalse(registry.isHeld("public.orders"));
    }

    @Test
    void testRelease_NotHeld_Throws() {
        TableLockRegistry registry = new TableLockRegistry();

        assertThrows(IllegalStateException.class, () -> registry.release("public.orders"));
    }

    @Test
    void testAcquire_BlocksUntilReleased() throws Exception {
        // Setup
        TableLockRegistry registry = new TableLockRegistry();
        registry.acquire("public.orders");
        CountDownLatch acquired = new CountDownLatch(1);
        AtomicBoolean failed = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try {
                registry.acquire("public.orders");
                acquired.countDown();
            } catch (InterruptedException e) {
                failed.set(true);
            }
        });

        // Execute
        waiter.start();
        assertFalse(acquired.await(100, TimeUnit.MILLISECONDS), "Second acquire must wait");
        registry.release("public.orders");

        // Verify
        assertTrue(acquired.await(5, TimeUnit.SECONDS));
        waiter.join();
        assertFalse(failed.get());
        assertTrue(registry.isHeld("public.orders"));
    }
}
