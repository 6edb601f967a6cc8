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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;

/**
 * One mutual exclusion token per table. Waiters are served in arrival order,
 * which keeps same-table operations in plan order.
 */
public class TableLockRegistry {
    private final ConcurrentMap<String, Semaphore> tokens = new ConcurrentHashMap<>();

    /**
     * Block until the token of {@code table} is free, then take it.
     */
    public void acquire(String table) throws InterruptedException {
        tokens.computeIfAbsent(table, key -> new Semaphore(1, true)).acquire();
    }

    /**
     * @throws IllegalStateException If the token was never taken
     */
    public void release(String table) {
        Semaphore token = tokens.get(table);
        if (token == null || token.availablePermits() > 0) {
            throw new IllegalStateException("Table token not held: " + table);
        }
        token.release();
    }

    public boolean isHeld(String table) {
        Semaphore token = tokens.get(table);
        return token != null && token.availablePermits() == 0;
    }
}
