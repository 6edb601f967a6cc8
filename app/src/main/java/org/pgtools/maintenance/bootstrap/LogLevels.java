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

import lombok.experimental.UtilityClass;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runtime log level changes on the Quarkus log manager.
 * Adjusted loggers are kept referenced so the level survives garbage collection.
 */
@UtilityClass
class LogLevels {
    private static final Map<String, Logger> ADJUSTED = new ConcurrentHashMap<>();

    static void enableDebug(String category) {
        ADJUSTED.computeIfAbsent(category, Logger::getLogger).setLevel(Level.FINE);
    }
}
