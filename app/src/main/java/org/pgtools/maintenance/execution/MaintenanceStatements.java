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

import lombok.experimental.UtilityClass;
import org.pgtools.maintenance.collector.TableCandidate;
import org.pgtools.maintenance.plan.OperationKind;

/**
 * SQL text of maintenance statements. Table names always come from
 * {@link TableCandidate#quotedName()}.
 */
@UtilityClass
public final class MaintenanceStatements {
    static final String SET_LOCK_TIMEOUT = "SELECT set_config('lock_timeout', ?, false)";

    public static String statementFor(OperationKind kind, TableCandidate target) {
        String table = target.quotedName();
        return switch (kind) {
            case ANALYZE -> "ANALYZE (VERBOSE) " + table;
            case VACUUM -> "VACUUM (VERBOSE) " + table;
            case VACUUM_FULL -> "VACUUM (FULL, VERBOSE) " + table;
            case REINDEX -> "REINDEX (VERBOSE) TABLE " + table;
        };
    }
}
