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
import org.pgtools.maintenance.collector.TableCandidate;
import org.pgtools.maintenance.plan.OperationKind;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MaintenanceStatementsTest {

    private static final TableCandidate ORDERS = new TableCandidate("Sales", "Orders", 10, 1, 0, 0, 0, 0, 0,
            null, null, null, null, 0);

    @Test
    void testStatementFor_EachKind() {
        assertEquals("ANALYZE (VERBOSE) \"Sales\".\"Orders\"",
                MaintenanceStatements.statementFor(OperationKind.ANALYZE, ORDERS));
        assertEquals("VACUUM (VERBOSE) \"Sales\".\"Orders\"",
                MaintenanceStatements.statementFor(OperationKind.VACUUM, ORDERS));
        assertEquals("VACUUM (FULL, VERBOSE) \"Sales\".\"Orders\"",
                MaintenanceStatements.statementFor(OperationKind.VACUUM_FULL, ORDERS));
        assertEquals("REINDEX (VERBOSE) TABLE \"Sales\".\"Orders\"",
                MaintenanceStatements.statementFor(OperationKind.REINDEX, ORDERS));
    }

    @Test
    void testStatementFor_HostileNameStaysOneIdentifier() {
        TableCandidate hostile = new TableCandidate("public", "x\"; DROP TABLE users; --", 1, 0, 0, 0, 0, 0, 0,
                null, null, null, null, 0);

        assertEquals("VACUUM (VERBOSE) \"public\".\"x\"\"; DROP TABLE users; --\"",
                MaintenanceStatements.statementFor(OperationKind.VACUUM, hostile));
    }
}
