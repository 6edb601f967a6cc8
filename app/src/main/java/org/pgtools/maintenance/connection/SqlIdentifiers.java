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
package org.pgtools.maintenance.connection;

import lombok.experimental.UtilityClass;

/**
 * The single place where identifiers are turned into SQL text.
 *
 * <p>Maintenance statements cannot take table names as bind parameters, so every
 * schema and table name that reaches a statement goes through {@link #quoteIdentifier(String)}.
 */
@UtilityClass
public final class SqlIdentifiers {

    /**
     * Quote an identifier the way PostgreSQL's quote_ident does, always adding quotes.
     *
     * @param identifier Raw identifier as stored in the catalog
     * @return Double-quoted identifier with embedded quotes doubled
     * @throws IllegalArgumentException If the identifier is empty or contains NUL
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        if (identifier.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Identifier contains a NUL character");
        }
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /**
     * Build a quoted, schema-qualified relation name.
     *
     * @param schema Schema name
     * @param table  Table name
     * @return {@code "schema"."table"}
     */
    public static String qualifiedName(String schema, String table) {
        return quoteIdentifier(schema) + "." + quoteIdentifier(table);
    }
}
