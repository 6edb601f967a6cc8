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
package org.pgtools.maintenance.collector;

import org.pgtools.maintenance.config.MaintenanceConfig;

import java.util.List;
import java.util.Optional;

/**
 * Which tables a run considers. Patterns are shell globs ({@code *} and {@code ?}).
 *
 * @param schemaPattern Schema glob, empty for all user schemas
 * @param tablePatterns Table name globs, empty for all tables
 */
public record CollectionScope(Optional<String> schemaPattern, List<String> tablePatterns) {

    public CollectionScope {
        schemaPattern = schemaPattern.map(String::trim).filter(pattern -> !pattern.isEmpty());
        tablePatterns = tablePatterns.stream()
                .map(String::trim)
                .filter(pattern -> !pattern.isEmpty())
                .toList();
    }

    public static CollectionScope all() {
        return new CollectionScope(Optional.empty(), List.of());
    }

    public static CollectionScope from(MaintenanceConfig config) {
        return new CollectionScope(config.schema(), config.tables().orElse(List.of()));
    }

    public Optional<String> schemaLikePattern() {
        return schemaPattern.map(CollectionScope::toLikePattern);
    }

    public String[] tableLikePatterns() {
        return tablePatterns.stream().map(CollectionScope::toLikePattern).toArray(String[]::new);
    }

    /**
     * Translate a glob into a LIKE pattern, escaping LIKE wildcards that appear literally.
     */
    static String toLikePattern(String glob) {
        StringBuilder like = new StringBuilder(glob.length() + 4);
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> like.append('%');
                case '?' -> like.append('_');
                case '%', '_', '\\' -> like.append('\\').append(c);
                default -> like.append(c);
            }
        }
        return like.toString();
    }

    public String describe() {
        return "schema " + schemaPattern.orElse("<all user schemas>")
                + ", tables " + (tablePatterns.isEmpty() ? "<all>" : String.join(",", tablePatterns));
    }
}
