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

import java.util.Objects;

/**
 * What the collector reads in one run.
 *
 * @param scope               Schema and table filters
 * @param includeIndexStats   Also read index statistics for bloat detection
 * @param indexMinBytes       Smallest index considered for bloat detection
 * @param indexReadFetchRatio Tuples read over tuples fetched above which an index is suspect
 * @param allowPartial        Keep table statistics when the index statistics query fails
 */
public record CollectionRequest(CollectionScope scope,
                                boolean includeIndexStats,
                                long indexMinBytes,
                                double indexReadFetchRatio,
                                boolean allowPartial) {

    public CollectionRequest {
        Objects.requireNonNull(scope, "scope");
    }

    public static CollectionRequest tablesOnly(CollectionScope scope) {
        return new CollectionRequest(scope, false, 0, 0, true);
    }
}
