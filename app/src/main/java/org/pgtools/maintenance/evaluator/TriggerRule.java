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
package org.pgtools.maintenance.evaluator;

/**
 * Rules that propose maintenance, with the priority tier they assign.
 * Tier 1 is the most urgent.
 */
public enum TriggerRule {
    URGENT("Urgent", 1),
    HIGH("High", 2),
    NEVER_ANALYZED("Never-analyzed", 1),
    STALE("Stale", 2),
    HIGH_CHURN("High-churn", 3),
    INDEX_BLOAT("Index-bloat", 2);

    private final String tag;
    private final int tier;

    TriggerRule(String tag, int tier) {
        this.tag = tag;
        this.tier = tier;
    }

    public String tag() {
        return tag;
    }

    public int tier() {
        return tier;
    }
}
