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
package org.pgtools.maintenance.schedule;

import java.util.List;

/**
 * Difference between the desired schedule and the installed crontab.
 *
 * @param toAdd     Entries missing or changed
 * @param toRemove  Installed entries no longer wanted, or replaced
 * @param unchanged Installed entries already as desired
 */
public record CrontabDiff(List<CrontabEntry> toAdd, List<CrontabEntry> toRemove, List<CrontabEntry> unchanged) {

    public CrontabDiff {
        toAdd = List.copyOf(toAdd);
        toRemove = List.copyOf(toRemove);
        unchanged = List.copyOf(unchanged);
    }

    public boolean isEmpty() {
        return toAdd.isEmpty() && toRemove.isEmpty();
    }
}
