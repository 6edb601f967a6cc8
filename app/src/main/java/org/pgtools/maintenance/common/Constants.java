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
package org.pgtools.maintenance.common;

import lombok.experimental.UtilityClass;

/**
 * Global constants for pg-maintenance
 */
@UtilityClass
public final class Constants {
    public static final String APPLICATION_NAME = "pgmaint";
    public static final String NAMESPACE = "pgmaint";
    public static final String SUBSYSTEM_OPERATION = "operation";
    public static final String SUBSYSTEM_RUN = "run";
    public static final String TAG_KIND = "kind";
    public static final String TAG_STATE = "state";
    public static final int EXIT_OK = 0;
    public static final int EXIT_OPERATION_FAILED = 1;
    public static final int EXIT_FATAL = 2;
}
