/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/WriteOutcome.java
 description: What happened to a single write request.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 [/File Info]
*/

/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tech.robd.smartlog;

/**
 * Result of a write request. Writes never throw; this is what callers may inspect instead.
 */
public enum WriteOutcome {
    /** The line was appended to the log file. */
    WRITTEN,
    /** An identical message at the same level is still in history; nothing was written. */
    DUPLICATE,
    /** {@link LogLevel#NONE}: echoed to the console sink only. */
    CONSOLE_ONLY,
    /** The logger was disposed before the line reached the file. */
    DISPOSED,
    /** Rotation or append failed; listeners and the failure channel were notified. */
    FAILED
}
