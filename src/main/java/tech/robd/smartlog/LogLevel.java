/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/LogLevel.java
 description: Severity levels for log lines, including the NONE console-only sentinel.
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

import org.jspecify.annotations.NonNull;

/**
 * Severity attached to each write.
 *
 * <p>{@link #NONE} is a sentinel: lines at that level skip history and the log file and are
 * echoed to the console sink only. Every other level is written when not a duplicate; there
 * is no threshold filtering.</p>
 *
 * <p>Each constant carries a distinct bit so callers can build masks, and the display name
 * used in the {@code [<LevelName>]} column of the file.</p>
 */
public enum LogLevel {
    NONE(0, "None"),
    DEBUG(1, "Debug"),
    VERBOSE(1 << 1, "Verbose"),
    INFO(1 << 2, "Info"),
    WARNING(1 << 3, "Warning"),
    ERROR(1 << 4, "Error"),
    SUCCESS(1 << 5, "Success"),
    IMPORTANT(1 << 6, "Important");

    private final int flag;
    private final @NonNull String displayName;

    LogLevel(int flag, @NonNull String displayName) {
        this.flag = flag;
        this.displayName = displayName;
    }

    public int flag() {
        return flag;
    }

    /**
     * @return the name printed between brackets in the log line, e.g. {@code Warning}
     */
    public @NonNull String displayName() {
        return displayName;
    }

    /**
     * @return {@code true} for every level except the {@link #NONE} sentinel
     */
    public boolean writesToFile() {
        return this != NONE;
    }
}
