/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/LogEntry.java
 description: Immutable record of an accepted write, kept in history for duplicate detection.
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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An accepted write as remembered by the duplicate-detection history.
 *
 * @param message   text as given by the caller (may be empty)
 * @param level     level of the write, never {@link LogLevel#NONE}
 * @param timestamp acceptance time in UTC, independent of the display format
 */
public record LogEntry(@NonNull String message, @NonNull LogLevel level, @NonNull Instant timestamp) {

    public LogEntry {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Same message text and same level; the timestamp is ignored.
     */
    public boolean sameContent(@NonNull String otherMessage, @NonNull LogLevel otherLevel) {
        return level == otherLevel && message.equals(otherMessage);
    }

    /**
     * @return {@code true} if this entry was accepted more than {@code window} before {@code now}
     */
    public boolean isOlderThan(@NonNull Duration window, @NonNull Instant now) {
        return Duration.between(timestamp, now).compareTo(window) > 0;
    }
}
