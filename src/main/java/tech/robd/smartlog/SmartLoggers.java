/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/SmartLoggers.java
 description: Static factories for SmartLogger instances.
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
import org.jspecify.annotations.Nullable;
import tech.robd.smartlog.internal.DefaultSmartLogger;

import java.time.Duration;

/**
 * Entry points for creating loggers.
 *
 * <p>Each logger owns a small daemon thread pool for asynchronous and deferred writes; close
 * it (try-with-resources works) when done.</p>
 */
public final class SmartLoggers {

    private SmartLoggers() {
    }

    public static @NonNull SmartLogger create(@NonNull SmartLoggerConfig config) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        return new DefaultSmartLogger(config);
    }

    /**
     * Logger writing to {@code logFilePath} with default settings; {@code null} or empty
     * selects date-based auto-naming.
     */
    public static @NonNull SmartLogger create(@Nullable String logFilePath) {
        return create(SmartLoggerConfig.builder().logFilePath(logFilePath).build());
    }

    /**
     * Same parameters, in the same order, as the classic constructor.
     *
     * @param timeFormat {@link java.time.format.DateTimeFormatter} pattern
     * @param staleWindow {@code null} means the 30 minute default
     */
    public static @NonNull SmartLogger create(@Nullable String logFilePath,
                                              @NonNull String timeFormat,
                                              int maxHistory,
                                              @Nullable Duration staleWindow) {
        return create(SmartLoggerConfig.builder()
                .logFilePath(logFilePath)
                .timeFormat(timeFormat)
                .maxHistory(maxHistory)
                .staleWindow(staleWindow != null ? staleWindow : SmartLoggerConfig.DEFAULT_STALE_WINDOW)
                .build());
    }

    /**
     * Auto-named logger under the working directory.
     */
    public static @NonNull SmartLogger autoNamed() {
        return create(SmartLoggerConfig.defaults());
    }

    /**
     * Logger configured from {@code -Dsmartlog.*} system properties.
     */
    public static @NonNull SmartLogger fromSystemProperties() {
        return create(SmartLoggerConfig.fromSystemProperties());
    }
}
