/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/SmartLoggerConfig.java
 description: Immutable construction parameters for a SmartLogger, with a fluent builder
              and a loader for -Dsmartlog.* system properties.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
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

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Construction parameters for a {@link SmartLogger}.
 *
 * <p>A {@code null} or empty {@code logFilePath} switches the logger to auto-naming: the target
 * file is derived from the current date under {@code <baseDirectory>/Logs} and rotates when
 * the calendar date changes. Otherwise the given path is used as-is for the logger's lifetime.</p>
 *
 * <p>Setting {@code maxHistory} to 0 or {@code staleWindow} to {@link Duration#ZERO} disables
 * duplicate suppression.</p>
 *
 * <p>All validation happens in {@link Builder#build()}, which throws
 * {@link IllegalArgumentException}; nothing else in the library throws at callers.</p>
 */
public final class SmartLoggerConfig {

    // 🧩 Section: defaults
    public static final String DEFAULT_TIME_FORMAT = "yyyy-MM-dd hh:mm:ss.SSS a";
    public static final int DEFAULT_MAX_HISTORY = 50;
    public static final Duration DEFAULT_STALE_WINDOW = Duration.ofMinutes(30);
    public static final Duration DEFAULT_DEFERRED_RETRY_INTERVAL = Duration.ofMillis(10);
    public static final int DEFAULT_DEFERRED_RETRIES = 10;
    public static final int DEFAULT_FAILURE_CHANNEL_CAPACITY = 256;
    // [/🧩 Section: defaults]

    // 🧩 Section: property-names
    public static final String PROP_PATH = "smartlog.path";
    public static final String PROP_TIME_FORMAT = "smartlog.timeFormat";
    public static final String PROP_MAX_HISTORY = "smartlog.maxHistory";
    public static final String PROP_STALE_WINDOW = "smartlog.staleWindow";
    public static final String PROP_BASE_DIR = "smartlog.baseDir";
    public static final String PROP_PROGRAM_NAME = "smartlog.programName";
    // [/🧩 Section: property-names]

    // 🧩 Section: state
    private final @Nullable Path logFilePath;
    private final @NonNull String timeFormat;
    private final @NonNull DateTimeFormatter formatter;
    private final int maxHistory;
    private final @NonNull Duration staleWindow;
    private final @NonNull Path baseDirectory;
    private final @Nullable String programName;
    private final @NonNull Locale locale;
    private final @NonNull Clock clock;
    private final @NonNull PrintStream console;
    private final @NonNull Duration deferredRetryInterval;
    private final int defaultDeferredRetries;
    private final int failureChannelCapacity;
    // [/🧩 Section: state]

    private SmartLoggerConfig(Builder b) {
        this.logFilePath = b.logFilePath;
        this.timeFormat = b.timeFormat;
        this.locale = b.locale;
        this.formatter = DateTimeFormatter.ofPattern(b.timeFormat, b.locale);
        this.maxHistory = b.maxHistory;
        this.staleWindow = b.staleWindow;
        this.baseDirectory = b.baseDirectory;
        this.programName = b.programName;
        this.clock = b.clock;
        this.console = b.console;
        this.deferredRetryInterval = b.deferredRetryInterval;
        this.defaultDeferredRetries = b.defaultDeferredRetries;
        this.failureChannelCapacity = b.failureChannelCapacity;
    }

    // 🧩 Section: factories
    public static @NonNull Builder builder() {
        return new Builder();
    }

    /**
     * Defaults with auto-naming.
     */
    public static @NonNull SmartLoggerConfig defaults() {
        return builder().build();
    }

    /**
     * Read {@code smartlog.*} entries from the JVM system properties over the defaults.
     *
     * @throws IllegalArgumentException if a property holds an unparseable value
     */
    public static @NonNull SmartLoggerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Read {@code smartlog.*} entries from {@code props} over the defaults.
     * {@code smartlog.staleWindow} is an ISO-8601 duration such as {@code PT30M}.
     *
     * @throws IllegalArgumentException if a property holds an unparseable value
     */
    public static @NonNull SmartLoggerConfig fromProperties(@NonNull Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        String path = trimmed(props, PROP_PATH);
        if (path != null) b.logFilePath(path);
        String format = trimmed(props, PROP_TIME_FORMAT);
        if (format != null) b.timeFormat(format);
        String max = trimmed(props, PROP_MAX_HISTORY);
        if (max != null) {
            try {
                b.maxHistory(Integer.parseInt(max));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PROP_MAX_HISTORY + " is not an integer: " + max, e);
            }
        }
        String window = trimmed(props, PROP_STALE_WINDOW);
        if (window != null) {
            try {
                b.staleWindow(Duration.parse(window));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(PROP_STALE_WINDOW + " is not an ISO-8601 duration: " + window, e);
            }
        }
        String baseDir = trimmed(props, PROP_BASE_DIR);
        if (baseDir != null) b.baseDirectory(toPath(baseDir, PROP_BASE_DIR));
        String program = trimmed(props, PROP_PROGRAM_NAME);
        if (program != null) b.programName(program);
        return b.build();
    }

    private static @Nullable String trimmed(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    private static Path toPath(String value, String what) {
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException(what + " is not a valid path: " + value, e);
        }
    }
    // [/🧩 Section: factories]

    // 🧩 Section: accessors

    /**
     * @return the fixed log file, or {@code null} when the name is derived from the date
     */
    public @Nullable Path logFilePath() {
        return logFilePath;
    }

    public boolean isAutoNamed() {
        return logFilePath == null;
    }

    public @NonNull String timeFormat() {
        return timeFormat;
    }

    /**
     * @return formatter for {@link #timeFormat()} in {@link #locale()}
     */
    public @NonNull DateTimeFormatter formatter() {
        return formatter;
    }

    public int maxHistory() {
        return maxHistory;
    }

    public @NonNull Duration staleWindow() {
        return staleWindow;
    }

    /**
     * @return {@code false} when history is disabled by a zero size or a zero window
     */
    public boolean suppressesDuplicates() {
        return maxHistory > 0 && !staleWindow.isZero();
    }

    public @NonNull Path baseDirectory() {
        return baseDirectory;
    }

    public @Nullable String programName() {
        return programName;
    }

    public @NonNull Locale locale() {
        return locale;
    }

    public @NonNull Clock clock() {
        return clock;
    }

    public @NonNull PrintStream console() {
        return console;
    }

    public @NonNull Duration deferredRetryInterval() {
        return deferredRetryInterval;
    }

    public int defaultDeferredRetries() {
        return defaultDeferredRetries;
    }

    public int failureChannelCapacity() {
        return failureChannelCapacity;
    }
    // [/🧩 Section: accessors]

    public @NonNull Builder toBuilder() {
        Builder b = new Builder();
        b.logFilePath = logFilePath;
        b.timeFormat = timeFormat;
        b.maxHistory = maxHistory;
        b.staleWindow = staleWindow;
        b.baseDirectory = baseDirectory;
        b.programName = programName;
        b.locale = locale;
        b.clock = clock;
        b.console = console;
        b.deferredRetryInterval = deferredRetryInterval;
        b.defaultDeferredRetries = defaultDeferredRetries;
        b.failureChannelCapacity = failureChannelCapacity;
        return b;
    }

    @Override
    public String toString() {
        return "SmartLoggerConfig[" + (logFilePath == null ? "auto-named under " + baseDirectory : logFilePath)
                + ", maxHistory=" + maxHistory + ", staleWindow=" + staleWindow
                + ", timeFormat='" + timeFormat + "']";
    }

    // 🧩 Section: builder

    /**
     * Fluent builder; every setter has a default.
     */
    public static final class Builder {
        private @Nullable Path logFilePath;
        private @NonNull String timeFormat = DEFAULT_TIME_FORMAT;
        private int maxHistory = DEFAULT_MAX_HISTORY;
        private @NonNull Duration staleWindow = DEFAULT_STALE_WINDOW;
        private @NonNull Path baseDirectory = Paths.get(System.getProperty("user.dir", "."));
        private @Nullable String programName;
        private @NonNull Locale locale = Locale.getDefault();
        private @NonNull Clock clock = Clock.systemDefaultZone();
        private @NonNull PrintStream console = System.out;
        private @NonNull Duration deferredRetryInterval = DEFAULT_DEFERRED_RETRY_INTERVAL;
        private int defaultDeferredRetries = DEFAULT_DEFERRED_RETRIES;
        private int failureChannelCapacity = DEFAULT_FAILURE_CHANNEL_CAPACITY;

        private Builder() {
        }

        /**
         * Fixed target file. {@code null} or empty selects auto-naming.
         */
        public @NonNull Builder logFilePath(@Nullable String path) {
            this.logFilePath = (path == null || path.isEmpty()) ? null : toPath(path, "logFilePath");
            return this;
        }

        public @NonNull Builder logFilePath(@Nullable Path path) {
            this.logFilePath = path;
            return this;
        }

        public @NonNull Builder autoNamed() {
            this.logFilePath = null;
            return this;
        }

        /**
         * {@link DateTimeFormatter} pattern for the timestamp column.
         */
        public @NonNull Builder timeFormat(@NonNull String pattern) {
            if (pattern == null || pattern.isEmpty()) throw new IllegalArgumentException("timeFormat is empty");
            this.timeFormat = pattern;
            return this;
        }

        public @NonNull Builder maxHistory(int maxHistory) {
            if (maxHistory < 0) throw new IllegalArgumentException("maxHistory must be >= 0: " + maxHistory);
            this.maxHistory = maxHistory;
            return this;
        }

        public @NonNull Builder staleWindow(@NonNull Duration window) {
            if (window == null || window.isNegative()) {
                throw new IllegalArgumentException("staleWindow must be non-negative: " + window);
            }
            this.staleWindow = window;
            return this;
        }

        public @NonNull Builder baseDirectory(@NonNull Path dir) {
            if (dir == null) throw new IllegalArgumentException("baseDirectory is null");
            this.baseDirectory = dir;
            return this;
        }

        /**
         * Overrides program-name introspection used in auto-generated file names.
         */
        public @NonNull Builder programName(@Nullable String name) {
            this.programName = (name == null || name.isBlank()) ? null : name.trim();
            return this;
        }

        public @NonNull Builder locale(@NonNull Locale locale) {
            if (locale == null) throw new IllegalArgumentException("locale is null");
            this.locale = locale;
            return this;
        }

        public @NonNull Builder clock(@NonNull Clock clock) {
            if (clock == null) throw new IllegalArgumentException("clock is null");
            this.clock = clock;
            return this;
        }

        public @NonNull Builder console(@NonNull PrintStream console) {
            if (console == null) throw new IllegalArgumentException("console is null");
            this.console = console;
            return this;
        }

        public @NonNull Builder deferredRetryInterval(@NonNull Duration interval) {
            if (interval == null || interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("deferredRetryInterval must be positive: " + interval);
            }
            this.deferredRetryInterval = interval;
            return this;
        }

        public @NonNull Builder defaultDeferredRetries(int retries) {
            if (retries < 0) throw new IllegalArgumentException("defaultDeferredRetries must be >= 0: " + retries);
            this.defaultDeferredRetries = retries;
            return this;
        }

        public @NonNull Builder failureChannelCapacity(int capacity) {
            if (capacity <= 0) throw new IllegalArgumentException("failureChannelCapacity must be positive: " + capacity);
            this.failureChannelCapacity = capacity;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the time format is not a valid pattern
         */
        public @NonNull SmartLoggerConfig build() {
            return new SmartLoggerConfig(this);
        }
    }
    // [/🧩 Section: builder]
}
