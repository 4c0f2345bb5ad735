/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/SmartLogger.java
 description: Public contract of the duplicate-suppressing rotating file logger.
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
import tech.robd.smartlog.fn.WriteHandle;

import java.time.Duration;

/**
 * A logger that appends timestamped lines to a flat text file and suppresses repeats.
 * <p>
 * Each line has the form {@code [<time>] [<LevelName>] <message>}. A message is a duplicate
 * when an entry with identical text and level is still held in the bounded recent history;
 * entries leave the history once older than the stale window or once the history exceeds
 * its maximum size. Duplicates are dropped silently.
 * </p>
 *
 * <h2>Key principles</h2>
 * <ul>
 *   <li><strong>Never throws:</strong> write operations always return (or their handle always
 *   settles). Failures reach {@link WriteFailureListener}s and {@link #failures()} instead.</li>
 *   <li><strong>Rotation:</strong> when the file name is auto-derived, the target moves to a new
 *   file the first time a write happens on a new calendar date.</li>
 *   <li><strong>No open handle:</strong> the file is opened in append mode for each line and
 *   closed right after, so other readers and writers can share it.</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> all methods may be called concurrently. The relative order
 * of lines written by concurrent callers is not guaranteed.</p>
 *
 * <p><strong>Disposal:</strong> {@link #close()} is fire-and-forget. A write already past its
 * duplicate check may still append after {@code close()} returns; use
 * {@link #awaitIdle(Duration)} first if that matters.</p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public interface SmartLogger extends AutoCloseable {

    // 🧩 Section: writes

    /**
     * Write on the caller's thread, blocking until the append completes or fails.
     *
     * @param message text to log, may be empty
     * @param level   severity; {@link LogLevel#NONE} echoes to the console only
     * @return what happened to the line
     */
    @NonNull WriteOutcome write(@NonNull String message, @NonNull LogLevel level);

    /**
     * {@link #write(String, LogLevel)} at {@link LogLevel#INFO}.
     */
    default @NonNull WriteOutcome write(@NonNull String message) {
        return write(message, LogLevel.INFO);
    }

    /**
     * Write without blocking the caller. The returned handle may be awaited or ignored.
     *
     * @return handle whose result never completes exceptionally
     */
    @NonNull WriteHandle writeAsync(@NonNull String message, @NonNull LogLevel level);

    /**
     * {@link #writeAsync(String, LogLevel)} at {@link LogLevel#INFO}.
     */
    default @NonNull WriteHandle writeAsync(@NonNull String message) {
        return writeAsync(message, LogLevel.INFO);
    }

    /**
     * Fire-and-forget write that first waits for the target file to be free of exclusive locks.
     * <p>
     * The lock is probed, and while it is held the probe is repeated at a short fixed interval,
     * up to {@code retries} extra times. The write then proceeds. If the file is still locked
     * once the budget is spent, the write fails with {@link FileLockedException}, reported
     * through the failure listeners and channel.
     * </p>
     * No ordering is guaranteed relative to other writes.
     *
     * @param retries extra probes allowed after the first, {@code >= 0}
     */
    void writeDeferred(@NonNull String message, @NonNull LogLevel level, int retries);

    /**
     * {@link #writeDeferred(String, LogLevel, int)} with the configured default retry budget.
     */
    void writeDeferred(@NonNull String message, @NonNull LogLevel level);

    /**
     * {@link #writeDeferred(String, LogLevel)} at {@link LogLevel#INFO}.
     */
    default void writeDeferred(@NonNull String message) {
        writeDeferred(message, LogLevel.INFO);
    }
    // [/🧩 Section: writes]

    // 🧩 Section: paths

    /**
     * Directory the log file lives in. For auto-naming this is computed from today's date,
     * even before a write has triggered rotation.
     */
    @NonNull String getLogPath();

    /**
     * Full path of the log file. For auto-naming this is computed from today's date,
     * even before a write has triggered rotation.
     */
    @NonNull String getLogName();
    // [/🧩 Section: paths]

    // 🧩 Section: history-and-failures

    /**
     * Forget all remembered entries, so any message may be written again.
     */
    void clearHistory();

    /**
     * Register a callback for failed writes. Listeners run on the writing thread.
     */
    void addWriteFailureListener(@NonNull WriteFailureListener listener);

    /**
     * @return {@code true} if the listener was registered
     */
    boolean removeWriteFailureListener(@NonNull WriteFailureListener listener);

    /**
     * Outbound channel receiving a record for every failed write.
     */
    @NonNull FailureChannel failures();
    // [/🧩 Section: history-and-failures]

    // 🧩 Section: lifecycle

    /**
     * Wait for asynchronous and deferred writes already started to settle.
     *
     * @return {@code true} if none were pending when the call returned
     */
    boolean awaitIdle(@NonNull Duration timeout);

    boolean isDisposed();

    /**
     * Clear history, reject further file writes and release worker threads. Idempotent and
     * non-blocking; in-flight writes are not awaited.
     */
    @Override
    void close();

    /**
     * Alias for {@link #close()}.
     */
    default void dispose() {
        close();
    }
    // [/🧩 Section: lifecycle]
}
