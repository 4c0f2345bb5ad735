/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/internal/LogHistory.java
 description: Bounded FIFO of recently accepted entries used for duplicate detection.
              Evict-then-check-then-insert is one call; the owning writer holds the lock.
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

package tech.robd.smartlog.internal;

import org.jspecify.annotations.NonNull;
import tech.robd.smartlog.LogEntry;
import tech.robd.smartlog.LogLevel;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Recent-history window behind duplicate suppression.
 *
 * <p>Entries are kept in acceptance order. Before every duplicate check the front of the
 * queue is evicted while the oldest entry is older than the stale window or the queue holds
 * more than {@code maxSize} entries. The check scans the whole remaining queue.</p>
 *
 * <p>A zero {@code maxSize} or a zero window empties the queue on every check, which
 * disables suppression.</p>
 *
 * <p>Not thread-safe: callers hold the writer's state lock around every method.</p>
 */
final class LogHistory {

    private final int maxSize;
    private final @NonNull Duration staleWindow;
    private final Deque<LogEntry> entries = new ArrayDeque<>();

    LogHistory(int maxSize, @NonNull Duration staleWindow) {
        if (maxSize < 0) throw new IllegalArgumentException("maxSize must be >= 0");
        if (staleWindow == null || staleWindow.isNegative()) {
            throw new IllegalArgumentException("staleWindow must be non-negative");
        }
        this.maxSize = maxSize;
        this.staleWindow = staleWindow;
    }

    /**
     * Evict, test for a duplicate and, if none, remember the entry.
     *
     * @return {@code true} if the message was accepted, {@code false} if it is a duplicate
     */
    boolean tryAccept(@NonNull String message, @NonNull LogLevel level, @NonNull Instant now) {
        evict(now);
        if (contains(message, level)) {
            return false;
        }
        entries.addLast(new LogEntry(message, level, now));
        // keep size <= maxSize between calls, not only at the next eviction
        while (entries.size() > maxSize) {
            entries.removeFirst();
        }
        return true;
    }

    void evict(@NonNull Instant now) {
        while (!entries.isEmpty() && (isStale(entries.peekFirst(), now) || entries.size() > maxSize)) {
            entries.removeFirst();
        }
    }

    private boolean isStale(LogEntry oldest, Instant now) {
        return staleWindow.isZero() || oldest.isOlderThan(staleWindow, now);
    }

    boolean contains(@NonNull String message, @NonNull LogLevel level) {
        for (LogEntry e : entries) {
            if (e.sameContent(message, level)) return true;
        }
        return false;
    }

    void clear() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    /**
     * @return a copy, oldest first
     */
    List<LogEntry> snapshot() {
        return List.copyOf(entries);
    }
}
