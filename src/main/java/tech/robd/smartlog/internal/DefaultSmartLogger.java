/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/internal/DefaultSmartLogger.java
 description: Default SmartLogger. Rotation, eviction, duplicate check and insert run under one lock;
              file I/O runs outside it. Async writes use a writer-owned daemon pool; deferred lock
              probes are rescheduled on a single scheduler thread.
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
import org.jspecify.annotations.Nullable;
import tech.robd.smartlog.*;
import tech.robd.smartlog.diagnostics.Diagnostics;
import tech.robd.smartlog.fn.WriteHandle;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link SmartLogger}.
 *
 * <p>A write goes through these steps:
 * <ol>
 *   <li>{@link LogLevel#NONE}: echo to the console sink and stop.</li>
 *   <li>Under the state lock: rotate the target if auto-named and the date changed, evict
 *   stale or surplus history, test for a duplicate and, if none, remember the entry.</li>
 *   <li>Outside the lock: append the formatted line, unless a duplicate or disposed.</li>
 * </ol>
 * Any exception in steps 2 and 3 is reported to listeners and the failure channel.</p>
 *
 * <p>{@link #close()} does not wait for in-flight writes; see {@link #awaitIdle(Duration)}.</p>
 */
public final class DefaultSmartLogger implements SmartLogger {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(DefaultSmartLogger.class);
    // [/🧩 Section: diagnostics]

    private static final AtomicInteger COUNTER = new AtomicInteger();

    // 🧩 Section: state
    private final int loggerId = COUNTER.incrementAndGet();
    private final @NonNull SmartLoggerConfig config;
    private final @Nullable LogFileNamer namer;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final LogHistory history;           // guarded by stateLock
    private @Nullable LocalDate rotationDate;   // guarded by stateLock
    private volatile @NonNull Path logFile;

    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final AtomicInteger pending = new AtomicInteger();
    private final List<WriteFailureListener> listeners = new CopyOnWriteArrayList<>();
    private final FailureChannel failures;

    private final ThreadPoolExecutor writers;
    private final ScheduledThreadPoolExecutor probes;
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public DefaultSmartLogger(@NonNull SmartLoggerConfig config) {
        this(config, config.isAutoNamed()
                ? new LogFileNamer(config.baseDirectory(), config.locale(), config.programName())
                : null);
    }

    DefaultSmartLogger(@NonNull SmartLoggerConfig config, @Nullable LogFileNamer namer) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.isAutoNamed() && namer == null) {
            throw new IllegalArgumentException("auto-named logger needs a file namer");
        }
        this.namer = config.isAutoNamed() ? namer : null;
        this.history = new LogHistory(config.maxHistory(), config.staleWindow());
        this.failures = FailureChannel.buffered(config.failureChannelCapacity());

        if (this.namer != null) {
            this.rotationDate = LocalDate.now(config.clock());
            this.logFile = this.namer.generate(rotationDate);
        } else {
            this.logFile = Objects.requireNonNull(config.logFilePath());
        }

        int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
        this.writers = new ThreadPoolExecutor(threads, threads, 30, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), new DaemonThreadFactory("smartlog-" + loggerId + "-writer"));
        this.writers.allowCoreThreadTimeOut(true);
        this.probes = new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory("smartlog-" + loggerId + "-probe"));
        this.probes.setRemoveOnCancelPolicy(true);

        DIAG.debug("logger#{} created target={} {}", loggerId, logFile, config);
    }
    // [/🧩 Section: construction]

    // 🧩 Section: write
    @Override
    public @NonNull WriteOutcome write(@NonNull String message, @NonNull LogLevel level) {
        checkArgs(message, level);
        return process(message, level, 0);
    }

    @Override
    public @NonNull WriteHandle writeAsync(@NonNull String message, @NonNull LogLevel level) {
        checkArgs(message, level);
        if (disposed.get() && level.writesToFile()) {
            DIAG.debug("logger#{} async write rejected: DISPOSED", loggerId);
            return WriteHandleImpl.completed(WriteOutcome.DISPOSED);
        }
        CompletableFuture<WriteOutcome> cf = new CompletableFuture<>();
        if (!submit(() -> cf.complete(process(message, level, 0)))) {
            cf.complete(level.writesToFile() ? WriteOutcome.DISPOSED : process(message, level, 0));
        }
        return new WriteHandleImpl(cf);
    }

    @Override
    public void writeDeferred(@NonNull String message, @NonNull LogLevel level) {
        writeDeferred(message, level, config.defaultDeferredRetries());
    }

    @Override
    public void writeDeferred(@NonNull String message, @NonNull LogLevel level, int retries) {
        checkArgs(message, level);
        if (retries < 0) throw new IllegalArgumentException("retries must be >= 0: " + retries);
        if (disposed.get() && level.writesToFile()) {
            DIAG.debug("logger#{} deferred write ignored: DISPOSED", loggerId);
            return;
        }
        DeferredWrite task = new DeferredWrite(message, level, retries);
        pending.incrementAndGet();
        try {
            probes.execute(task);
        } catch (RejectedExecutionException rex) {
            pending.decrementAndGet();
            DIAG.debug("logger#{} deferred write rejected: probe scheduler stopped", loggerId);
        }
    }

    /**
     * The whole write path. Never throws.
     *
     * @param lockedAfterProbes non-zero when a deferred write ran out of retries while the
     *                          file was still locked; the append then fails with
     *                          {@link FileLockedException}
     */
    private WriteOutcome process(String message, LogLevel level, int lockedAfterProbes) {
        try {
            if (!level.writesToFile()) {
                config.console().println(format(message, level));
                return WriteOutcome.CONSOLE_ONLY;
            }
            if (disposed.get()) {
                return WriteOutcome.DISPOSED;
            }

            final boolean accepted;
            final Path target;
            stateLock.lock();
            try {
                // read under the lock so history timestamps never go backwards
                final Instant now = config.clock().instant();
                rotateIfNeeded();
                accepted = history.tryAccept(message, level, now);
                target = logFile;
            } finally {
                stateLock.unlock();
            }

            if (!accepted) {
                DIAG.debug("logger#{} duplicate suppressed [{}] {}", loggerId, level, message);
                return WriteOutcome.DUPLICATE;
            }
            if (disposed.get()) {
                return WriteOutcome.DISPOSED;
            }
            if (lockedAfterProbes > 0) {
                throw new FileLockedException(target, lockedAfterProbes);
            }
            LogFileAppender.appendLine(target, format(message, level));
            return WriteOutcome.WRITTEN;
        } catch (Exception e) {
            reportFailure(message, e);
            return WriteOutcome.FAILED;
        }
    }

    private String format(String message, LogLevel level) {
        String time = config.formatter().format(ZonedDateTime.now(config.clock()));
        return "[" + time + "] [" + level.displayName() + "] " + message;
    }

    private static void checkArgs(String message, LogLevel level) {
        if (message == null) throw new IllegalArgumentException("message is null");
        if (level == null) throw new IllegalArgumentException("level is null");
    }
    // [/🧩 Section: write]

    // 🧩 Section: rotation

    // caller holds stateLock
    private void rotateIfNeeded() {
        if (namer == null) return;
        LocalDate today = LocalDate.now(config.clock());
        if (!today.equals(rotationDate)) {
            Path previous = logFile;
            rotationDate = today;
            logFile = namer.generate(today);
            DIAG.info("logger#{} rotated {} -> {}", loggerId, previous, logFile);
        }
    }

    // rotates first so a deferred write after midnight checks the lock on today's file
    private Path lockCheckTarget() {
        stateLock.lock();
        try {
            rotateIfNeeded();
            return logFile;
        } finally {
            stateLock.unlock();
        }
    }
    // [/🧩 Section: rotation]

    // 🧩 Section: deferred

    /**
     * Probe, reschedule while locked and budget remains, then hand the write to the pool.
     * Runs on the probe scheduler; the caller never observes it.
     */
    private final class DeferredWrite implements Runnable {
        private final String message;
        private final LogLevel level;
        private final int retries;
        private int probesDone;

        DeferredWrite(String message, LogLevel level, int retries) {
            this.message = message;
            this.level = level;
            this.retries = retries;
        }

        @Override
        public void run() {
            try {
                if (disposed.get() && level.writesToFile()) {
                    DIAG.debug("logger#{} deferred write dropped: DISPOSED", loggerId);
                    finish();
                    return;
                }
                boolean locked = level.writesToFile() && FileLockProbe.isLocked(lockCheckTarget());
                probesDone++;
                if (locked && probesDone <= retries) {
                    probes.schedule(this, config.deferredRetryInterval().toNanos(), TimeUnit.NANOSECONDS);
                    return;
                }
                if (locked) {
                    DIAG.debug("logger#{} deferred write: still locked after {} probe(s)", loggerId, probesDone);
                }
                final int lockedAfter = locked ? probesDone : 0;
                if (!submit(() -> process(message, level, lockedAfter))) {
                    DIAG.debug("logger#{} deferred write dropped: writer pool stopped", loggerId);
                }
                finish();
            } catch (RejectedExecutionException rex) {
                DIAG.debug("logger#{} deferred retry dropped: probe scheduler stopped", loggerId);
                finish();
            }
        }

        private void finish() {
            pending.decrementAndGet();
        }
    }
    // [/🧩 Section: deferred]

    // 🧩 Section: failures
    private void reportFailure(String message, Exception e) {
        DIAG.debug("logger#{} write failed for '{}': {}", loggerId, message, e.toString(), e);
        failures.trySend(new WriteFailure(message, e, config.clock().instant()));
        for (WriteFailureListener l : listeners) {
            try {
                l.onWriteFailure(message, e);
            } catch (RuntimeException le) {
                DIAG.warn("logger#{} failure listener {} threw", loggerId, l, le);
            }
        }
    }

    @Override
    public void addWriteFailureListener(@NonNull WriteFailureListener listener) {
        if (listener == null) throw new IllegalArgumentException("listener is null");
        listeners.add(listener);
    }

    @Override
    public boolean removeWriteFailureListener(@NonNull WriteFailureListener listener) {
        return listeners.remove(listener);
    }

    @Override
    public @NonNull FailureChannel failures() {
        return failures;
    }
    // [/🧩 Section: failures]

    // 🧩 Section: paths-and-history
    @Override
    public @NonNull String getLogPath() {
        if (namer != null) {
            return namer.directoryFor(LocalDate.now(config.clock())).toString();
        }
        Path fixed = Objects.requireNonNull(config.logFilePath());
        Path parent = fixed.getParent();
        return parent != null ? parent.toString() : fixed.toString();
    }

    @Override
    public @NonNull String getLogName() {
        if (namer != null) {
            return namer.fileFor(LocalDate.now(config.clock())).toString();
        }
        return Objects.requireNonNull(config.logFilePath()).toString();
    }

    /**
     * File the next write will append to, after any fallback naming. Unlike
     * {@link #getLogName()} this only changes when a write triggers rotation.
     */
    public @NonNull Path currentTarget() {
        return logFile;
    }

    @Override
    public void clearHistory() {
        stateLock.lock();
        try {
            history.clear();
        } finally {
            stateLock.unlock();
        }
        DIAG.debug("logger#{} history cleared", loggerId);
    }

    int historySize() {
        stateLock.lock();
        try {
            return history.size();
        } finally {
            stateLock.unlock();
        }
    }

    List<LogEntry> historySnapshot() {
        stateLock.lock();
        try {
            return history.snapshot();
        } finally {
            stateLock.unlock();
        }
    }
    // [/🧩 Section: paths-and-history]

    // 🧩 Section: lifecycle
    private boolean submit(Runnable work) {
        pending.incrementAndGet();
        try {
            writers.execute(() -> {
                try {
                    work.run();
                } finally {
                    pending.decrementAndGet();
                }
            });
            return true;
        } catch (RejectedExecutionException rex) {
            pending.decrementAndGet();
            DIAG.debug("logger#{} writer pool rejected task", loggerId);
            return false;
        }
    }

    @Override
    public boolean awaitIdle(@NonNull Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() - deadline >= 0) return false;
            try {
                Thread.sleep(5);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return pending.get() == 0;
            }
        }
        return true;
    }

    @Override
    public boolean isDisposed() {
        return disposed.get();
    }

    @Override
    public void close() {
        if (disposed.compareAndSet(false, true)) {
            DIAG.debug("logger#{} disposing: clear history, stop pools", loggerId);
            clearHistory();
            failures.close();
            // delayed probes still run once, see the flag and drop themselves
            probes.shutdown();
            writers.shutdown();
        } else {
            DIAG.debug("logger#{} close() ignored (already disposed)", loggerId);
        }
    }

    @Override
    public String toString() {
        return "SmartLogger[" + logFile + " " + (disposed.get() ? "DISPOSED" : "OPEN") + "]";
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: threads
    private static final class DaemonThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger();

        DaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
    // [/🧩 Section: threads]
}
