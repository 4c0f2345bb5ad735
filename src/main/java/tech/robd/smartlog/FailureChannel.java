/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/FailureChannel.java
 description: Bounded outbound channel of WriteFailure records. Producers never block;
              overflow is dropped and counted. Closed when the owning logger is disposed.
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
import tech.robd.smartlog.diagnostics.Diagnostics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Channel through which a logger publishes its write failures.
 *
 * <p>An alternative to {@link WriteFailureListener}: nothing runs on the writing thread except a
 * non-blocking {@link #trySend(WriteFailure)}. When the buffer is full the newest failure is
 * dropped and counted in {@link #dropped()}.</p>
 *
 * <p>Operations:
 * <ul>
 *   <li>{@link #tryReceive()} / {@link #receive(Duration)} / {@link #drain()} for consumers</li>
 *   <li>{@link #close()}; receivers see {@link ClosedReceiveException} once closed and empty</li>
 * </ul>
 */
public final class FailureChannel {

    private static final Diagnostics DIAG = Diagnostics.of(FailureChannel.class);

    // 🧩 Section: state
    private final int chId = System.identityHashCode(this);
    private final @NonNull BlockingQueue<WriteFailure> queue;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed = false;
    // [/🧩 Section: state]

    private FailureChannel(@NonNull BlockingQueue<WriteFailure> queue) {
        this.queue = queue;
        DIAG.debug("failures#{} init queue={}", chId, queue.getClass().getSimpleName());
    }

    /**
     * Bounded channel backed by an {@link ArrayBlockingQueue}.
     */
    public static @NonNull FailureChannel buffered(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("Capacity must be positive");
        return new FailureChannel(new ArrayBlockingQueue<>(capacity));
    }

    // 🧩 Section: send

    /**
     * Publish without blocking.
     *
     * @return {@code false} if the channel is closed or full; a full channel counts the drop
     */
    public boolean trySend(@NonNull WriteFailure failure) {
        if (failure == null) throw new IllegalArgumentException("failure cannot be null");
        if (closed) {
            DIAG.debug("failures#{} send ignored: closed", chId);
            return false;
        }
        boolean ok = queue.offer(failure);
        if (!ok) {
            long n = dropped.incrementAndGet();
            DIAG.warn("failures#{} full, dropped failure for '{}' (total dropped={})", chId, failure.message(), n);
        }
        return ok;
    }
    // [/🧩 Section: send]

    // 🧩 Section: receive

    /**
     * Non-blocking receive.
     *
     * @return the oldest failure, or {@code null} if none is waiting
     * @throws ClosedReceiveException if the channel is closed and drained
     */
    public @Nullable WriteFailure tryReceive() {
        WriteFailure f = queue.poll();
        if (f == null && closed) {
            throw new ClosedReceiveException();
        }
        return f;
    }

    /**
     * Wait up to {@code timeout} for a failure.
     *
     * @return the oldest failure, or {@code null} on timeout
     * @throws ClosedReceiveException if the channel is closed and drained
     * @throws CancellationException  if the waiting thread is interrupted
     */
    public @Nullable WriteFailure receive(@NonNull Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (; ; ) {
                long remaining = deadline - System.nanoTime();
                // short polls so close() is noticed while waiting
                WriteFailure f = queue.poll(Math.max(0L, Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(10))),
                        TimeUnit.NANOSECONDS);
                if (f != null) return f;
                if (closed) throw new ClosedReceiveException();
                if (deadline - System.nanoTime() <= 0) return null;
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            DIAG.warn("failures#{} receive interrupted", chId);
            throw new CancellationException("Interrupted while receiving");
        }
    }

    /**
     * Remove and return everything currently buffered. Never throws on a closed channel.
     */
    public @NonNull List<WriteFailure> drain() {
        List<WriteFailure> out = new ArrayList<>();
        queue.drainTo(out);
        return out;
    }
    // [/🧩 Section: receive]

    // 🧩 Section: lifecycle
    public long dropped() {
        return dropped.get();
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stop accepting failures. Already buffered ones can still be received.
     */
    public void close() {
        if (!closed) {
            closed = true;
            DIAG.debug("failures#{} closed with {} pending", chId, queue.size());
        }
    }

    /**
     * Thrown when receiving from a closed, drained channel.
     */
    public static class ClosedReceiveException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        public ClosedReceiveException() {
            super("Failure channel closed");
        }
    }
    // [/🧩 Section: lifecycle]
}
