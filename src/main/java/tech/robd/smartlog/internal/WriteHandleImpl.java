/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/internal/WriteHandleImpl.java
 description: Default WriteHandle over a CompletableFuture that always completes normally.
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
import tech.robd.smartlog.WriteOutcome;
import tech.robd.smartlog.diagnostics.Diagnostics;
import tech.robd.smartlog.fn.WriteHandle;

import java.util.concurrent.CompletableFuture;

/**
 * {@link WriteHandle} wrapping a {@link CompletableFuture} of the write outcome.
 *
 * @see DefaultSmartLogger#writeAsync(String, tech.robd.smartlog.LogLevel)
 */
final class WriteHandleImpl implements WriteHandle {

    private static final Diagnostics DIAG = Diagnostics.of(WriteHandleImpl.class);

    // 🧩 Section: state
    private final int handleId = System.identityHashCode(this);
    private final @NonNull CompletableFuture<WriteOutcome> future;
    // [/🧩 Section: state]

    WriteHandleImpl(@NonNull CompletableFuture<WriteOutcome> future) {
        if (future == null) throw new IllegalArgumentException("Future cannot be null");
        this.future = future;
        future.whenComplete((outcome, t) ->
                DIAG.debug("hdl#{} completed: {}", handleId, t == null ? outcome : t.getClass().getSimpleName()));
    }

    static @NonNull WriteHandle completed(@NonNull WriteOutcome outcome) {
        return new WriteHandleImpl(CompletableFuture.completedFuture(outcome));
    }

    // 🧩 Section: API
    @Override
    public boolean isCompleted() {
        return future.isDone();
    }

    @Override
    public CompletableFuture<WriteOutcome> result() {
        return future;
    }

    @Override
    public CompletableFuture<Void> completion() {
        return future.handle((r, t) -> null);
    }
    // [/🧩 Section: API]

    @Override
    public String toString() {
        return "WriteHandle[" + (future.isDone() ? future.getNow(WriteOutcome.FAILED) : "PENDING") + "]";
    }
}
