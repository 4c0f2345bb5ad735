/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/fn/WriteHandle.java
 description: Completion handle returned by asynchronous writes.
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

package tech.robd.smartlog.fn;

import tech.robd.smartlog.WriteOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * A handle to an asynchronous write.
 *
 * <p>Supports:
 * <ul>
 *   <li>State inspection with {@link #isCompleted()}.</li>
 *   <li>Outcome access via {@link #result()}; the future never completes exceptionally.</li>
 *   <li>Completion tracking via {@link #completion()}.</li>
 *   <li>Convenience blocking {@link #join()}.</li>
 * </ul>
 *
 * <p>Callers may ignore the handle entirely; the write runs detached.</p>
 */
public interface WriteHandle {

    /**
     * @return {@code true} once the write has settled
     */
    boolean isCompleted();

    /**
     * @return future completing with the {@link WriteOutcome}
     */
    CompletableFuture<WriteOutcome> result();

    /**
     * @return future completing when the write settles, whatever the outcome
     */
    CompletableFuture<Void> completion();

    /**
     * Block the calling thread until the write settles.
     *
     * @return the outcome
     */
    default WriteOutcome join() {
        return result().join();
    }
}
