/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/WriteFailureListener.java
 description: Callback invoked when a write fails.
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
 * Notified synchronously, on the writing thread, when a write fails.
 *
 * <p>May be invoked concurrently from several writer threads; implementations must be
 * thread-safe or serialize themselves. Exceptions thrown here are traced and otherwise
 * ignored; they never reach the caller of the write.</p>
 */
@FunctionalInterface
public interface WriteFailureListener {
    void onWriteFailure(@NonNull String message, @NonNull Throwable cause);
}
