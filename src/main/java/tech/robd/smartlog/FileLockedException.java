/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/FileLockedException.java
 description: Raised inside a deferred write whose retry budget ran out while the file stayed locked.
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

import java.io.IOException;
import java.nio.file.Path;

/**
 * The log file was still held exclusively by another handle after all deferred retries.
 * Delivered to failure listeners; never thrown to callers.
 */
public final class FileLockedException extends IOException {
    private static final long serialVersionUID = 1L;

    private final transient Path file;
    private final int attempts;

    public FileLockedException(@NonNull Path file, int attempts) {
        super("Log file still locked after " + attempts + " probe(s): " + file);
        this.file = file;
        this.attempts = attempts;
    }

    public Path getFile() {
        return file;
    }

    public int getAttempts() {
        return attempts;
    }
}
