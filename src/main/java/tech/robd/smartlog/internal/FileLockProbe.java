/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/internal/FileLockProbe.java
 description: Best-effort check whether another handle holds an exclusive lock on a file.
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

package tech.robd.smartlog.internal;

import org.jspecify.annotations.NonNull;
import tech.robd.smartlog.diagnostics.Diagnostics;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;

/**
 * Lock probe used by deferred writes.
 *
 * <p>Opens the file for read/write and tries to take an exclusive lock, releasing it at once.
 * Only contention counts as locked: a lock held by another process, a lock held through another
 * channel in this JVM, or a sharing violation reported when opening. Every other failure,
 * including a missing file, counts as not locked.</p>
 */
final class FileLockProbe {

    private static final Diagnostics DIAG = Diagnostics.of(FileLockProbe.class);

    private FileLockProbe() {
    }

    static boolean isLocked(@NonNull Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            FileLock lock = ch.tryLock();
            if (lock == null) {
                DIAG.debug("probe {}: held by another process", file);
                return true;
            }
            lock.release();
            return false;
        } catch (OverlappingFileLockException e) {
            DIAG.debug("probe {}: held by another channel in this JVM", file);
            return true;
        } catch (NoSuchFileException e) {
            return false;
        } catch (FileSystemException e) {
            boolean sharing = isSharingViolation(e);
            DIAG.debug("probe {}: {} -> locked={}", file, e.toString(), sharing);
            return sharing;
        } catch (IOException | RuntimeException e) {
            DIAG.debug("probe {}: {} -> not locked", file, e.toString());
            return false;
        }
    }

    // Windows reports exclusive opens by other processes as a sharing violation on open.
    static boolean isSharingViolation(@NonNull FileSystemException e) {
        String reason = e.getReason();
        return reason != null && reason.toLowerCase(Locale.ROOT).contains("being used by another process");
    }
}
