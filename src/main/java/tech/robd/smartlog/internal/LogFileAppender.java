/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/internal/LogFileAppender.java
 description: Appends one formatted line per call, opening and closing the file each time.
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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Line appender with no persistent handle.
 *
 * <p>The file is opened with {@link StandardOpenOption#APPEND} and without any lock, so other
 * readers and writers may hold it at the same time. The line and its terminator go out as a
 * single buffer so concurrent appenders do not split each other's lines. Missing parent
 * directories are not created.</p>
 */
final class LogFileAppender {

    private static final String LINE_SEPARATOR = System.lineSeparator();

    private LogFileAppender() {
    }

    static void appendLine(@NonNull Path file, @NonNull String line) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap((line + LINE_SEPARATOR).getBytes(StandardCharsets.UTF_8));
        try (FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
        }
    }
}
