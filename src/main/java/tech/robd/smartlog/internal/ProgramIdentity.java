/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/internal/ProgramIdentity.java
 description: Best-effort name of the running program, from the JVM launch command
              or, failing that, the current process executable.
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

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Names the running program for auto-generated log file names.
 *
 * <p>Two independent sources are offered so the file namer can fall back from one to the
 * other: the entry point the JVM was launched with and the process executable.</p>
 */
final class ProgramIdentity {

    static final String JAVA_COMMAND_PROPERTY = "sun.java.command";
    static final String DEFAULT_NAME = "Application";

    private ProgramIdentity() {
    }

    /**
     * Entry point from {@code sun.java.command}: the jar file name without extension, or the
     * simple name of the main class.
     *
     * @return {@code null} if the launcher did not record a command
     */
    static @Nullable String entryPointName() {
        return fromJavaCommand(System.getProperty(JAVA_COMMAND_PROPERTY));
    }

    static @Nullable String fromJavaCommand(@Nullable String command) {
        if (command == null || command.isBlank()) return null;
        String first = command.trim().split("\\s+", 2)[0];
        if (first.endsWith(".jar")) {
            return stripExtension(fileName(first));
        }
        // module/main.Class launches
        int slash = first.lastIndexOf('/');
        if (slash >= 0) first = first.substring(slash + 1);
        int dot = first.lastIndexOf('.');
        String simple = dot >= 0 ? first.substring(dot + 1) : first;
        return simple.isEmpty() ? null : simple;
    }

    /**
     * Executable of the current process, e.g. {@code java}.
     *
     * @return {@code null} if the platform does not expose it
     */
    static @Nullable String processName() {
        return ProcessHandle.current().info().command()
                .map(ProgramIdentity::fileName)
                .map(ProgramIdentity::stripExtension)
                .filter(s -> !s.isEmpty())
                .orElse(null);
    }

    private static String fileName(String path) {
        Path p = Paths.get(path).getFileName();
        return p == null ? path : p.toString();
    }

    static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
