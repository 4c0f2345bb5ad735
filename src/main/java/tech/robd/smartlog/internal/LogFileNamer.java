/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/internal/LogFileNamer.java
 description: Derives dated log directories and file names, creating directories on demand
              and falling back to a file in the working directory when that fails.
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
import tech.robd.smartlog.diagnostics.Diagnostics;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * File naming for auto-named loggers.
 *
 * <p>Layout: {@code <base>/Logs/<yyyy>/<MM>-<MonthName>/<program>_<dd>.log}.</p>
 *
 * <p>{@link #generate(LocalDate)} never throws. If the dated directory cannot be created it
 * returns {@code <cwd>/<entry-point>.log}; if the entry point cannot be named it uses the
 * process executable name instead; if even that fails, {@code Application.log}.</p>
 */
final class LogFileNamer {

    private static final Diagnostics DIAG = Diagnostics.of(LogFileNamer.class);

    static final String LOGS_DIR = "Logs";
    static final String EXTENSION = ".log";

    // 🧩 Section: state
    private final @NonNull Path baseDirectory;
    private final @NonNull Locale locale;
    private final @Nullable String programOverride;
    private final @NonNull Supplier<@Nullable String> entryPoint;
    private final @NonNull Supplier<@Nullable String> process;
    private final @NonNull Supplier<@NonNull Path> workingDirectory;
    // [/🧩 Section: state]

    LogFileNamer(@NonNull Path baseDirectory, @NonNull Locale locale, @Nullable String programOverride) {
        this(baseDirectory, locale, programOverride,
                ProgramIdentity::entryPointName,
                ProgramIdentity::processName,
                () -> Paths.get(System.getProperty("user.dir", ".")));
    }

    LogFileNamer(@NonNull Path baseDirectory,
                 @NonNull Locale locale,
                 @Nullable String programOverride,
                 @NonNull Supplier<@Nullable String> entryPoint,
                 @NonNull Supplier<@Nullable String> process,
                 @NonNull Supplier<@NonNull Path> workingDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory");
        this.locale = Objects.requireNonNull(locale, "locale");
        this.programOverride = programOverride;
        this.entryPoint = Objects.requireNonNull(entryPoint, "entryPoint");
        this.process = Objects.requireNonNull(process, "process");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    // 🧩 Section: pure-naming

    /**
     * {@code <base>/Logs/<yyyy>/<MM>-<MonthName>} for {@code date}. Pure; touches no files.
     */
    @NonNull Path directoryFor(@NonNull LocalDate date) {
        String month = String.format(Locale.ROOT, "%02d-%s",
                date.getMonthValue(), date.getMonth().getDisplayName(TextStyle.FULL_STANDALONE, locale));
        return baseDirectory
                .resolve(LOGS_DIR)
                .resolve(Integer.toString(date.getYear()))
                .resolve(month);
    }

    /**
     * {@code <directory>/<program>_<dd>.log} for {@code date}. Pure; touches no files.
     */
    @NonNull Path fileFor(@NonNull LocalDate date) {
        String name = String.format(Locale.ROOT, "%s_%02d%s", programName(), date.getDayOfMonth(), EXTENSION);
        return directoryFor(date).resolve(name);
    }

    @NonNull String programName() {
        if (programOverride != null) return programOverride;
        String name = safeGet(entryPoint);
        if (name == null) name = safeGet(process);
        return name != null ? name : ProgramIdentity.DEFAULT_NAME;
    }
    // [/🧩 Section: pure-naming]

    // 🧩 Section: generate

    /**
     * Create the dated directory if missing and return the file to write for {@code date}.
     */
    @NonNull Path generate(@NonNull LocalDate date) {
        Path result = Paths.get(ProgramIdentity.DEFAULT_NAME + EXTENSION);
        try {
            Path dir = directoryFor(date);
            Files.createDirectories(dir);
            result = fileFor(date);
            DIAG.debug("auto-named log file {} for {}", result, date);
        } catch (Exception primary) {
            DIAG.warn("cannot prepare dated log directory under {}: {}", baseDirectory, primary.toString());
            try {
                result = fallback(entryPoint);
            } catch (Exception second) {
                DIAG.warn("entry point unavailable for fallback log name: {}", second.toString());
                try {
                    result = fallback(process);
                } catch (Exception third) {
                    DIAG.error("process name unavailable for fallback log name, using {}: {}", result, third.toString());
                }
            }
            DIAG.info("falling back to log file {}", result);
        }
        return result;
    }

    private Path fallback(Supplier<@Nullable String> source) {
        String name = programOverride != null ? programOverride : source.get();
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("program name unavailable");
        }
        return workingDirectory.get().resolve(name + EXTENSION);
    }

    private static @Nullable String safeGet(Supplier<@Nullable String> source) {
        try {
            return source.get();
        } catch (RuntimeException e) {
            DIAG.debug("program name source failed: {}", e.toString());
            return null;
        }
    }
    // [/🧩 Section: generate]
}
