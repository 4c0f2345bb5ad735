/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/diagnostics/Diagnostics.java
 description: Owner-bound tracing facade used by the logger internals. Forwards to
              DiagnosticsBackend (SLF4J) and collapses to a no-op when disabled.
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

package tech.robd.smartlog.diagnostics;

/**
 * Tracing facade bound to an owning {@link Class}.
 * <p>
 * This is the library's own debug trace, not the log file it writes. Messages go to
 * SLF4J through {@link DiagnosticsBackend} and only when tracing is switched on with
 * {@code -Dsmartlog.diag=true} or {@link DiagnosticsBackend#enable()}.
 * <ul>
 *   <li>{@link #of(Class)} resolves to a no-op if tracing is off at creation time.</li>
 *   <li>{@link #noop()} is an explicit no-op.</li>
 * </ul>
 */
@FunctionalInterface
public interface Diagnostics {

    // 🧩 Section: identity

    /**
     * Owning class used to pick the SLF4J logger.
     *
     * @return the owner class associated with this diagnostics instance
     */
    Class<?> owner();
    // [/🧩 Section: identity]

    // 🧩 Section: forwarding

    /**
     * Emit a debug message.
     *
     * @param msg  SLF4J-style message pattern
     * @param args arguments to format into {@code msg}; a trailing {@link Throwable} is logged as such
     */
    default void debug(String msg, Object... args) {
        DiagnosticsBackend.debug(owner(), msg, args);
    }

    /**
     * Emit an info message.
     */
    default void info(String msg, Object... args) {
        DiagnosticsBackend.info(owner(), msg, args);
    }

    /**
     * Emit a warning message.
     */
    default void warn(String msg, Object... args) {
        DiagnosticsBackend.warn(owner(), msg, args);
    }

    /**
     * Emit an error message.
     */
    default void error(String msg, Object... args) {
        DiagnosticsBackend.error(owner(), msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories

    /**
     * Create a diagnostics instance for {@code owner}, or a no-op if tracing is off.
     *
     * @param owner the owning class (non-null)
     * @return active or no-op diagnostics depending on backend state
     */
    static Diagnostics of(Class<?> owner) {
        return DiagnosticsBackend.isEnabled() ? new ActiveD(owner) : NoOpD.INSTANCE;
    }

    /**
     * @return a no-op diagnostics singleton
     */
    static Diagnostics noop() {
        return NoOpD.INSTANCE;
    }
    // [/🧩 Section: factories]
}
