/*
 [File Info]
 path: src/main/java/tech/robd/smartlog/diagnostics/DiagnosticsBackend.java
 description: SLF4J sink behind Diagnostics. Per-owner logger cache, location-aware emission,
              global on/off switch via system property `smartlog.diag` and enable()/disable().
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Diagnostics sink that delegates to SLF4J.
 *
 * <p>Features:
 * <ul>
 *   <li>Global switch via system property {@code smartlog.diag} (default {@code false})
 *       and programmatic {@link #enable()}/{@link #disable()}.</li>
 *   <li>Per-owner {@link Logger} cache keyed by {@link Class}.</li>
 *   <li>Uses {@link LocationAwareLogger} when available to preserve caller location.</li>
 *   <li>No-ops fast when disabled.</li>
 * </ul>
 */
public final class DiagnosticsBackend {

    // 🧩 Section: constants-and-state
    private static final String FQClassName = DiagnosticsBackend.class.getName();

    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    /**
     * System property to enable diagnostics: {@code -Dsmartlog.diag=true}.
     */
    public static final String DIAGNOSTICS_PROPERTY_NAME = "smartlog.diag";

    private static volatile boolean enabled =
            "true".equalsIgnoreCase(
                    System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim()
            );
    // [/🧩 Section: constants-and-state]

    private DiagnosticsBackend() {
        // no instances
    }

    // 🧩 Section: enablement

    /**
     * Enable diagnostics globally (until disabled or JVM exit). Instances obtained
     * earlier through {@link Diagnostics#of(Class)} while disabled stay no-ops.
     */
    public static void enable() {
        enabled = true;
    }

    /**
     * Disable diagnostics globally.
     */
    public static void disable() {
        enabled = false;
    }

    public static boolean isEnabled() {
        return enabled;
    }
    // [/🧩 Section: enablement]

    private static Logger logger(Class<?> owner) {
        return LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
    }

    // 🧩 Section: emitters
    static void debug(Class<?> owner, String msg, Object... args) {
        if (!enabled) return; // fast path
        Logger log = logger(owner);
        if (log instanceof LocationAwareLogger law) {
            emit(law, LocationAwareLogger.DEBUG_INT, msg, args);
        } else if (log.isDebugEnabled()) {
            log.debug(msg, args);
        }
    }

    static void info(Class<?> owner, String msg, Object... args) {
        if (!enabled) return;
        Logger log = logger(owner);
        if (log instanceof LocationAwareLogger law) {
            emit(law, LocationAwareLogger.INFO_INT, msg, args);
        } else if (log.isInfoEnabled()) {
            log.info(msg, args);
        }
    }

    static void warn(Class<?> owner, String msg, Object... args) {
        if (!enabled) return;
        Logger log = logger(owner);
        if (log instanceof LocationAwareLogger law) {
            emit(law, LocationAwareLogger.WARN_INT, msg, args);
        } else if (log.isWarnEnabled()) {
            log.warn(msg, args);
        }
    }

    static void error(Class<?> owner, String msg, Object... args) {
        if (!enabled) return;
        Logger log = logger(owner);
        if (log instanceof LocationAwareLogger law) {
            emit(law, LocationAwareLogger.ERROR_INT, msg, args);
        } else if (log.isErrorEnabled()) {
            log.error(msg, args);
        }
    }

    // The location-aware API takes the throwable separately from the format arguments.
    private static void emit(LocationAwareLogger law, int level, String msg, Object[] args) {
        Throwable t = null;
        Object[] params = args;
        if (args != null && args.length > 0 && args[args.length - 1] instanceof Throwable last) {
            t = last;
            params = Arrays.copyOf(args, args.length - 1);
        }
        law.log(null, FQClassName, level, msg, params, t);
    }
    // [/🧩 Section: emitters]
}
