/*
 [File Info]
 path: src/test/java/tech/robd/smartlog/diagnostics/DiagnosticsTest.java
 description: Tracing switch and SLF4J forwarding.
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

package tech.robd.smartlog.diagnostics;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {

    private boolean wasEnabled;
    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void remember() {
        wasEnabled = DiagnosticsBackend.isEnabled();
        logger = (Logger) LoggerFactory.getLogger(DiagnosticsTest.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void restore() {
        logger.detachAppender(appender);
        appender.stop();
        if (wasEnabled) DiagnosticsBackend.enable();
        else DiagnosticsBackend.disable();
    }

    @Test
    void ofFollowsTheSwitch() {
        DiagnosticsBackend.disable();
        assertSame(Diagnostics.noop(), Diagnostics.of(DiagnosticsTest.class));

        DiagnosticsBackend.enable();
        assertEquals(DiagnosticsTest.class, Diagnostics.of(DiagnosticsTest.class).owner());
    }

    @Test
    void activeInstanceGoesQuietWhenSwitchedOff() {
        DiagnosticsBackend.enable();
        Diagnostics d = Diagnostics.of(DiagnosticsTest.class);
        d.info("visible {}", 1);

        DiagnosticsBackend.disable();
        d.warn("dropped while disabled {}", 2);

        assertEquals(1, appender.list.size());
        assertEquals("visible 1", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void trailingThrowableBecomesTheLoggedException() {
        DiagnosticsBackend.enable();
        Diagnostics d = Diagnostics.of(DiagnosticsTest.class);
        d.error("write failed for '{}'", "msg", new IOException("disk full"));

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals("write failed for 'msg'", event.getFormattedMessage());
        assertNotNull(event.getThrowableProxy());
        assertEquals(IOException.class.getName(), event.getThrowableProxy().getClassName());
        assertEquals("disk full", event.getThrowableProxy().getMessage());
        assertArrayEquals(new Object[]{"msg"}, event.getArgumentArray());
    }

    @Test
    void plainArgumentsCarryNoException() {
        DiagnosticsBackend.enable();
        Diagnostics d = Diagnostics.of(DiagnosticsTest.class);
        d.debug("no args");
        d.info("{} and {}", "a", "b");

        assertEquals(2, appender.list.size());
        assertEquals("no args", appender.list.get(0).getFormattedMessage());
        assertEquals("a and b", appender.list.get(1).getFormattedMessage());
        assertNull(appender.list.get(1).getThrowableProxy());
    }
}
