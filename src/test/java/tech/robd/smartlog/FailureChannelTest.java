/*
 [File Info]
 path: src/test/java/tech/robd/smartlog/FailureChannelTest.java
 description: Bounded failure channel: non-blocking send, overflow counting, close semantics.
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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class FailureChannelTest {

    private static WriteFailure failure(String msg) {
        return new WriteFailure(msg, new IOException("disk full"), Instant.EPOCH);
    }

    @Test
    void fifoOrder() {
        FailureChannel ch = FailureChannel.buffered(4);
        assertTrue(ch.trySend(failure("a")));
        assertTrue(ch.trySend(failure("b")));
        assertEquals("a", ch.tryReceive().message());
        assertEquals("b", ch.tryReceive().message());
        assertNull(ch.tryReceive());
    }

    @Test
    void overflowIsDroppedAndCounted() {
        FailureChannel ch = FailureChannel.buffered(2);
        assertTrue(ch.trySend(failure("1")));
        assertTrue(ch.trySend(failure("2")));
        assertFalse(ch.trySend(failure("3")));
        assertEquals(1, ch.dropped());
        assertEquals(2, ch.drain().size());
        assertTrue(ch.isEmpty());
    }

    @Test
    @Timeout(2)
    void receiveTimesOutWithNull() {
        FailureChannel ch = FailureChannel.buffered(1);
        assertNull(ch.receive(Duration.ofMillis(30)));
    }

    @Test
    @Timeout(2)
    void closedChannelDrainsThenThrows() {
        FailureChannel ch = FailureChannel.buffered(2);
        ch.trySend(failure("pending"));
        ch.close();
        assertFalse(ch.trySend(failure("late")));
        assertEquals("pending", ch.receive(Duration.ofMillis(100)).message());
        assertThrows(FailureChannel.ClosedReceiveException.class, () -> ch.receive(Duration.ofMillis(100)));
        assertThrows(FailureChannel.ClosedReceiveException.class, ch::tryReceive);
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> FailureChannel.buffered(0));
        assertThrows(IllegalArgumentException.class, () -> FailureChannel.buffered(1).trySend(null));
    }
}
