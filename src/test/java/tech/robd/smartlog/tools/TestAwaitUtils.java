/*
 [File Info]
 path: src/test/java/tech/robd/smartlog/tools/TestAwaitUtils.java
 description: Deterministic wait helpers for concurrent tests.
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

package tech.robd.smartlog.tools;

import tech.robd.smartlog.WriteOutcome;
import tech.robd.smartlog.fn.WriteHandle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.*;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic wait helpers for concurrent tests.
 */
public final class TestAwaitUtils {
    private TestAwaitUtils() {
    }

    /**
     * Poll a boolean condition until true or timeout (fails the test on timeout).
     */
    public static void awaitTrue(BooleanSupplier cond, long timeoutMs, long stepMs, String msg) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (System.nanoTime() < deadline) {
            if (cond.getAsBoolean()) return;
            try {
                Thread.sleep(stepMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting: " + msg);
            }
        }
        fail(msg);
    }

    /**
     * Await a CountDownLatch or fail with a useful message.
     */
    public static void awaitLatch(CountDownLatch latch, long timeoutMs, String msg) {
        try {
            assertTrue(latch.await(timeoutMs, TimeUnit.MILLISECONDS), msg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting for latch: " + e);
        }
    }

    /**
     * Wait for a write handle to settle and return its outcome.
     */
    public static WriteOutcome await(WriteHandle handle, long timeoutMs) {
        try {
            return handle.result().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            fail("Write not settled within " + timeoutMs + "ms");
            throw new AssertionError(te); // unreachable
        } catch (ExecutionException | CancellationException e) {
            fail("Write handle completed abnormally: " + e);
            throw new AssertionError(e); // unreachable
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            fail("Interrupted while awaiting write: " + ie);
            throw new AssertionError(ie); // unreachable
        }
    }

    /**
     * Lines of {@code file}, or an empty list if it does not exist yet.
     */
    public static List<String> lines(Path file) {
        if (!Files.exists(file)) return List.of();
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Number of lines in {@code file} ending with {@code suffix}.
     */
    public static long countEndingWith(Path file, String suffix) {
        return lines(file).stream().filter(l -> l.endsWith(suffix)).count();
    }
}
