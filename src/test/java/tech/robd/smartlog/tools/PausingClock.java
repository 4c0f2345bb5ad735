/*
 [File Info]
 path: src/test/java/tech/robd/smartlog/tools/PausingClock.java
 description: Clock that holds one named thread inside its first clock read until released.
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

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The first {@link #instant()} call made by the thread named {@code threadName} samples the
 * delegate, signals {@link #reading} and then blocks until {@link #release} is counted down.
 * It returns the value sampled before the pause. All other calls pass straight through.
 */
public final class PausingClock extends Clock {
    public final CountDownLatch reading = new CountDownLatch(1);
    public final CountDownLatch release = new CountDownLatch(1);

    private final Clock delegate;
    private final String threadName;
    private final AtomicBoolean paused = new AtomicBoolean();

    public PausingClock(Clock delegate, String threadName) {
        this.delegate = delegate;
        this.threadName = threadName;
    }

    @Override
    public ZoneId getZone() {
        return delegate.getZone();
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return delegate.withZone(zone);
    }

    @Override
    public Instant instant() {
        Instant sampled = delegate.instant();
        if (Thread.currentThread().getName().equals(threadName) && paused.compareAndSet(false, true)) {
            reading.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("never released");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while paused", ie);
            }
        }
        return sampled;
    }
}
