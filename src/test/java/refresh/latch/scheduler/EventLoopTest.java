/*
 * Copyright 2024-2025, Seqera Labs
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
package refresh.latch.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class EventLoopTest {

    private EventLoop eventLoop = new EventLoop("event-loop-test");

    @AfterEach
    void tearDown() {
        eventLoop.shutdown();
    }

    @Test
    void runsTasksOnNamedThread() throws InterruptedException {
        var name = new AtomicReference<String>();
        var done = new CountDownLatch(1);

        eventLoop.execute(() -> {
            name.set(Thread.currentThread().getName());
            done.countDown();
        });

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals("event-loop-test", name.get());
        assertEquals("event-loop-test", eventLoop.getName());
    }

    @Test
    void failuresAreReportedToHandler() throws InterruptedException {
        var failure = new AtomicReference<Throwable>();
        var thread = new AtomicReference<Thread>();
        var reported = new CountDownLatch(1);
        var reporting = new EventLoop("reporting-loop", (t, e) -> {
            thread.set(t);
            failure.set(e);
            reported.countDown();
        });
        var cause = new IllegalStateException("callback failed");

        try {
            reporting.execute(() -> {
                throw cause;
            });

            assertTrue(reported.await(5, TimeUnit.SECONDS));
            assertSame(cause, failure.get());
            assertEquals("reporting-loop", thread.get().getName());
        }
        finally {
            reporting.shutdown();
        }
    }

    @Test
    void loopSurvivesFailingTask() throws InterruptedException {
        var done = new CountDownLatch(1);

        eventLoop.execute(() -> {
            throw new IllegalStateException("callback failed");
        });
        eventLoop.execute(done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void rejectsTasksAfterShutdown() {
        eventLoop.shutdown();

        assertTrue(eventLoop.isShutdown());
        assertFalse(eventLoop.inEventLoop());
        assertThrows(RejectedExecutionException.class, () -> eventLoop.execute(() -> {}));
    }

    @Test
    void shutdownRunsSubmittedTasksAndDropsDelayedOnes() {
        var submitted = new AtomicBoolean();
        var delayed = new AtomicBoolean();

        eventLoop.newScheduler().schedule(1_000, () -> delayed.set(true));
        eventLoop.execute(() -> {
            try {
                Thread.sleep(50);
            }
            catch( InterruptedException e ) {
                Thread.currentThread().interrupt();
            }
            submitted.set(true);
        });

        eventLoop.shutdown();

        assertTrue(submitted.get());
        assertFalse(delayed.get());
    }

    @Test
    void shutdownFromLoopDoesNotWait() throws InterruptedException {
        var done = new CountDownLatch(1);

        eventLoop.execute(() -> {
            eventLoop.shutdown();
            done.countDown();
        });

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(eventLoop.isShutdown());
    }

}
