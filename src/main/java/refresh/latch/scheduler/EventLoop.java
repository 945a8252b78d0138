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

import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-threaded execution context on which latches and their
 * scheduled callbacks run.
 *
 * Tasks submitted to the loop never run concurrently with each
 * other, so state that is only touched from the loop needs no
 * locking.
 *
 * @author refresh-latch developers
 */
public class EventLoop {

    private static final AtomicInteger COUNTER = new AtomicInteger();

    private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000;

    private final String name;

    private final Thread.UncaughtExceptionHandler failureHandler;

    private final ScheduledThreadPoolExecutor executor;

    private volatile Thread thread;

    public EventLoop() {
        this("refresh-latch-" + COUNTER.incrementAndGet());
    }

    public EventLoop(String name) {
        this(name, (thread, e) -> thread.getThreadGroup().uncaughtException(thread, e));
    }

    /**
     * Create a loop that reports failures of its tasks to the
     * given handler. The handler is called on the loop thread.
     *
     * @param name
     * @param failureHandler
     */
    public EventLoop(String name, Thread.UncaughtExceptionHandler failureHandler) {
        this.name = name;
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
        this.executor = new ScheduledThreadPoolExecutor(1, (runnable) -> {
            var result = new Thread(runnable, name);
            result.setDaemon(true);
            thread = result;
            return result;
        });
        // delayed callbacks are dropped on shutdown, tasks that are already due still run
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        this.executor.setRemoveOnCancelPolicy(true);
    }

    public String getName() {
        return name;
    }

    /**
     * True if the calling thread is the loop thread.
     */
    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    /**
     * Run a task on the loop as soon as possible.
     *
     * @param task
     */
    public void execute(Runnable task) {
        executor.execute(guarded(task));
    }

    /**
     * Create a scheduler whose callbacks run on this loop.
     */
    public Scheduler newScheduler() {
        return new EventLoopScheduler(this);
    }

    public long uptimeMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Call this method to shut down the loop when no longer needed.
     *
     * Tasks submitted with {@link #execute(Runnable)} before this call
     * still run. Callbacks scheduled with a delay are discarded. When
     * called from outside the loop, waits a bounded time for the
     * remaining tasks to finish.
     */
    public void shutdown() {
        executor.shutdown();
        if( inEventLoop() )
            return;
        try {
            if( !executor.awaitTermination(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS) )
                executor.shutdownNow();
        }
        catch( InterruptedException e ) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    ScheduledFuture<?> schedule(Runnable task, long delayMillis) {
        return executor.schedule(guarded(task), delayMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * The executor keeps task failures inside the returned future,
     * so report them before they are rethrown into it.
     *
     * @param task
     */
    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            }
            catch( RuntimeException | Error e ) {
                failureHandler.uncaughtException(Thread.currentThread(), e);
                throw e;
            }
        };
    }

}
