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

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler that runs its callbacks on an {@link EventLoop} and
 * keeps track of the callbacks it created, so that they can be
 * cleared without touching other users of the same loop.
 *
 * @author refresh-latch developers
 */
public class EventLoopScheduler implements Scheduler {

    private final EventLoop eventLoop;

    private final Set<Task> pending = ConcurrentHashMap.newKeySet();

    public EventLoopScheduler(EventLoop eventLoop) {
        this.eventLoop = eventLoop;
    }

    @Override
    public Cancellable schedule(long delayMillis, Runnable callback) {
        if( delayMillis < 0 )
            throw new IllegalArgumentException("Delay must not be negative: " + delayMillis);

        var task = new Task(callback);
        pending.add(task);
        try {
            task.future = eventLoop.schedule(task, delayMillis);
        }
        catch( RejectedExecutionException e ) {
            task.done.set(true);
            pending.remove(task);
            throw e;
        }
        return task;
    }

    @Override
    public void cancelAll() {
        for( var task : List.copyOf(pending) )
            task.cancel();
    }

    @Override
    public int pendingCount() {
        return pending.size();
    }

    @Override
    public long uptimeMillis() {
        return eventLoop.uptimeMillis();
    }

    private class Task implements Runnable, Cancellable {

        private final Runnable callback;

        private final AtomicBoolean done = new AtomicBoolean();

        private volatile ScheduledFuture<?> future;

        Task(Runnable callback) {
            this.callback = callback;
        }

        @Override
        public void run() {
            // the future may already be running when cancel() is called
            if( !done.compareAndSet(false, true) )
                return;
            pending.remove(this);
            callback.run();
        }

        @Override
        public boolean cancel() {
            if( !done.compareAndSet(false, true) )
                return false;
            pending.remove(this);
            var existing = future;
            if( existing != null && !existing.isDone() )
                existing.cancel(false);
            return true;
        }

        @Override
        public boolean isDone() {
            return done.get();
        }
    }

}
