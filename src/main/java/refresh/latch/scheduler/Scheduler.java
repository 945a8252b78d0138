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

/**
 * Schedules delayed callbacks on a single execution context.
 *
 * A scheduler only knows about the callbacks it created itself,
 * so several schedulers can share one execution context and
 * still be cleared independently.
 *
 * Callbacks, cancellation and the code that schedules them are
 * expected to run on the same execution context. Under that rule
 * a cancelled callback never runs.
 *
 * @author refresh-latch developers
 */
public interface Scheduler {

    /**
     * Run the callback after at least the given delay.
     *
     * @param delayMillis
     * @param callback
     */
    Cancellable schedule(long delayMillis, Runnable callback);

    /**
     * Cancel every callback created by this scheduler that
     * has not run yet. Safe to call when nothing is pending.
     */
    void cancelAll();

    /**
     * Number of callbacks that are scheduled but have neither
     * run nor been cancelled.
     */
    int pendingCount();

    /**
     * Current time of the monotonic clock used to measure delays.
     */
    long uptimeMillis();

}
