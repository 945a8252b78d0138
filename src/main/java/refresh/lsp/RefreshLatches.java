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
package refresh.lsp;

import java.util.concurrent.TimeUnit;

import refresh.latch.DefaultRefreshLatch;
import refresh.latch.LatchConfiguration;
import refresh.latch.RefreshCallback;
import refresh.latch.RefreshLatch;
import refresh.latch.scheduler.EventLoop;
import refresh.latch.scheduler.Scheduler;
import refresh.lsp.util.Logger;

/**
 * Factory methods for refresh latches. Every latch gets its own
 * scheduler on the given event loop, and reports its diagnostics
 * to the client log when debugging is enabled.
 *
 * @author refresh-latch developers
 */
public final class RefreshLatches {

    private RefreshLatches() {
    }

    /**
     * Create a latch with the default delay time and minimum show time.
     *
     * @param eventLoop
     * @param callback
     */
    public static RefreshLatch newRefreshLatch(EventLoop eventLoop, RefreshCallback callback) {
        return newRefreshLatch(eventLoop.newScheduler(), LatchConfiguration.defaults(), callback);
    }

    /**
     * Create a latch with a custom delay time and the default minimum show time.
     *
     * @param eventLoop
     * @param time
     * @param timeUnit
     * @param callback
     */
    public static RefreshLatch newRefreshLatchWithDelay(EventLoop eventLoop, long time, TimeUnit timeUnit, RefreshCallback callback) {
        var configuration = LatchConfiguration.defaults().withDelayTime(time, timeUnit);
        return newRefreshLatch(eventLoop.newScheduler(), configuration, callback);
    }

    /**
     * Create a latch with the default delay time and a custom minimum show time.
     *
     * @param eventLoop
     * @param time
     * @param timeUnit
     * @param callback
     */
    public static RefreshLatch newRefreshLatchWithMinimumShowingTime(EventLoop eventLoop, long time, TimeUnit timeUnit, RefreshCallback callback) {
        var configuration = LatchConfiguration.defaults().withMinShowTime(time, timeUnit);
        return newRefreshLatch(eventLoop.newScheduler(), configuration, callback);
    }

    /**
     * Create a latch with a custom delay time and minimum show time.
     *
     * @param eventLoop
     * @param delayTime
     * @param delayTimeUnit
     * @param minShowTime
     * @param minShowTimeUnit
     * @param callback
     */
    public static RefreshLatch newRefreshLatch(
            EventLoop eventLoop,
            long delayTime,
            TimeUnit delayTimeUnit,
            long minShowTime,
            TimeUnit minShowTimeUnit,
            RefreshCallback callback) {
        var configuration = new LatchConfiguration(
            delayTimeUnit.toMillis(delayTime),
            minShowTimeUnit.toMillis(minShowTime),
            false
        );
        return newRefreshLatch(eventLoop.newScheduler(), configuration, callback);
    }

    public static RefreshLatch newRefreshLatch(Scheduler scheduler, LatchConfiguration configuration, RefreshCallback callback) {
        return new DefaultRefreshLatch(scheduler, configuration, callback, Logger.getInstance()::log);
    }

}
