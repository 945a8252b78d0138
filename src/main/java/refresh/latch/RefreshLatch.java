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
package refresh.latch;

/**
 * Latch that prevents the refresh indicator from flickering
 * on quick refresh events.
 *
 * If a refresh takes less time than the delay time, the refresh
 * indicator is not shown at all. If it takes longer, the indicator
 * is shown for at least the minimum show time, or for the rest of
 * the refresh, whichever is longer.
 *
 * A latch is not thread-safe. All calls must be made on the
 * execution context of the scheduler it was created with.
 *
 * @author refresh-latch developers
 */
public interface RefreshLatch extends Disposable {

    /**
     * The last value passed to {@link #setRefreshing(boolean)}
     * or {@link #force(boolean)}.
     */
    boolean isRefreshing();

    /**
     * Control whether the latch is in a refreshing state.
     *
     * When set to refreshing, a show command is queued to run
     * after the delay time.
     *
     * When set to not refreshing, the indicator is hidden. If it has
     * already been shown for the minimum show time, it is hidden
     * immediately, otherwise a hide command is queued for when the
     * minimum show time is reached. If the indicator was never shown,
     * the queued show command is cancelled and nothing is emitted.
     *
     * Setting the same value more than once is a no-op.
     *
     * @param refreshing
     */
    void setRefreshing(boolean refreshing);

    /**
     * Clear any queued command and immediately show or hide
     * the indicator, regardless of the delay and minimum show times.
     *
     * @param refreshing
     */
    void force(boolean refreshing);

    /**
     * Cancel any queued command. The latch cannot be used afterwards.
     * Calling this method more than once has no effect.
     */
    @Override
    void dispose();

    boolean isDisposed();

    LatchState getState();

    /**
     * Report every transition through the latch's default debug log.
     *
     * @throws IllegalStateException if the latch was created without one
     */
    RefreshLatch enableDebugging();

    /**
     * Report every transition through the given log.
     *
     * @param log
     */
    RefreshLatch enableDebugging(DebugLog log);

}
