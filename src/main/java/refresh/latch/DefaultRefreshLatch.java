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

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

import refresh.latch.scheduler.Cancellable;
import refresh.latch.scheduler.Scheduler;

/**
 * Refresh latch that queues its show and hide commands on
 * a scheduler.
 *
 * The scheduler must be owned by this latch, since clearing
 * the queued commands clears every callback of the scheduler.
 *
 * @author refresh-latch developers
 */
public class DefaultRefreshLatch implements RefreshLatch {

    private final Scheduler scheduler;

    private final long delayMillis;

    private final long minShowMillis;

    private final RefreshCallback callback;

    private final DebugLog defaultLog;

    private DebugLog debugLog;

    private boolean refreshing;

    // uptime at which the indicator was last shown, null while hidden
    private Long timeShown;

    private Cancellable pending;

    private boolean disposed;

    public DefaultRefreshLatch(Scheduler scheduler, LatchConfiguration configuration, RefreshCallback callback) {
        this(scheduler, configuration, callback, null);
    }

    /**
     * Create a latch whose diagnostics go to the given log when
     * debugging is enabled without naming a log.
     *
     * @param scheduler
     * @param configuration
     * @param callback
     * @param defaultLog
     */
    public DefaultRefreshLatch(Scheduler scheduler, LatchConfiguration configuration, RefreshCallback callback, DebugLog defaultLog) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.delayMillis = configuration.delayMillis();
        this.minShowMillis = configuration.minShowMillis();
        this.callback = Objects.requireNonNull(callback, "callback");
        this.defaultLog = defaultLog;
        if( configuration.debug() ) {
            if( defaultLog == null )
                throw new IllegalArgumentException("Debugging requires a debug log");
            this.debugLog = defaultLog;
        }
    }

    public long getDelayMillis() {
        return delayMillis;
    }

    public long getMinShowMillis() {
        return minShowMillis;
    }

    @Override
    public boolean isRefreshing() {
        return refreshing;
    }

    @Override
    public void setRefreshing(boolean refreshing) {
        checkNotDisposed();
        if( this.refreshing == refreshing ) {
            debug("setRefreshing(" + refreshing + ") called with same state, ignore.");
            return;
        }

        clearCommands();
        this.refreshing = refreshing;

        try {
            if( refreshing )
                queueShow();
            else if( timeShown != null )
                queueHide(timeShown);
            else
                debug("Refresh finished before show(), nothing to hide.");
        }
        catch( RejectedExecutionException e ) {
            // nothing was queued, so the request did not take effect
            this.refreshing = !refreshing;
            throw e;
        }
    }

    @Override
    public void force(boolean refreshing) {
        checkNotDisposed();
        clearCommands();
        this.refreshing = refreshing;

        if( refreshing )
            show();
        else
            hide();
    }

    @Override
    public void dispose() {
        if( disposed )
            return;
        clearCommands();
        disposed = true;
        debug("Disposed.");
    }

    @Override
    public boolean isDisposed() {
        return disposed;
    }

    @Override
    public LatchState getState() {
        if( disposed )
            return LatchState.DISPOSED;
        if( pending != null && !pending.isDone() )
            return refreshing ? LatchState.PENDING_SHOW : LatchState.PENDING_HIDE;
        return timeShown != null ? LatchState.SHOWN : LatchState.IDLE;
    }

    @Override
    public RefreshLatch enableDebugging() {
        if( defaultLog == null )
            throw new IllegalStateException("No default debug log was given, use enableDebugging(DebugLog)");
        return enableDebugging(defaultLog);
    }

    @Override
    public RefreshLatch enableDebugging(DebugLog log) {
        checkNotDisposed();
        this.debugLog = Objects.requireNonNull(log, "log");
        debug("Enabling debugging");
        return this;
    }

    private void queueShow() {
        debug("Queueing show() to run in " + delayMillis + " milliseconds.");
        queueCommand(delayMillis, this::show);
    }

    private void queueHide(long timeLastShown) {
        var shownTime = scheduler.uptimeMillis() - timeLastShown;
        if( shownTime < minShowMillis ) {
            var delay = minShowMillis - shownTime;
            debug("Queueing hide() to run in " + delay + " milliseconds.");
            queueCommand(delay, this::hide);
        }
        else {
            hide();
        }
    }

    private void queueCommand(long delay, Runnable command) {
        pending = scheduler.schedule(delay, () -> {
            pending = null;
            command.run();
        });
    }

    private void clearCommands() {
        debug("Clearing command buffer.");
        scheduler.cancelAll();
        pending = null;
    }

    private void show() {
        debug("show()");
        timeShown = scheduler.uptimeMillis();
        callback.onRefresh(true);
    }

    private void hide() {
        debug("hide()");
        timeShown = null;
        callback.onRefresh(false);
    }

    private void debug(String message) {
        if( debugLog != null )
            debugLog.debug(message);
    }

    private void checkNotDisposed() {
        if( disposed )
            throw new IllegalStateException("Refresh latch has already been disposed");
    }

}
