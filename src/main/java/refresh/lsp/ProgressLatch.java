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

import refresh.latch.DefaultRefreshLatch;
import refresh.latch.Disposable;
import refresh.latch.LatchConfiguration;
import refresh.latch.RefreshLatch;
import refresh.latch.scheduler.EventLoop;
import refresh.lsp.util.Logger;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * Refresh latch that reports the refresh state of a language
 * service to the client as work-done progress.
 *
 * Unlike a plain latch, it may be called from any thread
 * (e.g. the request threads of the language server). Every call
 * is forwarded to the event loop that owns the latch, so calls
 * are applied in the order they were made.
 *
 * @author refresh-latch developers
 */
public class ProgressLatch implements Disposable {

    private final EventLoop eventLoop;

    private final ProgressIndicator indicator;

    private final RefreshLatch latch;

    private volatile boolean disposed;

    public ProgressLatch(EventLoop eventLoop, LanguageClient client, LatchConfiguration configuration, String tokenPrefix, String title) {
        this.eventLoop = eventLoop;
        this.indicator = new ProgressIndicator(client, tokenPrefix, title);
        this.latch = new DefaultRefreshLatch(eventLoop.newScheduler(), configuration, indicator, Logger.getInstance()::log);
    }

    public void setRefreshing(boolean refreshing) {
        checkNotDisposed();
        run(() -> latch.setRefreshing(refreshing));
    }

    public void force(boolean refreshing) {
        checkNotDisposed();
        run(() -> latch.force(refreshing));
    }

    @Override
    public void dispose() {
        if( disposed )
            return;
        disposed = true;
        // a stopped loop has already discarded the queued commands
        if( eventLoop.isShutdown() )
            return;
        run(latch::dispose);
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * The underlying latch. Only use it on the event loop.
     */
    public RefreshLatch getLatch() {
        return latch;
    }

    ProgressIndicator getIndicator() {
        return indicator;
    }

    private void run(Runnable action) {
        if( eventLoop.inEventLoop() )
            action.run();
        else
            eventLoop.execute(action);
    }

    private void checkNotDisposed() {
        if( disposed )
            throw new IllegalStateException("Progress latch has already been disposed");
    }

}
