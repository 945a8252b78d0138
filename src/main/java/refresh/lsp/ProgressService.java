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

import java.util.concurrent.atomic.AtomicInteger;

import refresh.latch.LatchConfiguration;
import refresh.latch.scheduler.EventLoop;
import refresh.lsp.util.JsonUtils;
import refresh.lsp.util.Logger;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * Creates progress latches for a language server and releases
 * them when the server shuts down.
 *
 * The server forwards its client connection, configuration changes
 * and shutdown request to this service. All latches share one
 * event loop. Failures in latch callbacks are reported to the
 * client log.
 *
 * @author refresh-latch developers
 */
public class ProgressService {

    private static Logger log = Logger.getInstance();

    private final EventLoop eventLoop;

    private final LatchRegistry registry = new LatchRegistry();

    private final AtomicInteger latchCount = new AtomicInteger();

    private volatile LanguageClient client;

    private volatile LatchConfiguration configuration = LatchConfiguration.defaults();

    public ProgressService() {
        this(new EventLoop("refresh-progress", (thread, e) -> {
            log.error("Uncaught failure in event loop " + thread.getName() + " -- cause: " + e.toString());
        }));
    }

    public ProgressService(EventLoop eventLoop) {
        this.eventLoop = eventLoop;
    }

    public void connect(LanguageClient client) {
        this.client = client;
        log.initialize(client);
    }

    public LatchConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Update the latch timing from the client settings. Settings that
     * are missing or mistyped keep their current value. If the new
     * timing is invalid, a warning is sent to the client and the
     * whole configuration is kept. Only latches created afterwards
     * use the new timing.
     *
     * @param settings
     */
    public void didChangeConfiguration(Object settings) {
        log.debug("workspace/didChangeConfiguration " + settings);

        var current = configuration;
        try {
            configuration = new LatchConfiguration(
                withDefault(JsonUtils.getLong(settings, "refreshLatch.delayTime"), current.delayMillis()),
                withDefault(JsonUtils.getLong(settings, "refreshLatch.minShowTime"), current.minShowMillis()),
                withDefault(JsonUtils.getBoolean(settings, "refreshLatch.debug"), current.debug())
            );
        }
        catch( IllegalArgumentException e ) {
            log.warn("Ignoring invalid refresh latch settings -- " + e.getMessage());
        }
    }

    /**
     * Create a latch that shows the given title as progress
     * in the client while it is refreshing.
     *
     * The latch is disposed when the service shuts down. It can
     * also be disposed earlier by the caller.
     *
     * @param name
     * @param title
     */
    public ProgressLatch newProgressLatch(String name, String title) {
        if( client == null )
            throw new IllegalStateException("Progress service is not connected to a client");
        if( eventLoop.isShutdown() )
            throw new IllegalStateException("Progress service has been shut down");

        var tokenPrefix = "refresh/" + name + "/" + latchCount.incrementAndGet();
        var result = new ProgressLatch(eventLoop, client, configuration, tokenPrefix, title);
        registry.register(result);
        return result;
    }

    public int getLatchCount() {
        return registry.size();
    }

    /**
     * Dispose every latch and stop the event loop. The disposals
     * run on the loop before it stops.
     */
    public void shutdown() {
        registry.disposeAll();
        eventLoop.shutdown();
    }

    private <T> T withDefault(T value, T defaultValue) {
        return value != null ? value : defaultValue;
    }

}
