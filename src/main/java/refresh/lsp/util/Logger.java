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
package refresh.lsp.util;

import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * Log messages to the client using the language server protocol.
 *
 * NOTE: The logger must be used instead of printing directly
 * to standard output (i.e. System.out), because the language
 * server uses standard output to send protocol messages.
 * Messages logged before a client is connected are dropped.
 *
 * @author refresh-latch developers
 */
public class Logger {

    private static Logger instance;
    private static volatile boolean debugEnabled;

    private volatile LanguageClient client;

    public static boolean isDebugEnabled() {
        return debugEnabled;
    }

    public static void setDebugEnabled(boolean value) {
        debugEnabled = value;
    }

    private Logger() {
    }

    public static synchronized Logger getInstance() {
        if( instance == null )
            instance = new Logger();
        return instance;
    }

    /**
     * Connect the logger to a client. A later call replaces
     * the previous client, e.g. when the server is restarted.
     *
     * @param client
     */
    public void initialize(LanguageClient client) {
        this.client = client;
    }

    public void disconnect() {
        this.client = null;
    }

    public boolean isInitialized() {
        return client != null;
    }

    /**
     * Log a message only when debug output is enabled globally.
     *
     * @param message
     */
    public void debug(String message) {
        if( !isDebugEnabled() )
            return;
        send(MessageType.Log, message);
    }

    /**
     * Log a message regardless of the global debug flag. Used by
     * components that have debugging enabled individually.
     *
     * @param message
     */
    public void log(String message) {
        send(MessageType.Log, message);
    }

    public void warn(String message) {
        send(MessageType.Warning, message);
    }

    public void error(String message) {
        send(MessageType.Error, message);
    }

    private void send(MessageType type, String message) {
        var current = client;
        if( current == null )
            return;
        current.logMessage(new MessageParams(type, message));
    }

}
