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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.services.LanguageClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoggerTest {

    private Logger log = Logger.getInstance();

    private LanguageClient client;

    @BeforeEach
    void setUp() {
        client = mock(LanguageClient.class);
        log.initialize(client);
    }

    @AfterEach
    void tearDown() {
        Logger.setDebugEnabled(false);
        log.disconnect();
    }

    @Test
    void isSingleton() {
        assertSame(log, Logger.getInstance());
        assertTrue(log.isInitialized());
    }

    @Test
    void debugIsGatedByGlobalFlag() {
        Logger.setDebugEnabled(false);
        log.debug("hidden");
        verify(client, never()).logMessage(any());

        Logger.setDebugEnabled(true);
        log.debug("shown");
        verify(client).logMessage(new MessageParams(MessageType.Log, "shown"));
    }

    @Test
    void logIsNotGated() {
        Logger.setDebugEnabled(false);
        log.log("show()");
        verify(client).logMessage(new MessageParams(MessageType.Log, "show()"));
    }

    @Test
    void levelsMapToMessageTypes() {
        log.warn("warn");
        log.error("error");

        verify(client).logMessage(new MessageParams(MessageType.Warning, "warn"));
        verify(client).logMessage(new MessageParams(MessageType.Error, "error"));
    }

    @Test
    void messagesAreDroppedWithoutClient() {
        log.disconnect();
        assertFalse(log.isInitialized());

        log.error("dropped");
        log.log("dropped");
        verifyNoInteractions(client);
    }

}
