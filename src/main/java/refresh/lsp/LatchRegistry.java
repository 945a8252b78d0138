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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

import refresh.latch.Disposable;
import refresh.lsp.util.Logger;

/**
 * Disposes the latches of a lifecycle owner (e.g. the language
 * server) when the owner is torn down.
 *
 * Each registration gets its own handle, so the same latch can be
 * registered more than once and every registration can be released
 * on its own. Tearing down disposes each latch once.
 *
 * @author refresh-latch developers
 */
public class LatchRegistry {

    private static Logger log = Logger.getInstance();

    private final Set<Registration> registrations = new LinkedHashSet<>();

    public synchronized Registration register(Disposable latch) {
        var registration = new Registration(latch);
        registrations.add(registration);
        return registration;
    }

    public synchronized int size() {
        return registrations.size();
    }

    /**
     * Dispose every registered latch and clear the registry.
     */
    public void disposeAll() {
        ArrayList<Registration> current;
        synchronized (this) {
            current = new ArrayList<>(registrations);
            registrations.clear();
        }

        var disposed = Collections.newSetFromMap(new IdentityHashMap<Disposable, Boolean>());
        for( var registration : current ) {
            if( disposed.add(registration.latch) )
                registration.latch.dispose();
        }
        log.debug("Disposed " + disposed.size() + " refresh latches");
    }

    private synchronized boolean unregister(Registration registration) {
        return registrations.remove(registration);
    }

    /**
     * Handle returned by {@link LatchRegistry#register(Disposable)}.
     */
    public class Registration implements AutoCloseable {

        private final Disposable latch;

        private Registration(Disposable latch) {
            this.latch = latch;
        }

        public boolean isActive() {
            synchronized (LatchRegistry.this) {
                return registrations.contains(this);
            }
        }

        /**
         * Dispose the latch and remove it from the registry.
         * Does nothing if the registration was already released.
         */
        @Override
        public void close() {
            if( unregister(this) )
                latch.dispose();
        }
    }

}
