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

import refresh.latch.RefreshCallback;
import refresh.lsp.util.ProgressNotification;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * Show the refresh indicator in the client as work-done progress.
 *
 * Every show uses a new progress token. A show while the progress
 * is already active, or a hide while it is not, is ignored so that
 * the client always receives matching begin and end notifications.
 *
 * @author refresh-latch developers
 */
public class ProgressIndicator implements RefreshCallback {

    private LanguageClient client;

    private String tokenPrefix;

    private String title;

    private int count;

    private ProgressNotification active;

    public ProgressIndicator(LanguageClient client, String tokenPrefix, String title) {
        this.client = client;
        this.tokenPrefix = tokenPrefix;
        this.title = title;
    }

    @Override
    public void onRefresh(boolean refreshing) {
        if( refreshing )
            begin();
        else
            end();
    }

    public boolean isActive() {
        return active != null;
    }

    /**
     * Token of the active progress, or null if no progress is shown.
     */
    public String getActiveToken() {
        return active != null ? active.getToken() : null;
    }

    private void begin() {
        if( active != null )
            return;
        count++;
        var progress = new ProgressNotification(client, tokenPrefix + "-" + count);
        progress.create();
        progress.begin(title, null);
        active = progress;
    }

    private void end() {
        if( active == null )
            return;
        var progress = active;
        active = null;
        progress.end(null);
    }

}
