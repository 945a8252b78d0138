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
 * Observable state of a {@link RefreshLatch}.
 *
 * @author refresh-latch developers
 */
public enum LatchState {
    /** Not refreshing and nothing shown. */
    IDLE,
    /** Refreshing, a show is scheduled after the delay time. */
    PENDING_SHOW,
    /** The indicator is shown and no command is pending. */
    SHOWN,
    /** Done refreshing, a hide is scheduled once the minimum show time is reached. */
    PENDING_HIDE,
    /** The latch was disposed and can no longer be used. */
    DISPOSED
}
