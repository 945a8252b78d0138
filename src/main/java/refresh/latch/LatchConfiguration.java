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

import java.util.concurrent.TimeUnit;

/**
 * Timing of a {@link RefreshLatch}.
 *
 * @param delayMillis    how long the latch must be refreshing before the indicator is shown
 * @param minShowMillis  how long the indicator stays shown at least, once shown
 * @param debug          report every transition through the latch's debug log
 *
 * @author refresh-latch developers
 */
public record LatchConfiguration(
    long delayMillis,
    long minShowMillis,
    boolean debug
) {

    public static final long DEFAULT_DELAY_MILLIS = 300;

    public static final long DEFAULT_MIN_SHOW_MILLIS = 700;

    public LatchConfiguration {
        if( delayMillis < 0 )
            throw new IllegalArgumentException("Delay time must not be negative: " + delayMillis);
        if( minShowMillis < 0 )
            throw new IllegalArgumentException("Minimum show time must not be negative: " + minShowMillis);
    }

    public static LatchConfiguration defaults() {
        return new LatchConfiguration(
            DEFAULT_DELAY_MILLIS,
            DEFAULT_MIN_SHOW_MILLIS,
            false
        );
    }

    public LatchConfiguration withDelayTime(long time, TimeUnit unit) {
        return new LatchConfiguration(unit.toMillis(time), minShowMillis, debug);
    }

    public LatchConfiguration withMinShowTime(long time, TimeUnit unit) {
        return new LatchConfiguration(delayMillis, unit.toMillis(time), debug);
    }

    public LatchConfiguration withDebug(boolean debug) {
        return new LatchConfiguration(delayMillis, minShowMillis, debug);
    }
}
