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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

class LatchConfigurationTest {

    @Test
    void defaults() {
        var configuration = LatchConfiguration.defaults();

        assertEquals(300, configuration.delayMillis());
        assertEquals(700, configuration.minShowMillis());
        assertFalse(configuration.debug());
    }

    @Test
    void negativeDelayTimeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LatchConfiguration(-1, 700, false));
    }

    @Test
    void negativeMinShowTimeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LatchConfiguration(300, -1, false));
        assertThrows(IllegalArgumentException.class, () -> LatchConfiguration.defaults().withMinShowTime(-2, TimeUnit.SECONDS));
    }

    @Test
    void zeroDurationsAreAllowed() {
        var configuration = new LatchConfiguration(0, 0, false);

        assertEquals(0, configuration.delayMillis());
        assertEquals(0, configuration.minShowMillis());
    }

    @Test
    void withersConvertUnits() {
        var configuration = LatchConfiguration.defaults()
            .withDelayTime(1, TimeUnit.SECONDS)
            .withMinShowTime(2, TimeUnit.SECONDS)
            .withDebug(true);

        assertEquals(1_000, configuration.delayMillis());
        assertEquals(2_000, configuration.minShowMillis());
        assertTrue(configuration.debug());
    }

}
