/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.decisionlog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RetryBackoff}.
 */
class RetryBackoffTest {

    @Test
    void ceilingDoublesUpToMax() {
        RetryBackoff backoff = new RetryBackoff(100, 1_000);
        assertEquals(100, backoff.ceilingMs(1));
        assertEquals(200, backoff.ceilingMs(2));
        assertEquals(400, backoff.ceilingMs(3));
        assertEquals(800, backoff.ceilingMs(4));
        assertEquals(1_000, backoff.ceilingMs(5));
        assertEquals(1_000, backoff.ceilingMs(60));
    }

    @Test
    void delayIsBetweenHalfAndFullCeiling() {
        RetryBackoff backoff = new RetryBackoff(100, 10_000);
        for (int attempt = 1; attempt <= 8; attempt++) {
            long ceiling = backoff.ceilingMs(attempt);
            for (int i = 0; i < 50; i++) {
                long delay = backoff.delayMs(attempt);
                assertTrue(delay >= ceiling / 2 && delay <= ceiling, "delay " + delay + " for ceiling " + ceiling);
            }
        }
    }

    @Test
    void forSyncScalesWithInterval() {
        RetryBackoff backoff = RetryBackoff.forSync(TestRecords.config("n"));
        assertEquals(10, backoff.baseMs());
        assertEquals(320, backoff.maxMs());
    }

    @Test
    void invalidBoundsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(100, 10));
    }
}
