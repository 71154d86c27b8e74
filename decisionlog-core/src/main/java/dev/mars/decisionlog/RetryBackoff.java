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

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with a cap and full jitter.
 * <p>
 * Attempt {@code n} (1-based) waits a random time in {@code [base * 2^(n-1) / 2, base * 2^(n-1)]},
 * never more than {@code maxMs}.
 */
public final class RetryBackoff {

    private final long baseMs;
    private final long maxMs;

    public RetryBackoff(long baseMs, long maxMs) {
        if (baseMs <= 0 || maxMs < baseMs) {
            throw new IllegalArgumentException("Invalid backoff: base=" + baseMs + " ms, max=" + maxMs + " ms");
        }
        this.baseMs = baseMs;
        this.maxMs = maxMs;
    }

    /** Backoff for background sync: base is the sync interval, capped at 32 intervals. */
    public static RetryBackoff forSync(DecisionLogConfig config) {
        return new RetryBackoff(config.syncIntervalMs(), config.syncIntervalMs() * 32);
    }

    /** Upper bound of the delay before attempt {@code attempt}. */
    public long ceilingMs(int attempt) {
        if (attempt <= 1) {
            return baseMs;
        }
        int shift = Math.min(attempt - 1, 30);
        long ceiling = baseMs << shift;
        return ceiling <= 0 || ceiling > maxMs ? maxMs : ceiling;
    }

    /** Jittered delay before attempt {@code attempt}. */
    public long delayMs(int attempt) {
        long ceiling = ceilingMs(attempt);
        long floor = ceiling / 2;
        return floor + ThreadLocalRandom.current().nextLong(ceiling - floor + 1);
    }

    /**
     * Sleeps for the delay before {@code attempt}.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void pause(int attempt) throws InterruptedException {
        Thread.sleep(delayMs(attempt));
    }

    public long baseMs() {
        return baseMs;
    }

    public long maxMs() {
        return maxMs;
    }
}
