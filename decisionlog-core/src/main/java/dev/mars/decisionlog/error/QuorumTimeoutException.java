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
package dev.mars.decisionlog.error;

/**
 * A consensus round did not gather enough acknowledgements in time.
 * <p>
 * Not corruption: the segment stays pending and the round is retried.
 */
public class QuorumTimeoutException extends LedgerException {

    private final long segmentNumber;
    private final int acknowledgements;
    private final int required;

    public QuorumTimeoutException(long segmentNumber, int acknowledgements, int required) {
        super("Quorum not reached for segment " + segmentNumber + ": " +
                acknowledgements + " of " + required + " acknowledgements");
        this.segmentNumber = segmentNumber;
        this.acknowledgements = acknowledgements;
        this.required = required;
    }

    public long segmentNumber() {
        return segmentNumber;
    }

    public int acknowledgements() {
        return acknowledgements;
    }

    public int required() {
        return required;
    }
}
