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
package dev.mars.decisionlog.ledger;

import dev.mars.decisionlog.error.IntegrityViolationException;

/**
 * Outcome of a chain verification.
 * <p>
 * A mismatch names the first index that fails; every record from there on is
 * untrusted until the chain is re-anchored. {@code checked} counts the records
 * that were examined before the verdict.
 *
 * @param firstMismatch index of the first failing record, or -1 if intact
 * @param reason        why that record failed, or null if intact
 * @param checked       number of records examined
 */
public record VerificationResult(long firstMismatch, String reason, long checked) {

    public static VerificationResult ok(long checked) {
        return new VerificationResult(-1, null, checked);
    }

    public static VerificationResult firstMismatchAt(long index, String reason, long checked) {
        if (index < 0) {
            throw new IllegalArgumentException("Mismatch index must be >= 0: " + index);
        }
        return new VerificationResult(index, reason, checked);
    }

    public boolean isOk() {
        return firstMismatch < 0;
    }

    /**
     * @throws IntegrityViolationException if this result is a mismatch
     */
    public VerificationResult orThrow() {
        if (!isOk()) {
            throw toException();
        }
        return this;
    }

    public IntegrityViolationException toException() {
        if (isOk()) {
            throw new IllegalStateException("Verification succeeded; no violation to report");
        }
        return new IntegrityViolationException(firstMismatch, reason);
    }

    @Override
    public String toString() {
        return isOk()
                ? "VerificationResult{ok, checked=" + checked + "}"
                : "VerificationResult{mismatchAt=" + firstMismatch + ", reason=" + reason + "}";
    }
}
