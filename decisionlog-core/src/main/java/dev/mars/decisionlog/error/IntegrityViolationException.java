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
 * A chain link or record hash no longer matches.
 * <p>
 * Fatal: every record from {@link #atIndex()} onward is untrusted until the
 * chain is re-anchored from a trusted checkpoint.
 */
public class IntegrityViolationException extends LedgerException {

    private final long atIndex;

    public IntegrityViolationException(long atIndex, String message) {
        super("Integrity violation at index " + atIndex + ": " + message);
        this.atIndex = atIndex;
    }

    public IntegrityViolationException(long atIndex, String message, Throwable cause) {
        super("Integrity violation at index " + atIndex + ": " + message, cause);
        this.atIndex = atIndex;
    }

    public long atIndex() {
        return atIndex;
    }
}
